package io.intellixity.polydata.mongo;

import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.query.OrderBy;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.spi.Dialect;
import org.bson.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Document dialect: compiles descriptors into {@link MongoStatement}s.
 * <p>
 * Mapping:
 * <ul>
 *   <li>SELECT: find (findOne for single-row descriptors) with sort/skip/limit/projection</li>
 *   <li>SELECT with group-by: aggregate pipeline ($match, $group, $project, $match for having,
 *       $sort, $skip, $limit)</li>
 *   <li>INSERT: insertOne; UPDATE: updateMany with {@code $set}; DELETE: deleteMany
 *       (the *One variants for single-row descriptors)</li>
 * </ul>
 * Joins are not expressible.
 */
public final class MongoDialect implements Dialect<MongoStatement> {
  private static final Pattern AGGREGATE = Pattern.compile(
      "(?i)(COUNT|SUM|AVG|MIN|MAX)\\(\\s*(\\*|[A-Za-z_][A-Za-z0-9_.]*)\\s*\\)(?:\\s+AS\\s+([A-Za-z_][A-Za-z0-9_]*))?");

  @Override public String id() { return "mongo"; }

  @Override
  public MongoStatement compile(QueryDescriptor q) {
    if (q.kind() == null) throw new UnsupportedQueryException("Operation kind must be set before compilation");
    if (!q.joins().isEmpty()) throw new UnsupportedQueryException("Joins are not supported on document providers");
    String collection = field(q.target());
    boolean one = q.single();
    return switch (q.kind()) {
      case SELECT -> q.groupBy().isEmpty() ? renderFind(collection, q) : renderAggregate(collection, q);
      case INSERT -> MongoStatement.insertOne(collection, document(q.data()));
      case UPDATE -> one
          ? MongoStatement.updateOne(collection, filter(q.where()), new Document("$set", document(q.data())))
          : MongoStatement.updateMany(collection, filter(q.where()), new Document("$set", document(q.data())));
      case DELETE -> one
          ? MongoStatement.deleteOne(collection, filter(q.where()))
          : MongoStatement.deleteMany(collection, filter(q.where()));
    };
  }

  private MongoStatement renderFind(String collection, QueryDescriptor q) {
    MongoStatement st = q.single()
        ? MongoStatement.findOne(collection, filter(q.where()))
        : MongoStatement.find(collection, filter(q.where()));
    Document sort = sort(q.orderBy());
    if (sort != null) st = st.withSort(sort);
    if (q.offset() != null) st = st.withSkip(q.offset());
    if (q.limit() != null) st = st.withLimit(q.limit());
    Document projection = projection(q.columns());
    if (projection != null) st = st.withProjection(projection);
    return st;
  }

  private MongoStatement renderAggregate(String collection, QueryDescriptor q) {
    List<Document> pipeline = new ArrayList<>();
    Document match = filter(q.where());
    if (!match.isEmpty()) pipeline.add(new Document("$match", match));

    Document groupId = new Document();
    Document project = new Document("_id", 0);
    for (String g : q.groupBy()) {
      String key = field(g).replace('.', '_');
      groupId.append(key, "$" + g);
      project.append(key, "$_id." + key);
    }
    Document group = new Document("_id", groupId);

    Map<String, String> aliases = new LinkedHashMap<>();
    for (String c : q.columns()) {
      String col = c.trim();
      Aggregate a = Aggregate.parse(col);
      if (a == null) {
        if (!"*".equals(col) && !q.groupBy().contains(col)) {
          throw new UnsupportedQueryException("Column '" + col + "' must be grouped or aggregated");
        }
        continue;
      }
      addAccumulator(a, a.alias(), group, project, aliases);
    }

    Document having = new Document();
    for (Map.Entry<String, Object> e : q.having().entrySet()) {
      Aggregate a = Aggregate.parse(e.getKey().trim());
      String target;
      if (a == null) {
        target = field(e.getKey()).replace('.', '_');
      } else {
        target = aliases.get(a.key());
        if (target == null) {
          target = a.alias();
          addAccumulator(a, target, group, project, aliases);
        }
      }
      having.append(target, scalar(e.getKey(), e.getValue()));
    }

    pipeline.add(new Document("$group", group));
    pipeline.add(new Document("$project", project));
    if (!having.isEmpty()) pipeline.add(new Document("$match", having));
    Document sort = sort(q.orderBy());
    if (sort != null) pipeline.add(new Document("$sort", sort));
    if (q.offset() != null && q.offset() > 0) pipeline.add(new Document("$skip", q.offset()));
    if (q.limit() != null) pipeline.add(new Document("$limit", q.limit()));
    return MongoStatement.aggregate(collection, pipeline);
  }

  private static void addAccumulator(Aggregate a, String alias, Document group, Document project,
                                     Map<String, String> aliases) {
    group.append(alias, a.accumulator());
    project.append(alias, 1);
    aliases.putIfAbsent(a.key(), alias);
  }

  private static Document filter(Map<String, Object> where) {
    Document d = new Document();
    for (Map.Entry<String, Object> e : where.entrySet()) {
      d.append(field(e.getKey()), scalar(e.getKey(), e.getValue()));
    }
    return d;
  }

  private static Document document(Map<String, Object> data) {
    Document d = new Document();
    for (Map.Entry<String, Object> e : data.entrySet()) d.append(field(e.getKey()), e.getValue());
    return d;
  }

  private static Document sort(List<OrderBy> orderBy) {
    if (orderBy.isEmpty()) return null;
    Document d = new Document();
    for (OrderBy o : orderBy) d.append(field(o.field()), o.direction() == OrderBy.Direction.DESC ? -1 : 1);
    return d;
  }

  private static Document projection(List<String> columns) {
    if (columns.isEmpty()) return null;
    Document d = new Document();
    for (String c : columns) {
      String col = c.trim();
      if ("*".equals(col)) return null;
      d.append(field(col), 1);
    }
    return d;
  }

  /** Field names may not address operators. */
  private static String field(String name) {
    String n = name == null ? "" : name.trim();
    if (n.isEmpty() || n.startsWith("$") || n.indexOf('\0') >= 0) {
      throw new UnsupportedQueryException("Invalid field name: '" + name + "'");
    }
    return n;
  }

  /** Predicates are equality only; nested documents would be read as operators. */
  private static Object scalar(String key, Object v) {
    if (v instanceof Map<?, ?>) {
      throw new UnsupportedQueryException("Predicate on '" + key + "' must be a scalar value");
    }
    return v;
  }

  record Aggregate(String function, String argument, String alias) {
    static Aggregate parse(String expr) {
      Matcher m = AGGREGATE.matcher(expr);
      if (!m.matches()) return null;
      String fn = m.group(1).toUpperCase(Locale.ROOT);
      String arg = m.group(2);
      String alias = m.group(3);
      if (alias == null) {
        alias = "*".equals(arg) ? fn.toLowerCase(Locale.ROOT) : fn.toLowerCase(Locale.ROOT) + "_" + arg.replace('.', '_');
      }
      return new Aggregate(fn, arg, alias);
    }

    String key() { return function + "(" + argument + ")"; }

    Document accumulator() {
      if ("COUNT".equals(function)) return new Document("$sum", 1);
      if ("*".equals(argument)) throw new UnsupportedQueryException(function + "(*) is not an aggregate");
      return new Document("$" + function.toLowerCase(Locale.ROOT), "$" + argument);
    }
  }
}
