package io.intellixity.polydata.mongo;

import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.exec.NativeStatement;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Backend-native statement for document providers.
 * <p>
 * {@code filter} selects documents for find/update/delete; {@code document} is the inserted
 * document or the update document (with operators such as {@code $set}); {@code documents} feeds
 * insertMany; {@code pipeline} feeds aggregate. Sort/skip/limit/projection are cursor modifiers
 * for find.
 */
public record MongoStatement(
    Action action,
    String collection,
    Document filter,
    Document document,
    List<Document> documents,
    List<Document> pipeline,
    Document sort,
    Integer skip,
    Integer limit,
    Document projection
) implements NativeStatement {
  public enum Action {
    FIND("find"),
    FIND_ONE("findOne"),
    INSERT_ONE("insertOne"),
    INSERT_MANY("insertMany"),
    UPDATE_ONE("updateOne"),
    UPDATE_MANY("updateMany"),
    DELETE_ONE("deleteOne"),
    DELETE_MANY("deleteMany"),
    AGGREGATE("aggregate");

    private final String id;

    Action(String id) { this.id = id; }

    /** Driver verb name. */
    public String id() { return id; }

    /** Accepts the verb ({@code findOne}) or the constant name ({@code FIND_ONE}). */
    public static Action parse(String s) {
      Objects.requireNonNull(s, "action");
      String t = s.trim();
      for (Action a : values()) {
        if (a.id.equalsIgnoreCase(t) || a.name().equalsIgnoreCase(t)) return a;
      }
      throw new UnsupportedQueryException("Unsupported document action: " + s);
    }
  }

  public MongoStatement {
    Objects.requireNonNull(action, "action");
    if (collection == null || collection.isBlank()) throw new UnsupportedQueryException("collection is required");
    filter = (filter == null) ? new Document() : filter;
    documents = (documents == null) ? List.of() : List.copyOf(documents);
    pipeline = (pipeline == null) ? List.of() : List.copyOf(pipeline);
  }

  public static MongoStatement find(String collection, Document filter) {
    return new MongoStatement(Action.FIND, collection, filter, null, null, null, null, null, null, null);
  }

  public static MongoStatement findOne(String collection, Document filter) {
    return new MongoStatement(Action.FIND_ONE, collection, filter, null, null, null, null, null, null, null);
  }

  public static MongoStatement insertOne(String collection, Document document) {
    return new MongoStatement(Action.INSERT_ONE, collection, null, document, null, null, null, null, null, null);
  }

  public static MongoStatement insertMany(String collection, List<Document> documents) {
    return new MongoStatement(Action.INSERT_MANY, collection, null, null, documents, null, null, null, null, null);
  }

  public static MongoStatement updateOne(String collection, Document filter, Document update) {
    return new MongoStatement(Action.UPDATE_ONE, collection, filter, update, null, null, null, null, null, null);
  }

  public static MongoStatement updateMany(String collection, Document filter, Document update) {
    return new MongoStatement(Action.UPDATE_MANY, collection, filter, update, null, null, null, null, null, null);
  }

  public static MongoStatement deleteOne(String collection, Document filter) {
    return new MongoStatement(Action.DELETE_ONE, collection, filter, null, null, null, null, null, null, null);
  }

  public static MongoStatement deleteMany(String collection, Document filter) {
    return new MongoStatement(Action.DELETE_MANY, collection, filter, null, null, null, null, null, null, null);
  }

  public static MongoStatement aggregate(String collection, List<Document> pipeline) {
    return new MongoStatement(Action.AGGREGATE, collection, null, null, null, pipeline, null, null, null, null);
  }

  public MongoStatement withSort(Document s) {
    return new MongoStatement(action, collection, filter, document, documents, pipeline, s, skip, limit, projection);
  }

  public MongoStatement withSkip(Integer s) {
    return new MongoStatement(action, collection, filter, document, documents, pipeline, sort, s, limit, projection);
  }

  public MongoStatement withLimit(Integer l) {
    return new MongoStatement(action, collection, filter, document, documents, pipeline, sort, skip, l, projection);
  }

  public MongoStatement withProjection(Document p) {
    return new MongoStatement(action, collection, filter, document, documents, pipeline, sort, skip, limit, p);
  }

  /**
   * Operation-map form: {@code {collection, action, query, data, options}}.
   * <p>
   * {@code query} is the filter (the pipeline for {@code aggregate}); {@code data} is the inserted
   * document, the list for insertMany, or the update document; {@code options} may carry
   * {@code sort}, {@code skip}, {@code limit} and {@code projection}.
   */
  public static MongoStatement fromMap(Map<?, ?> op) {
    Objects.requireNonNull(op, "operation");
    Object collection = op.get("collection");
    Object action = op.get("action");
    if (!(collection instanceof String c) || !(action instanceof String a)) {
      throw new UnsupportedQueryException("Document operations require string 'collection' and 'action'");
    }
    Action act = Action.parse(a);
    Object query = op.get("query");
    Object data = op.get("data");
    Map<?, ?> options = (op.get("options") instanceof Map<?, ?> m) ? m : Map.of();

    MongoStatement st = switch (act) {
      case AGGREGATE -> aggregate(c, docs(query == null ? op.get("pipeline") : query, "query"));
      case INSERT_ONE -> insertOne(c, doc(data, "data"));
      case INSERT_MANY -> insertMany(c, docs(data, "data"));
      case UPDATE_ONE -> updateOne(c, doc(query, "query"), doc(data, "data"));
      case UPDATE_MANY -> updateMany(c, doc(query, "query"), doc(data, "data"));
      case FIND -> find(c, doc(query, "query"));
      case FIND_ONE -> findOne(c, doc(query, "query"));
      case DELETE_ONE -> deleteOne(c, doc(query, "query"));
      case DELETE_MANY -> deleteMany(c, doc(query, "query"));
    };
    if (options.get("sort") != null) st = st.withSort(doc(options.get("sort"), "options.sort"));
    if (options.get("skip") instanceof Number n) st = st.withSkip(n.intValue());
    if (options.get("limit") instanceof Number n) st = st.withLimit(n.intValue());
    if (options.get("projection") != null) st = st.withProjection(doc(options.get("projection"), "options.projection"));
    return st;
  }

  @SuppressWarnings("unchecked")
  private static Document doc(Object o, String what) {
    if (o == null) return new Document();
    if (o instanceof Document d) return d;
    if (o instanceof Map<?, ?> m) return new Document((Map<String, Object>) m);
    throw new UnsupportedQueryException("Expected a document for '" + what + "' but got " + o.getClass().getSimpleName());
  }

  private static List<Document> docs(Object o, String what) {
    if (!(o instanceof List<?> l)) {
      throw new UnsupportedQueryException("Expected a list of documents for '" + what + "'");
    }
    List<Document> out = new ArrayList<>(l.size());
    for (Object x : l) out.add(doc(x, what));
    return out;
  }

  /** Safe for logs: no filter or document values. */
  @Override
  public String toString() {
    return "MongoStatement[action=" + action.id() + ", collection=" + collection + "]";
  }
}
