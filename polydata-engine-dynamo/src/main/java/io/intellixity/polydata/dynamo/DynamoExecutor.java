package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.error.DriverException;
import io.intellixity.polydata.error.PolydataException;
import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.provider.Capabilities;
import io.intellixity.polydata.provider.ProviderKind;
import io.intellixity.polydata.query.OrderBy;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaResult;
import io.intellixity.polydata.spi.AbstractProviderExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wide-column executor over the DynamoDB client.
 * <p>
 * Scans page through the whole table, then ordering, offset and limit are applied in memory.
 * Inserts answer with the written item; updates and deletes with the number of items touched.
 * Ensuring a schema creates an on-demand table keyed by the schema key (hash, then range) only
 * when it is missing.
 */
public final class DynamoExecutor extends AbstractProviderExecutor<DynamoStatement, DynamoHandle> {
  private static final Logger log = LoggerFactory.getLogger(DynamoExecutor.class);
  private static final Pattern PLACEHOLDER = Pattern.compile("[#:][A-Za-z0-9_]+");

  static final int ACTIVE_POLL_ATTEMPTS = 50;
  static final long ACTIVE_POLL_MILLIS = 200;

  private final DynamoDbClient ddb;
  private final DynamoDialect dynamo;

  public DynamoExecutor(DynamoHandle handle) {
    this(handle, new DynamoDialect());
  }

  public DynamoExecutor(DynamoHandle handle, DynamoDialect dialect) {
    super(handle, ProviderKind.WIDE_COLUMN, dialect, Capabilities.of(false, false, false, false));
    this.ddb = handle.client();
    this.dynamo = dialect;
  }

  @Override
  public void ping() {
    guarded("PING", () -> ddb.listTables(r -> r.limit(1)));
  }

  @Override
  protected QueryResult run(QueryDescriptor query, DynamoStatement stmt) {
    return dispatch(query.kind().name(), stmt);
  }

  @Override
  protected QueryResult runNative(DynamoStatement stmt) {
    return dispatch("NATIVE", stmt);
  }

  @Override
  protected DynamoStatement toNative(Object statement, List<Object> params) {
    if (!params.isEmpty()) {
      throw new UnsupportedQueryException("Wide-column operations carry their values inline; positional params are not supported");
    }
    if (statement instanceof DynamoStatement s) return s;
    if (statement instanceof Map<?, ?> m) return DynamoStatement.fromMap(m);
    throw new UnsupportedQueryException("Wide-column providers accept DynamoStatement or an operation map, got "
        + statement.getClass().getName());
  }

  @Override
  protected SchemaResult doEnsureSchema(SchemaDescriptor schema) {
    String table = schema.name();
    List<String> key = schema.keyFields().isEmpty() ? DynamoDialect.DEFAULT_KEY : schema.keyFields();
    if (key.size() > 2) {
      throw new ValidationException("Table '" + table + "' key has " + key.size() + " fields; at most hash and range are supported");
    }
    dynamo.registerKey(table, key);
    if (!schema.indexes().isEmpty() || schema.fields().stream().anyMatch(f -> f.unique() && !f.primaryKey())) {
      log.warn("polydata.dynamo op=ENSURE_SCHEMA provider={} table={} secondary indexes and unique fields are not enforced",
          id(), table);
    }
    try {
      ddb.describeTable(r -> r.tableName(table));
      log.debug("polydata.dynamo op=ENSURE_SCHEMA provider={} table={} exists=true", id(), table);
      return new SchemaResult(table, true);
    } catch (ResourceNotFoundException e) {
      log.debug("polydata.dynamo op=ENSURE_SCHEMA provider={} table={} exists=false", id(), table);
    }

    List<AttributeDefinition> attrs = new ArrayList<>();
    List<KeySchemaElement> keySchema = new ArrayList<>();
    for (int i = 0; i < key.size(); i++) {
      String k = key.get(i);
      attrs.add(AttributeDefinition.builder().attributeName(k).attributeType(scalarType(schema.field(k))).build());
      keySchema.add(KeySchemaElement.builder().attributeName(k).keyType(i == 0 ? KeyType.HASH : KeyType.RANGE).build());
    }
    try {
      ddb.createTable(CreateTableRequest.builder()
          .tableName(table)
          .attributeDefinitions(attrs)
          .keySchema(keySchema)
          .billingMode(BillingMode.PAY_PER_REQUEST)
          .build());
      log.info("polydata.dynamo op=CREATE_TABLE provider={} table={} key={}", id(), table, key);
    } catch (ResourceInUseException e) {
      log.debug("polydata.dynamo op=CREATE_TABLE provider={} table={} concurrentCreate=true", id(), table);
    }
    awaitActive(table);
    return new SchemaResult(table, true);
  }

  @Override
  protected PolydataException translate(String operation, Exception e) {
    if (e instanceof ConditionalCheckFailedException) {
      return new ValidationException("Conditional check failed on " + operation + " (provider=" + id() + ")", e);
    }
    return super.translate(operation, e);
  }

  @Override
  public void close() {
    ddb.close();
    log.info("polydata.dynamo_closed provider={}", id());
  }

  private QueryResult dispatch(String op, DynamoStatement st) {
    long start = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("polydata.dynamo op={} action={} provider={} region={} table={} valueCount={}",
          op, st.action().id(), id(), handle().namespace(), st.table(), st.values().size());
    }
    QueryResult r = switch (st.action()) {
      case GET_ITEM -> getItem(st);
      case PUT_ITEM -> putItem(st);
      case UPDATE_ITEM -> st.hasKey() ? QueryResult.ofCount(updateItem(st, st.key(), st.condition()) ? 1 : 0) : sweep(st);
      case DELETE_ITEM -> st.hasKey() ? QueryResult.ofCount(deleteItem(st, st.key(), st.condition()) ? 1 : 0) : sweep(st);
      case SCAN, QUERY -> QueryResult.ofRows(clientSide(read(st, st.projection(), Map.of()), st));
    };
    if (log.isDebugEnabled()) {
      log.debug("polydata.dynamo_done op={} action={} durationMs={} rows={} affected={}",
          op, st.action().id(), (System.nanoTime() - start) / 1_000_000.0, r.size(), r.affected());
    }
    return r;
  }

  private QueryResult getItem(DynamoStatement st) {
    GetItemRequest.Builder b = GetItemRequest.builder()
        .tableName(st.table())
        .key(AttributeValues.toItem(st.key()))
        .consistentRead(true);
    if (st.projection() != null) {
      b.projectionExpression(st.projection());
      Map<String, String> names = usedNames(st.names(), st.projection());
      if (!names.isEmpty()) b.expressionAttributeNames(names);
    }
    GetItemResponse resp = ddb.getItem(b.build());
    if (!resp.hasItem() || resp.item().isEmpty()) return QueryResult.ofRows(List.of());
    return QueryResult.ofRows(List.of(AttributeValues.fromItem(resp.item())));
  }

  private QueryResult putItem(DynamoStatement st) {
    if (st.item() == null || st.item().isEmpty()) throw new UnsupportedQueryException("putItem requires an item");
    PutItemRequest.Builder b = PutItemRequest.builder()
        .tableName(st.table())
        .item(AttributeValues.toItem(st.item()));
    if (st.condition() != null) {
      b.conditionExpression(st.condition());
      withExpressions(st, st.condition(), b::expressionAttributeNames, b::expressionAttributeValues);
    }
    ddb.putItem(b.build());
    return QueryResult.of(List.of(new LinkedHashMap<>(st.item())), 1);
  }

  /** @return false when the item is missing or the condition does not hold */
  private boolean updateItem(DynamoStatement st, Map<String, Object> key, String condition) {
    if (st.update() == null) throw new UnsupportedQueryException("updateItem requires an update expression");
    UpdateItemRequest.Builder b = UpdateItemRequest.builder()
        .tableName(st.table())
        .key(AttributeValues.toItem(key))
        .updateExpression(st.update());
    String expressions = st.update();
    if (condition != null) {
      b.conditionExpression(condition);
      expressions = expressions + " " + condition;
    }
    withExpressions(st, expressions, b::expressionAttributeNames, b::expressionAttributeValues);
    try {
      ddb.updateItem(b.build());
      return true;
    } catch (ConditionalCheckFailedException e) {
      log.debug("polydata.dynamo op=UPDATE provider={} table={} matched=false", id(), st.table());
      return false;
    }
  }

  private boolean deleteItem(DynamoStatement st, Map<String, Object> key, String condition) {
    DeleteItemRequest.Builder b = DeleteItemRequest.builder()
        .tableName(st.table())
        .key(AttributeValues.toItem(key));
    if (condition != null) {
      b.conditionExpression(condition);
      withExpressions(st, condition, b::expressionAttributeNames, b::expressionAttributeValues);
    }
    try {
      ddb.deleteItem(b.build());
      return true;
    } catch (ConditionalCheckFailedException e) {
      log.debug("polydata.dynamo op=DELETE provider={} table={} matched=false", id(), st.table());
      return false;
    }
  }

  /** Keyless update/delete: scan the matching keys, then write item by item. */
  private QueryResult sweep(DynamoStatement st) {
    List<String> key = dynamo.keyOf(st.table());
    Map<String, String> keyNames = new LinkedHashMap<>();
    List<String> projected = new ArrayList<>();
    for (int i = 0; i < key.size(); i++) {
      keyNames.put("#pk" + i, key.get(i));
      projected.add("#pk" + i);
    }
    List<Map<String, Object>> matches = read(st, String.join(", ", projected), keyNames);

    DynamoStatement guarded = withNames(st, keyNames);
    String exists = "attribute_exists(#pk0)";
    long n = 0;
    for (Map<String, Object> row : matches) {
      Map<String, Object> k = new LinkedHashMap<>();
      for (String f : key) k.put(f, row.get(f));
      boolean hit = (st.action() == DynamoStatement.Action.UPDATE_ITEM)
          ? updateItem(guarded, k, exists)
          : deleteItem(guarded, k, exists);
      if (hit) n++;
    }
    return QueryResult.ofCount(n);
  }

  private static DynamoStatement withNames(DynamoStatement st, Map<String, String> extra) {
    Map<String, String> names = new LinkedHashMap<>(st.names());
    names.putAll(extra);
    return new DynamoStatement(st.action(), st.table(), st.key(), st.item(), st.keyCondition(), st.filter(),
        st.update(), st.condition(), st.projection(), names, st.values(), st.indexName(), st.limit(),
        st.orderBy(), st.offset(), st.take());
  }

  /** Scan or query; an explicit {@code limit} reads one page, otherwise every page. */
  private List<Map<String, Object>> read(DynamoStatement st, String projection, Map<String, String> extraNames) {
    Map<String, String> names = new LinkedHashMap<>(st.names());
    names.putAll(extraNames);
    StringBuilder exprs = new StringBuilder();
    if (st.keyCondition() != null) exprs.append(st.keyCondition()).append(' ');
    if (st.filter() != null) exprs.append(st.filter()).append(' ');
    if (projection != null) exprs.append(projection);
    Map<String, String> usedNames = usedNames(names, exprs.toString());
    Map<String, AttributeValue> usedValues = usedValues(st.values(), exprs.toString());

    List<Map<String, Object>> out = new ArrayList<>();
    Map<String, AttributeValue> lastKey = null;
    do {
      List<Map<String, AttributeValue>> items;
      if (st.action() == DynamoStatement.Action.QUERY) {
        if (st.keyCondition() == null) throw new UnsupportedQueryException("query requires a key condition expression");
        QueryRequest.Builder b = QueryRequest.builder()
            .tableName(st.table())
            .keyConditionExpression(st.keyCondition())
            .filterExpression(st.filter())
            .projectionExpression(projection)
            .indexName(st.indexName())
            .limit(st.limit())
            .exclusiveStartKey(lastKey);
        if (!usedNames.isEmpty()) b.expressionAttributeNames(usedNames);
        if (!usedValues.isEmpty()) b.expressionAttributeValues(usedValues);
        QueryResponse resp = ddb.query(b.build());
        items = resp.items();
        lastKey = resp.hasLastEvaluatedKey() ? resp.lastEvaluatedKey() : null;
      } else {
        ScanRequest.Builder b = ScanRequest.builder()
            .tableName(st.table())
            .filterExpression(st.filter())
            .projectionExpression(projection)
            .indexName(st.indexName())
            .limit(st.limit())
            .exclusiveStartKey(lastKey);
        if (!usedNames.isEmpty()) b.expressionAttributeNames(usedNames);
        if (!usedValues.isEmpty()) b.expressionAttributeValues(usedValues);
        ScanResponse resp = ddb.scan(b.build());
        items = resp.items();
        lastKey = resp.hasLastEvaluatedKey() ? resp.lastEvaluatedKey() : null;
      }
      for (Map<String, AttributeValue> item : items) out.add(AttributeValues.fromItem(item));
    } while (st.limit() == null && lastKey != null && !lastKey.isEmpty());
    return out;
  }

  static List<Map<String, Object>> clientSide(List<Map<String, Object>> rows, DynamoStatement st) {
    if (!st.clientSidePaging()) return rows;
    List<Map<String, Object>> sorted = new ArrayList<>(rows);
    if (!st.orderBy().isEmpty()) {
      Comparator<Map<String, Object>> cmp = null;
      for (OrderBy o : st.orderBy()) {
        Comparator<Map<String, Object>> c = (a, b) -> compareValues(a.get(o.field()), b.get(o.field()));
        if (o.direction() == OrderBy.Direction.DESC) c = c.reversed();
        cmp = (cmp == null) ? c : cmp.thenComparing(c);
      }
      sorted.sort(cmp);
    }
    int from = Math.min(sorted.size(), st.offset() == null ? 0 : st.offset());
    int to = (st.take() == null) ? sorted.size() : Math.min(sorted.size(), from + st.take());
    return sorted.subList(from, to);
  }

  /** Nulls first; numbers numerically; booleans false before true; everything else by string form. */
  static int compareValues(Object a, Object b) {
    if (a == b) return 0;
    if (a == null) return -1;
    if (b == null) return 1;
    if (a instanceof Number x && b instanceof Number y) {
      return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
    }
    if (a instanceof Boolean x && b instanceof Boolean y) return x.compareTo(y);
    return a.toString().compareTo(b.toString());
  }

  private static void withExpressions(DynamoStatement st, String expressions,
                                      Consumer<Map<String, String>> names,
                                      Consumer<Map<String, AttributeValue>> values) {
    Map<String, String> n = usedNames(st.names(), expressions);
    Map<String, AttributeValue> v = usedValues(st.values(), expressions);
    if (!n.isEmpty()) names.accept(n);
    if (!v.isEmpty()) values.accept(v);
  }

  /** DynamoDB rejects placeholders a request does not reference. */
  static Map<String, String> usedNames(Map<String, String> names, String expressions) {
    Set<String> used = placeholders(expressions);
    Map<String, String> out = new LinkedHashMap<>();
    names.forEach((k, v) -> { if (used.contains(k)) out.put(k, v); });
    return out;
  }

  static Map<String, AttributeValue> usedValues(Map<String, Object> values, String expressions) {
    Set<String> used = placeholders(expressions);
    Map<String, AttributeValue> out = new LinkedHashMap<>();
    values.forEach((k, v) -> { if (used.contains(k)) out.put(k, AttributeValues.toAttribute(v)); });
    return out;
  }

  private static Set<String> placeholders(String expressions) {
    Set<String> out = new HashSet<>();
    if (expressions == null) return out;
    Matcher m = PLACEHOLDER.matcher(expressions);
    while (m.find()) out.add(m.group());
    return out;
  }

  private void awaitActive(String table) {
    for (int i = 0; i < ACTIVE_POLL_ATTEMPTS; i++) {
      TableStatus status = ddb.describeTable(r -> r.tableName(table)).table().tableStatus();
      if (status == TableStatus.ACTIVE) return;
      try {
        Thread.sleep(ACTIVE_POLL_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DriverException(id(), "ENSURE_SCHEMA", e);
      }
    }
    log.warn("polydata.dynamo op=ENSURE_SCHEMA provider={} table={} notActiveAfterMs={}",
        id(), table, ACTIVE_POLL_ATTEMPTS * ACTIVE_POLL_MILLIS);
  }

  private static ScalarAttributeType scalarType(FieldDef f) {
    if (f == null) return ScalarAttributeType.S;
    return switch (f.type()) {
      case INTEGER, BIGINT, FLOAT, DOUBLE -> ScalarAttributeType.N;
      default -> ScalarAttributeType.S;
    };
  }
}
