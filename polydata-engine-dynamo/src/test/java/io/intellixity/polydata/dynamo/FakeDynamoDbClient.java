package io.intellixity.polydata.dynamo;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbServiceClientConfiguration;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.CreateTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.ListTablesResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory DynamoDB for executor tests.
 * <p>
 * Understands the expression subset the dialect emits: conjunctions of {@code #n = :v},
 * {@code attribute_exists(#n)}, {@code attribute_not_exists(#n)} and parenthesized OR groups,
 * plus {@code SET #a = :x, #b = :y} updates. Projections are ignored.
 */
final class FakeDynamoDbClient implements DynamoDbClient {
  final Map<String, List<String>> keySchemas = new LinkedHashMap<>();
  final Map<String, Map<List<AttributeValue>, Map<String, AttributeValue>>> tables = new LinkedHashMap<>();
  final List<Object> requests = new ArrayList<>();
  int createTableCalls;
  int pageSize = Integer.MAX_VALUE;
  boolean closed;

  @Override public String serviceName() { return "dynamodb"; }

  @Override public void close() { closed = true; }

  @Override
  public DynamoDbServiceClientConfiguration serviceClientConfiguration() {
    throw new UnsupportedOperationException();
  }

  @Override
  public ListTablesResponse listTables(ListTablesRequest r) {
    requests.add(r);
    return ListTablesResponse.builder().tableNames(new ArrayList<>(tables.keySet())).build();
  }

  @Override
  public DescribeTableResponse describeTable(DescribeTableRequest r) {
    requests.add(r);
    if (!tables.containsKey(r.tableName())) {
      throw ResourceNotFoundException.builder().message("Requested resource not found: " + r.tableName()).build();
    }
    return DescribeTableResponse.builder()
        .table(TableDescription.builder().tableName(r.tableName()).tableStatus(TableStatus.ACTIVE).build())
        .build();
  }

  @Override
  public CreateTableResponse createTable(CreateTableRequest r) {
    requests.add(r);
    createTableCalls++;
    if (tables.containsKey(r.tableName())) throw ResourceInUseException.builder().message("exists").build();
    List<String> key = new ArrayList<>();
    for (KeySchemaElement e : r.keySchema()) {
      if (e.keyType() == KeyType.HASH) key.add(0, e.attributeName());
      else key.add(e.attributeName());
    }
    keySchemas.put(r.tableName(), key);
    tables.put(r.tableName(), new LinkedHashMap<>());
    return CreateTableResponse.builder().build();
  }

  @Override
  public PutItemResponse putItem(PutItemRequest r) {
    requests.add(r);
    Map<List<AttributeValue>, Map<String, AttributeValue>> t = table(r.tableName());
    List<AttributeValue> key = keyOf(r.tableName(), r.item());
    check(r.conditionExpression(), t.get(key), r.expressionAttributeNames(), r.expressionAttributeValues());
    t.put(key, new LinkedHashMap<>(r.item()));
    return PutItemResponse.builder().build();
  }

  @Override
  public GetItemResponse getItem(GetItemRequest r) {
    requests.add(r);
    Map<String, AttributeValue> item = table(r.tableName()).get(keyOf(r.tableName(), r.key()));
    return item == null ? GetItemResponse.builder().build() : GetItemResponse.builder().item(item).build();
  }

  @Override
  public UpdateItemResponse updateItem(UpdateItemRequest r) {
    requests.add(r);
    Map<List<AttributeValue>, Map<String, AttributeValue>> t = table(r.tableName());
    List<AttributeValue> key = keyOf(r.tableName(), r.key());
    Map<String, AttributeValue> existing = t.get(key);
    check(r.conditionExpression(), existing, r.expressionAttributeNames(), r.expressionAttributeValues());
    Map<String, AttributeValue> next = existing == null ? new LinkedHashMap<>(r.key()) : new LinkedHashMap<>(existing);
    String expr = r.updateExpression().trim();
    if (!expr.startsWith("SET ")) throw new IllegalArgumentException("only SET updates are supported: " + expr);
    for (String assignment : expr.substring(4).split(",")) {
      String[] sides = assignment.split("=");
      next.put(resolveName(sides[0].trim(), r.expressionAttributeNames()), r.expressionAttributeValues().get(sides[1].trim()));
    }
    t.put(key, next);
    return UpdateItemResponse.builder().build();
  }

  @Override
  public DeleteItemResponse deleteItem(DeleteItemRequest r) {
    requests.add(r);
    Map<List<AttributeValue>, Map<String, AttributeValue>> t = table(r.tableName());
    List<AttributeValue> key = keyOf(r.tableName(), r.key());
    check(r.conditionExpression(), t.get(key), r.expressionAttributeNames(), r.expressionAttributeValues());
    t.remove(key);
    return DeleteItemResponse.builder().build();
  }

  @Override
  public ScanResponse scan(ScanRequest r) {
    requests.add(r);
    List<Map<String, AttributeValue>> all = new ArrayList<>(table(r.tableName()).values());
    int from = 0;
    if (r.hasExclusiveStartKey()) {
      List<AttributeValue> start = keyOf(r.tableName(), r.exclusiveStartKey());
      for (int i = 0; i < all.size(); i++) {
        if (keyOf(r.tableName(), all.get(i)).equals(start)) from = i + 1;
      }
    }
    int page = (r.limit() == null) ? pageSize : Math.min(pageSize, r.limit());
    int to = Math.min(all.size(), from + page);
    List<Map<String, AttributeValue>> out = new ArrayList<>();
    for (Map<String, AttributeValue> item : all.subList(from, to)) {
      if (matches(r.filterExpression(), item, r.expressionAttributeNames(), r.expressionAttributeValues())) out.add(item);
    }
    ScanResponse.Builder b = ScanResponse.builder().items(out).count(out.size());
    if (to < all.size()) {
      Map<String, AttributeValue> last = new LinkedHashMap<>();
      for (String k : keySchemas.get(r.tableName())) last.put(k, all.get(to - 1).get(k));
      b.lastEvaluatedKey(last);
    }
    return b.build();
  }

  long count(Class<?> requestType) {
    return requests.stream().filter(requestType::isInstance).count();
  }

  private Map<List<AttributeValue>, Map<String, AttributeValue>> table(String name) {
    Map<List<AttributeValue>, Map<String, AttributeValue>> t = tables.get(name);
    if (t == null) throw ResourceNotFoundException.builder().message("Requested resource not found: " + name).build();
    return t;
  }

  private List<AttributeValue> keyOf(String table, Map<String, AttributeValue> item) {
    List<AttributeValue> key = new ArrayList<>();
    for (String k : keySchemas.get(table)) {
      AttributeValue v = item.get(k);
      if (v == null) throw new IllegalArgumentException("missing key attribute " + k);
      key.add(v);
    }
    return key;
  }

  private static void check(String condition, Map<String, AttributeValue> item,
                            Map<String, String> names, Map<String, AttributeValue> values) {
    if (!matches(condition, item, names, values)) {
      throw ConditionalCheckFailedException.builder().message("The conditional request failed").build();
    }
  }

  static boolean matches(String expr, Map<String, AttributeValue> item,
                         Map<String, String> names, Map<String, AttributeValue> values) {
    if (expr == null || expr.isBlank()) return true;
    for (String term : splitTopLevel(expr, " AND ")) {
      if (!term(term.trim(), item, names, values)) return false;
    }
    return true;
  }

  private static boolean term(String t, Map<String, AttributeValue> item,
                              Map<String, String> names, Map<String, AttributeValue> values) {
    if (t.startsWith("(") && t.endsWith(")")) {
      for (String alt : t.substring(1, t.length() - 1).split(" OR ")) {
        if (term(alt.trim(), item, names, values)) return true;
      }
      return false;
    }
    if (t.startsWith("attribute_exists(")) {
      return item != null && item.containsKey(resolveName(inner(t), names));
    }
    if (t.startsWith("attribute_not_exists(")) {
      return item == null || !item.containsKey(resolveName(inner(t), names));
    }
    String[] sides = t.split("=");
    if (sides.length != 2) throw new IllegalArgumentException("unsupported expression: " + t);
    return item != null && Objects.equals(item.get(resolveName(sides[0].trim(), names)), values.get(sides[1].trim()));
  }

  private static String inner(String call) {
    return call.substring(call.indexOf('(') + 1, call.lastIndexOf(')')).trim();
  }

  private static String resolveName(String token, Map<String, String> names) {
    return token.startsWith("#") ? names.get(token) : token;
  }

  private static List<String> splitTopLevel(String s, String sep) {
    List<String> out = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '(') depth++;
      else if (c == ')') depth--;
      else if (depth == 0 && s.startsWith(sep, i)) {
        out.add(s.substring(start, i));
        start = i + sep.length();
        i = start - 1;
      }
    }
    out.add(s.substring(start));
    return out;
  }
}
