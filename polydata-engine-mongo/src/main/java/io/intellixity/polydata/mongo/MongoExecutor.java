package io.intellixity.polydata.mongo;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoServerException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.intellixity.polydata.error.PolydataException;
import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.provider.Capabilities;
import io.intellixity.polydata.provider.ProviderKind;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.IndexDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaResult;
import io.intellixity.polydata.spi.AbstractProviderExecutor;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Document executor over the MongoDB sync driver.
 * <p>
 * Inserts answer with the written document including its generated {@code _id}; updates answer
 * with the matched count and deletes with the deleted count. Managed-document and graph-document
 * providers reach this executor through their MongoDB-compatible endpoints.
 */
public final class MongoExecutor extends AbstractProviderExecutor<MongoStatement, MongoHandle> {
  private static final Logger log = LoggerFactory.getLogger(MongoExecutor.class);

  static final int DUPLICATE_KEY = 11000;
  static final int NAMESPACE_EXISTS = 48;

  private final MongoDatabase db;

  public MongoExecutor(MongoHandle handle, ProviderKind kind) {
    this(handle, kind, new MongoDialect());
  }

  public MongoExecutor(MongoHandle handle, ProviderKind kind, MongoDialect dialect) {
    super(handle, kind, dialect, Capabilities.of(true, false, false, true));
    this.db = handle.client().getDatabase(handle.namespace());
  }

  @Override
  public void ping() {
    guarded("PING", () -> db.runCommand(new Document("ping", 1)));
  }

  @Override
  protected QueryResult run(QueryDescriptor query, MongoStatement stmt) {
    return dispatch(query.kind().name(), stmt);
  }

  @Override
  protected QueryResult runNative(MongoStatement stmt) {
    return dispatch("NATIVE", stmt);
  }

  @Override
  protected MongoStatement toNative(Object statement, List<Object> params) {
    if (!params.isEmpty()) {
      throw new UnsupportedQueryException("Document operations carry their values inline; positional params are not supported");
    }
    if (statement instanceof MongoStatement s) return s;
    if (statement instanceof Map<?, ?> m) return MongoStatement.fromMap(m);
    throw new UnsupportedQueryException("Document providers accept MongoStatement or an operation map, got "
        + statement.getClass().getName());
  }

  @Override
  protected SchemaResult doEnsureSchema(SchemaDescriptor schema) {
    String name = schema.name();
    boolean exists = false;
    for (String c : db.listCollectionNames()) {
      if (c.equals(name)) {
        exists = true;
        break;
      }
    }
    boolean created = false;
    if (!exists) {
      try {
        db.createCollection(name);
        created = true;
      } catch (MongoCommandException e) {
        if (e.getErrorCode() != NAMESPACE_EXISTS) throw e;
      }
    }

    MongoCollection<Document> col = db.getCollection(name);
    for (IndexDef idx : schema.indexes()) {
      createIndex(col, idx.fields(), idx.nameFor(name), idx.unique());
    }
    for (FieldDef f : schema.fields()) {
      if (f.unique() && !f.primaryKey()) createIndex(col, List.of(f.name()), "uniq_" + name + "_" + f.name(), true);
    }
    List<String> key = schema.keyFields();
    if (!key.isEmpty() && !key.equals(List.of("_id"))) {
      createIndex(col, key, "pk_" + name, true);
    }
    log.info("polydata.mongo_schema provider={} collection={} freshlyCreated={} indexes={}",
        id(), name, created, schema.indexes().size());
    return new SchemaResult(name, true);
  }

  @Override
  protected PolydataException translate(String operation, Exception e) {
    if (isDuplicateKey(e)) {
      return new ValidationException("Duplicate key on " + operation + " (provider=" + id() + ")", e);
    }
    return super.translate(operation, e);
  }

  @Override
  public void close() {
    handle().client().close();
    log.info("polydata.mongo_closed provider={}", id());
  }

  private QueryResult dispatch(String op, MongoStatement st) {
    MongoCollection<Document> col = db.getCollection(st.collection());
    long start = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("polydata.mongo op={} action={} provider={} database={} collection={}",
          op, st.action().id(), id(), handle().namespace(), st.collection());
    }
    QueryResult r = switch (st.action()) {
      case FIND -> (st.limit() != null && st.limit() == 0)
          ? QueryResult.ofRows(List.of())
          : QueryResult.ofRows(MongoRows.toRows(cursor(col, st)));
      case FIND_ONE -> {
        Document d = cursor(col, st).first();
        yield QueryResult.ofRows(d == null ? List.of() : List.of(MongoRows.toRow(d)));
      }
      case INSERT_ONE -> {
        Document doc = new Document(requireDocument(st));
        col.insertOne(doc);
        yield QueryResult.of(List.of(MongoRows.toRow(doc)), 1);
      }
      case INSERT_MANY -> {
        if (st.documents().isEmpty()) yield QueryResult.ofCount(0);
        List<Document> docs = new ArrayList<>(st.documents().size());
        for (Document d : st.documents()) docs.add(new Document(d));
        col.insertMany(docs);
        yield QueryResult.of(MongoRows.toRows(docs), docs.size());
      }
      case UPDATE_ONE -> QueryResult.ofCount(col.updateOne(st.filter(), requireDocument(st)).getMatchedCount());
      case UPDATE_MANY -> QueryResult.ofCount(col.updateMany(st.filter(), requireDocument(st)).getMatchedCount());
      case DELETE_ONE -> QueryResult.ofCount(col.deleteOne(st.filter()).getDeletedCount());
      case DELETE_MANY -> QueryResult.ofCount(col.deleteMany(st.filter()).getDeletedCount());
      case AGGREGATE -> QueryResult.ofRows(MongoRows.toRows(col.aggregate(st.pipeline())));
    };
    if (log.isDebugEnabled()) {
      log.debug("polydata.mongo_done op={} action={} durationMs={} rows={} affected={}",
          op, st.action().id(), (System.nanoTime() - start) / 1_000_000.0, r.size(), r.affected());
    }
    return r;
  }

  private static FindIterable<Document> cursor(MongoCollection<Document> col, MongoStatement st) {
    FindIterable<Document> find = col.find(st.filter());
    if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
    if (st.skip() != null && st.skip() > 0) find = find.skip(st.skip());
    if (st.limit() != null) find = find.limit(st.limit());
    if (st.projection() != null && !st.projection().isEmpty()) find = find.projection(st.projection());
    return find;
  }

  private static Document requireDocument(MongoStatement st) {
    if (st.document() == null || st.document().isEmpty()) {
      throw new UnsupportedQueryException(st.action().id() + " requires a non-empty document");
    }
    return st.document();
  }

  private static void createIndex(MongoCollection<Document> col, List<String> fields, String name, boolean unique) {
    col.createIndex(Indexes.ascending(fields), new IndexOptions().name(name).unique(unique));
  }

  static boolean isDuplicateKey(Throwable e) {
    if (e instanceof MongoBulkWriteException bulk) {
      for (BulkWriteError err : bulk.getWriteErrors()) {
        if (err.getCode() == DUPLICATE_KEY) return true;
      }
      return false;
    }
    return e instanceof MongoServerException se && se.getCode() == DUPLICATE_KEY;
  }
}
