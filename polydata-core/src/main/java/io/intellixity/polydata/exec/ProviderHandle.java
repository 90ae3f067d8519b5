package io.intellixity.polydata.exec;

/**
 * Resolved runtime handle for one connected provider.
 * <p>
 * Example:
 * <ul>
 *   <li>relational: client() is a pooled {@code javax.sql.DataSource}, namespace() is the database</li>
 *   <li>document: client() is a {@code MongoClient}, namespace() is the database</li>
 *   <li>wide-column: client() is a {@code DynamoDbClient}, namespace() is the region</li>
 * </ul>
 * Handles are owned by the executor that wraps them; callers borrow, never close them.
 */
public interface ProviderHandle<C> {
  /** Provider id this handle was opened for (useful for logging/caching). */
  String id();

  /** Native client used by an executor. */
  C client();

  /** Namespace (database/region) for this handle. */
  String namespace();
}
