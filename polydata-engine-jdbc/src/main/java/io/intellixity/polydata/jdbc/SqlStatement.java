package io.intellixity.polydata.jdbc;

import io.intellixity.polydata.exec.NativeStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled SQL text plus positional binds.
 * <p>
 * Placeholders are dialect-specific ({@code $1..$n} or {@code ?}); the executor normalizes them with
 * {@link PlaceholderCompiler} before preparing. Binds may contain {@code null}.
 */
public record SqlStatement(String sql, List<Object> binds, ExecKind execKind) implements NativeStatement {
  public enum ExecKind {
    /** executeQuery(), rows returned. */
    QUERY,
    /** executeUpdate(), affected count returned. */
    UPDATE,
    /** executeUpdate() + getGeneratedKeys(), merged into the written payload. */
    UPDATE_GENERATED_KEYS,
    /** executeQuery() on a DML statement with a RETURNING clause. */
    QUERY_RETURNING
  }

  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is blank");
    binds = (binds == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
