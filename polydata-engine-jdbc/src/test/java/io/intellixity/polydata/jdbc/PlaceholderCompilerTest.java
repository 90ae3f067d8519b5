package io.intellixity.polydata.jdbc;

import io.intellixity.polydata.error.UnsupportedQueryException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PlaceholderCompilerTest {
  @Test
  void rewritesNumberedPlaceholdersInAppearanceOrder() {
    SqlStatement in = new SqlStatement("UPDATE t SET a = $2 WHERE b = $1", List.of("x", "y"));
    SqlStatement out = PlaceholderCompiler.toJdbc(in);
    assertEquals("UPDATE t SET a = ? WHERE b = ?", out.sql());
    assertEquals(List.of("y", "x"), out.binds());
  }

  @Test
  void ignoresDollarDigitsInsideQuotes() {
    SqlStatement in = new SqlStatement("SELECT '$1 it''s', \"$2\" FROM t WHERE a = $1", List.of(7));
    SqlStatement out = PlaceholderCompiler.toJdbc(in);
    assertEquals("SELECT '$1 it''s', \"$2\" FROM t WHERE a = ?", out.sql());
    assertEquals(List.of(7), out.binds());
  }

  @Test
  void repeatedPlaceholderRepeatsBind() {
    SqlStatement out = PlaceholderCompiler.toJdbc(new SqlStatement("SELECT $1, $1", List.of("v")));
    assertEquals(List.of("v", "v"), out.binds());
  }

  @Test
  void questionMarkStatementsPassThrough() {
    SqlStatement in = new SqlStatement("SELECT * FROM t WHERE a = ?", Arrays.asList((Object) null));
    assertSame(in, PlaceholderCompiler.toJdbc(in));
  }

  @Test
  void placeholderWithoutBindIsRejected() {
    assertThrows(UnsupportedQueryException.class,
        () -> PlaceholderCompiler.toJdbc(new SqlStatement("SELECT $3", List.of(1))));
  }

  @Test
  void countsMarkersOutsideQuotes() {
    assertEquals(3, PlaceholderCompiler.countPlaceholders("a = $1 AND b = $10 AND c = ? AND d = '?' AND `e?` = 1"));
  }
}
