package io.intellixity.polydata.provider;

/** What a provider family can express natively; the compiler rejects descriptors that need more. */
public record Capabilities(boolean transactions, boolean returning, boolean joins, boolean aggregation) {
  public static Capabilities of(boolean transactions, boolean returning, boolean joins, boolean aggregation) {
    return new Capabilities(transactions, returning, joins, aggregation);
  }
}
