package io.intellixity.polydata;

import java.time.Duration;

/** Engine-wide settings; per-provider connection settings live in {@code ProviderConfig}. */
public record PolydataSettings(
    String defaultProvider,
    Duration cacheTimeout,
    boolean enableCaching,
    boolean enableRestApi,
    boolean enableGraphQl,
    boolean enableRealtime,
    LedgerMode ledger,
    int ioThreads
) {
  public static final String DEFAULT_PROVIDER = "postgresql";
  public static final Duration DEFAULT_CACHE_TIMEOUT = Duration.ofMinutes(5);

  /** Where the migration applied-set lives. */
  public enum LedgerMode { STORE, IN_MEMORY }

  public PolydataSettings {
    defaultProvider = (defaultProvider == null || defaultProvider.isBlank()) ? DEFAULT_PROVIDER : defaultProvider;
    cacheTimeout = (cacheTimeout == null) ? DEFAULT_CACHE_TIMEOUT : cacheTimeout;
    if (cacheTimeout.isNegative() || cacheTimeout.isZero()) {
      throw new IllegalArgumentException("cacheTimeout must be > 0");
    }
    ledger = (ledger == null) ? LedgerMode.STORE : ledger;
    ioThreads = (ioThreads <= 0) ? Math.max(2, Runtime.getRuntime().availableProcessors()) : ioThreads;
  }

  public static PolydataSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String defaultProvider = DEFAULT_PROVIDER;
    private Duration cacheTimeout = DEFAULT_CACHE_TIMEOUT;
    private boolean enableCaching = true;
    private boolean enableRestApi = true;
    private boolean enableGraphQl = true;
    private boolean enableRealtime = true;
    private LedgerMode ledger = LedgerMode.STORE;
    private int ioThreads;

    private Builder() {}

    public Builder defaultProvider(String v) { this.defaultProvider = v; return this; }
    public Builder cacheTimeout(Duration v) { this.cacheTimeout = v; return this; }
    public Builder enableCaching(boolean v) { this.enableCaching = v; return this; }
    public Builder enableRestApi(boolean v) { this.enableRestApi = v; return this; }
    public Builder enableGraphQl(boolean v) { this.enableGraphQl = v; return this; }
    public Builder enableRealtime(boolean v) { this.enableRealtime = v; return this; }
    public Builder ledger(LedgerMode v) { this.ledger = v; return this; }
    public Builder ioThreads(int v) { this.ioThreads = v; return this; }

    public PolydataSettings build() {
      return new PolydataSettings(defaultProvider, cacheTimeout, enableCaching, enableRestApi, enableGraphQl,
          enableRealtime, ledger, ioThreads);
    }
  }
}
