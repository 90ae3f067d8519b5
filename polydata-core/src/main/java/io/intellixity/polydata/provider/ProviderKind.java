package io.intellixity.polydata.provider;

import java.util.Locale;

/**
 * Supported backing store technologies.
 * <p>
 * The managed-document and graph-document kinds are reached through their MongoDB-compatible wire
 * endpoints, so they share the document executor family.
 */
public enum ProviderKind {
  RELATIONAL_A("postgresql", ProviderFamily.RELATIONAL, 5432),
  RELATIONAL_B("mysql", ProviderFamily.RELATIONAL, 3306),
  DOCUMENT("mongodb", ProviderFamily.DOCUMENT, 27017),
  WIDE_COLUMN("dynamodb", ProviderFamily.WIDE_COLUMN, 443),
  MANAGED_DOCUMENT("cosmosdb", ProviderFamily.DOCUMENT, 10255),
  GRAPH_DOCUMENT("firestore", ProviderFamily.DOCUMENT, 443);

  private final String id;
  private final ProviderFamily family;
  private final int defaultPort;

  ProviderKind(String id, ProviderFamily family, int defaultPort) {
    this.id = id;
    this.family = family;
    this.defaultPort = defaultPort;
  }

  /** Default provider id; also the name used in configuration and environment variables. */
  public String id() { return id; }
  public ProviderFamily family() { return family; }
  public int defaultPort() { return defaultPort; }

  /** Accepts either the enum name ({@code RELATIONAL_A}) or the provider id ({@code postgresql}). */
  public static ProviderKind parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("provider kind is blank");
    String t = s.trim();
    for (ProviderKind k : values()) {
      if (k.id.equalsIgnoreCase(t) || k.name().equalsIgnoreCase(t.replace('-', '_'))) return k;
    }
    throw new IllegalArgumentException("Unknown provider kind: " + s.toLowerCase(Locale.ROOT));
  }
}
