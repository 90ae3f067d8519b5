package io.intellixity.polydata.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds provider configurations from environment variables.
 * <p>
 * Variable names and defaults follow the generated projects' conventions ({@code PG_HOST},
 * {@code MONGO_URL}, {@code AWS_REGION}, ...). Managed providers without credentials are skipped.
 * <p>
 * Managed-document and graph-document stores are reached through their MongoDB-compatible API, so
 * {@code COSMOS_ENDPOINT} and {@code FIREBASE_DATABASE_URL} are only used when they hold a
 * {@code mongodb://} or {@code mongodb+srv://} connection string. Native SQL-API and Firestore
 * endpoints are skipped with a warning.
 */
public final class ProviderConfigs {
  private static final Logger log = LoggerFactory.getLogger(ProviderConfigs.class);

  private ProviderConfigs() {}

  public static List<ProviderConfig> fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  public static List<ProviderConfig> fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    List<ProviderConfig> out = new ArrayList<>();

    out.add(ProviderConfig.builder(ProviderKind.RELATIONAL_A)
        .host(get(env, "PG_HOST", "localhost"))
        .port(intOf(get(env, "PG_PORT", "5432"), "PG_PORT"))
        .database(get(env, "PG_DATABASE", "pwa_app"))
        .username(get(env, "PG_USER", "postgres"))
        .password(get(env, "PG_PASSWORD", "password"))
        .tls(bool(get(env, "DB_SSL", "true")))
        .build());

    out.add(ProviderConfig.builder(ProviderKind.RELATIONAL_B)
        .host(get(env, "MYSQL_HOST", "localhost"))
        .port(intOf(get(env, "MYSQL_PORT", "3306"), "MYSQL_PORT"))
        .database(get(env, "MYSQL_DATABASE", "pwa_app"))
        .username(get(env, "MYSQL_USER", "root"))
        .password(get(env, "MYSQL_PASSWORD", "password"))
        .tls(bool(get(env, "DB_SSL", "true")))
        .build());

    out.add(ProviderConfig.builder(ProviderKind.DOCUMENT)
        .url(get(env, "MONGO_URL", "mongodb://localhost:27017/pwa_app"))
        .build());

    String accessKey = env.get("AWS_ACCESS_KEY_ID");
    String secretKey = env.get("AWS_SECRET_ACCESS_KEY");
    if (present(accessKey) && present(secretKey)) {
      out.add(ProviderConfig.builder(ProviderKind.WIDE_COLUMN)
          .region(get(env, "AWS_REGION", "us-east-1"))
          .username(accessKey)
          .password(secretKey)
          .url(env.get("DYNAMODB_ENDPOINT"))
          .build());
    }

    String cosmosEndpoint = env.get("COSMOS_ENDPOINT");
    String cosmosKey = env.get("COSMOS_KEY");
    if (present(cosmosEndpoint) && present(cosmosKey)) {
      if (mongoApi(cosmosEndpoint)) {
        out.add(ProviderConfig.builder(ProviderKind.MANAGED_DOCUMENT)
            .url(cosmosEndpoint.trim())
            .password(cosmosKey)
            .database(get(env, "COSMOS_DATABASE", "pwa_app"))
            .build());
      } else {
        skipNative(ProviderKind.MANAGED_DOCUMENT, "COSMOS_ENDPOINT");
      }
    }

    String firebaseProject = env.get("FIREBASE_PROJECT_ID");
    if (present(firebaseProject)) {
      String url = env.get("FIREBASE_DATABASE_URL");
      if (present(url) && mongoApi(url)) {
        out.add(ProviderConfig.builder(ProviderKind.GRAPH_DOCUMENT)
            .url(url.trim())
            .database(firebaseProject.trim())
            .build());
      } else {
        skipNative(ProviderKind.GRAPH_DOCUMENT, "FIREBASE_DATABASE_URL");
      }
    }
    return out;
  }

  static boolean mongoApi(String url) {
    String u = url.trim();
    return u.startsWith("mongodb://") || u.startsWith("mongodb+srv://");
  }

  private static void skipNative(ProviderKind kind, String variable) {
    log.warn("polydata.config provider={} status=skipped reason=\"{} is not a MongoDB API connection string\"",
        kind.id(), variable);
  }

  private static String get(Map<String, String> env, String name, String defaultValue) {
    String v = env.get(name);
    return present(v) ? v.trim() : defaultValue;
  }

  private static boolean present(String v) {
    return v != null && !v.isBlank();
  }

  private static boolean bool(String v) {
    return !"false".equalsIgnoreCase(v.trim());
  }

  private static int intOf(String v, String name) {
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + name + ": " + v, e);
    }
  }
}
