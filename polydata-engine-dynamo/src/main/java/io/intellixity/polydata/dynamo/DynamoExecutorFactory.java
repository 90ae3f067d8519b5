package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.error.ProviderConnectionException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.ProviderExecutor;
import io.intellixity.polydata.exec.ProviderExecutorFactory;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;
import java.util.Set;

/**
 * Opens the wide-column provider.
 * <p>
 * Access key and secret come from username/password; without them the SDK's default chain is
 * used. A configured url becomes the endpoint override (local DynamoDB, LocalStack).
 */
public final class DynamoExecutorFactory implements ProviderExecutorFactory {
  private static final Logger log = LoggerFactory.getLogger(DynamoExecutorFactory.class);
  static final String DEFAULT_REGION = "us-east-1";

  @Override
  public Set<ProviderKind> kinds() {
    return Set.of(ProviderKind.WIDE_COLUMN);
  }

  @Override
  public ProviderExecutor create(ProviderConfig config) {
    DynamoDbClient client;
    try {
      client = clientBuilder(config).build();
    } catch (ValidationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ProviderConnectionException(config.id(), "Client initialization failed", e);
    }
    log.info("polydata.dynamo op=client_open provider={} region={} endpoint={}",
        config.id(), region(config), endpoint(config));
    return new DynamoExecutor(new DynamoHandle(config.id(), client, region(config).id()));
  }

  /** Builder carrying region, credentials, endpoint and timeouts from {@code config}; nothing is connected. */
  public DynamoDbClientBuilder clientBuilder(ProviderConfig config) {
    DynamoDbClientBuilder b = DynamoDbClient.builder()
        .region(region(config))
        .credentialsProvider(credentials(config))
        .httpClientBuilder(UrlConnectionHttpClient.builder()
            .connectionTimeout(config.connectTimeout())
            .socketTimeout(config.idleTimeout()))
        .overrideConfiguration(ClientOverrideConfiguration.builder().build());
    URI endpoint = endpoint(config);
    if (endpoint != null) b = b.endpointOverride(endpoint);
    return b;
  }

  static Region region(ProviderConfig config) {
    String r = config.region();
    return Region.of(r == null || r.isBlank() ? DEFAULT_REGION : r.trim());
  }

  static URI endpoint(ProviderConfig config) {
    String url = config.url();
    if (url == null || url.isBlank()) return null;
    try {
      URI uri = URI.create(url.trim());
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new ValidationException("Endpoint for provider " + config.id() + " must be an absolute URI: " + url);
      }
      return uri;
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Invalid endpoint for provider " + config.id() + ": " + url, e);
    }
  }

  static AwsCredentialsProvider credentials(ProviderConfig config) {
    String key = config.username();
    String secret = config.password();
    if (key != null && !key.isBlank() && secret != null && !secret.isBlank()) {
      return StaticCredentialsProvider.create(AwsBasicCredentials.create(key, secret));
    }
    return DefaultCredentialsProvider.create();
  }
}
