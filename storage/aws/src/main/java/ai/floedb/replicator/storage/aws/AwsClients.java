/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.floedb.replicator.storage.aws;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/** One {@link DynamoDbClient} per environment, built on first use and closed together. */
public class AwsClients implements DynamoDbSessions, AutoCloseable {
  private static final Logger LOG = Logger.getLogger(AwsClients.class);

  private final AwsConfig config;
  private final Map<String, DynamoDbClient> clients = new ConcurrentHashMap<>();

  public AwsClients(AwsConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public DynamoDbClient forEnvironment(String environment) {
    return clients.computeIfAbsent(environment, this::dynamoDbClient);
  }

  DynamoDbClient dynamoDbClient(String environment) {
    var env = Optional.ofNullable(config.environments().get(environment));
    Region region = Region.of(env.flatMap(AwsConfig.Environment::region).orElse(config.region()));
    Optional<URI> endpoint =
        env.flatMap(AwsConfig.Environment::endpointOverride).or(config::endpointOverride);

    var builder =
        DynamoDbClient.builder()
            .region(region)
            .httpClient(UrlConnectionHttpClient.create())
            .credentialsProvider(resolveCredentials(environment))
            .overrideConfiguration(ClientOverrideConfiguration.builder().build());
    endpoint.ifPresent(builder::endpointOverride);
    LOG.debugf(
        "DynamoDB client for environment %s: region=%s endpoint=%s",
        environment, region, endpoint.map(URI::toString).orElse("default"));
    return builder.build();
  }

  AwsCredentialsProvider resolveCredentials(String environment) {
    String access = trim(config.accessKeyId().orElse(null));
    String secret = trim(config.secretAccessKey().orElse(null));
    if (access != null && secret != null) {
      AwsCredentials creds =
          config
              .sessionToken()
              .filter(token -> !token.isBlank())
              .map(token -> AwsSessionCredentials.create(access, secret, token))
              .map(AwsCredentials.class::cast)
              .orElseGet(() -> AwsBasicCredentials.create(access, secret));
      return StaticCredentialsProvider.create(creds);
    }
    String profile =
        Optional.ofNullable(config.environments().get(environment))
            .flatMap(AwsConfig.Environment::profile)
            .map(AwsClients::trim)
            .orElse(environment);
    return ProfileCredentialsProvider.create(profile);
  }

  @Override
  public void close() {
    clients.values().forEach(DynamoDbClient::close);
    clients.clear();
  }

  private static String trim(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
