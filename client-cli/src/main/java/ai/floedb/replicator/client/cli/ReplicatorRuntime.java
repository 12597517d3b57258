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
package ai.floedb.replicator.client.cli;

import ai.floedb.replicator.core.CopyCompatibility;
import ai.floedb.replicator.core.ReplicationOptions;
import ai.floedb.replicator.core.ReplicationOrchestrator;
import ai.floedb.replicator.core.config.ReplicationConfig;
import ai.floedb.replicator.storage.aws.AwsClients;
import ai.floedb.replicator.storage.aws.AwsConfig;
import ai.floedb.replicator.storage.aws.DynamoDbKeySchemaResolver;
import ai.floedb.replicator.storage.aws.DynamoDbTableService;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

/**
 * The orchestrator wired to DynamoDB, plus the clients it holds open. Configuration comes from
 * system properties, environment variables and {@code META-INF/microprofile-config.properties}.
 */
final class ReplicatorRuntime implements AutoCloseable {

  private final AwsClients clients;
  private final ReplicationOrchestrator orchestrator;

  private ReplicatorRuntime(AwsClients clients, ReplicationOrchestrator orchestrator) {
    this.clients = clients;
    this.orchestrator = orchestrator;
  }

  static ReplicatorRuntime load() {
    return fromConfig(loadConfig());
  }

  static SmallRyeConfig loadConfig() {
    return new SmallRyeConfigBuilder()
        .addDefaultSources()
        .withMapping(ReplicationConfig.class)
        .withMapping(AwsConfig.class)
        .build();
  }

  static ReplicatorRuntime fromConfig(SmallRyeConfig config) {
    ReplicationConfig replication = config.getConfigMapping(ReplicationConfig.class);
    var clients = new AwsClients(config.getConfigMapping(AwsConfig.class));
    var orchestrator =
        ReplicationOrchestrator.builder()
            .tableService(new DynamoDbTableService(clients))
            .keySchemaResolver(new DynamoDbKeySchemaResolver(clients))
            .copyCompatibility(CopyCompatibility.named(replication.copy().compatibility()))
            .options(ReplicationOptions.from(replication))
            .build();
    return new ReplicatorRuntime(clients, orchestrator);
  }

  ReplicationOrchestrator orchestrator() {
    return orchestrator;
  }

  @Override
  public void close() {
    clients.close();
  }
}
