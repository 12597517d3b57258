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
package ai.floedb.replicator.core;

import ai.floedb.replicator.core.config.ReplicationConfig;
import java.util.Objects;
import java.util.OptionalInt;

/** Tunables of the orchestrator, detached from the config source they were read from. */
public record ReplicationOptions(
    BackoffPolicy backoff,
    OptionalInt scanSegments,
    int queryPageSize,
    String backupNameSuffix,
    OptionalInt poolSize) {

  public ReplicationOptions {
    Objects.requireNonNull(backoff, "backoff");
    Objects.requireNonNull(backupNameSuffix, "backupNameSuffix");
    scanSegments = scanSegments == null ? OptionalInt.empty() : scanSegments;
    poolSize = poolSize == null ? OptionalInt.empty() : poolSize;
  }

  public static ReplicationOptions defaults() {
    return new ReplicationOptions(
        BackoffPolicy.DEFAULT,
        OptionalInt.empty(),
        PaginatedQuery.DEFAULT_PAGE_SIZE,
        "-backup",
        OptionalInt.empty());
  }

  public static ReplicationOptions from(ReplicationConfig config) {
    var write = config.write();
    var backoff =
        new BackoffPolicy(
            write.initialBackoff(),
            write.backoffMultiplier(),
            write.maxAttempts(),
            write.maxElapsed());
    return new ReplicationOptions(
        backoff,
        config.scan().segments(),
        config.query().pageSize(),
        config.backup().nameSuffix(),
        config.pool().size());
  }

  public ReplicationOptions withBackoff(BackoffPolicy policy) {
    return new ReplicationOptions(policy, scanSegments, queryPageSize, backupNameSuffix, poolSize);
  }

  public ReplicationOptions withScanSegments(int segments) {
    return new ReplicationOptions(
        backoff, OptionalInt.of(segments), queryPageSize, backupNameSuffix, poolSize);
  }

  public ReplicationOptions withPoolSize(int size) {
    return new ReplicationOptions(
        backoff, scanSegments, queryPageSize, backupNameSuffix, OptionalInt.of(size));
  }
}
