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

import ai.floedb.replicator.spi.TableService;
import ai.floedb.replicator.spi.WriteKind;
import java.util.Objects;

/** Creates {@link BackoffWriter}s sharing one service, backoff policy and sleeper. */
public final class BatchWriters {
  private final TableService tables;
  private final BackoffPolicy policy;
  private final Sleeper sleeper;

  public BatchWriters(TableService tables, BackoffPolicy policy, Sleeper sleeper) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public BackoffWriter forTable(TableHandle table, WriteKind kind) {
    return new BackoffWriter(tables, table, kind, policy, sleeper);
  }

  public BackoffPolicy policy() {
    return policy;
  }
}
