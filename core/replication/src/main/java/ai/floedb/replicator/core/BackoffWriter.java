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

import ai.floedb.replicator.spi.BatchWriteResult;
import ai.floedb.replicator.spi.Item;
import ai.floedb.replicator.spi.ReplicationException;
import ai.floedb.replicator.spi.ReplicationException.RetriesExhaustedException;
import ai.floedb.replicator.spi.ReplicationException.ServiceException;
import ai.floedb.replicator.spi.TableService;
import ai.floedb.replicator.spi.WriteIntent;
import ai.floedb.replicator.spi.WriteKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Writes one batch of a single kind into one table and keeps resubmitting whatever the service
 * reports as unprocessed, sleeping with exponential backoff in between.
 *
 * <p>When {@link #execute(List)} returns normally every intent of the batch has been applied. A
 * non-success status is never retried.
 */
public final class BackoffWriter {
  private static final Logger LOG = Logger.getLogger(BackoffWriter.class);

  private final TableService tables;
  private final TableHandle table;
  private final WriteKind kind;
  private final BackoffPolicy policy;
  private final Sleeper sleeper;

  public BackoffWriter(
      TableService tables,
      TableHandle table,
      WriteKind kind,
      BackoffPolicy policy,
      Sleeper sleeper) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.table = Objects.requireNonNull(table, "table");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public TableHandle table() {
    return table;
  }

  public WriteKind kind() {
    return kind;
  }

  /**
   * Turns {@code batch} into intents of this writer's kind and writes them.
   *
   * @return number of items applied
   */
  public int execute(List<Item> batch) {
    if (batch.isEmpty()) {
      return 0;
    }
    var intents = new ArrayList<WriteIntent>(batch.size());
    for (Item item : batch) {
      intents.add(toIntent(item));
    }
    return write(intents);
  }

  /** Writes pre-built intents; all of them must be of this writer's kind. */
  public int write(List<WriteIntent> intents) {
    if (intents.isEmpty()) {
      return 0;
    }
    if (intents.size() > Batcher.MAX_BATCH_SIZE) {
      throw new IllegalArgumentException(
          "batch of "
              + intents.size()
              + " exceeds the batch-write limit of "
              + Batcher.MAX_BATCH_SIZE);
    }
    for (WriteIntent intent : intents) {
      if (intent.kind() != kind) {
        throw new IllegalArgumentException(
            "a " + kind + " writer cannot submit a " + intent.kind() + " intent");
      }
    }

    BatchWriteResult result = submit(intents, "batch items");
    Duration delay = policy.initialDelay();
    Duration slept = Duration.ZERO;
    int attempt = 0;
    while (result.hasUnprocessed()) {
      attempt++;
      Duration sleptAfterDelay = slept.plus(delay);
      if (!policy.permits(attempt, sleptAfterDelay)) {
        throw new RetriesExhaustedException(
            String.format(
                "%s to %s gave up after %d retries with %d of %d items unprocessed",
                kind, table.ref(), attempt - 1, result.unprocessed().size(), intents.size()),
            attempt - 1,
            result.unprocessed());
      }
      LOG.infof(
          "Unprocessed items detected on %s (%d of %d), backing off %s before retry %d",
          table.ref(), result.unprocessed().size(), intents.size(), delay, attempt);
      sleep(delay);
      slept = sleptAfterDelay;
      delay = policy.next(delay);
      result = submit(result.unprocessed(), "batch unprocessed items");
    }
    return intents.size();
  }

  private WriteIntent toIntent(Item item) {
    if (kind == WriteKind.PUT) {
      return new WriteIntent.Put(item);
    }
    return new WriteIntent.Delete(item.key(table.keySchema()));
  }

  private BatchWriteResult submit(List<WriteIntent> intents, String what) {
    BatchWriteResult result = tables.batchWrite(table.ref(), kind, intents);
    if (!result.isSuccess()) {
      throw new ServiceException(
          String.format(
              "%s returned a problem writing %s to %s: HTTP %d",
              kind, what, table.ref(), result.httpStatus()),
          result.httpStatus());
    }
    return result;
  }

  private void sleep(Duration delay) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ReplicationException("Interrupted while backing off writes to " + table.ref(), e);
    }
  }
}
