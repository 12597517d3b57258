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

import ai.floedb.replicator.spi.BackupReceipt;
import ai.floedb.replicator.spi.Item;
import ai.floedb.replicator.spi.KeySchemaResolver;
import ai.floedb.replicator.spi.ReplicationException.ConfigurationException;
import ai.floedb.replicator.spi.TableService;
import ai.floedb.replicator.spi.WriteKind;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Public replication operations: full-table copy, selective item copy, backup, restore, and the
 * read-only queries the copy operations are built from.
 *
 * <p>Every operation is synchronous and runs its steps in a fixed order. The first failing step
 * aborts the rest; nothing is rolled back, so a partially truncated or partially restored table
 * can be left behind and has to be fixed by re-running the operation.
 */
public final class ReplicationOrchestrator {
  private static final Logger LOG = Logger.getLogger(ReplicationOrchestrator.class);

  private final TableService tables;
  private final KeySchemaResolver schemas;
  private final CopyCompatibility compatibility;
  private final Supplier<WorkerPool> pools;
  private final ReplicationOptions options;
  private final BatchWriters writers;
  private final SegmentedScanner scanner;
  private final PaginatedQuery query;
  private final Truncator truncator;

  private ReplicationOrchestrator(Builder b) {
    this.tables = Objects.requireNonNull(b.tables, "tables");
    this.schemas = Objects.requireNonNull(b.schemas, "schemas");
    this.compatibility = b.compatibility;
    this.options = b.options;
    this.pools =
        b.pools != null
            ? b.pools
            : () ->
                options.poolSize().isPresent()
                    ? WorkerPool.create(options.poolSize().getAsInt())
                    : WorkerPool.sizedToHost();
    this.writers = new BatchWriters(tables, options.backoff(), b.sleeper);
    this.scanner = new SegmentedScanner(tables);
    this.query = new PaginatedQuery(tables, schemas, options.queryPageSize());
    this.truncator = new Truncator(tables, writers);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Resolves the key schema of {@code tableName} in {@code environment}. */
  public TableHandle open(String environment, String tableName) {
    return TableHandle.resolve(environment, tableName, schemas);
  }

  /**
   * Replaces the contents of {@code target} with those of {@code source}: backs up the target,
   * truncates it, then scans the source in parallel segments and puts every item into the target.
   *
   * @throws ConfigurationException if source and target are the same table or are not
   *     copy-compatible; raised before any remote call
   */
  public CopySummary copyTable(TableHandle source, TableHandle target) {
    requireDistinct(source, target, "Cannot copy a table onto itself");
    requireCompatible(source, target, "Cannot copy different tables");

    createBackup(target);
    try (WorkerPool pool = pools.get()) {
      int deleted = truncator.truncate(target, pool);
      int written = copyInParallelBatches(source, target, pool);
      LOG.infof(
          "Copied %d items from %s in %s to %s in %s",
          written,
          source.tableName(),
          source.environment(),
          target.tableName(),
          target.environment());
      return new CopySummary(deleted, written);
    }
  }

  /**
   * Replaces the items matching {@code selector} in {@code target} with the matching items of
   * {@code source}. All deletes of the target's matches complete before the first put is issued.
   */
  public CopySummary copyItems(TableHandle source, TableHandle target, ItemSelector selector) {
    requireCompatible(source, target, "Cannot copy items across tables with different names");

    List<Item> sourceItems = query.query(source, selector);
    List<Item> targetItems = query.query(target, selector);

    try (WorkerPool pool = pools.get()) {
      int deleted =
          BatchDispatcher.writeAll(
              Batcher.partition(targetItems), writers.forTable(target, WriteKind.DELETE), pool);
      LOG.infof(
          "Deleted %d items from %s in %s", deleted, target.tableName(), target.environment());

      int written =
          BatchDispatcher.writeAll(
              Batcher.partition(sourceItems), writers.forTable(target, WriteKind.PUT), pool);
      LOG.infof("Put %d items to %s in %s", written, target.tableName(), target.environment());

      LOG.infof(
          "Copied %d items from %s in %s to %s in %s",
          written,
          source.tableName(),
          source.environment(),
          target.tableName(),
          target.environment());
      return new CopySummary(deleted, written);
    }
  }

  /** Requests an on-demand backup named after the table. */
  public BackupReceipt createBackup(TableHandle table) {
    String backupName = table.tableName() + options.backupNameSuffix();
    BackupReceipt receipt = tables.createBackup(table.ref(), backupName);
    LOG.infof(
        "Created on-demand backup of %s in %s as '%s'",
        table.tableName(), table.environment(), backupName);
    return receipt;
  }

  /**
   * Refills {@code restored} from the backup table {@code backup}, then deletes the backup table.
   */
  public CopySummary restoreFromBackup(TableHandle restored, TableHandle backup) {
    requireDistinct(restored, backup, "Cannot restore a table from itself");
    CopySummary summary;
    try (WorkerPool pool = pools.get()) {
      int deleted = truncator.truncate(restored, pool);
      int written = copyInParallelBatches(backup, restored, pool);
      summary = new CopySummary(deleted, written);
    }
    tables.deleteTable(backup.ref());
    LOG.infof(
        "All items from %s have been copied to %s. %s is now deleted",
        backup.tableName(), restored.tableName(), backup.tableName());
    return summary;
  }

  public List<Item> queryItems(TableHandle table, ItemSelector selector) {
    return query.query(table, selector);
  }

  public List<Item> queryWithFilter(
      TableHandle table, ItemSelector selector, String attributeName, String prefix) {
    return query.queryWithFilter(table, selector, attributeName, prefix);
  }

  private int copyInParallelBatches(TableHandle source, TableHandle target, WorkerPool pool) {
    int segments = options.scanSegments().orElse(pool.parallelism());
    BackoffWriter puts = writers.forTable(target, WriteKind.PUT);
    int written =
        BatchDispatcher.writeAll(
            scanner
                .segments(source, pool, segments)
                .onItem()
                .transformToIterable(segment -> Batcher.partition(segment.items())),
            puts,
            pool);
    LOG.infof("Put %d items to %s in %s", written, target.tableName(), target.environment());
    return written;
  }

  private static void requireDistinct(TableHandle first, TableHandle second, String message) {
    if (first.equals(second)) {
      throw new ConfigurationException(
          message + ": " + first.tableName() + " in " + first.environment() + ".");
    }
  }

  private void requireCompatible(TableHandle source, TableHandle target, String message) {
    if (!compatibility.isCopyCompatible(source, target)) {
      throw new ConfigurationException(
          message + ": " + source.tableName() + " != " + target.tableName() + ".");
    }
  }

  public static final class Builder {
    private TableService tables;
    private KeySchemaResolver schemas;
    private CopyCompatibility compatibility = CopyCompatibility.SUBSTRING;
    private Supplier<WorkerPool> pools;
    private ReplicationOptions options = ReplicationOptions.defaults();
    private Sleeper sleeper = Sleeper.SYSTEM;

    private Builder() {}

    public Builder tableService(TableService tables) {
      this.tables = tables;
      return this;
    }

    public Builder keySchemaResolver(KeySchemaResolver schemas) {
      this.schemas = schemas;
      return this;
    }

    public Builder copyCompatibility(CopyCompatibility compatibility) {
      this.compatibility = Objects.requireNonNull(compatibility, "compatibility");
      return this;
    }

    /** Source of the pool each operation acquires and closes. */
    public Builder workerPools(Supplier<WorkerPool> pools) {
      this.pools = pools;
      return this;
    }

    public Builder options(ReplicationOptions options) {
      this.options = Objects.requireNonNull(options, "options");
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    public ReplicationOrchestrator build() {
      return new ReplicationOrchestrator(this);
    }
  }
}
