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

import ai.floedb.replicator.spi.Page;
import ai.floedb.replicator.spi.ScanPageRequest;
import ai.floedb.replicator.spi.TableService;
import ai.floedb.replicator.spi.WriteKind;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Empties a table by scanning key attributes only and deleting every page it finds. A reader
 * running concurrently sees a partially emptied table.
 */
public final class Truncator {
  private static final Logger LOG = Logger.getLogger(Truncator.class);

  private final TableService tables;
  private final BatchWriters writers;

  public Truncator(TableService tables, BatchWriters writers) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.writers = Objects.requireNonNull(writers, "writers");
  }

  /**
   * @return number of items deleted
   */
  public int truncate(TableHandle table, WorkerPool pool) {
    BackoffWriter deletes = writers.forTable(table, WriteKind.DELETE);
    ScanPageRequest request =
        ScanPageRequest.keysOnly(table.ref(), table.keySchema().attributeNames());

    int deleted = 0;
    Page page = tables.scan(request);
    while (page.count() > 0) {
      deleted += BatchDispatcher.writeAll(Batcher.partition(page.items()), deletes, pool);
      if (!page.hasMore()) {
        break;
      }
      page = tables.scan(request.startingAfter(page.lastEvaluatedKey()));
    }
    LOG.infof(
        "Truncated all %d items from %s in %s", deleted, table.tableName(), table.environment());
    return deleted;
  }
}
