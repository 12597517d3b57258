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

import ai.floedb.replicator.spi.Item;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import java.util.List;

/**
 * Fans batches out to a worker pool and blocks until every batch has been written or one of them
 * failed.
 */
public final class BatchDispatcher {

  private BatchDispatcher() {}

  /**
   * @return number of items written
   */
  public static int writeAll(List<List<Item>> batches, BackoffWriter writer, WorkerPool pool) {
    if (batches.isEmpty()) {
      return 0;
    }
    return writeAll(Multi.createFrom().iterable(batches), writer, pool);
  }

  /** Writes batches as they are emitted by {@code batches}. */
  public static int writeAll(Multi<List<Item>> batches, BackoffWriter writer, WorkerPool pool) {
    return batches
        .onItem()
        .transformToUni(
            batch ->
                Uni.createFrom()
                    .item(() -> writer.execute(batch))
                    .runSubscriptionOn(pool.executor()))
        .merge(pool.parallelism())
        .collect()
        .asList()
        .map(counts -> counts.stream().mapToInt(Integer::intValue).sum())
        .await()
        .indefinitely();
  }
}
