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

import java.util.ArrayList;
import java.util.List;

/** Splits item sequences into batches no larger than the service's batch-write limit. */
public final class Batcher {

  /** Hard limit of the batch-write API; larger batches are rejected by the service. */
  public static final int MAX_BATCH_SIZE = 25;

  private Batcher() {}

  public static <T> List<List<T>> partition(List<T> items) {
    return partition(items, MAX_BATCH_SIZE);
  }

  /**
   * Ordered, contiguous, non-overlapping chunks of {@code batchSize}; the last one may be shorter.
   */
  public static <T> List<List<T>> partition(List<T> items, int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
    }
    if (items == null || items.isEmpty()) {
      return List.of();
    }
    var batches = new ArrayList<List<T>>((items.size() + batchSize - 1) / batchSize);
    for (int start = 0; start < items.size(); start += batchSize) {
      int end = Math.min(items.size(), start + batchSize);
      batches.add(List.copyOf(items.subList(start, end)));
    }
    return batches;
  }
}
