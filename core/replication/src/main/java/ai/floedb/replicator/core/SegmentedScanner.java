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
import ai.floedb.replicator.spi.Page;
import ai.floedb.replicator.spi.ScanPageRequest;
import ai.floedb.replicator.spi.SegmentPlan;
import ai.floedb.replicator.spi.TableService;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Reads a whole table as N disjoint segments scanned concurrently, each with strongly consistent
 * reads and paged until the service stops returning a continuation key.
 *
 * <p>The first failing segment fails the whole scan; finished segments are not kept.
 */
public final class SegmentedScanner {
  private static final Logger LOG = Logger.getLogger(SegmentedScanner.class);

  private final TableService tables;

  public SegmentedScanner(TableService tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  /** The items of one completed segment. */
  public record SegmentResult(SegmentPlan plan, List<Item> items) {}

  /** Scans with one segment per pool worker and returns the union of all segments. */
  public List<Item> scan(TableHandle table, WorkerPool pool) {
    return scan(table, pool, pool.parallelism());
  }

  public List<Item> scan(TableHandle table, WorkerPool pool, int totalSegments) {
    List<Item> items =
        segments(table, pool, totalSegments)
            .collect()
            .in(ArrayList<Item>::new, (acc, segment) -> acc.addAll(segment.items()))
            .await()
            .indefinitely();
    LOG.infof(
        "Scanned %d items from %s in %d segments", items.size(), table.ref(), totalSegments);
    return items;
  }

  /**
   * Lazily scans all segments on {@code pool}. Each segment is emitted as soon as it has been read
   * to the end, in completion order.
   */
  public Multi<SegmentResult> segments(TableHandle table, WorkerPool pool, int totalSegments) {
    if (totalSegments < 1) {
      throw new IllegalArgumentException("totalSegments must be >= 1");
    }
    return Multi.createFrom()
        .range(0, totalSegments)
        .onItem()
        .transformToUni(
            segment ->
                Uni.createFrom()
                    .item(() -> scanSegment(table, new SegmentPlan(segment, totalSegments)))
                    .runSubscriptionOn(pool.executor()))
        .merge(totalSegments);
  }

  SegmentResult scanSegment(TableHandle table, SegmentPlan plan) {
    ScanPageRequest request = ScanPageRequest.segment(table.ref(), plan);
    var items = new ArrayList<Item>();
    int pages = 0;
    while (true) {
      Page page = tables.scan(request);
      pages++;
      items.addAll(page.items());
      if (!page.hasMore()) {
        break;
      }
      request = request.startingAfter(page.lastEvaluatedKey());
    }
    LOG.debugf(
        "Segment %d/%d of %s: %d items in %d pages",
        plan.segmentIndex(), plan.totalSegments(), table.ref(), items.size(), pages);
    return new SegmentResult(plan, List.copyOf(items));
  }
}
