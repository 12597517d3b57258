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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BatcherTest {

  @Test
  void sixty_items_split_into_full_batches_and_a_tail() {
    List<Integer> items = range(60);

    List<List<Integer>> batches = Batcher.partition(items);

    assertEquals(List.of(25, 25, 10), batches.stream().map(List::size).toList());
    assertEquals(items, flatten(batches));
  }

  @Test
  void empty_input_yields_no_batches() {
    assertTrue(Batcher.partition(List.of()).isEmpty());
  }

  @Test
  void every_batch_size_preserves_order_and_count() {
    for (int n = 0; n <= 80; n++) {
      List<Integer> items = range(n);
      for (int b = 1; b <= 30; b++) {
        final int size = b;
        final String message = "n=" + n + " b=" + b;
        List<List<Integer>> batches = Batcher.partition(items, size);

        assertEquals((n + size - 1) / size, batches.size(), message);
        assertTrue(batches.stream().allMatch(batch -> batch.size() <= size && !batch.isEmpty()));
        if (!batches.isEmpty()) {
          batches
              .subList(0, batches.size() - 1)
              .forEach(batch -> assertEquals(size, batch.size(), message));
        }
        assertEquals(items, flatten(batches));
      }
    }
  }

  @Test
  void non_positive_batch_size_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> Batcher.partition(range(3), 0));
  }

  private static List<Integer> range(int n) {
    return IntStream.range(0, n).boxed().collect(Collectors.toList());
  }

  private static <T> List<T> flatten(List<List<T>> batches) {
    var out = new ArrayList<T>();
    batches.forEach(out::addAll);
    return out;
  }
}
