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
package ai.floedb.replicator.spi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class ItemTest {

  private static final Item ORDER =
      Item.of(
          Map.of(
              "pk", AttributeValue.fromS("c-1"),
              "sk", AttributeValue.fromS("2024-01-02"),
              "total", AttributeValue.fromN("19.90")));

  @Test
  void key_projects_partition_and_sort_attributes() {
    assertEquals(
        Map.of("pk", AttributeValue.fromS("c-1"), "sk", AttributeValue.fromS("2024-01-02")),
        ORDER.key(KeySchema.of("pk", "sk")));
    assertEquals(
        Map.of("pk", AttributeValue.fromS("c-1")), ORDER.key(KeySchema.hashOnly("pk")));
  }

  @Test
  void key_fails_when_a_key_attribute_is_missing() {
    assertThrows(IllegalArgumentException.class, () -> ORDER.key(KeySchema.of("pk", "placed")));
  }

  @Test
  void key_schema_lists_partition_key_first() {
    assertEquals(List.of("pk", "sk"), KeySchema.of("pk", "sk").attributeNames());
    assertEquals(List.of("pk"), KeySchema.hashOnly("pk").attributeNames());
  }

  @Test
  void page_has_more_only_with_a_continuation_key() {
    assertFalse(Page.last(List.of(ORDER)).hasMore());
    assertTrue(Page.of(List.of(ORDER), ORDER.key(KeySchema.of("pk", "sk"))).hasMore());
  }

  @Test
  void segment_index_must_be_below_the_total() {
    assertThrows(IllegalArgumentException.class, () -> new SegmentPlan(4, 4));
    assertThrows(IllegalArgumentException.class, () -> new SegmentPlan(0, 0));
    assertEquals(3, new SegmentPlan(3, 4).segmentIndex());
  }

  @Test
  void batch_write_result_without_unprocessed_is_complete() {
    assertFalse(BatchWriteResult.accepted().hasUnprocessed());
    assertTrue(BatchWriteResult.accepted().isSuccess());
    assertFalse(new BatchWriteResult(500, List.of()).isSuccess());
  }
}
