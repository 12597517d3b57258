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
package ai.floedb.replicator.storage.memory;

import static org.junit.jupiter.api.Assertions.*;

import ai.floedb.replicator.spi.BatchWriteResult;
import ai.floedb.replicator.spi.Item;
import ai.floedb.replicator.spi.KeySchema;
import ai.floedb.replicator.spi.Page;
import ai.floedb.replicator.spi.QueryPageRequest;
import ai.floedb.replicator.spi.QueryPageRequest.AttributeFilter;
import ai.floedb.replicator.spi.QueryPageRequest.KeyCondition;
import ai.floedb.replicator.spi.ReplicationException.NotFoundException;
import ai.floedb.replicator.spi.ScanPageRequest;
import ai.floedb.replicator.spi.SegmentPlan;
import ai.floedb.replicator.spi.TableRef;
import ai.floedb.replicator.spi.WriteIntent;
import ai.floedb.replicator.spi.WriteKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

public class InMemoryTableServiceTest {

  private static final TableRef ORDERS = new TableRef("dev", "orders");
  private static final KeySchema KEYS = KeySchema.of("pk", "sk");

  private InMemoryTableService service;

  @BeforeEach
  void setUp() {
    service = new InMemoryTableService(3);
    service.createTable(ORDERS, KEYS);
  }

  @Test
  void scan_pages_until_no_continuation_key() {
    service.putItems(ORDERS, items("p", 7));

    var seen = new ArrayList<Item>();
    ScanPageRequest request = ScanPageRequest.keysOnly(ORDERS, KEYS.attributeNames());
    int pages = 0;
    while (true) {
      Page page = service.scan(request);
      pages++;
      seen.addAll(page.items());
      if (!page.hasMore()) {
        break;
      }
      request = request.startingAfter(page.lastEvaluatedKey());
    }

    assertEquals(3, pages);
    assertEquals(7, seen.size());
    assertEquals(Set.of("pk", "sk"), seen.get(0).attributes().keySet());
  }

  @Test
  void segments_are_disjoint_and_cover_the_table() {
    for (int p = 0; p < 20; p++) {
      service.putItems(ORDERS, items("p" + p, 2));
    }

    var union = new HashSet<Map<String, AttributeValue>>();
    int total = 0;
    for (int s = 0; s < 4; s++) {
      ScanPageRequest request = ScanPageRequest.segment(ORDERS, new SegmentPlan(s, 4));
      while (true) {
        Page page = service.scan(request);
        for (Item item : page.items()) {
          union.add(item.key(KEYS));
          total++;
        }
        if (!page.hasMore()) {
          break;
        }
        request = request.startingAfter(page.lastEvaluatedKey());
      }
    }

    assertEquals(40, total);
    assertEquals(40, union.size());
  }

  @Test
  void query_matches_partition_and_sort_key_prefix() {
    service.putItems(
        ORDERS,
        List.of(
            item("a", "x1", "red"), item("a", "x2", "blue"), item("a", "y1", "red"),
            item("b", "x1", "red")));

    Page page =
        service.query(
            request(new KeyCondition("pk", "a", Optional.of("sk"), Optional.of("x")), null));

    assertEquals(2, page.count());
    assertFalse(page.hasMore());
  }

  @Test
  void filter_reduces_count_but_not_scanned_count() {
    service.putItems(
        ORDERS, List.of(item("a", "1", "red"), item("a", "2", "blue"), item("a", "3", "rose")));

    Page page =
        service.query(
            request(
                new KeyCondition("pk", "a", Optional.of("sk"), Optional.empty()),
                new AttributeFilter("color", "r")));

    assertEquals(2, page.count());
    assertEquals(3, page.scannedCount());
  }

  @Test
  void scripted_unprocessed_leaves_trailing_intents() {
    service.scriptUnprocessed(ORDERS, WriteKind.PUT, 2);
    var intents = new ArrayList<WriteIntent>();
    for (Item item : items("p", 5)) {
      intents.add(new WriteIntent.Put(item));
    }

    BatchWriteResult first = service.batchWrite(ORDERS, WriteKind.PUT, intents);
    assertEquals(2, first.unprocessed().size());
    assertEquals(3, service.items(ORDERS).size());

    BatchWriteResult second = service.batchWrite(ORDERS, WriteKind.PUT, first.unprocessed());
    assertFalse(second.hasUnprocessed());
    assertEquals(5, service.items(ORDERS).size());
  }

  @Test
  void delete_table_removes_it_and_later_calls_fail() {
    service.deleteTable(ORDERS);

    assertFalse(service.exists(ORDERS));
    assertThrows(NotFoundException.class, () -> service.resolveKeySchema(ORDERS));
  }

  @Test
  void same_name_in_other_environment_is_another_table() {
    TableRef prod = new TableRef("prod", "orders");
    service.createTable(prod, KEYS);
    service.putItems(prod, items("p", 1));

    assertEquals(0, service.items(ORDERS).size());
    assertEquals(1, service.items(prod).size());
  }

  @Test
  void missing_index_is_not_found() {
    service.createIndex(ORDERS, "by-color", KeySchema.of("color", "sk"));

    assertEquals("color", service.resolveSecondaryKeySchema(ORDERS, "by-color").partitionKeyName());
    assertThrows(
        NotFoundException.class, () -> service.resolveSecondaryKeySchema(ORDERS, "by-size"));
  }

  private static QueryPageRequest request(KeyCondition condition, AttributeFilter filter) {
    return new QueryPageRequest(
        ORDERS, Optional.empty(), condition, Optional.ofNullable(filter), 200, Map.of());
  }

  static List<Item> items(String pk, int n) {
    var out = new ArrayList<Item>();
    for (int i = 0; i < n; i++) {
      out.add(item(pk, String.format("%03d", i), "c" + i));
    }
    return out;
  }

  static Item item(String pk, String sk, String color) {
    return Item.of(
        Map.of(
            "pk", AttributeValue.fromS(pk),
            "sk", AttributeValue.fromS(sk),
            "color", AttributeValue.fromS(color)));
  }
}
