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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ai.floedb.replicator.spi.Item;
import ai.floedb.replicator.spi.KeySchema;
import ai.floedb.replicator.spi.KeySchemaResolver;
import ai.floedb.replicator.spi.Page;
import ai.floedb.replicator.spi.QueryPageRequest;
import ai.floedb.replicator.spi.ReplicationException.ConfigurationException;
import ai.floedb.replicator.spi.TableRef;
import ai.floedb.replicator.spi.TableService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class PaginatedQueryTest {

  private static final TableRef REF = new TableRef("dev", "orders");
  private static final TableHandle TABLE = new TableHandle(REF, KeySchema.of("pk", "sk"));
  private static final Map<String, AttributeValue> LEK =
      Map.of("pk", AttributeValue.fromS("a"), "sk", AttributeValue.fromS("2"));

  private TableService tables;
  private KeySchemaResolver schemas;
  private PaginatedQuery query;

  @BeforeEach
  void setUp() {
    tables = mock(TableService.class);
    schemas = mock(KeySchemaResolver.class);
    query = new PaginatedQuery(tables, schemas);
  }

  @Test
  void follows_continuation_keys_until_the_last_page() {
    when(tables.query(any()))
        .thenReturn(Page.of(List.of(item("1"), item("2")), LEK), Page.last(List.of(item("3"))));

    List<Item> items = query.query(TABLE, ItemSelector.partition("a"));

    assertEquals(3, items.size());
    ArgumentCaptor<QueryPageRequest> requests = ArgumentCaptor.forClass(QueryPageRequest.class);
    verify(tables, times(2)).query(requests.capture());
    assertTrue(requests.getAllValues().get(0).exclusiveStartKey().isEmpty());
    assertEquals(LEK, requests.getAllValues().get(1).exclusiveStartKey());
    assertEquals(200, requests.getAllValues().get(0).limit());
  }

  @Test
  void zero_scanned_page_ends_the_query_even_with_a_continuation_key() {
    when(tables.query(any())).thenReturn(new Page(List.of(), 0, 0, LEK));

    List<Item> items = query.query(TABLE, ItemSelector.partition("a"));

    assertTrue(items.isEmpty());
    verify(tables, times(1)).query(any());
  }

  @Test
  void sort_key_prefix_goes_into_the_key_condition() {
    when(tables.query(any())).thenReturn(Page.last(List.of()));

    query.query(TABLE, ItemSelector.partition("a").withSortKeyPrefix("2024-"));

    ArgumentCaptor<QueryPageRequest> request = ArgumentCaptor.forClass(QueryPageRequest.class);
    verify(tables).query(request.capture());
    var condition = request.getValue().keyCondition();
    assertEquals("pk", condition.partitionKeyName());
    assertEquals("a", condition.partitionValue());
    assertEquals(Optional.of("sk"), condition.sortKeyName());
    assertEquals(Optional.of("2024-"), condition.sortKeyPrefix());
  }

  @Test
  void index_queries_use_the_index_key_names() {
    when(schemas.resolveSecondaryKeySchema(REF, "by-customer"))
        .thenReturn(KeySchema.of("customer", "placed"));
    when(tables.query(any())).thenReturn(Page.last(List.of()));

    query.query(TABLE, ItemSelector.of("c-1", "2024", "by-customer"));

    ArgumentCaptor<QueryPageRequest> request = ArgumentCaptor.forClass(QueryPageRequest.class);
    verify(tables).query(request.capture());
    assertEquals(Optional.of("by-customer"), request.getValue().indexName());
    assertEquals("customer", request.getValue().keyCondition().partitionKeyName());
    assertEquals(Optional.of("placed"), request.getValue().keyCondition().sortKeyName());
  }

  @Test
  void prefix_without_sort_key_is_a_configuration_error() {
    var hashOnly = new TableHandle(REF, KeySchema.hashOnly("pk"));

    assertThrows(
        ConfigurationException.class,
        () -> query.query(hashOnly, ItemSelector.partition("a").withSortKeyPrefix("x")));
    verifyNoInteractions(tables);
  }

  @Test
  void filtered_query_carries_the_attribute_filter() {
    when(tables.query(any())).thenReturn(Page.last(List.of(item("1"))));

    List<Item> items = query.queryWithFilter(TABLE, ItemSelector.partition("a"), "status", "OPEN");

    assertEquals(1, items.size());
    ArgumentCaptor<QueryPageRequest> request = ArgumentCaptor.forClass(QueryPageRequest.class);
    verify(tables).query(request.capture());
    var filter = request.getValue().filter().orElseThrow();
    assertEquals("status", filter.attributeName());
    assertEquals("OPEN", filter.prefix());
  }

  private static Item item(String sk) {
    return Item.of(Map.of("pk", AttributeValue.fromS("a"), "sk", AttributeValue.fromS(sk)));
  }
}
