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
import ai.floedb.replicator.spi.KeySchema;
import ai.floedb.replicator.spi.KeySchemaResolver;
import ai.floedb.replicator.spi.Page;
import ai.floedb.replicator.spi.QueryPageRequest;
import ai.floedb.replicator.spi.QueryPageRequest.AttributeFilter;
import ai.floedb.replicator.spi.QueryPageRequest.KeyCondition;
import ai.floedb.replicator.spi.ReplicationException.ConfigurationException;
import ai.floedb.replicator.spi.TableService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one logical key-conditioned query across as many pages as the service hands back.
 *
 * <p>Paging stops at the first response without a continuation key, and also at a response that
 * reports zero scanned items even if it carries one.
 */
public final class PaginatedQuery {

  public static final int DEFAULT_PAGE_SIZE = 200;

  private final TableService tables;
  private final KeySchemaResolver schemas;
  private final int pageSize;

  public PaginatedQuery(TableService tables, KeySchemaResolver schemas) {
    this(tables, schemas, DEFAULT_PAGE_SIZE);
  }

  public PaginatedQuery(TableService tables, KeySchemaResolver schemas, int pageSize) {
    if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.pageSize = pageSize;
  }

  /**
   * All items matching {@code selector}. An empty list means nothing matched.
   *
   * @throws ConfigurationException if a sort key prefix is given for a key schema without a sort
   *     key
   */
  public List<Item> query(TableHandle table, ItemSelector selector) {
    return drain(request(table, selector, Optional.empty()));
  }

  /** Like {@link #query} with an extra {@code begins_with(attributeName, prefix)} filter. */
  public List<Item> queryWithFilter(
      TableHandle table, ItemSelector selector, String attributeName, String prefix) {
    return drain(
        request(table, selector, Optional.of(new AttributeFilter(attributeName, prefix))));
  }

  private QueryPageRequest request(
      TableHandle table, ItemSelector selector, Optional<AttributeFilter> filter) {
    KeySchema keys =
        selector
            .indexName()
            .map(index -> schemas.resolveSecondaryKeySchema(table.ref(), index))
            .orElse(table.keySchema());
    if (selector.sortKeyPrefix().isPresent() && !keys.hasSortKey()) {
      throw new ConfigurationException(
          "Sort key prefix given but "
              + selector.indexName().map(i -> "index " + i).orElse("table " + table.tableName())
              + " has no sort key");
    }
    var condition =
        new KeyCondition(
            keys.partitionKeyName(),
            selector.partitionValue(),
            keys.sortKeyName(),
            selector.sortKeyPrefix());
    return new QueryPageRequest(
        table.ref(), selector.indexName(), condition, filter, pageSize, Map.of());
  }

  private List<Item> drain(QueryPageRequest request) {
    var items = new ArrayList<Item>();
    while (true) {
      Page page = tables.query(request);
      items.addAll(page.items());
      if (!page.hasMore() || page.scannedCount() == 0) {
        break;
      }
      request = request.startingAfter(page.lastEvaluatedKey());
    }
    return items;
  }
}
