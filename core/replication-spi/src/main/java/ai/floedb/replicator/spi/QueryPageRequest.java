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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Request for one page of a key-conditioned query, optionally against a secondary index. */
public record QueryPageRequest(
    TableRef table,
    Optional<String> indexName,
    KeyCondition keyCondition,
    Optional<AttributeFilter> filter,
    int limit,
    Map<String, AttributeValue> exclusiveStartKey) {

  public QueryPageRequest {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(keyCondition, "keyCondition");
    indexName = indexName == null ? Optional.empty() : indexName;
    filter = filter == null ? Optional.empty() : filter;
    if (limit < 1) throw new IllegalArgumentException("limit must be >= 1");
    exclusiveStartKey = exclusiveStartKey == null ? Map.of() : Map.copyOf(exclusiveStartKey);
  }

  public QueryPageRequest startingAfter(Map<String, AttributeValue> lastEvaluatedKey) {
    return new QueryPageRequest(table, indexName, keyCondition, filter, limit, lastEvaluatedKey);
  }

  /**
   * {@code partitionKey = :value}, and when a prefix is present {@code begins_with(sortKey,
   * :prefix)}.
   */
  public record KeyCondition(
      String partitionKeyName,
      String partitionValue,
      Optional<String> sortKeyName,
      Optional<String> sortKeyPrefix) {
    public KeyCondition {
      Objects.requireNonNull(partitionKeyName, "partitionKeyName");
      Objects.requireNonNull(partitionValue, "partitionValue");
      sortKeyName = sortKeyName == null ? Optional.empty() : sortKeyName;
      sortKeyPrefix = sortKeyPrefix == null ? Optional.empty() : sortKeyPrefix;
      if (sortKeyPrefix.isPresent() && sortKeyName.isEmpty()) {
        throw new IllegalArgumentException("sort key prefix given without a sort key name");
      }
    }
  }

  /** Non-key filter {@code begins_with(attribute, :prefix)}. */
  public record AttributeFilter(String attributeName, String prefix) {
    public AttributeFilter {
      Objects.requireNonNull(attributeName, "attributeName");
      Objects.requireNonNull(prefix, "prefix");
    }
  }
}
