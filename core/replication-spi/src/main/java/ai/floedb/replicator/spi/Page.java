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

import java.util.List;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * A single page returned by a scan or query.
 *
 * <p>{@code lastEvaluatedKey} is empty when the service reported no continuation token.
 */
public record Page(
    List<Item> items, int count, int scannedCount, Map<String, AttributeValue> lastEvaluatedKey) {
  public Page {
    items = items == null ? List.of() : List.copyOf(items);
    lastEvaluatedKey = lastEvaluatedKey == null ? Map.of() : Map.copyOf(lastEvaluatedKey);
  }

  public static Page of(List<Item> items, Map<String, AttributeValue> lastEvaluatedKey) {
    int n = items == null ? 0 : items.size();
    return new Page(items, n, n, lastEvaluatedKey);
  }

  public static Page last(List<Item> items) {
    return of(items, Map.of());
  }

  public boolean hasMore() {
    return !lastEvaluatedKey.isEmpty();
  }
}
