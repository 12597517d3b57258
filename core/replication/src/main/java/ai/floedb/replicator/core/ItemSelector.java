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

import java.util.Objects;
import java.util.Optional;

/**
 * Items sharing one partition key value, optionally narrowed to sort keys beginning with a prefix,
 * optionally looked up through a secondary index.
 */
public record ItemSelector(
    String partitionValue, Optional<String> sortKeyPrefix, Optional<String> indexName) {
  public ItemSelector {
    Objects.requireNonNull(partitionValue, "partitionValue");
    sortKeyPrefix = sortKeyPrefix == null ? Optional.empty() : sortKeyPrefix;
    indexName = indexName == null ? Optional.empty() : indexName;
  }

  public static ItemSelector partition(String partitionValue) {
    return new ItemSelector(partitionValue, Optional.empty(), Optional.empty());
  }

  public static ItemSelector of(String partitionValue, String sortKeyPrefix, String indexName) {
    return new ItemSelector(
        partitionValue, Optional.ofNullable(sortKeyPrefix), Optional.ofNullable(indexName));
  }

  public ItemSelector withSortKeyPrefix(String prefix) {
    return new ItemSelector(partitionValue, Optional.of(prefix), indexName);
  }

  public ItemSelector onIndex(String index) {
    return new ItemSelector(partitionValue, sortKeyPrefix, Optional.of(index));
  }
}
