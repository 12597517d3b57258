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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Names of the partition (HASH) and optional sort (RANGE) key attributes. */
public record KeySchema(String partitionKeyName, Optional<String> sortKeyName) {
  public KeySchema {
    Objects.requireNonNull(partitionKeyName, "partitionKeyName");
    sortKeyName = sortKeyName == null ? Optional.empty() : sortKeyName;
  }

  public static KeySchema of(String partitionKeyName, String sortKeyName) {
    return new KeySchema(partitionKeyName, Optional.ofNullable(sortKeyName));
  }

  public static KeySchema hashOnly(String partitionKeyName) {
    return new KeySchema(partitionKeyName, Optional.empty());
  }

  public boolean hasSortKey() {
    return sortKeyName.isPresent();
  }

  /** Key attribute names, partition key first. */
  public List<String> attributeNames() {
    var names = new ArrayList<String>(2);
    names.add(partitionKeyName);
    sortKeyName.ifPresent(names::add);
    return List.copyOf(names);
  }
}
