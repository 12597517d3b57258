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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * An immutable snapshot of one item as read from the table service, in the service's native typed
 * representation.
 */
public record Item(Map<String, AttributeValue> attributes) {
  public Item {
    Objects.requireNonNull(attributes, "attributes");
    attributes = Map.copyOf(attributes);
  }

  public static Item of(Map<String, AttributeValue> attributes) {
    return new Item(attributes);
  }

  public Optional<AttributeValue> get(String name) {
    return Optional.ofNullable(attributes.get(name));
  }

  /**
   * Projects the key attributes of {@code schema}.
   *
   * @throws IllegalArgumentException if the item lacks one of the key attributes
   */
  public Map<String, AttributeValue> key(KeySchema schema) {
    var key = new HashMap<String, AttributeValue>(2);
    for (String name : schema.attributeNames()) {
      var v = attributes.get(name);
      if (v == null) {
        throw new IllegalArgumentException("item is missing key attribute '" + name + "'");
      }
      key.put(name, v);
    }
    return Map.copyOf(key);
  }
}
