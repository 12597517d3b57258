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
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** One entry of a batch write: either put a whole item or delete by key. */
public sealed interface WriteIntent permits WriteIntent.Put, WriteIntent.Delete {

  WriteKind kind();

  record Put(Item item) implements WriteIntent {
    public Put {
      Objects.requireNonNull(item, "item");
    }

    @Override
    public WriteKind kind() {
      return WriteKind.PUT;
    }
  }

  record Delete(Map<String, AttributeValue> key) implements WriteIntent {
    public Delete {
      Objects.requireNonNull(key, "key");
      if (key.isEmpty()) throw new IllegalArgumentException("delete key must not be empty");
      key = Map.copyOf(key);
    }

    @Override
    public WriteKind kind() {
      return WriteKind.DELETE;
    }
  }
}
