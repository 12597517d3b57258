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

import ai.floedb.replicator.spi.KeySchema;
import ai.floedb.replicator.spi.KeySchemaResolver;
import ai.floedb.replicator.spi.TableRef;
import java.util.Objects;
import java.util.Optional;

/**
 * A table instance together with its key schema, resolved once when the handle is opened.
 *
 * <p>Two handles are equal when they address the same table in the same environment; the key
 * schema does not take part in identity.
 */
public record TableHandle(TableRef ref, KeySchema keySchema) {
  public TableHandle {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(keySchema, "keySchema");
  }

  public static TableHandle resolve(TableRef ref, KeySchemaResolver resolver) {
    return new TableHandle(ref, resolver.resolveKeySchema(ref));
  }

  public static TableHandle resolve(
      String environment, String tableName, KeySchemaResolver resolver) {
    return resolve(new TableRef(environment, tableName), resolver);
  }

  public String environment() {
    return ref.environment();
  }

  public String tableName() {
    return ref.tableName();
  }

  public String partitionKeyName() {
    return keySchema.partitionKeyName();
  }

  public Optional<String> sortKeyName() {
    return keySchema.sortKeyName();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TableHandle other && ref.equals(other.ref);
  }

  @Override
  public int hashCode() {
    return ref.hashCode();
  }

  @Override
  public String toString() {
    return "TableHandle(env="
        + environment()
        + ", table="
        + tableName()
        + ", pk="
        + partitionKeyName()
        + ", sk="
        + sortKeyName().orElse("-")
        + ")";
  }
}
