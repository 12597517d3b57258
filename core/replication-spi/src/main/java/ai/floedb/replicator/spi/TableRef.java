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

import java.util.Objects;

/**
 * Identity of one table instance: the environment (credential/network context) it lives in and
 * its name. Every collaborator call receives the ref explicitly.
 */
public record TableRef(String environment, String tableName) {
  public TableRef {
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(tableName, "tableName");
    if (tableName.isBlank()) {
      throw new IllegalArgumentException("tableName must not be blank");
    }
  }

  @Override
  public String toString() {
    return tableName + "@" + environment;
  }
}
