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

/** Describe-table style key lookup. */
public interface KeySchemaResolver {

  KeySchema resolveKeySchema(TableRef table);

  /**
   * Key schema of a global or local secondary index.
   *
   * @throws ReplicationException.NotFoundException if the table has no such index
   */
  KeySchema resolveSecondaryKeySchema(TableRef table, String indexName);
}
