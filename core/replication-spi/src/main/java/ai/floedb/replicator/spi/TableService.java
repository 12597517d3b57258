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

/**
 * Data-plane and control-plane calls the replication engine needs from the remote table service.
 *
 * <p>Implementations must be safe for concurrent use: scan segments and batch writes are issued
 * from several worker threads at once. The environment in each {@link TableRef} selects the
 * session the call runs in.
 */
public interface TableService {

  /** Reads one page. Pagination is driven by the caller through the continuation key. */
  Page scan(ScanPageRequest request);

  Page query(QueryPageRequest request);

  /**
   * Submits at most 25 intents of {@code kind} to {@code table}. Intents the service could not
   * apply are returned in {@link BatchWriteResult#unprocessed()}.
   */
  BatchWriteResult batchWrite(TableRef table, WriteKind kind, List<WriteIntent> intents);

  BackupReceipt createBackup(TableRef table, String backupName);

  void deleteTable(TableRef table);
}
