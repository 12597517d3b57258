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
package ai.floedb.replicator.client.cli;

import ai.floedb.replicator.core.CopySummary;
import ai.floedb.replicator.core.ReplicationOrchestrator;
import picocli.CommandLine;

@CommandLine.Command(
    name = "restore",
    mixinStandardHelpOptions = true,
    description =
        "Refill a table from a backup table in the same environment, then delete the backup table")
class RestoreCommand implements Runnable {

  @CommandLine.ParentCommand ReplicatorCli parent;

  @CommandLine.Option(
      names = {"-t", "--table"},
      required = true,
      description = "Table to restore")
  String table;

  @CommandLine.Option(
      names = {"-b", "--backup-table"},
      required = true,
      description = "Table holding the backed-up items; deleted once restored")
  String backupTable;

  @CommandLine.Option(
      names = {"-e", "--env"},
      required = true,
      description = "Environment both tables live in")
  String environment;

  @Override
  public void run() {
    ReplicationOrchestrator orchestrator = parent.orchestrator();
    CopySummary summary =
        orchestrator.restoreFromBackup(
            orchestrator.open(environment, table), orchestrator.open(environment, backupTable));
    parent
        .out()
        .printf(
            "%d items restored into %s from %s.%n", summary.written(), table, backupTable);
  }
}
