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

import ai.floedb.replicator.core.ReplicationOrchestrator;
import ai.floedb.replicator.spi.BackupReceipt;
import picocli.CommandLine;

@CommandLine.Command(
    name = "backup",
    mixinStandardHelpOptions = true,
    description = "Request an on-demand backup of a table")
class BackupCommand implements Runnable {

  @CommandLine.ParentCommand ReplicatorCli parent;

  @CommandLine.Option(
      names = {"-t", "--table"},
      required = true,
      description = "Table to back up")
  String table;

  @CommandLine.Option(
      names = {"-e", "--env"},
      required = true,
      description = "Environment the table lives in")
  String environment;

  @Override
  public void run() {
    ReplicationOrchestrator orchestrator = parent.orchestrator();
    BackupReceipt receipt = orchestrator.createBackup(orchestrator.open(environment, table));
    parent
        .out()
        .printf(
            "Backup '%s' requested (%s)%s%n",
            receipt.backupName(),
            receipt.status() == null ? "unknown status" : receipt.status(),
            receipt.backupArn() == null ? "" : ": " + receipt.backupArn());
  }
}
