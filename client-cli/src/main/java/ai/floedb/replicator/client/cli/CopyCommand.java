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
import ai.floedb.replicator.core.ItemSelector;
import ai.floedb.replicator.core.ReplicationOrchestrator;
import ai.floedb.replicator.core.TableHandle;
import picocli.CommandLine;

@CommandLine.Command(
    name = "copy",
    mixinStandardHelpOptions = true,
    description = "Copy a table, or the items of one partition, from source to target environment")
class CopyCommand implements Runnable {

  @CommandLine.ParentCommand ReplicatorCli parent;

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = {"-t", "--table"},
      required = true,
      description = "Table to copy")
  String table;

  @CommandLine.Option(
      names = {"--target-table"},
      description = "Table name in the target environment (default: same as --table)")
  String targetTable;

  @CommandLine.Option(
      names = {"-pk", "--pk"},
      description = "Partition key value of the items to copy; copies the whole table when absent")
  String partitionKey;

  @CommandLine.Option(
      names = {"-sk", "--sk"},
      description = "Sort key prefix of the items to copy")
  String sortKeyPrefix;

  @CommandLine.Option(
      names = {"-i", "--index"},
      description = "Secondary index to select the items through")
  String index;

  @CommandLine.Option(
      names = {"-src", "--source"},
      required = true,
      description = "Environment to copy data from")
  String source;

  @CommandLine.Option(
      names = {"-tgt", "--target"},
      required = true,
      description = "Environment to wipe and repopulate with the copied data")
  String target;

  @Override
  public void run() {
    if (partitionKey == null && (sortKeyPrefix != null || index != null)) {
      throw new CommandLine.ParameterException(spec.commandLine(), "--sk and --index require --pk");
    }
    ReplicationOrchestrator orchestrator = parent.orchestrator();
    TableHandle from = orchestrator.open(source, table);
    TableHandle to = orchestrator.open(target, targetTable != null ? targetTable : table);

    CopySummary summary;
    if (partitionKey != null) {
      summary =
          orchestrator.copyItems(from, to, ItemSelector.of(partitionKey, sortKeyPrefix, index));
    } else {
      summary = orchestrator.copyTable(from, to);
    }
    parent
        .out()
        .printf(
            "%d items copied from %s to %s (%d replaced).%n",
            summary.written(), from.ref(), to.ref(), summary.deleted());
  }
}
