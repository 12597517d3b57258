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

import ai.floedb.replicator.core.ItemSelector;
import ai.floedb.replicator.core.ReplicationOrchestrator;
import ai.floedb.replicator.core.TableHandle;
import ai.floedb.replicator.spi.Item;
import java.io.PrintStream;
import java.util.List;
import java.util.TreeSet;
import picocli.CommandLine;

@CommandLine.Command(
    name = "query",
    mixinStandardHelpOptions = true,
    description = "Query the items of one partition in an environment's table")
class QueryCommand implements Runnable {

  @CommandLine.ParentCommand ReplicatorCli parent;

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = {"-t", "--table"},
      required = true,
      description = "Table to query")
  String table;

  @CommandLine.Option(
      names = {"-pk", "--pk"},
      required = true,
      description = "Partition key value of the items to query")
  String partitionKey;

  @CommandLine.Option(
      names = {"-sk", "--sk"},
      description = "Sort key prefix of the items to query")
  String sortKeyPrefix;

  @CommandLine.Option(
      names = {"-i", "--index"},
      description = "Secondary index to query")
  String index;

  @CommandLine.Option(
      names = {"-e", "--env"},
      required = true,
      description = "Environment the table lives in")
  String environment;

  @CommandLine.Option(
      names = {"-u", "--unique"},
      description = "Print the unique string values of this attribute")
  String unique;

  @CommandLine.Option(
      names = {"-head", "--head"},
      description = "Print the first item as JSON")
  boolean head;

  @CommandLine.Option(
      names = {"--filter-attr"},
      description = "Only keep items whose attribute begins with --filter-prefix")
  String filterAttribute;

  @CommandLine.Option(
      names = {"--filter-prefix"},
      description = "Prefix for --filter-attr")
  String filterPrefix;

  @Override
  public void run() {
    if ((filterAttribute == null) != (filterPrefix == null)) {
      throw new CommandLine.ParameterException(
          spec.commandLine(), "--filter-attr and --filter-prefix must be given together");
    }
    ReplicationOrchestrator orchestrator = parent.orchestrator();
    TableHandle handle = orchestrator.open(environment, table);
    ItemSelector selector = ItemSelector.of(partitionKey, sortKeyPrefix, index);
    List<Item> items =
        filterAttribute == null
            ? orchestrator.queryItems(handle, selector)
            : orchestrator.queryWithFilter(handle, selector, filterAttribute, filterPrefix);

    PrintStream out = parent.out();
    if (items.isEmpty()) {
      out.println("No item was found.");
      return;
    }
    out.println(items.size() + " items queried.");
    if (head) {
      out.println(ItemJson.toPrettyJson(items.get(0)));
      out.println("-".repeat(30));
    }
    if (unique != null) {
      var values = new TreeSet<String>();
      for (Item item : items) {
        item.get(unique).map(v -> v.s()).ifPresent(values::add);
      }
      out.println(ItemJson.toJson(values));
    }
  }
}
