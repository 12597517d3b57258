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
import ai.floedb.replicator.spi.ReplicationException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Supplier;
import picocli.CommandLine;

@CommandLine.Command(
    name = "replicator",
    mixinStandardHelpOptions = true,
    version = "replicator 0.1",
    description = "Copy, query, back up and restore DynamoDB tables across environments",
    subcommands = {
      CopyCommand.class,
      QueryCommand.class,
      BackupCommand.class,
      RestoreCommand.class
    })
public class ReplicatorCli implements Runnable {

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  private final Supplier<ReplicationOrchestrator> orchestrator;
  private final PrintStream out;

  /**
   * @param orchestrator called once per command that touches a table, so that {@code --help}
   *     never builds service clients
   */
  public ReplicatorCli(Supplier<ReplicationOrchestrator> orchestrator, PrintStream out) {
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void run() {
    throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
  }

  ReplicationOrchestrator orchestrator() {
    return orchestrator.get();
  }

  PrintStream out() {
    return out;
  }

  /** Command line whose failed operations print one line and exit with status 1. */
  public static CommandLine commandLine(ReplicatorCli cli) {
    var cmd = new CommandLine(cli);
    cmd.setExecutionExceptionHandler(
        (ex, commandLine, parseResult) -> {
          if (ex instanceof ReplicationException || ex instanceof IllegalArgumentException) {
            commandLine.getErr().println("! " + ex.getMessage());
            return 1;
          }
          throw ex;
        });
    return cmd;
  }
}
