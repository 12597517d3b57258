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

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.LogManager;

public final class Main {

  private Main() {}

  public static void main(String[] args) {
    configureLogging();
    var runtime = new AtomicReference<ReplicatorRuntime>();
    int exit;
    try {
      var cli =
          new ReplicatorCli(
              () ->
                  runtime
                      .updateAndGet(r -> r != null ? r : ReplicatorRuntime.load())
                      .orchestrator(),
              System.out);
      exit = ReplicatorCli.commandLine(cli).execute(args);
    } finally {
      ReplicatorRuntime r = runtime.get();
      if (r != null) {
        r.close();
      }
    }
    System.exit(exit);
  }

  // jboss-logging falls back to java.util.logging when no other backend is present
  private static void configureLogging() {
    if (System.getProperty("java.util.logging.config.file") != null) {
      return;
    }
    try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    } catch (IOException e) {
      System.err.println("! cannot read logging.properties: " + e.getMessage());
    }
  }
}
