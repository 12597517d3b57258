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

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool that runs scan segments and batch writes for one replication operation. Acquire it
 * with try-with-resources; closing shuts the threads down.
 */
public final class WorkerPool implements AutoCloseable {

  private static final AtomicInteger COUNTER = new AtomicInteger(1);

  private final ExecutorService executor;
  private final int parallelism;

  private WorkerPool(int parallelism) {
    this.parallelism = parallelism;
    this.executor =
        Executors.newFixedThreadPool(
            parallelism,
            new ThreadFactory() {
              @Override
              public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "replicator-worker-" + COUNTER.getAndIncrement());
                thread.setDaemon(true);
                return thread;
              }
            });
  }

  public static WorkerPool create(int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1");
    }
    return new WorkerPool(parallelism);
  }

  /** One worker per available processor. */
  public static WorkerPool sizedToHost() {
    return create(Runtime.getRuntime().availableProcessors());
  }

  public Executor executor() {
    return executor;
  }

  public int parallelism() {
    return parallelism;
  }

  public boolean isShutdown() {
    return executor.isShutdown();
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
