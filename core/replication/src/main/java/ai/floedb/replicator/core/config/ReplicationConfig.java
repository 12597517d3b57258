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
package ai.floedb.replicator.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

@ConfigMapping(prefix = "replicator")
public interface ReplicationConfig {

  Write write();

  Scan scan();

  Query query();

  Backup backup();

  Copy copy();

  Pool pool();

  interface Write {
    /** Delay before the first resubmission of unprocessed items. */
    @WithDefault("PT3S")
    Duration initialBackoff();

    @WithDefault("2")
    int backoffMultiplier();

    /** Unset means retry until the service admits every item. */
    OptionalInt maxAttempts();

    Optional<Duration> maxElapsed();
  }

  interface Scan {
    /** Segments per parallel scan; defaults to the worker pool size. */
    OptionalInt segments();
  }

  interface Query {
    @WithDefault("200")
    int pageSize();
  }

  interface Backup {
    @WithDefault("-backup")
    String nameSuffix();
  }

  interface Copy {
    /** {@code substring} or {@code exact}. */
    @WithDefault("substring")
    String compatibility();
  }

  interface Pool {
    /** Worker threads per operation; defaults to the number of available processors. */
    OptionalInt size();
  }
}
