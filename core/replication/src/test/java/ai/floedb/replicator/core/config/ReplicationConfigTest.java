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

import static org.junit.jupiter.api.Assertions.*;

import ai.floedb.replicator.core.BackoffPolicy;
import ai.floedb.replicator.core.ReplicationOptions;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ReplicationConfigTest {

  @Test
  void defaults_match_the_tool_behaviour() {
    ReplicationConfig config = load(Map.of());

    assertEquals(Duration.ofSeconds(3), config.write().initialBackoff());
    assertEquals(2, config.write().backoffMultiplier());
    assertTrue(config.write().maxAttempts().isEmpty());
    assertTrue(config.write().maxElapsed().isEmpty());
    assertTrue(config.scan().segments().isEmpty());
    assertEquals(200, config.query().pageSize());
    assertEquals("-backup", config.backup().nameSuffix());
    assertEquals("substring", config.copy().compatibility());

    ReplicationOptions options = ReplicationOptions.from(config);
    assertEquals(BackoffPolicy.DEFAULT, options.backoff());
    assertFalse(options.backoff().isBounded());
  }

  @Test
  void overrides_reach_the_options() {
    ReplicationConfig config =
        load(
            Map.of(
                "replicator.write.initial-backoff", "PT0.5S",
                "replicator.write.max-attempts", "7",
                "replicator.write.max-elapsed", "PT2M",
                "replicator.scan.segments", "16",
                "replicator.query.page-size", "50",
                "replicator.pool.size", "8"));

    ReplicationOptions options = ReplicationOptions.from(config);

    assertEquals(Duration.ofMillis(500), options.backoff().initialDelay());
    assertEquals(OptionalInt.of(7), options.backoff().maxAttempts());
    assertEquals(Optional.of(Duration.ofMinutes(2)), options.backoff().maxElapsed());
    assertEquals(OptionalInt.of(16), options.scanSegments());
    assertEquals(50, options.queryPageSize());
    assertEquals(OptionalInt.of(8), options.poolSize());
  }

  private static ReplicationConfig load(Map<String, String> properties) {
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .withSources(new PropertiesConfigSource(properties, "test", 500))
            .withMapping(ReplicationConfig.class)
            .build();
    return config.getConfigMapping(ReplicationConfig.class);
  }
}
