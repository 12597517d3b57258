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
package ai.floedb.replicator.storage.aws;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * Connection settings for the DynamoDB binding. Each environment name selects a credential
 * profile of the same name unless it is configured under {@code environments}.
 */
@ConfigMapping(prefix = "replicator.aws")
public interface AwsConfig {

  @WithDefault("us-east-1")
  String region();

  Optional<URI> endpointOverride();

  /** Static credentials win over profiles when both key and secret are set. */
  Optional<String> accessKeyId();

  Optional<String> secretAccessKey();

  Optional<String> sessionToken();

  Map<String, Environment> environments();

  interface Environment {
    Optional<String> profile();

    Optional<String> region();

    Optional<URI> endpointOverride();
  }
}
