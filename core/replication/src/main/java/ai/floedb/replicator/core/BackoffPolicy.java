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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Exponential backoff for retrying unprocessed batch-write items.
 *
 * <p>With neither {@code maxAttempts} nor {@code maxElapsed} set the retry loop is unbounded and
 * relies on the service eventually admitting the backlog. {@code maxAttempts} caps the number of
 * resubmissions after the first call; {@code maxElapsed} caps the total time spent sleeping.
 */
public record BackoffPolicy(
    Duration initialDelay, int multiplier, OptionalInt maxAttempts, Optional<Duration> maxElapsed) {

  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(3);

  public static final BackoffPolicy DEFAULT = unbounded(DEFAULT_INITIAL_DELAY);

  public BackoffPolicy {
    Objects.requireNonNull(initialDelay, "initialDelay");
    if (initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay < 0");
    if (multiplier < 1) throw new IllegalArgumentException("multiplier must be >= 1");
    maxAttempts = maxAttempts == null ? OptionalInt.empty() : maxAttempts;
    maxElapsed = maxElapsed == null ? Optional.empty() : maxElapsed;
  }

  public static BackoffPolicy unbounded(Duration initialDelay) {
    return new BackoffPolicy(initialDelay, 2, OptionalInt.empty(), Optional.empty());
  }

  public BackoffPolicy withMaxAttempts(int attempts) {
    if (attempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
    return new BackoffPolicy(initialDelay, multiplier, OptionalInt.of(attempts), maxElapsed);
  }

  public BackoffPolicy withMaxElapsed(Duration elapsed) {
    return new BackoffPolicy(initialDelay, multiplier, maxAttempts, Optional.of(elapsed));
  }

  public boolean isBounded() {
    return maxAttempts.isPresent() || maxElapsed.isPresent();
  }

  public Duration next(Duration current) {
    return current.multipliedBy(multiplier);
  }

  /**
   * @param attempt 1-based number of the resubmission about to be made
   * @param sleptAfterNextDelay total sleep time including the delay preceding that attempt
   */
  boolean permits(int attempt, Duration sleptAfterNextDelay) {
    if (maxAttempts.isPresent() && attempt > maxAttempts.getAsInt()) {
      return false;
    }
    return maxElapsed.isEmpty() || sleptAfterNextDelay.compareTo(maxElapsed.get()) <= 0;
  }
}
