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
package ai.floedb.replicator.spi;

import java.util.List;

/**
 * Outcome of one batch-write call. {@code unprocessed} holds the intents the service declined to
 * apply; an empty list means the whole batch was accepted.
 */
public record BatchWriteResult(int httpStatus, List<WriteIntent> unprocessed) {
  public static final int HTTP_OK = 200;

  public BatchWriteResult {
    unprocessed = unprocessed == null ? List.of() : List.copyOf(unprocessed);
  }

  public static BatchWriteResult accepted() {
    return new BatchWriteResult(HTTP_OK, List.of());
  }

  public static BatchWriteResult partial(List<WriteIntent> unprocessed) {
    return new BatchWriteResult(HTTP_OK, unprocessed);
  }

  public boolean isSuccess() {
    return httpStatus == HTTP_OK;
  }

  public boolean hasUnprocessed() {
    return !unprocessed.isEmpty();
  }
}
