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

/** One slice of a parallel scan. All segments of one scan share the same total. */
public record SegmentPlan(int segmentIndex, int totalSegments) {
  public SegmentPlan {
    if (totalSegments < 1) {
      throw new IllegalArgumentException("totalSegments must be >= 1");
    }
    if (segmentIndex < 0 || segmentIndex >= totalSegments) {
      throw new IllegalArgumentException(
          "segmentIndex " + segmentIndex + " out of range [0, " + totalSegments + ")");
    }
  }
}
