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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Request for one page of a (possibly segmented) table scan.
 *
 * <p>An empty {@code projection} requests all attributes.
 */
public record ScanPageRequest(
    TableRef table,
    Optional<SegmentPlan> segment,
    boolean consistentRead,
    List<String> projection,
    Map<String, AttributeValue> exclusiveStartKey,
    OptionalInt limit) {

  public ScanPageRequest {
    Objects.requireNonNull(table, "table");
    segment = segment == null ? Optional.empty() : segment;
    projection = projection == null ? List.of() : List.copyOf(projection);
    exclusiveStartKey = exclusiveStartKey == null ? Map.of() : Map.copyOf(exclusiveStartKey);
    limit = limit == null ? OptionalInt.empty() : limit;
  }

  /** Consistent, all-attribute scan of one segment. */
  public static ScanPageRequest segment(TableRef table, SegmentPlan plan) {
    return new ScanPageRequest(
        table, Optional.of(plan), true, List.of(), Map.of(), OptionalInt.empty());
  }

  /** Unsegmented scan returning only the named attributes. */
  public static ScanPageRequest keysOnly(TableRef table, List<String> keyAttributes) {
    return new ScanPageRequest(
        table, Optional.empty(), false, keyAttributes, Map.of(), OptionalInt.empty());
  }

  public ScanPageRequest startingAfter(Map<String, AttributeValue> lastEvaluatedKey) {
    return new ScanPageRequest(table, segment, consistentRead, projection, lastEvaluatedKey, limit);
  }

  public ScanPageRequest withLimit(int pageLimit) {
    return new ScanPageRequest(
        table, segment, consistentRead, projection, exclusiveStartKey, OptionalInt.of(pageLimit));
  }
}
