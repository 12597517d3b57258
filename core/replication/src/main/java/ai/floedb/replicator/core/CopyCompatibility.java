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

import java.util.Locale;

/**
 * Decides whether items may be copied from one table into another.
 *
 * <p>{@link #SUBSTRING} accepts a pair when either table name contains the other, which admits
 * copies to and from a backup table named after the table it backs up (e.g. {@code orders}
 * and {@code orders-restore}). It also admits unrelated tables whose names happen to nest;
 * callers that need a stricter pairing inject {@link #EXACT} or their own policy.
 */
@FunctionalInterface
public interface CopyCompatibility {

  CopyCompatibility SUBSTRING =
      (a, b) -> a.tableName().contains(b.tableName()) || b.tableName().contains(a.tableName());

  CopyCompatibility EXACT = (a, b) -> a.tableName().equals(b.tableName());

  boolean isCopyCompatible(TableHandle source, TableHandle target);

  /** Looks up a built-in policy by name ({@code substring} or {@code exact}). */
  static CopyCompatibility named(String name) {
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "substring" -> SUBSTRING;
      case "exact" -> EXACT;
      default -> throw new IllegalArgumentException("Unknown copy compatibility policy: " + name);
    };
  }
}
