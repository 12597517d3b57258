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
package ai.floedb.replicator.storage.memory;

import ai.floedb.replicator.spi.BackupReceipt;
import ai.floedb.replicator.spi.BatchWriteResult;
import ai.floedb.replicator.spi.Item;
import ai.floedb.replicator.spi.KeySchema;
import ai.floedb.replicator.spi.KeySchemaResolver;
import ai.floedb.replicator.spi.Page;
import ai.floedb.replicator.spi.QueryPageRequest;
import ai.floedb.replicator.spi.ReplicationException.NotFoundException;
import ai.floedb.replicator.spi.ReplicationException.ServiceException;
import ai.floedb.replicator.spi.ScanPageRequest;
import ai.floedb.replicator.spi.TableRef;
import ai.floedb.replicator.spi.TableService;
import ai.floedb.replicator.spi.WriteIntent;
import ai.floedb.replicator.spi.WriteKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Table service held entirely in memory, for tests and offline runs of the command line.
 *
 * <p>Tables are keyed by {@link TableRef}, so the same name in two environments is two tables.
 * Items are kept in key order and paged like the remote service: scan segments are assigned by a
 * hash of the partition key, page limits count scanned items, and filters reduce {@code count}
 * but not {@code scannedCount}.
 *
 * <p>Tests can script partial batch-write acceptance with {@link #scriptUnprocessed}, inject
 * failures with {@link #failOn} and inspect the order of calls through {@link #journal()}.
 */
public class InMemoryTableService implements TableService, KeySchemaResolver {

  public static final int DEFAULT_PAGE_SIZE = 100;

  public enum Operation {
    SCAN,
    QUERY,
    BATCH_WRITE,
    CREATE_BACKUP,
    DELETE_TABLE
  }

  /** One call as seen by the service. {@code kind} is only set for batch writes. */
  public record Call(Operation operation, TableRef table, WriteKind kind, int size) {}

  public record Backup(String backupName, TableRef source, List<Item> items) {}

  private static final class Table {
    final KeySchema keySchema;
    final Map<String, KeySchema> indexes = new LinkedHashMap<>();
    final TreeMap<String, Item> rows = new TreeMap<>();

    Table(KeySchema keySchema) {
      this.keySchema = keySchema;
    }
  }

  private record Fault(Operation operation, TableRef table) {}

  private record Script(TableRef table, WriteKind kind) {}

  private final int pageSize;
  private final Map<TableRef, Table> tables = new HashMap<>();
  private final Map<Script, Deque<Integer>> unprocessed = new HashMap<>();
  private final Map<Fault, RuntimeException> faults = new HashMap<>();
  private final Map<TableRef, Map<Integer, RuntimeException>> segmentFaults = new HashMap<>();
  private final List<Call> journal = new ArrayList<>();
  private final List<Backup> backups = new ArrayList<>();

  public InMemoryTableService() {
    this(DEFAULT_PAGE_SIZE);
  }

  /**
   * @param pageSize items scanned per page when the request carries no limit of its own
   */
  public InMemoryTableService(int pageSize) {
    if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1");
    this.pageSize = pageSize;
  }

  // ---- fixture setup ----

  public synchronized InMemoryTableService createTable(TableRef ref, KeySchema keySchema) {
    tables.put(ref, new Table(Objects.requireNonNull(keySchema, "keySchema")));
    return this;
  }

  public synchronized InMemoryTableService createIndex(
      TableRef ref, String indexName, KeySchema keySchema) {
    table(ref).indexes.put(indexName, keySchema);
    return this;
  }

  public synchronized InMemoryTableService putItems(TableRef ref, Collection<Item> items) {
    Table t = table(ref);
    for (Item item : items) {
      t.rows.put(rowKey(t.keySchema, item.key(t.keySchema)), item);
    }
    return this;
  }

  /**
   * Makes the next batch writes of {@code kind} to {@code ref} leave the given number of trailing
   * intents unprocessed, one count per call. Calls beyond the script accept everything.
   */
  public synchronized void scriptUnprocessed(TableRef ref, WriteKind kind, int... counts) {
    var queue = unprocessed.computeIfAbsent(new Script(ref, kind), k -> new ArrayDeque<>());
    for (int c : counts) {
      queue.add(c);
    }
  }

  /** Every later {@code operation} against {@code ref} throws {@code failure}. */
  public synchronized void failOn(Operation operation, TableRef ref, RuntimeException failure) {
    faults.put(new Fault(operation, ref), failure);
  }

  public synchronized void failOnSegment(TableRef ref, int segmentIndex, RuntimeException failure) {
    segmentFaults.computeIfAbsent(ref, k -> new HashMap<>()).put(segmentIndex, failure);
  }

  public synchronized void clearFaults() {
    faults.clear();
    segmentFaults.clear();
  }

  // ---- inspection ----

  public synchronized boolean exists(TableRef ref) {
    return tables.containsKey(ref);
  }

  /** Snapshot of the table in key order. */
  public synchronized List<Item> items(TableRef ref) {
    return List.copyOf(table(ref).rows.values());
  }

  public synchronized List<Call> journal() {
    return List.copyOf(journal);
  }

  public synchronized List<Call> journal(TableRef ref) {
    return journal.stream().filter(c -> c.table().equals(ref)).toList();
  }

  public synchronized List<Backup> backups() {
    return List.copyOf(backups);
  }

  // ---- KeySchemaResolver ----

  @Override
  public synchronized KeySchema resolveKeySchema(TableRef ref) {
    return table(ref).keySchema;
  }

  @Override
  public synchronized KeySchema resolveSecondaryKeySchema(TableRef ref, String indexName) {
    KeySchema schema = table(ref).indexes.get(indexName);
    if (schema == null) {
      throw new NotFoundException("Index " + indexName + " not found on " + ref);
    }
    return schema;
  }

  // ---- TableService ----

  @Override
  public synchronized Page scan(ScanPageRequest request) {
    record(Operation.SCAN, request.table(), null, 0);
    Table t = table(request.table());
    request
        .segment()
        .map(plan -> segmentFaults.getOrDefault(request.table(), Map.of()).get(plan.segmentIndex()))
        .ifPresent(
            failure -> {
              throw failure;
            });

    int limit = request.limit().orElse(pageSize);
    var page = new ArrayList<Item>();
    String last = null;
    boolean more = false;
    var tail =
        request.exclusiveStartKey().isEmpty()
            ? t.rows
            : t.rows.tailMap(rowKey(t.keySchema, request.exclusiveStartKey()), false);
    for (var e : tail.entrySet()) {
      Item item = e.getValue();
      if (request.segment().isPresent()) {
        var plan = request.segment().get();
        String pk = text(item.attributes().get(t.keySchema.partitionKeyName()));
        if (Math.floorMod(pk.hashCode(), plan.totalSegments()) != plan.segmentIndex()) {
          continue;
        }
      }
      if (page.size() == limit) {
        more = true;
        break;
      }
      page.add(project(item, request.projection()));
      last = e.getKey();
    }
    Map<String, AttributeValue> lek =
        more ? t.rows.get(last).key(t.keySchema) : Map.<String, AttributeValue>of();
    return new Page(page, page.size(), page.size(), lek);
  }

  @Override
  public synchronized Page query(QueryPageRequest request) {
    record(Operation.QUERY, request.table(), null, 0);
    Table t = table(request.table());
    var condition = request.keyCondition();

    var matched = new ArrayList<Map.Entry<String, Item>>();
    for (var e : t.rows.entrySet()) {
      var attrs = e.getValue().attributes();
      var pk = attrs.get(condition.partitionKeyName());
      if (pk == null || !text(pk).equals(condition.partitionValue())) {
        continue;
      }
      if (condition.sortKeyPrefix().isPresent()) {
        var sk = attrs.get(condition.sortKeyName().orElseThrow());
        if (sk == null || !text(sk).startsWith(condition.sortKeyPrefix().get())) {
          continue;
        }
      }
      matched.add(e);
    }
    condition
        .sortKeyName()
        .ifPresent(
            sk ->
                matched.sort(
                    Comparator.comparing(
                        (Map.Entry<String, Item> e) -> {
                          AttributeValue v = e.getValue().attributes().get(sk);
                          return v == null ? "" : text(v);
                        })));

    int start = 0;
    if (!request.exclusiveStartKey().isEmpty()) {
      String cursor = rowKey(t.keySchema, request.exclusiveStartKey());
      for (int i = 0; i < matched.size(); i++) {
        if (matched.get(i).getKey().equals(cursor)) {
          start = i + 1;
          break;
        }
      }
    }
    int end = Math.min(matched.size(), start + request.limit());

    var page = new ArrayList<Item>();
    for (int i = start; i < end; i++) {
      Item item = matched.get(i).getValue();
      if (request.filter().isPresent()) {
        var f = request.filter().get();
        var v = item.attributes().get(f.attributeName());
        if (v == null || v.s() == null || !v.s().startsWith(f.prefix())) {
          continue;
        }
      }
      page.add(item);
    }
    Map<String, AttributeValue> lek =
        end < matched.size()
            ? matched.get(end - 1).getValue().key(t.keySchema)
            : Map.<String, AttributeValue>of();
    return new Page(page, page.size(), end - start, lek);
  }

  @Override
  public synchronized BatchWriteResult batchWrite(
      TableRef ref, WriteKind kind, List<WriteIntent> intents) {
    record(Operation.BATCH_WRITE, ref, kind, intents.size());
    Table t = table(ref);
    if (intents.isEmpty() || intents.size() > 25) {
      throw new ServiceException(
          "Batch write to " + ref + " must carry 1 to 25 requests, got " + intents.size(), 400);
    }

    var queue = unprocessed.get(new Script(ref, kind));
    int withheld = queue == null || queue.isEmpty() ? 0 : Math.min(queue.poll(), intents.size());
    int applied = intents.size() - withheld;
    for (WriteIntent intent : intents.subList(0, applied)) {
      if (intent instanceof WriteIntent.Put put) {
        t.rows.put(rowKey(t.keySchema, put.item().key(t.keySchema)), put.item());
      } else if (intent instanceof WriteIntent.Delete delete) {
        t.rows.remove(rowKey(t.keySchema, delete.key()));
      }
    }
    return BatchWriteResult.partial(intents.subList(applied, intents.size()));
  }

  @Override
  public synchronized BackupReceipt createBackup(TableRef ref, String backupName) {
    record(Operation.CREATE_BACKUP, ref, null, 0);
    Table t = table(ref);
    backups.add(new Backup(backupName, ref, List.copyOf(t.rows.values())));
    return new BackupReceipt(
        backupName, "arn:memory:" + ref.environment() + ":backup/" + backupName, "CREATING");
  }

  @Override
  public synchronized void deleteTable(TableRef ref) {
    record(Operation.DELETE_TABLE, ref, null, 0);
    table(ref);
    tables.remove(ref);
  }

  private void record(Operation operation, TableRef ref, WriteKind kind, int size) {
    journal.add(new Call(operation, ref, kind, size));
    RuntimeException failure = faults.get(new Fault(operation, ref));
    if (failure != null) {
      throw failure;
    }
  }

  private Table table(TableRef ref) {
    Table t = tables.get(ref);
    if (t == null) {
      throw new NotFoundException("Requested resource not found: Table: " + ref + " not found");
    }
    return t;
  }

  private static Item project(Item item, List<String> projection) {
    if (projection.isEmpty()) {
      return item;
    }
    var out = new HashMap<String, AttributeValue>();
    for (String name : projection) {
      var v = item.attributes().get(name);
      if (v != null) {
        out.put(name, v);
      }
    }
    return Item.of(out);
  }

  private static String rowKey(KeySchema schema, Map<String, AttributeValue> key) {
    var sb = new StringBuilder(text(key.get(schema.partitionKeyName())));
    schema.sortKeyName().ifPresent(sk -> sb.append('\u0000').append(text(key.get(sk))));
    return sb.toString();
  }

  static String text(AttributeValue v) {
    if (v == null) {
      throw new IllegalArgumentException("missing key attribute");
    }
    if (v.s() != null) {
      return v.s();
    }
    if (v.n() != null) {
      return v.n();
    }
    if (v.b() != null) {
      return v.b().asUtf8String();
    }
    throw new IllegalArgumentException("key attributes must be S, N or B: " + v);
  }
}
