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

import ai.floedb.replicator.spi.BackupReceipt;
import ai.floedb.replicator.spi.BatchWriteResult;
import ai.floedb.replicator.spi.Item;
import ai.floedb.replicator.spi.Page;
import ai.floedb.replicator.spi.QueryPageRequest;
import ai.floedb.replicator.spi.ReplicationException.NotFoundException;
import ai.floedb.replicator.spi.ReplicationException.ServiceException;
import ai.floedb.replicator.spi.ReplicationException.TransportException;
import ai.floedb.replicator.spi.ScanPageRequest;
import ai.floedb.replicator.spi.TableRef;
import ai.floedb.replicator.spi.TableService;
import ai.floedb.replicator.spi.WriteIntent;
import ai.floedb.replicator.spi.WriteKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.jboss.logging.Logger;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BackupDetails;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.CreateBackupRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/** {@link TableService} over the DynamoDB data and control plane. */
public class DynamoDbTableService implements TableService {
  private static final Logger LOG = Logger.getLogger(DynamoDbTableService.class);

  private final DynamoDbSessions sessions;

  public DynamoDbTableService(DynamoDbSessions sessions) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
  }

  @Override
  public Page scan(ScanPageRequest request) {
    TableRef table = request.table();
    var builder =
        ScanRequest.builder().tableName(table.tableName()).consistentRead(request.consistentRead());
    request
        .segment()
        .ifPresent(
            plan -> builder.segment(plan.segmentIndex()).totalSegments(plan.totalSegments()));
    if (!request.projection().isEmpty()) {
      var names = new HashMap<String, String>();
      var placeholders = new ArrayList<String>();
      for (int i = 0; i < request.projection().size(); i++) {
        names.put("#p" + i, request.projection().get(i));
        placeholders.add("#p" + i);
      }
      builder.projectionExpression(String.join(", ", placeholders)).expressionAttributeNames(names);
    }
    if (!request.exclusiveStartKey().isEmpty()) {
      builder.exclusiveStartKey(request.exclusiveStartKey());
    }
    request.limit().ifPresent(builder::limit);

    ScanResponse resp = call("scan", table, () -> client(table).scan(builder.build()));
    return page(
        resp.items(),
        resp.count(),
        resp.scannedCount(),
        resp.hasLastEvaluatedKey() ? resp.lastEvaluatedKey() : Map.of());
  }

  @Override
  public Page query(QueryPageRequest request) {
    TableRef table = request.table();
    var condition = request.keyCondition();
    var names = new HashMap<String, String>();
    var values = new HashMap<String, AttributeValue>();

    names.put("#pk", condition.partitionKeyName());
    values.put(":pk", AttributeValue.fromS(condition.partitionValue()));
    var keyExpr = new StringBuilder("#pk = :pk");
    if (condition.sortKeyPrefix().isPresent()) {
      names.put("#sk", condition.sortKeyName().orElseThrow());
      values.put(":sk", AttributeValue.fromS(condition.sortKeyPrefix().get()));
      keyExpr.append(" AND begins_with(#sk, :sk)");
    }

    var builder =
        QueryRequest.builder()
            .tableName(table.tableName())
            .keyConditionExpression(keyExpr.toString())
            .limit(request.limit());
    request
        .filter()
        .ifPresent(
            f -> {
              names.put("#f", f.attributeName());
              values.put(":f", AttributeValue.fromS(f.prefix()));
              builder.filterExpression("begins_with(#f, :f)");
            });
    request.indexName().ifPresent(builder::indexName);
    if (!request.exclusiveStartKey().isEmpty()) {
      builder.exclusiveStartKey(request.exclusiveStartKey());
    }
    builder.expressionAttributeNames(names).expressionAttributeValues(values);

    QueryResponse resp = call("query", table, () -> client(table).query(builder.build()));
    return page(
        resp.items(),
        resp.count(),
        resp.scannedCount(),
        resp.hasLastEvaluatedKey() ? resp.lastEvaluatedKey() : Map.of());
  }

  @Override
  public BatchWriteResult batchWrite(TableRef table, WriteKind kind, List<WriteIntent> intents) {
    var writes = new ArrayList<WriteRequest>(intents.size());
    for (WriteIntent intent : intents) {
      writes.add(toWriteRequest(intent));
    }
    var req =
        BatchWriteItemRequest.builder().requestItems(Map.of(table.tableName(), writes)).build();

    BatchWriteItemResponse resp =
        call("batch write", table, () -> client(table).batchWriteItem(req));
    int status = resp.sdkHttpResponse() == null ? 200 : resp.sdkHttpResponse().statusCode();
    List<WriteRequest> unprocessed =
        resp.hasUnprocessedItems()
            ? resp.unprocessedItems().getOrDefault(table.tableName(), List.of())
            : List.of();
    LOG.debugf(
        "%s of %d items to %s: status %d, %d unprocessed",
        kind, intents.size(), table, status, unprocessed.size());

    var remaining = new ArrayList<WriteIntent>(unprocessed.size());
    for (WriteRequest w : unprocessed) {
      remaining.add(fromWriteRequest(w));
    }
    return new BatchWriteResult(status, remaining);
  }

  @Override
  public BackupReceipt createBackup(TableRef table, String backupName) {
    var req =
        CreateBackupRequest.builder().tableName(table.tableName()).backupName(backupName).build();
    BackupDetails details =
        call("create backup", table, () -> client(table).createBackup(req)).backupDetails();
    if (details == null) {
      return new BackupReceipt(backupName, null, null);
    }
    return new BackupReceipt(
        details.backupName(), details.backupArn(), details.backupStatusAsString());
  }

  @Override
  public void deleteTable(TableRef table) {
    var req = DeleteTableRequest.builder().tableName(table.tableName()).build();
    call("delete table", table, () -> client(table).deleteTable(req));
  }

  private DynamoDbClient client(TableRef table) {
    return sessions.forEnvironment(table.environment());
  }

  static <T> T call(String what, TableRef table, Supplier<T> op) {
    try {
      return op.get();
    } catch (ResourceNotFoundException e) {
      throw new NotFoundException("Cannot " + what + " " + table + ": " + e.getMessage(), e);
    } catch (SdkServiceException e) {
      throw new ServiceException(
          "DynamoDB returned a problem on " + what + " of " + table + ": " + e.getMessage(),
          e.statusCode(),
          e);
    } catch (SdkClientException e) {
      throw new TransportException(
          "DynamoDB " + what + " of " + table + " failed: " + e.getMessage(), e);
    }
  }

  private static Page page(
      List<Map<String, AttributeValue>> rows,
      Integer count,
      Integer scannedCount,
      Map<String, AttributeValue> lastEvaluatedKey) {
    var items = new ArrayList<Item>(rows.size());
    for (var row : rows) {
      items.add(Item.of(row));
    }
    int n = count == null ? items.size() : count;
    return new Page(items, n, scannedCount == null ? n : scannedCount, lastEvaluatedKey);
  }

  private static WriteRequest toWriteRequest(WriteIntent intent) {
    if (intent instanceof WriteIntent.Put put) {
      return WriteRequest.builder()
          .putRequest(PutRequest.builder().item(put.item().attributes()).build())
          .build();
    }
    var delete = (WriteIntent.Delete) intent;
    return WriteRequest.builder()
        .deleteRequest(DeleteRequest.builder().key(delete.key()).build())
        .build();
  }

  private static WriteIntent fromWriteRequest(WriteRequest w) {
    if (w.putRequest() != null) {
      return new WriteIntent.Put(Item.of(w.putRequest().item()));
    }
    return new WriteIntent.Delete(w.deleteRequest().key());
  }
}
