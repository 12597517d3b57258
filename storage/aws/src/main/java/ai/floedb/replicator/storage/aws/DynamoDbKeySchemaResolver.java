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

import ai.floedb.replicator.spi.KeySchema;
import ai.floedb.replicator.spi.KeySchemaResolver;
import ai.floedb.replicator.spi.ReplicationException.NotFoundException;
import ai.floedb.replicator.spi.TableRef;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndexDescription;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.LocalSecondaryIndexDescription;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

/** Reads key schemas from {@code DescribeTable}. */
public class DynamoDbKeySchemaResolver implements KeySchemaResolver {

  private final DynamoDbSessions sessions;

  public DynamoDbKeySchemaResolver(DynamoDbSessions sessions) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
  }

  @Override
  public KeySchema resolveKeySchema(TableRef table) {
    return toKeySchema(describe(table).keySchema(), table.toString());
  }

  @Override
  public KeySchema resolveSecondaryKeySchema(TableRef table, String indexName) {
    TableDescription description = describe(table);
    if (description.hasGlobalSecondaryIndexes()) {
      for (GlobalSecondaryIndexDescription gsi : description.globalSecondaryIndexes()) {
        if (indexName.equals(gsi.indexName())) {
          return toKeySchema(gsi.keySchema(), indexName);
        }
      }
    }
    if (description.hasLocalSecondaryIndexes()) {
      for (LocalSecondaryIndexDescription lsi : description.localSecondaryIndexes()) {
        if (indexName.equals(lsi.indexName())) {
          return toKeySchema(lsi.keySchema(), indexName);
        }
      }
    }
    throw new NotFoundException("Index " + indexName + " not found on " + table);
  }

  private TableDescription describe(TableRef table) {
    var req = DescribeTableRequest.builder().tableName(table.tableName()).build();
    return DynamoDbTableService.call(
            "describe table",
            table,
            () -> sessions.forEnvironment(table.environment()).describeTable(req))
        .table();
  }

  private static KeySchema toKeySchema(List<KeySchemaElement> elements, String owner) {
    String hash = null;
    String range = null;
    for (KeySchemaElement e : elements) {
      if (e.keyType() == KeyType.HASH) {
        hash = e.attributeName();
      } else if (e.keyType() == KeyType.RANGE) {
        range = e.attributeName();
      }
    }
    if (hash == null) {
      throw new IllegalStateException("No HASH key in the key schema of " + owner);
    }
    return new KeySchema(hash, Optional.ofNullable(range));
  }
}
