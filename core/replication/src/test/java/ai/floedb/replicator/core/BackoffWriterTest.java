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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.floedb.replicator.spi.BatchWriteResult;
import ai.floedb.replicator.spi.Item;
import ai.floedb.replicator.spi.KeySchema;
import ai.floedb.replicator.spi.ReplicationException;
import ai.floedb.replicator.spi.ReplicationException.RetriesExhaustedException;
import ai.floedb.replicator.spi.ReplicationException.ServiceException;
import ai.floedb.replicator.spi.TableRef;
import ai.floedb.replicator.spi.TableService;
import ai.floedb.replicator.spi.WriteIntent;
import ai.floedb.replicator.spi.WriteKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class BackoffWriterTest {

  private static final TableRef REF = new TableRef("dev", "orders");
  private static final TableHandle TABLE = new TableHandle(REF, KeySchema.of("pk", "sk"));

  private TableService tables;
  private List<Duration> sleeps;

  @BeforeEach
  void setUp() {
    tables = mock(TableService.class);
    sleeps = new ArrayList<>();
  }

  @Test
  @SuppressWarnings("unchecked")
  void shrinking_unprocessed_set_backs_off_and_stops_when_empty() {
    List<WriteIntent> intents = puts(25);
    when(tables.batchWrite(eq(REF), eq(WriteKind.PUT), anyList()))
        .thenReturn(
            BatchWriteResult.partial(intents),
            BatchWriteResult.partial(intents.subList(15, 25)),
            BatchWriteResult.accepted());

    int written = writer(BackoffPolicy.DEFAULT).write(intents);

    assertEquals(25, written);
    assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(6)), sleeps);
    ArgumentCaptor<List<WriteIntent>> submitted = ArgumentCaptor.forClass(List.class);
    verify(tables, times(3)).batchWrite(eq(REF), eq(WriteKind.PUT), submitted.capture());
    assertEquals(List.of(25, 25, 10), submitted.getAllValues().stream().map(List::size).toList());
    assertEquals(intents.subList(15, 25), submitted.getAllValues().get(2));
  }

  @Test
  void delays_keep_doubling() {
    List<WriteIntent> intents = puts(3);
    when(tables.batchWrite(eq(REF), eq(WriteKind.PUT), anyList()))
        .thenReturn(
            BatchWriteResult.partial(intents),
            BatchWriteResult.partial(intents),
            BatchWriteResult.partial(intents),
            BatchWriteResult.accepted());

    writer(BackoffPolicy.DEFAULT).write(intents);

    assertEquals(
        List.of(Duration.ofSeconds(3), Duration.ofSeconds(6), Duration.ofSeconds(12)), sleeps);
  }

  @Test
  void fully_accepted_batch_never_sleeps() {
    when(tables.batchWrite(eq(REF), eq(WriteKind.PUT), anyList()))
        .thenReturn(BatchWriteResult.accepted());

    assertEquals(4, writer(BackoffPolicy.DEFAULT).write(puts(4)));
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void non_success_status_is_not_retried() {
    when(tables.batchWrite(eq(REF), eq(WriteKind.PUT), anyList()))
        .thenReturn(new BatchWriteResult(400, List.of()));

    var ex =
        assertThrows(ServiceException.class, () -> writer(BackoffPolicy.DEFAULT).write(puts(5)));

    assertEquals(400, ex.statusCode());
    verify(tables, times(1)).batchWrite(eq(REF), eq(WriteKind.PUT), anyList());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void max_attempts_gives_up_with_remaining_intents() {
    List<WriteIntent> intents = puts(5);
    when(tables.batchWrite(eq(REF), eq(WriteKind.PUT), anyList()))
        .thenReturn(BatchWriteResult.partial(intents.subList(3, 5)));

    var ex =
        assertThrows(
            RetriesExhaustedException.class,
            () -> writer(BackoffPolicy.DEFAULT.withMaxAttempts(2)).write(intents));

    assertEquals(2, ex.attempts());
    assertEquals(intents.subList(3, 5), ex.remaining());
    verify(tables, times(3)).batchWrite(eq(REF), eq(WriteKind.PUT), anyList());
    assertEquals(2, sleeps.size());
  }

  @Test
  void max_elapsed_stops_before_oversleeping() {
    List<WriteIntent> intents = puts(2);
    when(tables.batchWrite(eq(REF), eq(WriteKind.PUT), anyList()))
        .thenReturn(BatchWriteResult.partial(intents));

    assertThrows(
        RetriesExhaustedException.class,
        () -> writer(BackoffPolicy.DEFAULT.withMaxElapsed(Duration.ofSeconds(10))).write(intents));

    // 3s + 6s fits, the next 12s would not
    assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(6)), sleeps);
  }

  @Test
  void delete_writer_submits_keys_only() {
    when(tables.batchWrite(eq(REF), eq(WriteKind.DELETE), anyList()))
        .thenReturn(BatchWriteResult.accepted());
    var writer =
        new BackoffWriter(tables, TABLE, WriteKind.DELETE, BackoffPolicy.DEFAULT, sleeps::add);

    writer.execute(List.of(item(1)));

    verify(tables)
        .batchWrite(
            REF,
            WriteKind.DELETE,
            List.of(
                new WriteIntent.Delete(
                    Map.of("pk", AttributeValue.fromS("p"), "sk", AttributeValue.fromS("1")))));
  }

  @Test
  void oversized_or_mixed_batches_are_rejected() {
    var writer = writer(BackoffPolicy.DEFAULT);

    assertThrows(IllegalArgumentException.class, () -> writer.write(puts(26)));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            writer.write(
                List.of(new WriteIntent.Delete(Map.of("pk", AttributeValue.fromS("p"))))));
  }

  @Test
  void interrupted_backoff_surfaces_and_keeps_the_flag() {
    List<WriteIntent> intents = puts(1);
    when(tables.batchWrite(eq(REF), eq(WriteKind.PUT), anyList()))
        .thenReturn(BatchWriteResult.partial(intents));
    var writer =
        new BackoffWriter(
            tables,
            TABLE,
            WriteKind.PUT,
            BackoffPolicy.DEFAULT,
            d -> {
              throw new InterruptedException();
            });

    assertThrows(ReplicationException.class, () -> writer.write(intents));
    assertTrue(Thread.interrupted());
  }

  private BackoffWriter writer(BackoffPolicy policy) {
    return new BackoffWriter(tables, TABLE, WriteKind.PUT, policy, sleeps::add);
  }

  private static List<WriteIntent> puts(int n) {
    var out = new ArrayList<WriteIntent>();
    for (int i = 0; i < n; i++) {
      out.add(new WriteIntent.Put(item(i)));
    }
    return out;
  }

  private static Item item(int i) {
    return Item.of(
        Map.of(
            "pk", AttributeValue.fromS("p"),
            "sk", AttributeValue.fromS(Integer.toString(i)),
            "qty", AttributeValue.fromN(Integer.toString(i))));
  }
}
