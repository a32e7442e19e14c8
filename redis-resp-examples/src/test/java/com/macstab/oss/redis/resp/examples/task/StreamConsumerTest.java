/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.resp.RespClient;
import com.macstab.oss.redis.resp.examples.RespClientFactory;
import com.macstab.oss.redis.resp.examples.RespExampleProperties;
import com.macstab.oss.redis.resp.reply.ArrayReply;
import com.macstab.oss.redis.resp.reply.BulkStringReply;
import com.macstab.oss.redis.resp.reply.RespReply;
import com.macstab.oss.redis.resp.stream.StreamEntry;

@DisplayName("StreamConsumer")
class StreamConsumerTest {

  private RespExampleProperties properties;
  private RespClient client;
  private StreamConsumer consumer;

  @BeforeEach
  void setUp() {
    properties = new RespExampleProperties();
    properties.setStreamKey("stream");
    properties.setBlock(Duration.ofMillis(100));
    properties.setMaxIterations(3);
    client = mock(RespClient.class);
    consumer = new StreamConsumer(mock(RespClientFactory.class), properties);
  }

  @Test
  @DisplayName("null poll is not an error, entries advance the cursor for the next poll")
  void pollsAndAdvances() {
    // Arrange
    final var cursor = new StreamCursor("$");
    when(client.execute("XREAD", "BLOCK", "100", "STREAMS", "stream", "$"))
        .thenReturn(ArrayReply.NULL, xreadReply("1700000000000-0", "foo", "bar"));
    when(client.execute("XREAD", "BLOCK", "100", "STREAMS", "stream", "1700000000000-0"))
        .thenReturn(ArrayReply.NULL);

    // Act
    final long received = consumer.consume(client, cursor);

    // Assert
    assertThat(received).isEqualTo(1);
    assertThat(cursor.getLastId()).isEqualTo("1700000000000-0");
    verify(client, times(2)).execute("XREAD", "BLOCK", "100", "STREAMS", "stream", "$");
    verify(client).execute("XREAD", "BLOCK", "100", "STREAMS", "stream", "1700000000000-0");
  }

  @Nested
  @DisplayName("StreamCursor")
  class Cursor {

    @Test
    @DisplayName("moves to the highest id and never backwards")
    void advance() {
      // Arrange
      final var cursor = new StreamCursor("0");

      // Act & Assert
      assertThat(cursor.advance(List.of(entry("9-0"), entry("10-0")))).isTrue();
      assertThat(cursor.getLastId()).isEqualTo("10-0");
      assertThat(cursor.advance(List.of(entry("3-0")))).isFalse();
      assertThat(cursor.advance(List.of())).isFalse();
      assertThat(cursor.getLastId()).isEqualTo("10-0");
    }

    @Test
    @DisplayName("rejects a blank start id")
    void blankStart() {
      assertThatThrownBy(() -> new StreamCursor(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    private StreamEntry entry(final String id) {
      return new StreamEntry("stream", id, Map.of());
    }
  }

  private static RespReply xreadReply(final String id, final String field, final String value) {
    return ArrayReply.of(
        ArrayReply.of(
            BulkStringReply.of("stream"),
            ArrayReply.of(
                ArrayReply.of(
                    BulkStringReply.of(id),
                    ArrayReply.of(BulkStringReply.of(field), BulkStringReply.of(value))))));
  }
}
