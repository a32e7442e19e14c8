/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.resp.exception.ErrorKind;
import com.macstab.oss.redis.resp.exception.RespConnectionException;
import com.macstab.oss.redis.resp.exception.RespConnectionException.Reason;
import com.macstab.oss.redis.resp.exception.RespEncodeException;
import com.macstab.oss.redis.resp.exception.RespIoException;
import com.macstab.oss.redis.resp.exception.RespProtocolException;
import com.macstab.oss.redis.resp.exception.RespServerException;
import com.macstab.oss.redis.resp.metrics.RespClientMetrics;
import com.macstab.oss.redis.resp.pubsub.PubSubMessage;
import com.macstab.oss.redis.resp.reply.IntegerReply;
import com.macstab.oss.redis.resp.reply.RespReply;
import com.macstab.oss.redis.resp.reply.SimpleStringReply;
import com.macstab.oss.redis.resp.stream.StreamReadReply;
import com.macstab.oss.redis.resp.support.FreePorts;
import com.macstab.oss.redis.resp.support.StubRespServer;

/**
 * Tests for {@link RespClient} against a scripted {@link StubRespServer}.
 *
 * <p><strong>What We Test:</strong>
 *
 * <ul>
 *   <li>Request/reply pairing (INCR, XREAD including the null-array poll timeout)
 *   <li>State machine: IDLE, SUBSCRIBED (terminal), CLOSED
 *   <li>Error policy: server errors keep the client usable, transport and protocol errors close it
 *   <li>Cancellation of a blocked {@code readFrame()} by {@code close()} from another thread
 *   <li>Metrics callbacks (Mockito)
 * </ul>
 */
@DisplayName("RespClient")
class RespClientTest {

  private static final String SUBSCRIBE_CONFIRMATION =
      "*3\r\n$9\r\nsubscribe\r\n$6\r\nnotify\r\n:1\r\n";

  private StubRespServer server;
  private RespClientMetrics metrics;
  private RespClient client;

  @BeforeEach
  void setUp() {
    server = new StubRespServer();
    metrics = mock(RespClientMetrics.class);
    client =
        RespClient.connect(
            RespClientOptions.builder()
                .host(server.host())
                .port(server.port())
                .connectionName("test")
                .metrics(metrics)
                .build());
  }

  @AfterEach
  void tearDown() {
    client.close();
    server.close();
  }

  @Nested
  @DisplayName("Request/reply")
  class RequestReply {

    @Test
    @DisplayName("INCR on a fresh key returns 1, then 2")
    void incrementTwice() {
      // Arrange
      server.reply(":1\r\n").reply(":2\r\n");

      // Act
      final var first = client.execute("INCR", "counter");
      final var second = client.execute("INCR", "counter");

      // Assert
      assertThat(first).isEqualTo(new IntegerReply(1));
      assertThat(second.asLong()).isEqualTo(2);
      assertThat(server.requests())
          .containsExactly(List.of("INCR", "counter"), List.of("INCR", "counter"));
      assertThat(client.getState()).isEqualTo(ClientState.IDLE);
    }

    @Test
    @DisplayName("XREAD block timeout (*-1) is a null reply, not an error")
    void blockingPollTimesOut() {
      // Arrange
      server.reply("*-1\r\n").reply("+PONG\r\n");

      // Act
      final var reply = client.execute("XREAD", "BLOCK", "100", "STREAMS", "stream", "$");

      // Assert
      assertThat(reply.isNull()).isTrue();
      assertThat(StreamReadReply.parse(reply)).isEmpty();
      assertThat(client.getState()).isEqualTo(ClientState.IDLE);
      assertThat(client.execute("PING")).isEqualTo(new SimpleStringReply("PONG"));
    }

    @Test
    @DisplayName("XREAD with data decodes into stream entries")
    void blockingPollReturnsEntry() {
      // Arrange
      server.reply(
          "*1\r\n*2\r\n$6\r\nstream\r\n*1\r\n*2\r\n$15\r\n1700000000000-0\r\n"
              + "*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");

      // Act
      final var entries =
          StreamReadReply.parse(client.execute("XREAD", "BLOCK", "5000", "STREAMS", "stream", "$"));

      // Assert
      assertThat(entries).hasSize(1);
      assertThat(entries.get(0).id()).isEqualTo("1700000000000-0");
      assertThat(entries.get(0).fields()).containsEntry("foo", "bar");
    }

    @Test
    @DisplayName("command name is sent as given, arguments in order")
    void commandLineList() {
      // Arrange
      server.reply("+OK\r\n");

      // Act
      client.execute(List.of("set", "k", "v"));

      // Assert
      assertThat(server.requests()).containsExactly(List.of("set", "k", "v"));
    }
  }

  @Nested
  @DisplayName("Errors")
  class Errors {

    @Test
    @DisplayName("server error reply throws RespServerException and keeps the client usable")
    void serverErrorKeepsClient() {
      // Arrange
      server.reply("-ERR unknown command 'FOO'\r\n").reply("+PONG\r\n");

      // Act & Assert
      assertThatThrownBy(() -> client.execute("FOO"))
          .isInstanceOfSatisfying(
              RespServerException.class,
              e -> {
                assertThat(e.getErrorCode()).isEqualTo("ERR");
                assertThat(e.getServerMessage()).isEqualTo("ERR unknown command 'FOO'");
              });
      assertThat(client.getState()).isEqualTo(ClientState.IDLE);
      assertThat(client.execute("PING").asText()).isEqualTo("PONG");
    }

    @Test
    @DisplayName("unencodable argument fails before sending and keeps the client usable")
    void encodeErrorSendsNothing() {
      // Arrange
      server.reply("+PONG\r\n");

      // Act & Assert
      assertThatThrownBy(() -> client.execute("SET", "k", "\uD800"))
          .isInstanceOf(RespEncodeException.class);
      assertThat(client.getState()).isEqualTo(ClientState.IDLE);
      assertThat(client.execute("PING").asText()).isEqualTo("PONG");
      assertThat(server.requests()).containsExactly(List.of("PING"));
    }

    @Test
    @DisplayName("empty command name is rejected")
    void emptyCommand() {
      assertThatThrownBy(() -> client.execute(List.of()))
          .isInstanceOf(RespEncodeException.class);
      assertThatThrownBy(() -> client.execute(" ")).isInstanceOf(RespEncodeException.class);
      assertThat(client.getState()).isEqualTo(ClientState.IDLE);
    }

    @Test
    @DisplayName("malformed reply closes the client with RespProtocolException")
    void malformedReply() {
      // Arrange
      server.reply("?garbage\r\n");

      // Act & Assert
      assertThatThrownBy(() -> client.execute("PING")).isInstanceOf(RespProtocolException.class);
      assertThat(client.getState()).isEqualTo(ClientState.CLOSED);
      assertThat(client.isOpen()).isFalse();
    }

    @Test
    @DisplayName("peer closing the connection fails with RespIoException, then CLOSED")
    void peerDrop() {
      // Arrange
      server.reply(":1\r\n");
      client.execute("INCR", "counter");
      server.dropConnection();

      // Act & Assert
      assertThatThrownBy(() -> client.execute("INCR", "counter"))
          .isInstanceOf(RespIoException.class);
      assertThat(client.getState()).isEqualTo(ClientState.CLOSED);
      assertThatThrownBy(() -> client.execute("PING"))
          .isInstanceOfSatisfying(
              RespConnectionException.class,
              e -> assertThat(e.getReason()).isEqualTo(Reason.CLOSED));
    }

    @Test
    @DisplayName("tryExecute returns failures as values")
    void tryExecute() {
      // Arrange
      server.reply("-WRONGTYPE Operation against a key holding the wrong kind of value\r\n");

      // Act
      final var result = client.tryExecute("INCR", "a-list");

      // Assert
      assertThat(result.isSuccess()).isFalse();
      assertThat(result.errorKind()).isEqualTo(ErrorKind.SERVER);
    }

    @Test
    @DisplayName("connect to a port without listener reports REFUSED")
    void connectRefused() {
      // Arrange
      final var options =
          RespClientOptions.builder().host("127.0.0.1").port(FreePorts.unusedPort()).build();

      // Act
      final var result = RespClient.tryConnect(options);

      // Assert
      assertThat(result.isSuccess()).isFalse();
      assertThat(result.errorKind()).isEqualTo(ErrorKind.CONNECTION);
      assertThat(((RespConnectionException) result.error()).getReason())
          .isEqualTo(Reason.REFUSED);
    }
  }

  @Nested
  @DisplayName("Subscription mode")
  class Subscription {

    @Test
    @DisplayName("SUBSCRIBE enters SUBSCRIBED and readFrame returns pushed messages")
    void receivesMessage() {
      // Arrange
      server.reply(SUBSCRIBE_CONFIRMATION);
      final var confirmation = client.execute("SUBSCRIBE", "notify");

      // Act
      server.push("*3\r\n$7\r\nmessage\r\n$6\r\nnotify\r\n$5\r\nhello\r\n");
      final var frame = client.readFrame();

      // Assert
      assertThat(PubSubMessage.from(confirmation).kind()).isEqualTo("subscribe");
      assertThat(client.isSubscribed()).isTrue();
      final var message = PubSubMessage.from(frame);
      assertThat(message.channel()).isEqualTo("notify");
      assertThat(message.payload()).isEqualTo("hello");
      assertThat(client.getState()).isEqualTo(ClientState.SUBSCRIBED);
    }

    @Test
    @DisplayName("execute after SUBSCRIBE fails without touching the socket")
    void executeRejected() {
      // Arrange
      server.reply(SUBSCRIBE_CONFIRMATION);
      client.execute("subscribe", "notify");

      // Act & Assert
      assertThatThrownBy(() -> client.execute("PING"))
          .isInstanceOf(RespProtocolException.class)
          .hasMessageContaining("subscription mode");
      assertThat(client.getState()).isEqualTo(ClientState.SUBSCRIBED);
      assertThat(server.requests()).containsExactly(List.of("subscribe", "notify"));
    }

    @Test
    @DisplayName("close from another thread cancels a blocked readFrame")
    void closeCancelsBlockedRead() throws Exception {
      // Arrange
      server.reply(SUBSCRIBE_CONFIRMATION);
      client.execute("SUBSCRIBE", "notify");
      final ExecutorService executor = Executors.newSingleThreadExecutor();

      try {
        final var pending = executor.submit(client::readFrame);

        // Act
        client.close();

        // Assert
        await().atMost(5, SECONDS).until(pending::isDone);
        assertThatThrownBy(pending::get)
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(RespConnectionException.class);
        final var cause = (RespConnectionException) catchCause(pending);
        assertThat(cause.getReason()).isEqualTo(Reason.CLOSED);
        assertThat(client.getState()).isEqualTo(ClientState.CLOSED);
      } finally {
        executor.shutdownNow();
      }
    }

    private Throwable catchCause(final Future<RespReply> future)
        throws InterruptedException {
      try {
        future.get();
        throw new AssertionError("Expected readFrame to fail");
      } catch (final ExecutionException e) {
        return e.getCause();
      }
    }
  }

  @Nested
  @DisplayName("Lifecycle and metrics")
  class LifecycleAndMetrics {

    @Test
    @DisplayName("close is idempotent and later calls fail with Reason.CLOSED")
    void closeIdempotent() {
      // Act
      client.close();
      client.close();

      // Assert
      assertThat(client.isOpen()).isFalse();
      verify(metrics, times(1)).close("test");
      assertThatThrownBy(() -> client.execute("PING"))
          .isInstanceOfSatisfying(
              RespConnectionException.class,
              e -> assertThat(e.getReason()).isEqualTo(Reason.CLOSED));
      assertThat(client.tryReadFrame().errorKind()).isEqualTo(ErrorKind.CONNECTION);
    }

    @Test
    @DisplayName("fatal failure records the error and releases metrics only on close")
    void fatalFailureKeepsMetricsUntilClose() {
      // Arrange
      server.reply(":1\r\n");
      client.execute("INCR", "counter");
      server.dropConnection();

      // Act
      assertThatThrownBy(() -> client.execute("INCR", "counter"))
          .isInstanceOf(RespIoException.class);

      // Assert
      verify(metrics).register("test");
      verify(metrics).recordError("test", ErrorKind.IO);
      verify(metrics, never()).close("test");

      client.close();
      client.close();
      verify(metrics, times(1)).close("test");
    }

    @Test
    @DisplayName("successful and failed commands are recorded with their outcome")
    void recordsCommands() {
      // Arrange
      server.reply(":1\r\n").reply("-ERR boom\r\n");

      // Act
      client.execute("incr", "counter");
      client.tryExecute("FOO");

      // Assert
      verify(metrics).recordCommand(eq("test"), eq("INCR"), any(Duration.class), eq(true));
      verify(metrics).recordCommand(eq("test"), eq("FOO"), any(Duration.class), eq(false));
      verify(metrics).recordError("test", ErrorKind.SERVER);
    }

    @Test
    @DisplayName("pushed frames are recorded by kind")
    void recordsFrames() {
      // Arrange
      server.reply(SUBSCRIBE_CONFIRMATION);
      client.execute("SUBSCRIBE", "notify");
      server.push("*3\r\n$7\r\nmessage\r\n$6\r\nnotify\r\n$1\r\nx\r\n");

      // Act
      client.readFrame();

      // Assert
      verify(metrics).recordFrame("test", RespReply.Kind.ARRAY);
    }
  }
}
