/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp;

import static com.macstab.oss.redis.resp.ClientState.AWAITING_REPLY;
import static com.macstab.oss.redis.resp.ClientState.CLOSED;
import static com.macstab.oss.redis.resp.ClientState.IDLE;
import static com.macstab.oss.redis.resp.ClientState.SUBSCRIBED;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.macstab.oss.redis.resp.codec.RespDecoder;
import com.macstab.oss.redis.resp.codec.RespEncoder;
import com.macstab.oss.redis.resp.connection.RespConnection;
import com.macstab.oss.redis.resp.exception.ErrorKind;
import com.macstab.oss.redis.resp.exception.RespConnectionException;
import com.macstab.oss.redis.resp.exception.RespConnectionException.Reason;
import com.macstab.oss.redis.resp.exception.RespEncodeException;
import com.macstab.oss.redis.resp.exception.RespException;
import com.macstab.oss.redis.resp.exception.RespProtocolException;
import com.macstab.oss.redis.resp.exception.RespServerException;
import com.macstab.oss.redis.resp.metrics.RespClientMetrics;
import com.macstab.oss.redis.resp.reply.ErrorReply;
import com.macstab.oss.redis.resp.reply.RespReply;
import com.macstab.oss.redis.resp.result.RespResult;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Blocking Redis command client over a single {@link RespConnection}.
 *
 * <p><strong>RESP ordering constraint:</strong> RESP has no request IDs. The n-th reply on a
 * socket belongs to the n-th request. This client therefore allows exactly one outstanding request:
 * {@link #execute(String, String...)} sends, then blocks until its reply is fully decoded. A second
 * call while one is in flight (another thread) is rejected with {@link RespProtocolException}
 * rather than interleaving frames.
 *
 * <p><strong>Push-style usage:</strong>
 *
 * <ul>
 *   <li><strong>Bounded poll</strong> ({@code XREAD BLOCK 5000 STREAMS s $}): plain {@code
 *       execute()}. When the block time elapses the server answers {@code *-1}, returned as {@code
 *       ArrayReply.NULL}. That is "no data this round", not an error; re-issue the poll.
 *   <li><strong>Subscription</strong> ({@code SUBSCRIBE news}): once the subscribe reply is
 *       decoded, the client is {@link ClientState#SUBSCRIBED} for good. The server only pushes
 *       {@code [message, channel, payload]} frames now; read them with {@link #readFrame()}. Any
 *       further {@code execute()} fails with {@link RespProtocolException} without touching the
 *       socket.
 * </ul>
 *
 * <p><strong>Failure policy:</strong> no retries inside the client. Errors propagate unchanged
 * and typed by {@link ErrorKind}:
 *
 * <table>
 *   <caption>Failure → client state</caption>
 *   <thead>
 *     <tr><th>Failure</th><th>Exception</th><th>State after</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code -ERR ...} reply</td><td>{@link RespServerException}</td>
 *         <td>unchanged (usable)</td></tr>
 *     <tr><td>Unencodable argument</td><td>{@link RespEncodeException}</td>
 *         <td>unchanged (nothing sent)</td></tr>
 *     <tr><td>Broken pipe, reset, EOF</td><td>{@code RespIoException}</td><td>CLOSED</td></tr>
 *     <tr><td>Malformed reply bytes</td><td>{@link RespProtocolException}</td><td>CLOSED</td></tr>
 *     <tr><td>Call after close</td><td>{@link RespConnectionException} (CLOSED)</td>
 *         <td>CLOSED</td></tr>
 * </tbody>
 * </table>
 *
 * <p>Callers preferring values over exceptions use {@link #tryExecute(String, String...)}, {@link
 * #tryReadFrame()} and {@link #tryConnect(RespClientOptions)}.
 *
 * <p><strong>Cancellation:</strong> {@link #readFrame()} in subscription mode blocks without limit.
 * {@link #close()} from another thread releases the socket; the blocked call then fails with
 * {@link RespConnectionException} reason {@link Reason#CLOSED}.
 *
 * <p><strong>Thread safety:</strong> not a shared object. One logical thread issues commands; for
 * parallel work open one client per thread. Only {@link #close()}, {@link #getState()} and {@link
 * #isOpen()} may be called concurrently. The {@link AtomicReference} state exists to detect misuse,
 * not to serialize callers.
 */
@Slf4j
public final class RespClient implements AutoCloseable {

  private static final Set<String> SUBSCRIBE_COMMANDS =
      Set.of("SUBSCRIBE", "PSUBSCRIBE", "SSUBSCRIBE");

  private final RespConnection connection;
  private final RespEncoder encoder;
  private final RespDecoder decoder;
  private final RespClientMetrics metrics;
  private final String connectionName;
  private final AtomicReference<ClientState> state;
  private final AtomicBoolean metricsReleased = new AtomicBoolean();

  RespClient(@NonNull final RespConnection connection, @NonNull final RespClientOptions options) {
    this.connection = connection;
    this.encoder = new RespEncoder();
    this.decoder = new RespDecoder();
    this.metrics = options.getMetrics();
    this.connectionName = options.getConnectionName();
    this.state = new AtomicReference<>(IDLE);
    metrics.register(connectionName);
  }

  /**
   * Connects with default options to {@code host:port}.
   *
   * @see #connect(RespClientOptions)
   */
  public static RespClient connect(@NonNull final String host, final int port) {
    return connect(RespClientOptions.builder().host(host).port(port).build());
  }

  /**
   * Opens the TCP connection and returns an {@link ClientState#IDLE} client.
   *
   * @param options connection settings
   * @return connected client (owns the socket, close it)
   * @throws RespConnectionException if the connection cannot be established
   */
  public static RespClient connect(@NonNull final RespClientOptions options) {
    try {
      final var connection =
          RespConnection.connect(
              options.getHost(),
              options.getPort(),
              options.getConnectTimeout(),
              options.getReadTimeout());
      final var client = new RespClient(connection, options);

      if (log.isInfoEnabled()) {
        log.info(
            "Connected RESP client '{}' to {}:{}",
            options.getConnectionName(),
            options.getHost(),
            options.getPort());
      }
      return client;
    } catch (final RespConnectionException e) {
      options.getMetrics().recordError(options.getConnectionName(), e.kind());
      throw e;
    }
  }

  /**
   * Result-returning variant of {@link #connect(RespClientOptions)}.
   *
   * @return success holding the client, or failure holding a {@link RespConnectionException}
   */
  public static RespResult<RespClient> tryConnect(@NonNull final RespClientOptions options) {
    return RespResult.of(() -> connect(options));
  }

  /**
   * Sends one command and blocks until its reply is fully decoded.
   *
   * @param command command name ({@code INCR}, {@code XREAD}, ...), case-insensitive
   * @param args command arguments as text (UTF-8 on the wire)
   * @return decoded reply, may be a null bulk string or null array
   * @throws RespServerException on an error reply (client stays usable)
   * @throws RespProtocolException when subscribed, when a request is already in flight, or on
   *     malformed reply bytes
   * @throws RespConnectionException when the client is closed
   * @throws com.macstab.oss.redis.resp.exception.RespIoException on transport failure
   */
  public RespReply execute(@NonNull final String command, final String... args) {
    final List<String> commandLine = new ArrayList<>(1 + (args == null ? 0 : args.length));
    commandLine.add(command);
    if (args != null) {
      commandLine.addAll(Arrays.asList(args));
    }
    return execute(commandLine);
  }

  /**
   * Sends one command given as a full command line (name first).
   *
   * @see #execute(String, String...)
   */
  public RespReply execute(@NonNull final List<String> commandLine) {
    if (commandLine.isEmpty() || commandLine.get(0) == null || commandLine.get(0).isBlank()) {
      throw new RespEncodeException("Command name must not be empty");
    }
    final var commandName = commandLine.get(0).toUpperCase(Locale.ROOT);

    beginRequest(commandName);

    final long start = System.nanoTime();
    try {
      final byte[] frame = encodeOrRelease(commandLine);
      connection.send(frame);
      final var reply = decoder.decode(connection.input());

      if (reply instanceof ErrorReply error) {
        release(IDLE);
        throw new RespServerException(error.message());
      }

      final var next = SUBSCRIBE_COMMANDS.contains(commandName) ? SUBSCRIBED : IDLE;
      release(next);
      if (next == SUBSCRIBED && log.isDebugEnabled()) {
        log.debug("Client '{}' entered subscription mode via {}", connectionName, commandName);
      }

      metrics.recordCommand(connectionName, commandName, elapsed(start), true);
      return reply;
    } catch (final RespServerException | RespEncodeException e) {
      metrics.recordCommand(connectionName, commandName, elapsed(start), false);
      metrics.recordError(connectionName, e.kind());
      throw e;
    } catch (final RespException e) {
      metrics.recordCommand(connectionName, commandName, elapsed(start), false);
      throw fail(e, commandName);
    }
  }

  /**
   * Result-returning variant of {@link #execute(String, String...)}. Never throws a {@link
   * RespException}.
   */
  public RespResult<RespReply> tryExecute(final String command, final String... args) {
    return RespResult.of(() -> execute(command, args));
  }

  /**
   * Blocks until the server sends one unsolicited frame.
   *
   * <p>Used after {@code SUBSCRIBE} (each call returns one {@code [message, channel, payload]}
   * array) and for confirmation frames of multi-channel subscribes. Allowed in {@link
   * ClientState#IDLE} too, for servers that push without a pending request.
   *
   * @return next frame
   * @throws RespServerException if the frame is an error reply
   * @throws RespProtocolException while a request is in flight or on malformed bytes
   * @throws RespConnectionException when closed, also when closed from another thread while
   *     blocked here
   */
  public RespReply readFrame() {
    final var current = state.get();
    final ClientState restore;
    if (current == SUBSCRIBED) {
      restore = SUBSCRIBED;
    } else if (state.compareAndSet(IDLE, AWAITING_REPLY)) {
      restore = IDLE;
    } else {
      throw rejected(state.get(), "readFrame");
    }

    try {
      final var frame = decoder.decode(connection.input());
      if (restore == IDLE) {
        release(IDLE);
      }
      if (frame instanceof ErrorReply error) {
        metrics.recordError(connectionName, ErrorKind.SERVER);
        throw new RespServerException(error.message());
      }
      metrics.recordFrame(connectionName, frame.kind());
      return frame;
    } catch (final RespServerException e) {
      throw e;
    } catch (final RespException e) {
      throw fail(e, "readFrame");
    }
  }

  /** Result-returning variant of {@link #readFrame()}. Never throws a {@link RespException}. */
  public RespResult<RespReply> tryReadFrame() {
    return RespResult.of(this::readFrame);
  }

  public ClientState getState() {
    return state.get();
  }

  public boolean isSubscribed() {
    return state.get() == SUBSCRIBED;
  }

  public boolean isOpen() {
    return state.get() != CLOSED && connection.isOpen();
  }

  public String getConnectionName() {
    return connectionName;
  }

  /**
   * Releases the socket and the client's metrics registration. Idempotent; callable from another
   * thread to cancel a blocked call. Call it also after a fatal failure already moved the client to
   * {@link ClientState#CLOSED}.
   */
  @Override
  public void close() {
    final var previous = state.getAndSet(CLOSED);
    // A fatal failure already closed the socket but left the meters readable
    if (metricsReleased.compareAndSet(false, true)) {
      metrics.close(connectionName);
    }
    if (previous == CLOSED) {
      return;
    }
    connection.close();

    if (log.isInfoEnabled()) {
      log.info("Closed RESP client '{}' (was {})", connectionName, previous);
    }
  }

  @Override
  public String toString() {
    return String.format(
        "RespClient[%s, %s:%d, %s]",
        connectionName, connection.getHost(), connection.getPort(), state.get());
  }

  // ==================== Private Methods ====================

  private void beginRequest(final String commandName) {
    if (!state.compareAndSet(IDLE, AWAITING_REPLY)) {
      final var current = state.get();
      final var error = rejected(current, commandName);
      metrics.recordError(connectionName, error.kind());
      throw error;
    }
  }

  private RespException rejected(final ClientState current, final String operation) {
    return switch (current) {
      case SUBSCRIBED -> new RespProtocolException(
          "Cannot "
              + operation
              + ": client '"
              + connectionName
              + "' is in subscription mode, only readFrame() is allowed");
      case AWAITING_REPLY -> new RespProtocolException(
          "Cannot "
              + operation
              + ": a request is already in flight on client '"
              + connectionName
              + "'");
      case CLOSED -> closedException(operation, null);
      // Lost a race with a concurrent state change, report as in-flight misuse
      case IDLE -> new RespProtocolException(
          "Cannot " + operation + ": concurrent use of client '" + connectionName + "'");
    };
  }

  private byte[] encodeOrRelease(final List<String> commandLine) {
    try {
      return encoder.encodeCommand(commandLine);
    } catch (final RespEncodeException e) {
      release(IDLE);
      throw e;
    }
  }

  private void release(final ClientState next) {
    // CAS: a concurrent close() wins and keeps CLOSED
    state.compareAndSet(AWAITING_REPLY, next);
  }

  /**
   * Fatal failure: stream position is unknown, so the connection cannot be reused.
   *
   * <p>If another thread closed the client first, the failure is the expected consequence of that
   * close and is reported as {@link Reason#CLOSED}.
   */
  private RespException fail(final RespException cause, final String operation) {
    final var previous = state.getAndSet(CLOSED);
    connection.close();

    if (previous == CLOSED) {
      final var closed = closedException(operation, cause);
      metrics.recordError(connectionName, closed.kind());
      return closed;
    }

    metrics.recordError(connectionName, cause.kind());
    log.warn(
        "RESP client '{}' closed after {} failure during {}: {}",
        connectionName,
        cause.kind(),
        operation,
        cause.getMessage());
    return cause;
  }

  private RespConnectionException closedException(final String operation, final Throwable cause) {
    final var message = "Cannot " + operation + ": client '" + connectionName + "' is closed";
    return cause == null
        ? new RespConnectionException(
            Reason.CLOSED, connection.getHost(), connection.getPort(), message)
        : new RespConnectionException(
            Reason.CLOSED, connection.getHost(), connection.getPort(), message, cause);
  }

  private static Duration elapsed(final long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
