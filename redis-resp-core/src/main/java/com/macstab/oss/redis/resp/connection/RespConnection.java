/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.connection;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;

import com.macstab.oss.redis.resp.exception.RespConnectionException;
import com.macstab.oss.redis.resp.exception.RespConnectionException.Reason;
import com.macstab.oss.redis.resp.exception.RespIoException;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns exactly one TCP socket to a RESP server and its buffers.
 *
 * <p><strong>Lifecycle:</strong>
 *
 * <pre>
 * connect() ──→ OPEN ──close() / fatal I/O──→ CLOSED (terminal)
 * </pre>
 *
 * <p>{@link #send(byte[])} failures close the socket before the exception leaves: after a
 * partial write the byte stream is out of sync with the server and cannot be reused. Read-side
 * failures are reported by the decoder; the owner ({@code RespClient}) closes in that case.
 *
 * <p><strong>Blocking:</strong> reads block without limit unless a read timeout was configured.
 * {@link #close()} may be called from another thread to cancel a blocked read; the reader then
 * sees an {@link IOException} ({@code SocketException: Socket closed}).
 *
 * <p><strong>Thread safety:</strong> one writer and one reader at a time (the owning client
 * serializes requests). Only {@link #close()} and {@link #isOpen()} are safe from other threads.
 */
@Slf4j
public final class RespConnection implements AutoCloseable {

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

  private static final int BUFFER_SIZE = 16 * 1024;

  private final Socket socket;
  private final InputStream input;
  private final OutputStream output;
  @Getter private final String host;
  @Getter private final int port;
  private volatile boolean closed;

  private RespConnection(final Socket socket, final String host, final int port)
      throws IOException {
    this.socket = socket;
    this.host = host;
    this.port = port;
    this.input = new BufferedInputStream(socket.getInputStream(), BUFFER_SIZE);
    this.output = new BufferedOutputStream(socket.getOutputStream(), BUFFER_SIZE);
  }

  /**
   * Opens a connection with the default connect timeout and no read timeout.
   *
   * @see #connect(String, int, Duration, Duration)
   */
  public static RespConnection connect(@NonNull final String host, final int port) {
    return connect(host, port, DEFAULT_CONNECT_TIMEOUT, Duration.ZERO);
  }

  /**
   * Opens a TCP connection.
   *
   * @param host server host name or address
   * @param port server port (1-65535)
   * @param connectTimeout handshake timeout, {@link Duration#ZERO} waits indefinitely
   * @param readTimeout per-read timeout, {@link Duration#ZERO} (default) blocks indefinitely
   * @return open connection
   * @throws RespConnectionException with {@link Reason#REFUSED}, {@link Reason#TIMEOUT}, {@link
   *     Reason#UNKNOWN_HOST} or {@link Reason#OTHER}
   * @throws IllegalArgumentException on an invalid port or negative timeout
   */
  public static RespConnection connect(
      @NonNull final String host,
      final int port,
      @NonNull final Duration connectTimeout,
      @NonNull final Duration readTimeout) {
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be in [1, 65535], got: " + port);
    }
    if (connectTimeout.isNegative() || readTimeout.isNegative()) {
      throw new IllegalArgumentException("timeouts must not be negative");
    }

    final var socket = new Socket();
    try {
      socket.setTcpNoDelay(true);
      socket.setKeepAlive(true);
      socket.setSoTimeout(toMillis(readTimeout));
      socket.connect(new InetSocketAddress(host, port), toMillis(connectTimeout));
      final var connection = new RespConnection(socket, host, port);

      if (log.isDebugEnabled()) {
        log.debug("Connected to {}:{} (local port {})", host, port, socket.getLocalPort());
      }
      return connection;
    } catch (final IOException e) {
      closeQuietly(socket);
      throw translate(e, host, port);
    }
  }

  /**
   * Writes and flushes all bytes. Partial writes are retried by the socket stream until the
   * buffer is drained.
   *
   * @param frame complete request frame
   * @throws RespIoException on broken pipe / reset (connection is closed afterwards)
   */
  public void send(final byte[] frame) {
    try {
      output.write(frame);
      output.flush();
    } catch (final IOException e) {
      close();
      throw new RespIoException("Failed to send to " + host + ":" + port + ": " + e.getMessage(), e);
    }
  }

  /**
   * Blocking, ordered read side. The decoder consumes exactly one frame per call.
   *
   * @return buffered socket input (same instance for the connection's lifetime)
   */
  public InputStream input() {
    return input;
  }

  public boolean isOpen() {
    return !closed && !socket.isClosed();
  }

  /** Releases the socket. Idempotent, callable from any thread. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    closeQuietly(socket);

    if (log.isDebugEnabled()) {
      log.debug("Closed connection to {}:{}", host, port);
    }
  }

  @Override
  public String toString() {
    return String.format("RespConnection[%s:%d, open=%s]", host, port, isOpen());
  }

  /**
   * Maps a failed connect attempt to its {@link Reason}.
   *
   * @param e failure raised by {@link Socket#connect}
   * @param host target host
   * @param port target port
   * @return typed connection failure carrying {@code e} as cause
   */
  static RespConnectionException translate(

      final IOException e, final String host, final int port) {
    final var target = host + ":" + port;
    if (e instanceof UnknownHostException) {
      return new RespConnectionException(
          Reason.UNKNOWN_HOST, host, port, "Unknown host: " + host, e);
    }
    if (e instanceof SocketTimeoutException) {
      return new RespConnectionException(
          Reason.TIMEOUT, host, port, "Timed out connecting to " + target, e);
    }
    if (e instanceof ConnectException) {
      return new RespConnectionException(
          Reason.REFUSED, host, port, "Connection refused by " + target, e);
    }
    return new RespConnectionException(
        Reason.OTHER, host, port, "Failed to connect to " + target + ": " + e.getMessage(), e);
  }

  // ==================== Private Methods ====================

  private static int toMillis(final Duration timeout) {
    return (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
  }

  private static void closeQuietly(final Socket socket) {
    try {
      socket.close();
    } catch (final IOException e) {
      log.debug("Ignoring failure while closing socket", e);
    }
  }
}
