/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.exception;

import lombok.Getter;

/**
 * TCP link to the server cannot be established or is no longer usable.
 *
 * <p>{@link Reason} separates the usual suspects so a caller can log something meaningful (a
 * refused connection usually means the server is down, a DNS failure means misconfiguration).
 */
@Getter
public class RespConnectionException extends RespException {

  private static final long serialVersionUID = 1L;

  /** Why the link is unavailable. */
  public enum Reason {
    /** Nothing listens on host:port ({@code ECONNREFUSED}). */
    REFUSED,
    /** Connect timeout elapsed before the handshake completed. */
    TIMEOUT,
    /** Host name did not resolve. */
    UNKNOWN_HOST,
    /** Client was closed (explicitly or after a fatal failure). */
    CLOSED,
    /** Any other socket failure. */
    OTHER
  }

  private final Reason reason;
  private final String host;
  private final int port;

  public RespConnectionException(
      final Reason reason, final String host, final int port, final String message) {
    super(message);
    this.reason = reason;
    this.host = host;
    this.port = port;
  }

  public RespConnectionException(
      final Reason reason,
      final String host,
      final int port,
      final String message,
      final Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.host = host;
    this.port = port;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.CONNECTION;
  }
}
