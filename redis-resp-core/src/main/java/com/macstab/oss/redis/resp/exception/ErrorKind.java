/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.exception;

/**
 * Failure category of a {@link RespException}.
 *
 * <p>Callers branch on the kind to pick a recovery policy:
 *
 * <ul>
 *   <li>{@link #CONNECTION} / {@link #IO}: link is gone, reconnect (application-side backoff)
 *   <li>{@link #SERVER}: request was understood and rejected, retrying the same request is useless
 *   <li>{@link #PROTOCOL} / {@link #ENCODE}: client bug or corrupted stream, abort
 * </ul>
 */
public enum ErrorKind {
  /** TCP link could not be established, or the client is already closed. */
  CONNECTION,

  /** Transport failure in the middle of an operation (broken pipe, reset, read timeout). */
  IO,

  /** Malformed or unexpected RESP bytes, or a call that violates the client state machine. */
  PROTOCOL,

  /** Well-formed {@code -ERR ...} style error reply sent by the server. */
  SERVER,

  /** Command arguments that cannot be turned into a request frame. */
  ENCODE;

  /**
   * Whether a fresh connection may let the caller continue.
   *
   * @return {@code true} for {@link #CONNECTION} and {@link #IO}
   */
  public boolean isTransport() {
    return this == CONNECTION || this == IO;
  }
}
