/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.exception;

/**
 * Malformed or unexpected RESP data, or a call the client state does not allow (for example
 * {@code execute()} after {@code SUBSCRIBE}).
 */
public class RespProtocolException extends RespException {

  private static final long serialVersionUID = 1L;

  public RespProtocolException(final String message) {
    super(message);
  }

  public RespProtocolException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.PROTOCOL;
  }
}
