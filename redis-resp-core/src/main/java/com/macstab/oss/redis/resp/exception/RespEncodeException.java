/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.exception;

/** Command arguments could not be represented as a request frame. Nothing was sent. */
public class RespEncodeException extends RespException {

  private static final long serialVersionUID = 1L;

  public RespEncodeException(final String message) {
    super(message);
  }

  public RespEncodeException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.ENCODE;
  }
}
