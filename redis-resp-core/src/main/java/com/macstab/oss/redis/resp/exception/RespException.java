/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.exception;

/**
 * Base type of every failure raised by the RESP client.
 *
 * <p>Unchecked. Subclasses map one-to-one onto {@link ErrorKind}; callers that handle every
 * failure in one place switch on {@link #kind()}.
 */
public abstract class RespException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  protected RespException(final String message) {
    super(message);
  }

  protected RespException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the failure category.
   *
   * @return never {@code null}
   */
  public abstract ErrorKind kind();
}
