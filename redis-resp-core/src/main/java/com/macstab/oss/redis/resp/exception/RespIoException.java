/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.exception;

import java.io.IOException;
import java.net.SocketTimeoutException;

/** Transport failed in the middle of a send or receive. The connection is closed afterwards. */
public class RespIoException extends RespException {

  private static final long serialVersionUID = 1L;

  public RespIoException(final String message, final IOException cause) {
    super(message, cause);
  }

  /**
   * Whether the failure is an elapsed read timeout (only possible when a read timeout was
   * configured).
   *
   * @return {@code true} if the cause is a {@link SocketTimeoutException}
   */
  public boolean timedOut() {
    return getCause() instanceof SocketTimeoutException;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.IO;
  }
}
