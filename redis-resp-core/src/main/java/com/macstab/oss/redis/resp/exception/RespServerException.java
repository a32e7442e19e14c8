/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.exception;

import lombok.Getter;

/**
 * Server answered with an error reply ({@code -WRONGTYPE Operation against a key holding the
 * wrong kind of value}).
 *
 * <p>The connection stays usable: the error reply is a complete frame, request/reply ordering is
 * intact.
 */
@Getter
public class RespServerException extends RespException {

  private static final long serialVersionUID = 1L;

  /** Leading upper-case token of the error text ({@code ERR}, {@code WRONGTYPE}), may be empty. */
  private final String errorCode;

  /** Full error text as sent by the server, without the {@code -} prefix. */
  private final String serverMessage;

  public RespServerException(final String serverMessage) {
    super("Server error: " + serverMessage);
    this.serverMessage = serverMessage;
    this.errorCode = extractErrorCode(serverMessage);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.SERVER;
  }

  static String extractErrorCode(final String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    final int space = text.indexOf(' ');
    final var token = space < 0 ? text : text.substring(0, space);
    for (int i = 0; i < token.length(); i++) {
      final char c = token.charAt(i);
      if (!(Character.isUpperCase(c) || Character.isDigit(c) || c == '_')) {
        return "";
      }
    }
    return token;
  }
}
