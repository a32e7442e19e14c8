/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.reply;

import java.util.Objects;

/**
 * {@code -<message>\r\n}: error reply.
 *
 * <p>Returned as a value only when it appears nested inside an array (e.g. inside an {@code EXEC}
 * result). A top-level error reply is turned into a {@code RespServerException} by the client.
 *
 * @param message error text without prefix and CRLF
 */
public record ErrorReply(String message) implements RespReply {

  public ErrorReply {
    Objects.requireNonNull(message, "message must not be null");
  }

  @Override
  public Kind kind() {
    return Kind.ERROR;
  }

  @Override
  public String asText() {
    return message;
  }
}
