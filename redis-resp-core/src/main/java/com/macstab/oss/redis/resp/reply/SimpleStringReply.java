/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.reply;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@code +<text>\r\n}: status reply ({@code +OK}, {@code +PONG}).
 *
 * @param value text without prefix and CRLF
 */
public record SimpleStringReply(String value) implements RespReply {

  public static final SimpleStringReply OK = new SimpleStringReply("OK");

  public SimpleStringReply {
    Objects.requireNonNull(value, "value must not be null");
  }

  @Override
  public Kind kind() {
    return Kind.SIMPLE_STRING;
  }

  @Override
  public String asText() {
    return value;
  }

  @Override
  public byte[] asBytes() {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
