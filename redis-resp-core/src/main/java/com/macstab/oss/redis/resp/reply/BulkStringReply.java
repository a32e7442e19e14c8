/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.reply;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * {@code $<len>\r\n<bytes>\r\n}: binary-safe string.
 *
 * <p>{@code $-1\r\n} decodes to {@link #NULL} (absent value, e.g. {@code GET} on a missing key).
 * {@code $0\r\n\r\n} decodes to an empty, non-null bulk string. The two are never equal.
 *
 * <p>Records compare arrays by reference, so {@code equals}/{@code hashCode}/{@code toString} are
 * overridden to work on content.
 *
 * @param value payload, {@code null} for the null bulk string
 */
public record BulkStringReply(byte[] value) implements RespReply {

  public static final BulkStringReply NULL = new BulkStringReply(null);

  public BulkStringReply {
    value = value == null ? null : value.clone();
  }

  public static BulkStringReply of(final String text) {
    return new BulkStringReply(text.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public byte[] value() {
    return value == null ? null : value.clone();
  }

  /**
   * Payload length in bytes.
   *
   * @return length, {@code -1} for {@link #NULL}
   */
  public int length() {
    return value == null ? -1 : value.length;
  }

  @Override
  public Kind kind() {
    return Kind.BULK_STRING;
  }

  @Override
  public boolean isNull() {
    return value == null;
  }

  @Override
  public String asText() {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  @Override
  public byte[] asBytes() {
    return value();
  }

  @Override
  public boolean equals(final Object other) {
    return other instanceof BulkStringReply that && Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return value == null ? "BulkStringReply[null]" : "BulkStringReply[" + asText() + "]";
  }
}
