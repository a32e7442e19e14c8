/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.reply;

/**
 * {@code :<n>\r\n}: signed 64-bit integer ({@code INCR}, {@code PUBLISH} receiver count).
 *
 * @param value decoded value
 */
public record IntegerReply(long value) implements RespReply {

  @Override
  public Kind kind() {
    return Kind.INTEGER;
  }

  @Override
  public long asLong() {
    return value;
  }
}
