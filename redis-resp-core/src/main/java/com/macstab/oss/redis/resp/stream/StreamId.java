/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.stream;

import com.macstab.oss.redis.resp.exception.RespProtocolException;

/**
 * Stream entry ID {@code <milliseconds>-<sequence>}, ordered numerically.
 *
 * <p>Server IDs compare as unsigned 64-bit pairs; plain string comparison gets {@code
 * "9-0" > "10-0"} wrong, so cursors compare through this type.
 *
 * @param millis milliseconds part
 * @param sequence sequence part
 */
public record StreamId(long millis, long sequence) implements Comparable<StreamId> {

  public static final StreamId ZERO = new StreamId(0, 0);

  /**
   * Parses {@code "1700000000000-3"}. A bare {@code "1700000000000"} means sequence 0.
   *
   * @param id entry id as sent by the server
   * @return parsed id
   * @throws RespProtocolException if the text is not an entry id
   */
  public static StreamId parse(final String id) {
    if (id == null || id.isEmpty()) {
      throw new RespProtocolException("Stream id must not be empty");
    }
    final int dash = id.indexOf('-');
    try {
      if (dash < 0) {
        return new StreamId(Long.parseUnsignedLong(id), 0);
      }
      return new StreamId(
          Long.parseUnsignedLong(id.substring(0, dash)),
          Long.parseUnsignedLong(id.substring(dash + 1)));
    } catch (final NumberFormatException e) {
      throw new RespProtocolException("Invalid stream id: '" + id + "'", e);
    }
  }

  @Override
  public int compareTo(final StreamId other) {
    final int byMillis = Long.compareUnsigned(millis, other.millis);
    return byMillis != 0 ? byMillis : Long.compareUnsigned(sequence, other.sequence);
  }

  @Override
  public String toString() {
    return Long.toUnsignedString(millis) + "-" + Long.toUnsignedString(sequence);
  }
}
