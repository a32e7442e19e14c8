/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.codec;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Leading type byte of a RESP frame.
 *
 * <p>RESP2 types plus the RESP3 null ({@code _}), which some servers send even on RESP2
 * connections for absent values.
 */
@Getter
@RequiredArgsConstructor
public enum RespType {
  SIMPLE_STRING('+'),
  ERROR('-'),
  INTEGER(':'),
  BULK_STRING('$'),
  ARRAY('*'),
  NULL('_');

  private final char prefix;

  /**
   * Resolves a type byte.
   *
   * @param prefix first byte of a frame
   * @return matching type, or {@code null} if the byte starts no known frame
   */
  public static RespType fromPrefix(final int prefix) {
    for (final var type : values()) {
      if (type.prefix == prefix) {
        return type;
      }
    }
    return null;
  }
}
