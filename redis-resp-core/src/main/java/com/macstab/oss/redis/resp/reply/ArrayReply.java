/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.reply;

import java.util.List;

import com.macstab.oss.redis.resp.exception.RespProtocolException;

/**
 * {@code *<count>\r\n<element>...}: ordered sequence of replies, elements may be arrays again.
 *
 * <p>{@code *-1\r\n} decodes to {@link #NULL}. That is what {@code XREAD BLOCK} answers when the
 * block timeout elapses without new entries.
 *
 * @param elements unmodifiable element list, {@code null} for the null array
 */
public record ArrayReply(List<RespReply> elements) implements RespReply {

  public static final ArrayReply NULL = new ArrayReply(null);
  public static final ArrayReply EMPTY = new ArrayReply(List.of());

  public ArrayReply {
    elements = elements == null ? null : List.copyOf(elements);
  }

  public static ArrayReply of(final RespReply... elements) {
    return new ArrayReply(List.of(elements));
  }

  public int size() {
    return elements == null ? -1 : elements.size();
  }

  public RespReply get(final int index) {
    if (elements == null) {
      throw new RespProtocolException("Null array has no element at index " + index);
    }
    return elements.get(index);
  }

  @Override
  public Kind kind() {
    return Kind.ARRAY;
  }

  @Override
  public boolean isNull() {
    return elements == null;
  }

  @Override
  public List<RespReply> asList() {
    return elements;
  }
}
