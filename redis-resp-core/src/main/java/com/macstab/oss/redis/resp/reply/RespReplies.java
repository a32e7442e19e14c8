/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.reply;

import lombok.experimental.UtilityClass;

/**
 * Human-readable rendering of replies, in the layout {@code redis-cli} uses.
 *
 * <pre>
 * (integer) 42
 * "hello"
 * (nil)
 * 1) "stream"
 * 2) 1) 1) "1700000000000-0"
 *       2) 1) "foo"
 *          2) "bar"
 * </pre>
 */
@UtilityClass
public class RespReplies {

  public String format(final RespReply reply) {
    final var out = new StringBuilder();
    append(out, reply, 0);
    return out.toString();
  }

  private void append(final StringBuilder out, final RespReply reply, final int indent) {
    switch (reply.kind()) {
      case INTEGER -> out.append("(integer) ").append(reply.asLong());
      case SIMPLE_STRING -> out.append(reply.asText());
      case ERROR -> out.append("(error) ").append(reply.asText());
      case BULK_STRING -> {
        if (reply.isNull()) {
          out.append("(nil)");
        } else {
          out.append('"').append(reply.asText()).append('"');
        }
      }
      case ARRAY -> appendArray(out, reply, indent);
    }
  }

  private void appendArray(final StringBuilder out, final RespReply reply, final int indent) {
    if (reply.isNull()) {
      out.append("(nil)");
      return;
    }
    final var elements = reply.asList();
    if (elements.isEmpty()) {
      out.append("(empty array)");
      return;
    }
    for (int i = 0; i < elements.size(); i++) {
      final var label = (i + 1) + ") ";
      if (i > 0) {
        out.append('\n').append(" ".repeat(indent));
      }
      out.append(label);
      append(out, elements.get(i), indent + label.length());
    }
  }
}
