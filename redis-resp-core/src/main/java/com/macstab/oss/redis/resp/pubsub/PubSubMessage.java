/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.pubsub;

import java.util.List;
import java.util.Locale;

import com.macstab.oss.redis.resp.exception.RespProtocolException;
import com.macstab.oss.redis.resp.reply.RespReply;
import com.macstab.oss.redis.resp.reply.RespReply.Kind;

/**
 * Typed view of a pub/sub push frame.
 *
 * <pre>
 * [message,     channel, payload]          → kind "message", pattern null
 * [pmessage,    pattern, channel, payload] → kind "pmessage"
 * [subscribe,   channel, count]            → confirmation, payload = subscription count
 * [unsubscribe, channel, count]
 * </pre>
 *
 * @param kind lower-case frame type tag
 * @param channel channel name
 * @param pattern matching pattern for {@code pmessage}, otherwise {@code null}
 * @param payload message text, or the subscription count for confirmation frames
 */
public record PubSubMessage(String kind, String channel, String pattern, String payload) {

  public static final String MESSAGE = "message";
  public static final String PMESSAGE = "pmessage";

  /**
   * Converts a frame returned by {@code RespClient.readFrame()}.
   *
   * @param frame push frame
   * @return typed message
   * @throws RespProtocolException if the frame is not a pub/sub push frame
   */
  public static PubSubMessage from(final RespReply frame) {
    if (frame.kind() != Kind.ARRAY || frame.isNull()) {
      throw new RespProtocolException("Pub/sub frame must be an array, got " + frame);
    }
    final var parts = frame.asList();
    if (parts.isEmpty()) {
      throw new RespProtocolException("Pub/sub frame is empty");
    }
    final var kind = text(parts.get(0)).toLowerCase(Locale.ROOT);
    if (PMESSAGE.equals(kind)) {
      requireSize(parts, 4, kind);
      return new PubSubMessage(kind, text(parts.get(2)), text(parts.get(1)), text(parts.get(3)));
    }
    requireSize(parts, 3, kind);
    return new PubSubMessage(kind, text(parts.get(1)), null, text(parts.get(2)));
  }

  /** Whether this frame carries published data (as opposed to a (un)subscribe confirmation). */
  public boolean isMessage() {
    return MESSAGE.equals(kind) || PMESSAGE.equals(kind);
  }

  private static void requireSize(final List<RespReply> parts, final int size, final String kind) {
    if (parts.size() != size) {
      throw new RespProtocolException(
          "Pub/sub '" + kind + "' frame must have " + size + " elements, got " + parts.size());
    }
  }

  private static String text(final RespReply part) {
    return switch (part.kind()) {
      case BULK_STRING, SIMPLE_STRING -> part.asText();
      case INTEGER -> Long.toString(part.asLong());
      default -> throw new RespProtocolException("Unexpected pub/sub frame element: " + part);
    };
  }
}
