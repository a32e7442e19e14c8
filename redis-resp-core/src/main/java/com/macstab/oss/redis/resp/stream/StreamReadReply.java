/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.stream;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.macstab.oss.redis.resp.exception.RespProtocolException;
import com.macstab.oss.redis.resp.reply.RespReply;
import com.macstab.oss.redis.resp.reply.RespReply.Kind;

import lombok.experimental.UtilityClass;

/**
 * Flattens the nested {@code XREAD} reply into {@link StreamEntry} values.
 *
 * <p><strong>Reply shape (RESP2):</strong>
 *
 * <pre>
 * *1                        ← one element per requested stream
 *   *2
 *     $6 stream             ← stream key
 *     *1                    ← entries
 *       *2
 *         $15 1700000000000-0   ← entry id
 *         *2                    ← flat field/value list
 *           $3 foo
 *           $3 bar
 * </pre>
 *
 * <p>A null array ({@code *-1}, the block timeout elapsed) yields an empty list. Wrong nesting,
 * non-string ids/fields or an odd field list fail with {@link RespProtocolException}.
 */
@UtilityClass
public class StreamReadReply {

  public List<StreamEntry> parse(final RespReply reply) {
    if (reply.isNull()) {
      return List.of();
    }
    final var streams = requireArray(reply, "XREAD reply");
    final List<StreamEntry> entries = new ArrayList<>();
    for (final var streamReply : streams) {
      final var pair = requireArray(streamReply, "stream element");
      if (pair.size() != 2) {
        throw new RespProtocolException(
            "Stream element must be [key, entries], got " + pair.size() + " elements");
      }
      final var key = requireText(pair.get(0), "stream key");
      for (final var entryReply : requireArray(pair.get(1), "stream entries")) {
        entries.add(parseEntry(key, entryReply));
      }
    }
    return List.copyOf(entries);
  }

  /**
   * Highest entry id in the list.
   *
   * @param entries parsed entries (any order)
   * @param current current cursor, returned when {@code entries} is empty
   * @return highest of {@code current} and all entry ids
   */
  public String highestId(final List<StreamEntry> entries, final String current) {
    StreamId highest = null;
    String highestText = current;
    for (final var entry : entries) {
      final var id = entry.streamId();
      if (highest == null || id.compareTo(highest) > 0) {
        highest = id;
        highestText = entry.id();
      }
    }
    if (highest == null) {
      return current;
    }
    if (isConcreteId(current) && StreamId.parse(current).compareTo(highest) >= 0) {
      return current;
    }
    return highestText;
  }

  private StreamEntry parseEntry(final String stream, final RespReply entryReply) {
    final var entry = requireArray(entryReply, "stream entry");
    if (entry.size() != 2) {
      throw new RespProtocolException(
          "Stream entry must be [id, fields], got " + entry.size() + " elements");
    }
    final var id = requireText(entry.get(0), "entry id");
    final var flat =
        entry.get(1).isNull() ? List.<RespReply>of() : requireArray(entry.get(1), "entry fields");
    if (flat.size() % 2 != 0) {
      throw new RespProtocolException(
          "Entry " + id + " has an odd field/value list (" + flat.size() + " elements)");
    }
    final Map<String, String> fields = new LinkedHashMap<>();
    for (int i = 0; i < flat.size(); i += 2) {
      fields.put(requireText(flat.get(i), "field name"), requireText(flat.get(i + 1), "field value"));
    }
    return new StreamEntry(stream, id, fields);
  }

  private List<RespReply> requireArray(final RespReply reply, final String what) {
    if (reply.kind() != Kind.ARRAY || reply.isNull()) {
      throw new RespProtocolException("Expected array for " + what + " but was " + reply);
    }
    return reply.asList();
  }

  private String requireText(final RespReply reply, final String what) {
    if ((reply.kind() != Kind.BULK_STRING && reply.kind() != Kind.SIMPLE_STRING)
        || reply.isNull()) {
      throw new RespProtocolException("Expected string for " + what + " but was " + reply);
    }
    return reply.asText();
  }

  private boolean isConcreteId(final String id) {
    return id != null && !id.isEmpty() && Character.isDigit(id.charAt(0));
  }
}
