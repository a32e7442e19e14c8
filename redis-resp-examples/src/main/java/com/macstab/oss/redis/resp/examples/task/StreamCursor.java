/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import java.util.List;

import com.macstab.oss.redis.resp.stream.StreamEntry;
import com.macstab.oss.redis.resp.stream.StreamReadReply;

import lombok.Getter;
import lombok.NonNull;

/**
 * Last-seen ID of an XREAD loop.
 *
 * <p>Starts at a special ID ({@code $}: only new entries; {@code 0}: everything) and afterwards
 * holds the highest entry ID received, so the next poll continues right after it. Never moves
 * backwards.
 */
public final class StreamCursor {

  @Getter private String lastId;

  public StreamCursor(@NonNull final String startId) {
    if (startId.isBlank()) {
      throw new IllegalArgumentException("startId must not be blank");
    }
    this.lastId = startId;
  }

  /**
   * Moves past the given entries.
   *
   * @param entries entries of one poll (may be empty)
   * @return {@code true} if the cursor moved
   */
  public boolean advance(final List<StreamEntry> entries) {
    final var next = StreamReadReply.highestId(entries, lastId);
    final boolean moved = !next.equals(lastId);
    lastId = next;
    return moved;
  }
}
