/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.stream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One stream entry as returned by {@code XREAD}.
 *
 * @param stream stream key the entry belongs to
 * @param id entry id ({@code 1700000000000-0})
 * @param fields field/value pairs in server order (unmodifiable)
 */
public record StreamEntry(String stream, String id, Map<String, String> fields) {

  public StreamEntry {
    Objects.requireNonNull(stream, "stream must not be null");
    Objects.requireNonNull(id, "id must not be null");
    fields =
        fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public StreamId streamId() {
    return StreamId.parse(id);
  }
}
