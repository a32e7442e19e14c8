/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import org.springframework.stereotype.Component;

import com.macstab.oss.redis.resp.RespClient;
import com.macstab.oss.redis.resp.examples.RespClientFactory;
import com.macstab.oss.redis.resp.examples.RespExampleProperties;
import com.macstab.oss.redis.resp.stream.StreamReadReply;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Blocking stream poll loop.
 *
 * <pre>
 * XREAD BLOCK &lt;block-ms&gt; STREAMS &lt;stream-key&gt; &lt;cursor&gt;
 *   → *-1       no data within block time, poll again
 *   → entries   log each, advance cursor to the highest id
 * </pre>
 *
 * <p>One poll is one iteration for {@code max-iterations}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamConsumer implements ExampleTask {

  private final RespClientFactory clientFactory;
  private final RespExampleProperties properties;

  @Override
  public String name() {
    return "stream-consumer";
  }

  @Override
  public void run() {
    try (var client = clientFactory.connect("stream-consumer")) {
      consume(client, new StreamCursor(properties.getStreamStartId()));
    }
  }

  /**
   * Polls until {@code max-iterations} is reached.
   *
   * @return number of entries received
   */
  long consume(final RespClient client, final StreamCursor cursor) {
    final var key = properties.getStreamKey();
    final var blockMillis = Long.toString(properties.getBlock().toMillis());
    long received = 0;

    for (long polls = 0; Iterations.more(polls, properties.getMaxIterations()); polls++) {
      final var reply =
          client.execute("XREAD", "BLOCK", blockMillis, "STREAMS", key, cursor.getLastId());
      final var entries = StreamReadReply.parse(reply);

      if (entries.isEmpty()) {
        if (log.isDebugEnabled()) {
          log.debug("No new entries on {} after {} ms, polling again", key, blockMillis);
        }
        continue;
      }

      for (final var entry : entries) {
        log.info("{} {} {}", entry.stream(), entry.id(), entry.fields());
      }
      received += entries.size();
      cursor.advance(entries);
    }
    return received;
  }
}
