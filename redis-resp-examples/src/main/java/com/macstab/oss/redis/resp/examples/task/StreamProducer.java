/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import org.springframework.stereotype.Component;

import com.macstab.oss.redis.resp.examples.RespClientFactory;
import com.macstab.oss.redis.resp.examples.RespExampleProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** {@code XADD <stream-key> * seq <n> message <message>}, one entry per iteration. */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamProducer implements ExampleTask {

  private final RespClientFactory clientFactory;
  private final RespExampleProperties properties;

  @Override
  public String name() {
    return "stream-producer";
  }

  @Override
  public void run() throws InterruptedException {
    final var key = properties.getStreamKey();

    try (var client = clientFactory.connect("stream-producer")) {
      for (long seq = 0; Iterations.more(seq, properties.getMaxIterations()); seq++) {
        final var reply =
            client.execute(
                "XADD", key, "*", "seq", Long.toString(seq), "message", properties.getMessage());
        final var id = reply.asText();
        log.info("Added {} to {}", id, key);
        Iterations.pause(properties.getInterval());
      }
    }
  }
}
