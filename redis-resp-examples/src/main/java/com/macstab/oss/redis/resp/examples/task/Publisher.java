/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import org.springframework.stereotype.Component;

import com.macstab.oss.redis.resp.examples.RespClientFactory;
import com.macstab.oss.redis.resp.examples.RespExampleProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** {@code PUBLISH <channel> <message>}, logging how many subscribers received it. */
@Slf4j
@Component
@RequiredArgsConstructor
public class Publisher implements ExampleTask {

  private final RespClientFactory clientFactory;
  private final RespExampleProperties properties;

  @Override
  public String name() {
    return "publisher";
  }

  @Override
  public void run() throws InterruptedException {
    final var channel = properties.getChannel();

    try (var client = clientFactory.connect("publisher")) {
      for (long sent = 0; Iterations.more(sent, properties.getMaxIterations()); sent++) {
        final long receivers =
            client.execute("PUBLISH", channel, properties.getMessage()).asLong();
        log.info("Published to {} ({} receivers)", channel, receivers);
        Iterations.pause(properties.getInterval());
      }
    }
  }
}
