/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import org.springframework.stereotype.Component;

import com.macstab.oss.redis.resp.RespClient;
import com.macstab.oss.redis.resp.examples.RespClientFactory;
import com.macstab.oss.redis.resp.examples.RespExampleProperties;
import com.macstab.oss.redis.resp.pubsub.PubSubMessage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@code SUBSCRIBE <channel>}, then logs every pushed message.
 *
 * <p>The client stays in subscription mode until the process ends; each received {@code message}
 * frame counts as one iteration.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PubSubListener implements ExampleTask {

  private final RespClientFactory clientFactory;
  private final RespExampleProperties properties;

  @Override
  public String name() {
    return "pubsub-listener";
  }

  @Override
  public void run() {
    try (var client = clientFactory.connect("pubsub-listener")) {
      listen(client);
    }
  }

  /**
   * Subscribes and reads frames until {@code max-iterations} messages arrived.
   *
   * @return number of messages received
   */
  long listen(final RespClient client) {
    final var channel = properties.getChannel();
    final var confirmation = PubSubMessage.from(client.execute("SUBSCRIBE", channel));
    log.info(
        "Subscribed to {} ({} active subscriptions)",
        confirmation.channel(),
        confirmation.payload());

    long messages = 0;
    while (Iterations.more(messages, properties.getMaxIterations())) {
      final var frame = PubSubMessage.from(client.readFrame());
      if (!frame.isMessage()) {
        log.debug("Ignoring {} frame for {}", frame.kind(), frame.channel());
        continue;
      }
      log.info("[{}] {}", frame.channel(), frame.payload());
      messages++;
    }
    return messages;
  }
}
