/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples.task;

import org.springframework.stereotype.Component;

import com.macstab.oss.redis.resp.RespClient;
import com.macstab.oss.redis.resp.examples.RespClientFactory;
import com.macstab.oss.redis.resp.examples.RespExampleProperties;
import com.macstab.oss.redis.resp.exception.RespException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@code INCR <counter-key>} in a loop, logging each new value.
 *
 * <p><strong>Failure Handling:</strong> the client never retries, so this loop does:
 *
 * <ul>
 *   <li>{@code CONNECTION}/{@code IO}: wait (exponential backoff), reconnect, then close the
 *       broken client
 *   <li>{@code SERVER}/{@code PROTOCOL}/{@code ENCODE}: abort, retrying cannot help
 *       ({@code WRONGTYPE} stays {@code WRONGTYPE})
 * </ul>
 *
 * <p>{@code max-reconnect-attempts} bounds consecutive transport failures; a successful {@code
 * INCR} resets the count and the backoff.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CounterLoop implements ExampleTask {

  static final String CONNECTION_NAME = "counter";

  private final RespClientFactory clientFactory;
  private final RespExampleProperties properties;

  @Override
  public String name() {
    return "counter";
  }

  /**
   * Runs the loop.
   *
   * @return last counter value, or 0 when no increment succeeded
   */
  public long increment() throws InterruptedException {
    final var key = properties.getCounterKey();
    final var backoff =
        new ExponentialBackoff(
            properties.getReconnectInitialBackoff(), properties.getReconnectMaxBackoff());
    final int maxAttempts = properties.getMaxReconnectAttempts();

    RespClient client = null;
    RespClient broken = null;
    long iterations = 0;
    long value = 0;
    int failures = 0;

    try {
      while (Iterations.more(iterations, properties.getMaxIterations())) {
        try {
          if (client == null) {
            client = clientFactory.connect(CONNECTION_NAME);
            // Closed only now so the connection's error meters survive the reconnect
            close(broken);
            broken = null;
          }
          value = client.execute("INCR", key).asLong();
          iterations++;
          failures = 0;
          backoff.reset();

          log.info("{} = {}", key, value);
          Iterations.pause(properties.getInterval());
        } catch (final RespException e) {
          if (!e.kind().isTransport()) {
            log.error("Aborting counter loop on {} failure: {}", e.kind(), e.getMessage());
            throw e;
          }
          if (client != null) {
            close(broken);
            broken = client;
            client = null;
          }
          failures++;
          if (maxAttempts > 0 && failures > maxAttempts) {
            log.error("Giving up after {} consecutive {} failures", failures - 1, e.kind());
            throw e;
          }

          final var delay = backoff.next();
          log.warn(
              "{} failure ({}), reconnecting in {} ms (attempt {})",
              e.kind(),
              e.getMessage(),
              delay.toMillis(),
              failures);
          Iterations.pause(delay);
        }
      }
    } finally {
      close(broken);
      close(client);
    }
    return value;
  }

  @Override
  public void run() throws InterruptedException {
    increment();
  }

  private static void close(final RespClient client) {
    if (client != null) {
      client.close();
    }
  }
}
