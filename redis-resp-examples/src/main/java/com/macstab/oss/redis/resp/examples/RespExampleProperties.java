/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Settings of the example programs ({@code resp.example.*}). Defaults live in {@code
 * application.yml}; the field initializers only cover binding without it (tests).
 *
 * <pre>{@code
 * resp:
 *   example:
 *     task: stream-consumer
 *     host: localhost
 *     port: 6379
 *     stream-key: events
 *     stream-start-id: "0"   # replay from the beginning instead of "$"
 *     block: 5s
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "resp.example")
public class RespExampleProperties {

  /** Task to run: counter, stream-producer, stream-consumer, publisher, pubsub-listener. */
  private String task = "counter";

  private String host = "localhost";

  private int port = 6379;

  private Duration connectTimeout = Duration.ofSeconds(5);

  private String counterKey = "counter";

  private String streamKey = "stream";

  /** Initial XREAD cursor. {@code $} = only entries added after the first poll. */
  private String streamStartId = "$";

  /** XREAD BLOCK time per poll. */
  private Duration block = Duration.ofSeconds(5);

  private String channel = "notify";

  private String message = "hello";

  /** Pause between iterations of counter, stream-producer and publisher. */
  private Duration interval = Duration.ofSeconds(1);

  /** Iterations before the task ends; 0 runs until the process is stopped. */
  private long maxIterations = 0;

  private Duration reconnectInitialBackoff = Duration.ofMillis(100);

  private Duration reconnectMaxBackoff = Duration.ofSeconds(10);

  /** Consecutive transport failures tolerated by the counter loop; 0 = unlimited. */
  private int maxReconnectAttempts = 0;
}
