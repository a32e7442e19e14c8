/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp;

import java.time.Duration;

import com.macstab.oss.redis.resp.connection.RespConnection;
import com.macstab.oss.redis.resp.metrics.RespClientMetrics;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Connection settings for a {@link RespClient}.
 *
 * <pre>{@code
 * RespClientOptions options = RespClientOptions.builder()
 *     .host("redis.internal")
 *     .port(6379)
 *     .connectTimeout(Duration.ofSeconds(2))
 *     .connectionName("stream-consumer")
 *     .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class RespClientOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 6379;

  @NonNull @Builder.Default String host = DEFAULT_HOST;

  @Builder.Default int port = DEFAULT_PORT;

  @NonNull @Builder.Default Duration connectTimeout = RespConnection.DEFAULT_CONNECT_TIMEOUT;

  /**
   * Socket read timeout. {@link Duration#ZERO} (default) blocks indefinitely, which is what
   * {@code SUBSCRIBE} listeners and {@code XREAD BLOCK 0} need. When set, it must exceed every
   * {@code BLOCK} argument the caller uses, or bounded polls fail with a read timeout.
   */
  @NonNull @Builder.Default Duration readTimeout = Duration.ZERO;

  /** Name used as {@code connection.name} metric tag and in log lines. */
  @NonNull @Builder.Default String connectionName = "default";

  @NonNull @Builder.Default RespClientMetrics metrics = RespClientMetrics.NOOP;

  public static RespClientOptions defaults() {
    return builder().build();
  }
}
