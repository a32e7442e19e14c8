/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.examples;

import org.springframework.stereotype.Component;

import com.macstab.oss.redis.resp.RespClient;
import com.macstab.oss.redis.resp.RespClientOptions;
import com.macstab.oss.redis.resp.metrics.RespClientMetrics;

import lombok.RequiredArgsConstructor;

/** Opens {@link RespClient}s for the configured server, wired to the metrics bean. */
@Component
@RequiredArgsConstructor
public class RespClientFactory {

  private final RespExampleProperties properties;
  private final RespClientMetrics metrics;

  /**
   * Connects a new client.
   *
   * @param connectionName metric tag and log name of the client
   * @return connected client, owned by the caller
   * @throws com.macstab.oss.redis.resp.exception.RespConnectionException if the server is not
   *     reachable
   */
  public RespClient connect(final String connectionName) {
    return RespClient.connect(options(connectionName));
  }

  RespClientOptions options(final String connectionName) {
    return RespClientOptions.builder()
        .host(properties.getHost())
        .port(properties.getPort())
        .connectTimeout(properties.getConnectTimeout())
        .connectionName(connectionName)
        .metrics(metrics)
        .build();
  }
}
