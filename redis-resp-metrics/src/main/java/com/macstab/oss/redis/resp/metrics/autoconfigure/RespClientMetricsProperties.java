/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration for RESP client metrics.
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     redis-resp:
 *       enabled: true        # default
 *       max-cache-size: 1000 # default
 * }</pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.redis-resp")
public class RespClientMetricsProperties {

  /** Enable Micrometer metrics (requires a {@code MeterRegistry} bean). */
  private boolean enabled = true;

  /** Upper bound for cached meter instances before falling back to registry lookups. */
  private int maxCacheSize = 1000;
}
