/* (C)2026 Macstab GmbH */

/**
 * Micrometer metrics for RESP clients.
 *
 * <h2>Quick Start</h2>
 *
 * <p><strong>1. Add dependency (Maven):</strong>
 *
 * <pre>{@code
 * <dependency>
 *   <groupId>com.macstab.oss.redis</groupId>
 *   <artifactId>redis-resp-metrics</artifactId>
 *   <version>1.0.0</version>
 * </dependency>
 * }</pre>
 *
 * <p><strong>2. Metrics auto-activate when a {@code MeterRegistry} bean exists:</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     redis-resp:
 *       enabled: true  # default
 * }</pre>
 *
 * <p><strong>3. Pass the bean to the client:</strong>
 *
 * <pre>{@code
 * RespClient.connect(RespClientOptions.builder()
 *     .connectionName("orders")
 *     .metrics(respClientMetrics)
 *     .build());
 * }</pre>
 *
 * <p>Without Spring, construct {@link
 * com.macstab.oss.redis.resp.metrics.micrometer.MicrometerRespClientMetrics} with any registry.
 */
package com.macstab.oss.redis.resp.metrics.micrometer;
