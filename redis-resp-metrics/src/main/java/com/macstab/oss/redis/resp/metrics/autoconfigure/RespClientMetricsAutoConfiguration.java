/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.redis.resp.metrics.RespClientMetrics;
import com.macstab.oss.redis.resp.metrics.micrometer.MicrometerRespClientMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for RESP client metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ul>
 *   <li>Micrometer on the classpath ({@code MeterRegistry})
 *   <li>A {@code MeterRegistry} bean exists (Spring Boot Actuator provides one)
 *   <li>{@code management.metrics.redis-resp.enabled=true} (default)
 *   <li>No user-defined {@link RespClientMetrics} bean
 * </ul>
 *
 * <p>Otherwise a {@link RespClientMetrics#NOOP} bean is registered, so consumers can always inject
 * one.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(RespClientMetricsProperties.class)
public class RespClientMetricsAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.redis-resp",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(RespClientMetrics.class)
  public RespClientMetrics micrometerRespClientMetrics(
      final MeterRegistry registry, final RespClientMetricsProperties properties) {

    log.info(
        "Activating RESP client metrics (Micrometer) - maxCacheSize: {}",
        properties.getMaxCacheSize());

    return new MicrometerRespClientMetrics(registry, properties.getMaxCacheSize());
  }

  @Bean
  @ConditionalOnMissingBean(RespClientMetrics.class)
  public RespClientMetrics noOpRespClientMetrics() {
    log.debug("RESP client metrics disabled - using NOOP singleton");
    return RespClientMetrics.NOOP;
  }
}
