/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.metrics.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.macstab.oss.redis.resp.metrics.RespClientMetrics;
import com.macstab.oss.redis.resp.metrics.micrometer.MicrometerRespClientMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link RespClientMetricsAutoConfiguration}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>{@link ApplicationContextRunner} for conditional bean creation
 *   <li>Enabled, disabled, missing {@code MeterRegistry}, user-defined bean
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("RespClientMetricsAutoConfiguration")
class RespClientMetricsAutoConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(RespClientMetricsAutoConfiguration.class));

  @Test
  @DisplayName("Should create MicrometerRespClientMetrics by default when a registry exists")
  void shouldCreateMicrometerMetricsByDefault() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(RespClientMetrics.class);
              assertThat(context.getBean(RespClientMetrics.class))
                  .isInstanceOf(MicrometerRespClientMetrics.class);
            });
  }

  @Test
  @DisplayName("Should create NOOP metrics when explicitly disabled")
  void shouldCreateNoOpMetricsWhenDisabled() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .withPropertyValues("management.metrics.redis-resp.enabled=false")
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(RespClientMetrics.class);
              assertThat(context.getBean(RespClientMetrics.class))
                  .isSameAs(RespClientMetrics.NOOP);
            });
  }

  @Test
  @DisplayName("Should create NOOP metrics when MeterRegistry missing")
  void shouldCreateNoOpMetricsWhenMeterRegistryMissing() {
    contextRunner.run(
        context ->
            assertThat(context.getBean(RespClientMetrics.class))
                .isSameAs(RespClientMetrics.NOOP));
  }

  @Test
  @DisplayName("Should keep a user-defined RespClientMetrics bean")
  void shouldBackOffForUserBean() {
    // Arrange & Act
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class, CustomMetricsConfiguration.class)
        .run(
            context -> {
              // Assert
              assertThat(context).hasSingleBean(RespClientMetrics.class);
              assertThat(context.getBean(RespClientMetrics.class))
                  .isSameAs(CustomMetricsConfiguration.CUSTOM);
            });
  }

  @Test
  @DisplayName("Should bind max-cache-size")
  void shouldBindProperties() {
    contextRunner
        .withUserConfiguration(MeterRegistryConfiguration.class)
        .withPropertyValues("management.metrics.redis-resp.max-cache-size=42")
        .run(
            context ->
                assertThat(context.getBean(RespClientMetricsProperties.class).getMaxCacheSize())
                    .isEqualTo(42));
  }

  @Configuration(proxyBeanMethods = false)
  static class MeterRegistryConfiguration {

    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class CustomMetricsConfiguration {

    static final RespClientMetrics CUSTOM = new RespClientMetrics() {};

    @Bean
    RespClientMetrics customMetrics() {
      return CUSTOM;
    }
  }
}
