/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.metrics.micrometer.MicrometerDriverMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for driver metrics.
 *
 * <p><strong>Activation Conditions</strong> for the Micrometer bean:
 *
 * <ol>
 *   <li>{@code MeterRegistry} bean exists (Actuator or a user-defined registry)
 *   <li>{@code management.metrics.ring-driver.enabled=true} (default)
 *   <li>No user-defined {@link DriverMetrics} bean
 * </ol>
 *
 * <p>Otherwise {@link DriverMetrics#NOOP} is exposed, so the session starter can always inject a
 * {@code DriverMetrics}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics."
          + "CompositeMeterRegistryAutoConfiguration"
    })
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(RingDriverMetricsProperties.class)
public class RingDriverMetricsAutoConfiguration {

  /**
   * Creates the Micrometer metrics collector.
   *
   * @param registry meter registry
   * @param properties metrics configuration properties
   * @return Micrometer metrics collector
   */
  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.ring-driver",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(DriverMetrics.class)
  public DriverMetrics micrometerDriverMetrics(
      final MeterRegistry registry, final RingDriverMetricsProperties properties) {
    log.info(
        "Activating ring-driver metrics (Micrometer) - prefix: '{}', maxCacheSize: {}",
        properties.getPrefix(),
        properties.getMaxCacheSize());
    return new MicrometerDriverMetrics(
        registry,
        properties.getPrefix(),
        properties.getMaxCacheSize(),
        properties.getLatencyPercentiles());
  }

  /**
   * No-op collector when metrics are disabled or no registry exists.
   *
   * @return {@link DriverMetrics#NOOP}
   */
  @Bean
  @ConditionalOnMissingBean(DriverMetrics.class)
  public DriverMetrics noOpDriverMetrics() {
    log.debug("ring-driver metrics disabled - using NOOP");
    return DriverMetrics.NOOP;
  }
}
