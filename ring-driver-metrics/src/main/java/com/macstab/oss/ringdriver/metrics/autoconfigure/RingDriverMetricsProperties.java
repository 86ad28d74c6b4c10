/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for ring-driver metrics.
 *
 * <p><strong>Configuration Example:</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     ring-driver:
 *       enabled: true
 *       prefix: ring.driver
 *       max-cache-size: 1000
 *       latency-percentiles: 0.5, 0.95, 0.99
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.ring-driver")
public class RingDriverMetricsProperties {

  /**
   * Enable Micrometer metrics for driver sessions.
   *
   * <p>When disabled, {@code DriverMetrics.NOOP} is used.
   */
  private boolean enabled = true;

  /** Metric name prefix. */
  private String prefix = "ring.driver";

  /**
   * Maximum cached meter instances.
   *
   * <p>Per-host meters grow with cluster size. When the cache is full, meters are registered
   * directly and a warning is logged.
   */
  private int maxCacheSize = 1000;

  /** Client-side percentiles published by the request latency timer. Empty to disable. */
  private double[] latencyPercentiles = {0.50, 0.95, 0.99};
}
