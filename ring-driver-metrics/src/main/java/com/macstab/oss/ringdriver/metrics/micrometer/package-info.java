/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Micrometer implementation of the driver metrics hook.
 *
 * <h2>Quick Start</h2>
 *
 * <pre>{@code
 * final var metrics = new MicrometerDriverMetrics(meterRegistry);
 * final var session =
 *     RingDriver.connect(
 *         SessionConfig.builder().contactPoint("10.0.0.1").metrics(metrics).build());
 * }</pre>
 *
 * <p>With Spring Boot the bean is created by {@code RingDriverMetricsAutoConfiguration} as soon as
 * a {@code MeterRegistry} exists, and picked up by the session starter.
 *
 * <h2>Prometheus Output Example</h2>
 *
 * <pre>
 * ring_driver_host_selections_total{session_name="default",host="/10.0.0.1:9042",policy_name="..."}
 * ring_driver_pool_connections_open{session_name="default",host="/10.0.0.1:9042"} 8
 * ring_driver_retry_decisions_total{session_name="default",error_kind="READ_TIMEOUT",...}
 * ring_driver_requests_seconds{session_name="default",outcome="success",quantile="0.99"}
 * </pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.ringdriver.metrics.micrometer;
