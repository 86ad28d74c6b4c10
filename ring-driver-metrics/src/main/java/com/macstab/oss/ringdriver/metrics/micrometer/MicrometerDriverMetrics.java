/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.metrics.micrometer;

import static com.macstab.oss.ringdriver.metrics.micrometer.MetricsConfiguration.*;

import java.time.Duration;
import java.util.Objects;

import com.macstab.oss.ringdriver.metrics.DriverMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link DriverMetrics} with dimensional tags.
 *
 * <p><strong>Dimensional Metrics:</strong> every meter carries a {@code session.name} tag, so one
 * instance can serve several sessions of the same application.
 *
 * <p><strong>Metrics Published</strong> (names relative to the configured prefix):
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code host.selections}</td><td>Counter</td><td>host, policy.name</td></tr>
 *     <tr><td>{@code pool.connections.open}</td><td>Gauge</td><td>host</td></tr>
 *     <tr><td>{@code retry.decisions}</td><td>Counter</td><td>error.kind, decision</td></tr>
 *     <tr><td>{@code speculative.executions}</td><td>Counter</td><td>-</td></tr>
 *     <tr><td>{@code reconnection.attempts}</td><td>Counter</td><td>host, outcome</td></tr>
 *     <tr><td>{@code topology.events}</td><td>Counter</td><td>event</td></tr>
 *     <tr><td>{@code requests}</td><td>Timer</td><td>outcome</td></tr>
 *     <tr><td>{@code shard.awareness.disabled}</td><td>Counter</td><td>host</td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Memory Management:</strong> {@link #close(String)} removes every meter of the session
 * from the registry. A session reopened under the same name registers fresh meters.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerDriverMetrics implements DriverMetrics {

  /** Default bound of {@link MetricCache}. */
  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;

  private final MetricCache cache;
  private final String prefix;
  private final double[] latencyPercentiles;

  /**
   * Creates a Micrometer metrics collector.
   *
   * @param registry Micrometer meter registry
   * @param prefix metric name prefix, e.g. {@code ring.driver}
   * @param maxCacheSize maximum cached meters
   * @param latencyPercentiles percentiles published by the request timer, may be empty
   * @throws NullPointerException if registry or prefix is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  public MicrometerDriverMetrics(
      @NonNull final MeterRegistry registry,
      @NonNull final String prefix,
      final int maxCacheSize,
      final double... latencyPercentiles) {
    this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
    this.cache = new MetricCache(registry, maxCacheSize);
    this.latencyPercentiles =
        latencyPercentiles == null ? new double[0] : latencyPercentiles.clone();

    log.debug(
        "Created MicrometerDriverMetrics (prefix: {}, maxCacheSize: {})", prefix, maxCacheSize);
  }

  /**
   * Creates a collector with the default prefix, cache size and no latency percentiles.
   *
   * @param registry Micrometer meter registry
   */
  public MicrometerDriverMetrics(@NonNull final MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordHostSelection(
      final String sessionName, final String host, final String policyName) {
    cache
        .getOrCreateCounter(
            prefix + HOST_SELECTIONS,
            "Coordinator choices per host",
            TAG_SESSION_NAME,
            sessionName,
            TAG_HOST,
            host,
            TAG_POLICY_NAME,
            policyName)
        .increment();
  }

  @Override
  public void setOpenConnections(final String sessionName, final String host, final int open) {
    if (open < 0) {
      log.warn("Invalid open connection count {} for host {}, skipping metric", open, host);
      return;
    }
    cache
        .getOrCreateGaugeValue(
            prefix + CONNECTIONS_OPEN,
            "Open transports of the host pool",
            TAG_SESSION_NAME,
            sessionName,
            TAG_HOST,
            host)
        .set(open);
  }

  @Override
  public void recordRetryDecision(
      final String sessionName, final String errorKind, final String decision) {
    cache
        .getOrCreateCounter(
            prefix + RETRY_DECISIONS,
            "Retry policy decisions by error kind",
            TAG_SESSION_NAME,
            sessionName,
            TAG_ERROR_KIND,
            errorKind,
            TAG_DECISION,
            decision)
        .increment();
  }

  @Override
  public void recordSpeculativeExecution(final String sessionName) {
    cache
        .getOrCreateCounter(
            prefix + SPECULATIVE_EXECUTIONS,
            "Speculative executions started",
            TAG_SESSION_NAME,
            sessionName)
        .increment();
  }

  @Override
  public void recordReconnectionAttempt(
      final String sessionName, final String host, final boolean success) {
    cache
        .getOrCreateCounter(
            prefix + RECONNECTION_ATTEMPTS,
            "Reconnection attempts by outcome",
            TAG_SESSION_NAME,
            sessionName,
            TAG_HOST,
            host,
            TAG_OUTCOME,
            outcome(success))
        .increment();
  }

  @Override
  public void recordTopologyEvent(final String sessionName, final String event) {
    cache
        .getOrCreateCounter(
            prefix + TOPOLOGY_EVENTS,
            "Topology, status and schema events applied",
            TAG_SESSION_NAME,
            sessionName,
            TAG_EVENT,
            event)
        .increment();
  }

  @Override
  public void recordRequestLatency(
      final String sessionName, final Duration latency, final boolean success) {
    cache
        .getOrCreateTimer(
            prefix + REQUESTS,
            "End-to-end request latency including retries",
            latencyPercentiles,
            TAG_SESSION_NAME,
            sessionName,
            TAG_OUTCOME,
            outcome(success))
        .record(latency);
  }

  @Override
  public void recordShardAwarenessDisabled(final String sessionName, final String host) {
    cache
        .getOrCreateCounter(
            prefix + SHARD_AWARENESS_DISABLED,
            "Host pools that fell back to best-effort shard mode",
            TAG_SESSION_NAME,
            sessionName,
            TAG_HOST,
            host)
        .increment();
  }

  @Override
  public void close(final String sessionName) {
    final int removed = cache.removeByTag(TAG_SESSION_NAME, sessionName);
    log.info("Closed metrics for session '{}' ({} meters removed)", sessionName, removed);
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }

  // ==================== Private Methods ====================

  private static String outcome(final boolean success) {
    return success ? OUTCOME_SUCCESS : OUTCOME_FAILURE;
  }
}
