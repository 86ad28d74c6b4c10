/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.metrics;

import java.time.Duration;

/**
 * Metrics hook of the driver.
 *
 * <p><strong>Design:</strong> every method has a no-op default, so the core has no dependency on
 * a metrics library. {@code ring-driver-metrics} provides a Micrometer implementation; anything
 * else can be plugged in through {@code SessionConfig.metrics}.
 *
 * <p><strong>Threading:</strong> methods are called from query threads, Netty event loops and the
 * control connection executor concurrently. Implementations must be thread-safe and must not
 * block.
 *
 * <p><strong>Dimensions:</strong> every method takes the session name so several sessions in one
 * JVM report separately.
 */
public interface DriverMetrics {

  /** Metrics implementation that discards everything. */
  DriverMetrics NOOP = new DriverMetrics() {};

  /**
   * A host was chosen as coordinator for an attempt.
   *
   * @param sessionName session name
   * @param host host address
   * @param policyName name of the host selection policy
   */
  default void recordHostSelection(String sessionName, String host, String policyName) {
    // No-op by default
  }

  /**
   * Open connection count of one host pool changed.
   *
   * @param sessionName session name
   * @param host host address
   * @param open open transports
   */
  default void setOpenConnections(String sessionName, String host, int open) {
    // No-op by default
  }

  /**
   * The retry policy made a decision.
   *
   * @param sessionName session name
   * @param errorKind error kind handed to the policy
   * @param decision decision name
   */
  default void recordRetryDecision(String sessionName, String errorKind, String decision) {
    // No-op by default
  }

  /** A speculative execution was started. */
  default void recordSpeculativeExecution(String sessionName) {
    // No-op by default
  }

  /**
   * A reconnection attempt finished.
   *
   * @param sessionName session name
   * @param host host address
   * @param success whether the connection was established
   */
  default void recordReconnectionAttempt(String sessionName, String host, boolean success) {
    // No-op by default
  }

  /**
   * A topology or status event was applied to the registry.
   *
   * @param sessionName session name
   * @param event event name (NEW_NODE, UP, ...)
   */
  default void recordTopologyEvent(String sessionName, String event) {
    // No-op by default
  }

  /**
   * A logical request finished.
   *
   * @param sessionName session name
   * @param latency end-to-end latency including retries
   * @param success whether a result was returned
   */
  default void recordRequestLatency(String sessionName, Duration latency, boolean success) {
    // No-op by default
  }

  /**
   * A host pool switched to best-effort shard mode.
   *
   * @param sessionName session name
   * @param host host address
   */
  default void recordShardAwarenessDisabled(String sessionName, String host) {
    // No-op by default
  }

  /**
   * Releases meters registered for a session.
   *
   * @param sessionName session name
   */
  default void close(String sessionName) {
    // No-op by default
  }
}
