/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric name suffixes and tag keys of the Micrometer integration.
 *
 * <p><strong>Naming Convention:</strong> {@code <prefix>.<area>.<measure>} with the default prefix
 * {@code ring.driver}. Prometheus output replaces dots with underscores:
 *
 * <pre>
 * ring.driver.host.selections       → ring_driver_host_selections_total
 * ring.driver.pool.connections.open → ring_driver_pool_connections_open
 * ring.driver.requests              → ring_driver_requests_seconds_count
 * </pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  /** Default metric name prefix. */
  public static final String DEFAULT_PREFIX = "ring.driver";

  /**
   * Coordinator choices per host.
   *
   * <p><strong>Type:</strong> Counter. <strong>Tags:</strong> session.name, host, policy.name
   */
  public static final String HOST_SELECTIONS = ".host.selections";

  /**
   * Open transports per host pool.
   *
   * <p><strong>Type:</strong> Gauge. <strong>Tags:</strong> session.name, host
   */
  public static final String CONNECTIONS_OPEN = ".pool.connections.open";

  /**
   * Retry policy decisions.
   *
   * <p><strong>Type:</strong> Counter. <strong>Tags:</strong> session.name, error.kind, decision
   */
  public static final String RETRY_DECISIONS = ".retry.decisions";

  /** Speculative executions started. Counter tagged with session.name. */
  public static final String SPECULATIVE_EXECUTIONS = ".speculative.executions";

  /**
   * Reconnection attempts of pools, the control connection and the downed-host prober.
   *
   * <p><strong>Type:</strong> Counter. <strong>Tags:</strong> session.name, host, outcome
   */
  public static final String RECONNECTION_ATTEMPTS = ".reconnection.attempts";

  /** Topology, status and schema events applied. Counter tagged with session.name, event. */
  public static final String TOPOLOGY_EVENTS = ".topology.events";

  /**
   * End-to-end request latency including retries and speculative executions.
   *
   * <p><strong>Type:</strong> Timer. <strong>Tags:</strong> session.name, outcome
   */
  public static final String REQUESTS = ".requests";

  /** Pools that fell back to best-effort shard mode. Counter tagged with session.name, host. */
  public static final String SHARD_AWARENESS_DISABLED = ".shard.awareness.disabled";

  // Tag keys
  public static final String TAG_SESSION_NAME = "session.name";
  public static final String TAG_HOST = "host";
  public static final String TAG_POLICY_NAME = "policy.name";
  public static final String TAG_ERROR_KIND = "error.kind";
  public static final String TAG_DECISION = "decision";
  public static final String TAG_OUTCOME = "outcome";
  public static final String TAG_EVENT = "event";

  // Outcome tag values
  public static final String OUTCOME_SUCCESS = "success";
  public static final String OUTCOME_FAILURE = "failure";
}
