/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;

import com.macstab.oss.ringdriver.protocol.Request;

/**
 * A request a session can execute: a {@link SimpleStatement} or a {@link BatchStatement}.
 *
 * <p>Unset options (null consistency, non-positive page size, null timeout) fall back to the
 * session defaults when the request is built.
 */
public interface Statement {

  /** Consistency level, null for the session default. */
  Consistency getConsistency();

  /** Serial consistency for conditional updates, null for the session default. */
  Consistency getSerialConsistency();

  /**
   * Whether applying the statement twice is harmless. Only idempotent statements are executed
   * speculatively or retried after errors that may have applied a write.
   */
  boolean isIdempotent();

  /** Keyspace used to find replicas, null for the session keyspace. */
  String getKeyspace();

  /** Serialized partition key, null if the statement cannot be routed by token. */
  ByteBuffer getRoutingKey();

  /** Per-attempt timeout, null for the session default. */
  Duration getTimeout();

  /**
   * Custom payload sent with the request, for server-side query handlers that read one. Needs
   * protocol V4 or later.
   */
  Map<String, ByteBuffer> getCustomPayload();

  /**
   * Builds the wire request.
   *
   * @param defaults session defaults for unset options
   * @return QUERY or BATCH request
   */
  Request toRequest(StatementDefaults defaults);
}
