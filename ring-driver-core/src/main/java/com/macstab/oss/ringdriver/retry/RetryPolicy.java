/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.retry;

import java.time.Duration;

/**
 * Decides what happens after a failed attempt.
 *
 * <p>Consulted by the query executor for every attempt that failed with a connection, client
 * timeout or server-reported error. Topology and agreement errors (session closed, cancelled,
 * schema disagreement) never reach the policy.
 *
 * <p>Implementations must keep the idempotency contract: an error after which a write may have
 * been partially applied must not be retried for a non-idempotent statement unless the
 * implementation documents that it opts in.
 */
public interface RetryPolicy {

  RetryDecision decide(RetryContext context);

  /** Pause before a retry. Zero by default. */
  default Duration retryDelay(final RetryContext context) {
    return Duration.ZERO;
  }

  default String getName() {
    return getClass().getSimpleName();
  }
}
