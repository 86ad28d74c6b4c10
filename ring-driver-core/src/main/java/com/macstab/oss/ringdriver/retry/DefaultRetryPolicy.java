/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.retry;

import com.macstab.oss.ringdriver.error.ReadTimeoutException;
import com.macstab.oss.ringdriver.error.WriteTimeoutException;

import lombok.Getter;

/**
 * Idempotency-aware retry policy used unless configured otherwise.
 *
 * <p><strong>Decisions</strong> (after {@code maxRetries} retries everything is rethrown):
 *
 * <table>
 *   <caption>Decision per error kind</caption>
 *   <tr><th>Kind</th><th>Idempotent</th><th>Non-idempotent</th></tr>
 *   <tr><td>CONNECTION, request not sent</td><td>next host</td><td>next host</td></tr>
 *   <tr><td>CONNECTION, CLIENT_TIMEOUT, PROTOCOL</td><td>next host</td><td>rethrow</td></tr>
 *   <tr><td>UNAVAILABLE</td><td>next host, first failure only</td><td>same</td></tr>
 *   <tr><td>READ_TIMEOUT, enough replicas answered but no data</td><td>same host</td><td>same
 *       host</td></tr>
 *   <tr><td>READ_TIMEOUT otherwise</td><td>next host</td><td>rethrow</td></tr>
 *   <tr><td>WRITE_TIMEOUT</td><td>next host (same host for BATCH_LOG)</td><td>rethrow, unless
 *       {@code retryNonIdempotentWriteTimeouts}</td></tr>
 *   <tr><td>WRITE_FAILURE, SERVER_ERROR, OVERLOADED</td><td>next host</td><td>rethrow</td></tr>
 *   <tr><td>BOOTSTRAPPING</td><td>next host</td><td>next host</td></tr>
 *   <tr><td>READ_FAILURE, QUERY_INVALID, AUTHENTICATION, others</td><td>rethrow</td>
 *       <td>rethrow</td></tr>
 * </table>
 *
 * <p>A bootstrapping node rejects the request before executing it, so moving on is always safe.
 * Unavailable is raised by the coordinator before any replica is contacted; another coordinator
 * may see a different liveness picture, but a second unavailable is final.
 */
@Getter
public class DefaultRetryPolicy implements RetryPolicy {

  public static final int DEFAULT_MAX_RETRIES = 3;

  private final int maxRetries;
  private final boolean retryNonIdempotentWriteTimeouts;

  public DefaultRetryPolicy() {
    this(DEFAULT_MAX_RETRIES, false);
  }

  /**
   * @param maxRetries retries per query before errors are rethrown
   * @param retryNonIdempotentWriteTimeouts retry write timeouts even for non-idempotent statements
   */
  public DefaultRetryPolicy(final int maxRetries, final boolean retryNonIdempotentWriteTimeouts) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
    }
    this.maxRetries = maxRetries;
    this.retryNonIdempotentWriteTimeouts = retryNonIdempotentWriteTimeouts;
  }

  @Override
  public RetryDecision decide(final RetryContext context) {
    if (context.retryCount() >= maxRetries) {
      return RetryDecision.RETHROW;
    }
    final boolean idempotent = context.idempotent();
    return switch (context.kind()) {
      case CONNECTION, CLIENT_TIMEOUT, PROTOCOL ->
          idempotent || context.requestNotSent()
              ? RetryDecision.RETRY_NEXT_HOST
              : RetryDecision.RETHROW;
      case UNAVAILABLE ->
          context.retryCount() == 0 ? RetryDecision.RETRY_NEXT_HOST : RetryDecision.RETHROW;
      case READ_TIMEOUT -> onReadTimeout(context);
      case WRITE_TIMEOUT -> onWriteTimeout(context);
      case WRITE_FAILURE, SERVER_ERROR, OVERLOADED ->
          idempotent ? RetryDecision.RETRY_NEXT_HOST : RetryDecision.RETHROW;
      case BOOTSTRAPPING -> RetryDecision.RETRY_NEXT_HOST;
      default -> RetryDecision.RETHROW;
    };
  }

  @Override
  public String getName() {
    return "default";
  }

  // ==================== Private Methods ====================

  private RetryDecision onReadTimeout(final RetryContext context) {
    if (context.error() instanceof ReadTimeoutException rte
        && rte.getReceived() >= rte.getBlockFor()
        && !rte.isDataPresent()
        && context.retryCount() == 0) {
      // enough replicas answered, only the data replica was slow
      return RetryDecision.RETRY_SAME_HOST;
    }
    return context.idempotent() ? RetryDecision.RETRY_NEXT_HOST : RetryDecision.RETHROW;
  }

  private RetryDecision onWriteTimeout(final RetryContext context) {
    if (!context.idempotent() && !retryNonIdempotentWriteTimeouts) {
      return RetryDecision.RETHROW;
    }
    if (context.error() instanceof WriteTimeoutException wte
        && "BATCH_LOG".equals(wte.getWriteType())) {
      return RetryDecision.RETRY_SAME_HOST;
    }
    return RetryDecision.RETRY_NEXT_HOST;
  }
}
