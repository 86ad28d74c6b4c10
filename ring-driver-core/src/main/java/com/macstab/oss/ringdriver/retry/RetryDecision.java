/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.retry;

/** Outcome of {@link RetryPolicy#decide(RetryContext)}. */
public enum RetryDecision {
  /** Send the request again to the host that just failed. */
  RETRY_SAME_HOST,
  /** Move on to the next candidate of the query plan. */
  RETRY_NEXT_HOST,
  /** Fail the query with the error. */
  RETHROW,
  /** Complete the query with an empty result. */
  IGNORE
}
