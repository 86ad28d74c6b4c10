/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.retry;

/** Never retries; every error goes straight to the caller. */
public enum FallthroughRetryPolicy implements RetryPolicy {
  INSTANCE;

  @Override
  public RetryDecision decide(final RetryContext context) {
    return RetryDecision.RETHROW;
  }

  @Override
  public String getName() {
    return "fallthrough";
  }
}
