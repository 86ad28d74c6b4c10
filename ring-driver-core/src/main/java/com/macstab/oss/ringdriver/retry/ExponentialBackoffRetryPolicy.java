/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import lombok.NonNull;

/**
 * {@link DefaultRetryPolicy} decisions with a growing pause before each retry.
 *
 * <p>The pause before retry {@code n} (0-based) is drawn uniformly from {@code [d/2, d]} with
 * {@code d = min(max, min * 2^n)}.
 */
public class ExponentialBackoffRetryPolicy extends DefaultRetryPolicy {

  private final Duration minDelay;
  private final Duration maxDelay;

  public ExponentialBackoffRetryPolicy(
      final int maxRetries, @NonNull final Duration minDelay, @NonNull final Duration maxDelay) {
    super(maxRetries, false);
    if (minDelay.isNegative() || maxDelay.compareTo(minDelay) < 0) {
      throw new IllegalArgumentException(
          "Invalid backoff bounds: min=" + minDelay + ", max=" + maxDelay);
    }
    this.minDelay = minDelay;
    this.maxDelay = maxDelay;
  }

  @Override
  public Duration retryDelay(final RetryContext context) {
    final long ceiling = ceilingMillis(context.retryCount());
    if (ceiling <= 1) {
      return Duration.ofMillis(ceiling);
    }
    return Duration.ofMillis(ThreadLocalRandom.current().nextLong(ceiling / 2, ceiling + 1));
  }

  @Override
  public String getName() {
    return "exponential-backoff";
  }

  long ceilingMillis(final int retryCount) {
    final long max = maxDelay.toMillis();
    long delay = minDelay.toMillis();
    for (int i = 0; i < retryCount && delay < max; i++) {
      delay = Math.min(max, delay * 2);
    }
    return Math.min(delay, max);
  }
}
