/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Doubles the delay after each failed attempt, capped at {@code maxDelay}.
 *
 * <p><strong>Jitter:</strong> with jitter enabled each delay is drawn uniformly from {@code [d/2,
 * d]} where {@code d} is the un-jittered delay, so pools that lost a node at the same instant do
 * not reconnect in lockstep.
 */
@Getter
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ExponentialReconnectionPolicy implements ReconnectionPolicy {

  Duration baseDelay;
  Duration maxDelay;
  boolean jitter;

  public ExponentialReconnectionPolicy(
      @NonNull final Duration baseDelay, @NonNull final Duration maxDelay, final boolean jitter) {
    if (baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelay);
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    }
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
    this.jitter = jitter;
  }

  @Override
  public ReconnectionSchedule newSchedule() {
    return new ReconnectionSchedule() {
      private int attempt;

      @Override
      public Duration nextDelay() {
        final var delay = rawDelay(attempt);
        if (attempt < 62) {
          attempt++;
        }
        if (!jitter) {
          return delay;
        }
        final long nanos = delay.toNanos();
        final long half = nanos / 2;
        return Duration.ofNanos(half + ThreadLocalRandom.current().nextLong(nanos - half + 1));
      }
    };
  }

  /**
   * Un-jittered delay of attempt {@code n} (0-based).
   *
   * @param n attempt number
   * @return {@code min(maxDelay, baseDelay * 2^n)}
   */
  Duration rawDelay(final int n) {
    final long base = baseDelay.toNanos();
    final long max = maxDelay.toNanos();
    if (n >= 62 || base > (max >> Math.min(n, 62))) {
      return maxDelay;
    }
    return Duration.ofNanos(Math.min(max, base << n));
  }
}
