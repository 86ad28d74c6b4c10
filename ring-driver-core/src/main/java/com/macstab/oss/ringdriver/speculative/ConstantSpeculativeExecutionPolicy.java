/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.speculative;

import java.time.Duration;
import java.util.Optional;

import lombok.Getter;
import lombok.NonNull;

/**
 * Starts up to {@code maxSpeculativeExecutions} extra executions, each {@code delay} after the
 * previous one.
 */
@Getter
public class ConstantSpeculativeExecutionPolicy implements SpeculativeExecutionPolicy {

  private final Duration delay;
  private final int maxSpeculativeExecutions;

  public ConstantSpeculativeExecutionPolicy(
      @NonNull final Duration delay, final int maxSpeculativeExecutions) {
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative: " + delay);
    }
    if (maxSpeculativeExecutions < 1) {
      throw new IllegalArgumentException(
          "maxSpeculativeExecutions must be >= 1, got " + maxSpeculativeExecutions);
    }
    this.delay = delay;
    this.maxSpeculativeExecutions = maxSpeculativeExecutions;
  }

  @Override
  public Optional<Duration> nextExecution(final int runningExecutions) {
    return runningExecutions <= maxSpeculativeExecutions ? Optional.of(delay) : Optional.empty();
  }

  @Override
  public String getName() {
    return "constant";
  }
}
