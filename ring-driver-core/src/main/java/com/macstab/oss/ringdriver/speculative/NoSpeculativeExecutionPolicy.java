/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.speculative;

import java.time.Duration;
import java.util.Optional;

/** Never starts a speculative execution. */
public enum NoSpeculativeExecutionPolicy implements SpeculativeExecutionPolicy {
  INSTANCE;

  @Override
  public Optional<Duration> nextExecution(final int runningExecutions) {
    return Optional.empty();
  }

  @Override
  public String getName() {
    return "none";
  }
}
