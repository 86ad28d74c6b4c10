/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.speculative;

import java.time.Duration;
import java.util.Optional;

/**
 * Schedules redundant attempts for slow idempotent queries.
 *
 * <p>After an execution starts, the executor asks for the delay before the next one. If the
 * query is still running when the delay elapses, another execution is sent to the next candidate
 * host of the same query plan. The first execution to complete wins; the others are abandoned
 * and their responses ignored.
 *
 * <p>Only idempotent statements are ever executed speculatively.
 */
public interface SpeculativeExecutionPolicy {

  /**
   * Delay before starting another execution.
   *
   * @param runningExecutions executions started so far, the initial one included
   * @return delay, or empty to start no further execution
   */
  Optional<Duration> nextExecution(int runningExecutions);

  default String getName() {
    return getClass().getSimpleName();
  }
}
