/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import java.time.Duration;

/** Stateful sequence of delays for one series of reconnection attempts. */
@FunctionalInterface
public interface ReconnectionSchedule {

  /** Delay before the next attempt; advances the schedule. */
  Duration nextDelay();
}
