/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import java.time.Duration;

import lombok.NonNull;

/** Same delay before every attempt. */
public final class ConstantReconnectionPolicy implements ReconnectionPolicy {

  private final Duration delay;

  public ConstantReconnectionPolicy(@NonNull final Duration delay) {
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must be >= 0, got: " + delay);
    }
    this.delay = delay;
  }

  @Override
  public ReconnectionSchedule newSchedule() {
    return () -> delay;
  }
}
