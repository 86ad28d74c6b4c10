/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import static lombok.AccessLevel.PRIVATE;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.ringdriver.transport.FrameTransport;

import lombok.experimental.FieldDefaults;

/**
 * Cycles through the open transports.
 *
 * <p><strong>Algorithm:</strong> {@code (counter.getAndIncrement() & Integer.MAX_VALUE) % n}. The
 * mask clears the sign bit after the counter wraps, keeping the index non-negative.
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RoundRobinConnectionStrategy implements ConnectionSelectionStrategy {

  AtomicInteger counter = new AtomicInteger();

  @Override
  public int select(final List<FrameTransport> candidates) {
    return (counter.getAndIncrement() & Integer.MAX_VALUE) % candidates.size();
  }

  @Override
  public String getName() {
    return "round-robin";
  }
}
