/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import java.util.Iterator;
import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.ringdriver.host.HostInfo;

/**
 * Rotates through every up host.
 *
 * <p><strong>Algorithm:</strong> each plan starts at {@code (counter++ & Integer.MAX_VALUE) % n}
 * and yields all {@code n} up hosts once, wrapping around. For N up hosts, N consecutive plans
 * start at N distinct hosts, so every host leads exactly once per cycle.
 *
 * <p><strong>Thread safety:</strong> lock-free; the cursor is a single {@link AtomicInteger}. The
 * bitmask keeps the index non-negative after the counter overflows.
 */
public class RoundRobinPolicy extends AbstractHostSelectionPolicy {

  private final AtomicInteger counter = new AtomicInteger();

  @Override
  public Iterator<HostInfo> newQueryPlan(final QueryPlanContext context) {
    final var hosts = upHosts();
    if (hosts.isEmpty()) {
      return new RotatingIterator<>(hosts, 0);
    }
    final int start = (counter.getAndIncrement() & Integer.MAX_VALUE) % hosts.size();
    return new RotatingIterator<>(hosts, start);
  }

  @Override
  public HostDistance distance(final HostInfo host) {
    return HostDistance.LOCAL;
  }

  @Override
  public String getName() {
    return "round-robin";
  }
}
