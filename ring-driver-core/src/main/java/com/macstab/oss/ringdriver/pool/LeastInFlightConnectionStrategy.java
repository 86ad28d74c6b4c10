/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import java.util.List;

import com.macstab.oss.ringdriver.transport.FrameTransport;

/**
 * Picks the transport with the fewest requests awaiting a response.
 *
 * <p>In-flight counts are read without coordination; two concurrent callers may both pick the
 * same transport. Ties go to the lowest index.
 */
public final class LeastInFlightConnectionStrategy implements ConnectionSelectionStrategy {

  @Override
  public int select(final List<FrameTransport> candidates) {
    var minIndex = 0;
    var minCount = candidates.get(0).inFlight();
    for (var i = 1; i < candidates.size(); i++) {
      final var count = candidates.get(i).inFlight();
      if (count < minCount) {
        minCount = count;
        minIndex = i;
      }
    }
    return minIndex;
  }

  @Override
  public String getName() {
    return "least-in-flight";
  }
}
