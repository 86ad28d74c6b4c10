/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import com.macstab.oss.ringdriver.host.HostInfo;

/**
 * Places replicas on the next {@code replicationFactor} distinct hosts walking clockwise.
 *
 * @param replicationFactor number of replicas per token range
 */
public record SimpleStrategy(int replicationFactor) implements ReplicationStrategy {

  public SimpleStrategy {
    if (replicationFactor < 0) {
      throw new IllegalArgumentException(
          "replicationFactor must be >= 0, got: " + replicationFactor);
    }
  }

  @Override
  public List<HostInfo> computeReplicas(final TokenRing ring, final int index) {
    final int want = Math.min(replicationFactor, ring.hostCount());
    final var replicas = new LinkedHashSet<HostInfo>(want * 2);
    for (int i = 0; i < ring.size() && replicas.size() < want; i++) {
      replicas.add(ring.ownerAt(index + i));
    }
    return new ArrayList<>(replicas);
  }
}
