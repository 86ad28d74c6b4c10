/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import com.macstab.oss.ringdriver.host.HostInfo;

/** Every node replicates everything; primary owner first, then ring order. */
public record EverywhereStrategy() implements ReplicationStrategy {

  public static final EverywhereStrategy INSTANCE = new EverywhereStrategy();

  @Override
  public List<HostInfo> computeReplicas(final TokenRing ring, final int index) {
    final var replicas = new LinkedHashSet<HostInfo>();
    for (int i = 0; i < ring.size() && replicas.size() < ring.hostCount(); i++) {
      replicas.add(ring.ownerAt(index + i));
    }
    return new ArrayList<>(replicas);
  }
}
