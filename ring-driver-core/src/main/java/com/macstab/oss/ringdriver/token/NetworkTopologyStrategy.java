/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.macstab.oss.ringdriver.host.HostInfo;

/**
 * Per-datacenter replication factors with rack awareness.
 *
 * <p><strong>Placement (same as the server):</strong> walk the ring clockwise from the primary
 * owner. In each datacenter take hosts from racks not yet used; hosts on an already used rack are
 * parked and only taken once every rack of the datacenter holds a replica. A datacenter is done
 * when it holds {@code min(rf, hostsInDc)} replicas.
 *
 * @param replicationFactors replication factor per datacenter name
 */
public record NetworkTopologyStrategy(Map<String, Integer> replicationFactors)
    implements ReplicationStrategy {

  public NetworkTopologyStrategy {
    replicationFactors = Map.copyOf(replicationFactors);
  }

  @Override
  public List<HostInfo> computeReplicas(final TokenRing ring, final int index) {
    final Map<String, Integer> wanted = new HashMap<>();
    final Map<String, Integer> racksPerDc = new HashMap<>();
    final Map<String, Set<String>> racksSeen = new HashMap<>();
    final Map<String, List<HostInfo>> parked = new HashMap<>();
    final Map<String, Integer> taken = new HashMap<>();

    for (final var e : replicationFactors.entrySet()) {
      final var hostsInDc = ring.hostsInDatacenter(e.getKey());
      final int want = Math.min(e.getValue(), hostsInDc);
      if (want > 0) {
        wanted.put(e.getKey(), want);
        racksPerDc.put(e.getKey(), ring.racksInDatacenter(e.getKey()));
        racksSeen.put(e.getKey(), new HashSet<>());
        parked.put(e.getKey(), new ArrayList<>());
        taken.put(e.getKey(), 0);
      }
    }

    final var replicas = new LinkedHashSet<HostInfo>();
    int satisfied = 0;
    for (int i = 0; i < ring.size() && satisfied < wanted.size(); i++) {
      final var host = ring.ownerAt(index + i);
      final var dc = host.getDatacenter();
      final Integer want = wanted.get(dc);
      if (want == null || replicas.contains(host) || taken.get(dc) >= want) {
        continue;
      }

      final var rack = host.getRack();
      final var seen = racksSeen.get(dc);
      if (rack == null || seen.size() == racksPerDc.get(dc)) {
        replicas.add(host);
        taken.merge(dc, 1, Integer::sum);
      } else if (seen.contains(rack)) {
        final var dcParked = parked.get(dc);
        if (!dcParked.contains(host)) {
          dcParked.add(host);
        }
        continue;
      } else {
        replicas.add(host);
        taken.merge(dc, 1, Integer::sum);
        seen.add(rack);
        if (seen.size() == racksPerDc.get(dc)) {
          final var it = parked.get(dc).iterator();
          while (it.hasNext() && taken.get(dc) < want) {
            final var p = it.next();
            if (replicas.add(p)) {
              taken.merge(dc, 1, Integer::sum);
            }
            it.remove();
          }
        }
      }

      if (taken.get(dc).intValue() == want.intValue()) {
        satisfied++;
      }
    }
    return new ArrayList<>(replicas);
  }
}
