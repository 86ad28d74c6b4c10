/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.host;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Consistent, immutable view of the registry at one version.
 *
 * @param version registry version the view was taken at
 * @param hosts hosts by id, in discovery order
 */
public record HostSnapshot(long version, Map<UUID, HostInfo> hosts) {

  public HostSnapshot {
    hosts = Collections.unmodifiableMap(new LinkedHashMap<>(hosts));
  }

  public static HostSnapshot empty() {
    return new HostSnapshot(0L, Map.of());
  }

  public List<HostInfo> all() {
    return List.copyOf(hosts.values());
  }

  public List<HostInfo> upHosts() {
    final var result = new ArrayList<HostInfo>(hosts.size());
    for (final var h : hosts.values()) {
      if (h.isUp()) {
        result.add(h);
      }
    }
    return result;
  }

  public Optional<HostInfo> get(final UUID hostId) {
    return Optional.ofNullable(hosts.get(hostId));
  }

  public int size() {
    return hosts.size();
  }
}
