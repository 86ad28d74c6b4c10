/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.macstab.oss.ringdriver.host.HostInfo;

/**
 * Replica placement of a keyspace.
 *
 * <p>Implementations are value objects (records): they are used as cache keys by {@link TokenRing}
 * so that replica lists are computed once per ring version and strategy.
 */
public interface ReplicationStrategy {

  /**
   * Computes the ordered replica list for the token range owned by {@code ring.ownerAt(index)},
   * primary replica first.
   *
   * @param ring immutable ring snapshot
   * @param index index of the primary owner's token in the ring
   * @return replicas in ring order
   */
  List<HostInfo> computeReplicas(TokenRing ring, int index);

  /**
   * Parses the replication map stored in {@code system_schema.keyspaces.replication}.
   *
   * @param options map containing {@code class} plus strategy options
   * @return strategy; unknown classes degrade to {@link SimpleStrategy} with factor 1
   */
  static ReplicationStrategy fromOptions(final Map<String, String> options) {
    final var cls = options.getOrDefault("class", "");
    if (cls.endsWith("SimpleStrategy")) {
      return new SimpleStrategy(parseFactor(options.get("replication_factor")));
    }
    if (cls.endsWith("NetworkTopologyStrategy")) {
      final Map<String, Integer> perDc = new HashMap<>();
      for (final var e : options.entrySet()) {
        if (!"class".equals(e.getKey())) {
          perDc.put(e.getKey(), parseFactor(e.getValue()));
        }
      }
      return new NetworkTopologyStrategy(perDc);
    }
    if (cls.endsWith("LocalStrategy")) {
      return LocalStrategy.INSTANCE;
    }
    if (cls.endsWith("EverywhereStrategy")) {
      return EverywhereStrategy.INSTANCE;
    }
    return new SimpleStrategy(1);
  }

  private static int parseFactor(final String value) {
    if (value == null) {
      return 1;
    }
    // Transient replication is written as "3/1"; only full replicas receive reads and writes.
    final var slash = value.indexOf('/');
    final var full = slash >= 0 ? value.substring(0, slash) : value;
    try {
      return Integer.parseInt(full.trim());
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid replication factor: " + value, e);
    }
  }
}
