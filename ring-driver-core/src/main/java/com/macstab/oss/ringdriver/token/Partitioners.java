/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.util.Optional;

/** Resolves partitioners from the class name reported by the cluster. */
public final class Partitioners {

  public static final Partitioner MURMUR3 = new Murmur3Partitioner();
  public static final Partitioner RANDOM = new RandomPartitioner();

  private Partitioners() {}

  /**
   * Looks up a partitioner by (possibly unqualified) class name.
   *
   * @param name e.g. {@code org.apache.cassandra.dht.Murmur3Partitioner}
   * @return partitioner, empty for unsupported ones (byte-ordered, custom)
   */
  public static Optional<Partitioner> forName(final String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    if (name.endsWith("Murmur3Partitioner")) {
      return Optional.of(MURMUR3);
    }
    if (name.endsWith("RandomPartitioner")) {
      return Optional.of(RANDOM);
    }
    return Optional.empty();
  }
}
