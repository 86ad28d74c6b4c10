/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.shard;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Chooses local (source) ports for connections to the shard-aware port.
 *
 * <p>The server routes a connection arriving on its shard-aware port to shard {@code sourcePort %
 * shardCount}. Ports are picked from the ephemeral range starting at a random offset, so two pools
 * for the same shard do not race for the same port. A port that turns out to be taken is reported
 * back by the caller trying the next candidate.
 */
public final class ShardPortAllocator {

  public static final int MIN_PORT = 49152;
  public static final int MAX_PORT = 65535;

  private ShardPortAllocator() {}

  /**
   * Lowest port in range that maps to {@code shard}.
   *
   * @param shard target shard
   * @param shardCount node shard count
   * @return first candidate port
   */
  public static int firstPort(final int shard, final int shardCount) {
    checkArgs(shard, shardCount);
    return MIN_PORT + Math.floorMod(shard - MIN_PORT, shardCount);
  }

  /**
   * Random port in range that maps to {@code shard}.
   *
   * @param shard target shard
   * @param shardCount node shard count
   * @return candidate local port with {@code port % shardCount == shard}
   */
  public static int randomPort(final int shard, final int shardCount) {
    final int first = firstPort(shard, shardCount);
    final int slots = (MAX_PORT - first) / shardCount + 1;
    return first + ThreadLocalRandom.current().nextInt(slots) * shardCount;
  }

  /**
   * Next port after {@code port} mapping to the same shard, wrapping to the start of the range.
   *
   * @param port previously tried port
   * @param shard target shard
   * @param shardCount node shard count
   * @return next candidate
   */
  public static int nextPort(final int port, final int shard, final int shardCount) {
    final int next = port + shardCount;
    return next > MAX_PORT ? firstPort(shard, shardCount) : next;
  }

  private static void checkArgs(final int shard, final int shardCount) {
    if (shardCount <= 0 || shard < 0 || shard >= shardCount) {
      throw new IllegalArgumentException(
          "Invalid shard " + shard + " for shard count " + shardCount);
    }
  }
}
