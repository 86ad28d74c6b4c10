/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.shard;

import com.macstab.oss.ringdriver.token.Murmur3Token;
import com.macstab.oss.ringdriver.token.Token;

/**
 * Maps Murmur3 tokens to the shard that owns them on a shard-per-core node.
 *
 * <p><strong>Algorithm (biased token):</strong>
 *
 * <pre>{@code
 * biased = token + 2^63            // shift signed range to unsigned [0, 2^64)
 * biased = biased << ignoreMsb     // drop bits the server ignores
 * shard  = (biased * shardCount) >>> 64   // high 64 bits of the unsigned 128-bit product
 * }</pre>
 *
 * <p>{@link Math#multiplyHigh(long, long)} computes the signed high word; adding {@code
 * shardCount} when {@code biased} is negative as a signed long turns it into the unsigned high
 * word ({@code shardCount} is always positive).
 */
public final class ShardCalculator {

  private final int shardCount;
  private final int ignoreMsb;

  public ShardCalculator(final int shardCount, final int ignoreMsb) {
    if (shardCount <= 0) {
      throw new IllegalArgumentException("shardCount must be > 0, got: " + shardCount);
    }
    if (ignoreMsb < 0 || ignoreMsb > ShardingInfo.MAX_IGNORE_MSB) {
      throw new IllegalArgumentException("ignoreMsb must be in [0, 63], got: " + ignoreMsb);
    }
    this.shardCount = shardCount;
    this.ignoreMsb = ignoreMsb;
  }

  public int shardCount() {
    return shardCount;
  }

  /**
   * Shard owning {@code token}.
   *
   * @param token Murmur3 token value
   * @return shard in {@code [0, shardCount)}
   */
  public int shardOf(final long token) {
    long biased = token + Long.MIN_VALUE;
    biased <<= ignoreMsb;
    final long high = Math.multiplyHigh(biased, shardCount) + ((biased >> 63) & shardCount);
    return (int) high;
  }

  /**
   * Shard owning {@code token}; tokens of other partitioners land on shard 0.
   *
   * @param token ring token
   * @return shard in {@code [0, shardCount)}
   */
  public int shardOf(final Token token) {
    if (token instanceof Murmur3Token murmur3) {
      return shardOf(murmur3.value());
    }
    return 0;
  }
}
