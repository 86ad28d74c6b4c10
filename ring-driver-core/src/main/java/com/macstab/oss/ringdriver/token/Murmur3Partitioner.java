/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.nio.ByteBuffer;

/**
 * Murmur3 x64 128-bit hash, upper 64 bits, exactly as the server computes it.
 *
 * <p><strong>Server quirk preserved:</strong> tail bytes are sign-extended before being mixed in
 * (the server reads them as signed {@code byte}). For keys whose tail has bytes &gt;= 0x80 this
 * differs from the reference MurmurHash3 implementation; routing must match the server, not the
 * reference.
 *
 * <p>{@code Long.MIN_VALUE} is reserved as the ring minimum and normalized to {@code
 * Long.MAX_VALUE}.
 */
public final class Murmur3Partitioner implements Partitioner {

  public static final String NAME = "org.apache.cassandra.dht.Murmur3Partitioner";

  private static final long C1 = 0x87c37b91114253d5L;
  private static final long C2 = 0x4cf5ad432745937fL;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Token hash(final ByteBuffer partitionKey) {
    final long h1 = hash3x64h1(partitionKey);
    return new Murmur3Token(h1 == Long.MIN_VALUE ? Long.MAX_VALUE : h1);
  }

  @Override
  public Token parse(final String token) {
    try {
      return new Murmur3Token(Long.parseLong(token.trim()));
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid Murmur3 token: " + token, e);
    }
  }

  /**
   * Upper half of murmur3 x64 128 with seed 0.
   *
   * @param key bytes between position and limit
   * @return h1
   */
  static long hash3x64h1(final ByteBuffer key) {
    final int offset = key.position();
    final int length = key.remaining();
    final int nblocks = length >> 4;

    long h1 = 0;
    long h2 = 0;

    for (int i = 0; i < nblocks; i++) {
      long k1 = getBlock(key, offset, i * 2);
      long k2 = getBlock(key, offset, i * 2 + 1);

      k1 *= C1;
      k1 = Long.rotateLeft(k1, 31);
      k1 *= C2;
      h1 ^= k1;

      h1 = Long.rotateLeft(h1, 27);
      h1 += h2;
      h1 = h1 * 5 + 0x52dce729;

      k2 *= C2;
      k2 = Long.rotateLeft(k2, 33);
      k2 *= C1;
      h2 ^= k2;

      h2 = Long.rotateLeft(h2, 31);
      h2 += h1;
      h2 = h2 * 5 + 0x38495ab5;
    }

    final int tail = offset + (nblocks << 4);
    long k1 = 0;
    long k2 = 0;

    switch (length & 15) {
      case 15:
        k2 ^= ((long) key.get(tail + 14)) << 48;
      case 14:
        k2 ^= ((long) key.get(tail + 13)) << 40;
      case 13:
        k2 ^= ((long) key.get(tail + 12)) << 32;
      case 12:
        k2 ^= ((long) key.get(tail + 11)) << 24;
      case 11:
        k2 ^= ((long) key.get(tail + 10)) << 16;
      case 10:
        k2 ^= ((long) key.get(tail + 9)) << 8;
      case 9:
        k2 ^= key.get(tail + 8);
        k2 *= C2;
        k2 = Long.rotateLeft(k2, 33);
        k2 *= C1;
        h2 ^= k2;
      case 8:
        k1 ^= ((long) key.get(tail + 7)) << 56;
      case 7:
        k1 ^= ((long) key.get(tail + 6)) << 48;
      case 6:
        k1 ^= ((long) key.get(tail + 5)) << 40;
      case 5:
        k1 ^= ((long) key.get(tail + 4)) << 32;
      case 4:
        k1 ^= ((long) key.get(tail + 3)) << 24;
      case 3:
        k1 ^= ((long) key.get(tail + 2)) << 16;
      case 2:
        k1 ^= ((long) key.get(tail + 1)) << 8;
      case 1:
        k1 ^= key.get(tail);
        k1 *= C1;
        k1 = Long.rotateLeft(k1, 31);
        k1 *= C2;
        h1 ^= k1;
      default:
        break;
    }

    h1 ^= length;
    h2 ^= length;

    h1 += h2;
    h2 += h1;

    h1 = fmix(h1);
    h2 = fmix(h2);

    h1 += h2;
    return h1;
  }

  private static long getBlock(final ByteBuffer key, final int offset, final int index) {
    final int i = offset + (index << 3);
    return (key.get(i) & 0xffL)
        | ((key.get(i + 1) & 0xffL) << 8)
        | ((key.get(i + 2) & 0xffL) << 16)
        | ((key.get(i + 3) & 0xffL) << 24)
        | ((key.get(i + 4) & 0xffL) << 32)
        | ((key.get(i + 5) & 0xffL) << 40)
        | ((key.get(i + 6) & 0xffL) << 48)
        | ((key.get(i + 7) & 0xffL) << 56);
  }

  private static long fmix(long k) {
    k ^= k >>> 33;
    k *= 0xff51afd7ed558ccdL;
    k ^= k >>> 33;
    k *= 0xc4ceb9fe1a85ec53L;
    k ^= k >>> 33;
    return k;
  }
}
