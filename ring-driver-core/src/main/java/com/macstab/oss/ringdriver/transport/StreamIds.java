/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Lock-free allocator of stream ids {@code [0, 32768)}.
 *
 * <p>One bit per id in an {@link AtomicLongArray}. Allocation scans words starting at a rotating
 * offset so concurrent callers spread over different words and rarely collide on the same CAS.
 *
 * <p>An id is released only when its response (or the connection close) arrives. A request the
 * caller stopped waiting for keeps its id until then; reusing it earlier would hand the late
 * response to the wrong request.
 */
public final class StreamIds {

  public static final int MAX_STREAMS = 32768;

  private static final int WORDS = MAX_STREAMS / Long.SIZE;

  private final AtomicLongArray bits = new AtomicLongArray(WORDS);
  private final AtomicInteger offset = new AtomicInteger();
  private final AtomicInteger inUse = new AtomicInteger();

  /**
   * Reserves a free id.
   *
   * @return id, or -1 if all ids are in use
   */
  public int acquire() {
    final int start = (offset.getAndIncrement() & Integer.MAX_VALUE) % WORDS;
    for (int i = 0; i < WORDS; i++) {
      final int word = (start + i) % WORDS;
      while (true) {
        final long current = bits.get(word);
        if (current == -1L) {
          break;
        }
        final long free = Long.lowestOneBit(~current);
        if (bits.compareAndSet(word, current, current | free)) {
          inUse.incrementAndGet();
          return word * Long.SIZE + Long.numberOfTrailingZeros(free);
        }
      }
    }
    return -1;
  }

  /**
   * Releases an id. Releasing a free id is a no-op.
   *
   * @param id id from {@link #acquire()}
   */
  public void release(final int id) {
    if (id < 0 || id >= MAX_STREAMS) {
      return;
    }
    final int word = id / Long.SIZE;
    final long mask = 1L << (id % Long.SIZE);
    while (true) {
      final long current = bits.get(word);
      if ((current & mask) == 0) {
        return;
      }
      if (bits.compareAndSet(word, current, current & ~mask)) {
        inUse.decrementAndGet();
        return;
      }
    }
  }

  public int inUse() {
    return inUse.get();
  }
}
