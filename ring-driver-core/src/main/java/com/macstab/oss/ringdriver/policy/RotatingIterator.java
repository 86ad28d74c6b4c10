/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/** Yields every element of a list once, starting at {@code start} and wrapping around. */
final class RotatingIterator<T> implements Iterator<T> {

  private final List<T> items;
  private final int start;
  private int yielded;

  RotatingIterator(final List<T> items, final int start) {
    this.items = items;
    this.start = items.isEmpty() ? 0 : Math.floorMod(start, items.size());
  }

  @Override
  public boolean hasNext() {
    return yielded < items.size();
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final var item = items.get((start + yielded) % items.size());
    yielded++;
    return item;
  }
}
