/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

import lombok.NonNull;

/**
 * Iterates every row of a paged result, fetching the next page when the current one is consumed.
 *
 * <p>Pages are fetched lazily and synchronously on the iterating thread. A failed fetch is thrown
 * from {@link #hasNext()}: iteration never ends early without an error.
 */
public final class PagingIterator implements Iterator<Row> {

  private final Function<ResultSet, ResultSet> nextPage;
  private ResultSet current;
  private Iterator<Row> rows;
  private int pagesFetched = 1;

  /**
   * @param first first page
   * @param nextPage fetches the page following its argument; throws on failure
   */
  public PagingIterator(
      @NonNull final ResultSet first, @NonNull final Function<ResultSet, ResultSet> nextPage) {
    this.current = first;
    this.rows = first.iterator();
    this.nextPage = nextPage;
  }

  @Override
  public boolean hasNext() {
    while (!rows.hasNext()) {
      if (!current.hasMorePages()) {
        return false;
      }
      current = nextPage.apply(current);
      rows = current.iterator();
      pagesFetched++;
    }
    return true;
  }

  @Override
  public Row next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return rows.next();
  }

  /** Execution info of the page currently iterated. */
  public ExecutionInfo currentExecutionInfo() {
    return current.getExecutionInfo();
  }

  public int pagesFetched() {
    return pagesFetched;
  }
}
