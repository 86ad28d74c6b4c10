/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.List;

import com.macstab.oss.ringdriver.protocol.ColumnSpec;

import lombok.Getter;
import lombok.NonNull;

/**
 * One page of a query result.
 *
 * <p>The rows of further pages are fetched with {@code Session.fetchNextPage(statement, rs)} or
 * by iterating {@code Session.executeStreaming(statement)}.
 */
@Getter
public final class ResultSet implements Iterable<Row> {

  private static final String APPLIED_COLUMN = "[applied]";

  private final List<ColumnSpec> columns;
  private final List<Row> rows;
  private final ByteBuffer pagingState;
  private final ExecutionInfo executionInfo;

  public ResultSet(
      @NonNull final List<ColumnSpec> columns,
      @NonNull final List<Row> rows,
      final ByteBuffer pagingState,
      @NonNull final ExecutionInfo executionInfo) {
    this.columns = List.copyOf(columns);
    this.rows = List.copyOf(rows);
    this.pagingState = pagingState;
    this.executionInfo = executionInfo;
  }

  /** Result without rows (writes, DDL, ignored errors). */
  public static ResultSet empty(final ExecutionInfo executionInfo) {
    return new ResultSet(List.of(), List.of(), null, executionInfo);
  }

  public boolean hasMorePages() {
    return pagingState != null;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }

  /** First row, or null if the page is empty. */
  public Row one() {
    return rows.isEmpty() ? null : rows.get(0);
  }

  /**
   * Outcome of a conditional update. True for results without an {@code [applied]} column.
   *
   * @return whether the condition held
   */
  public boolean wasApplied() {
    final var first = one();
    if (first == null || !first.hasColumn(APPLIED_COLUMN)) {
      return true;
    }
    return first.getBool(APPLIED_COLUMN);
  }

  @Override
  public Iterator<Row> iterator() {
    return rows.iterator();
  }
}
