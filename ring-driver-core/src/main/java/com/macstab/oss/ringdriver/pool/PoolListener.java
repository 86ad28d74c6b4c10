/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

/** Pool lifecycle callbacks, implemented by {@link PoolManager}. */
public interface PoolListener {

  /**
   * The pool has no open connection and could not open one. Its host should be marked down.
   *
   * @param pool failing pool
   * @param cause last connection failure
   */
  void onPoolDown(HostConnectionPool pool, Throwable cause);

  /** Open connection count of {@code pool} changed. */
  default void onConnectionCountChanged(final HostConnectionPool pool, final int open) {}
}
