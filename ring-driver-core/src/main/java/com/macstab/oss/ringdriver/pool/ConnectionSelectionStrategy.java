/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import java.util.List;

import com.macstab.oss.ringdriver.transport.FrameTransport;

/**
 * Picks one of a host's open transports when no shard-specific transport applies.
 *
 * <p>Used for unsharded hosts, for statements without a routing token and as the fallback when
 * the target shard's slot is empty. Implementations are lock-free; one instance per pool.
 */
public interface ConnectionSelectionStrategy {

  /**
   * Selects a transport.
   *
   * @param candidates open transports, never empty
   * @return index into {@code candidates}
   */
  int select(List<FrameTransport> candidates);

  String getName();
}
