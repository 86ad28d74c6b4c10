/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import java.util.List;

import com.macstab.oss.ringdriver.host.HostInfo;

import lombok.NonNull;

/**
 * Cluster nodes as reported by the node the control connection talks to.
 *
 * @param partitioner partitioner class name, null if not reported
 * @param localHost the queried node itself
 * @param peers the other nodes, connect addresses not yet translated
 */
public record TopologyInfo(
    String partitioner, @NonNull HostInfo localHost, @NonNull List<HostInfo> peers) {

  public TopologyInfo {
    peers = List.copyOf(peers);
  }
}
