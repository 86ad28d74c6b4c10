/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.net.InetSocketAddress;

/**
 * Node joined, left or moved tokens.
 *
 * @param change kind of change
 * @param address node address (native transport address)
 */
public record TopologyChangeEvent(Change change, InetSocketAddress address)
    implements ProtocolEvent {

  public enum Change {
    NEW_NODE,
    REMOVED_NODE,
    MOVED_NODE
  }

  @Override
  public EventType type() {
    return EventType.TOPOLOGY_CHANGE;
  }
}
