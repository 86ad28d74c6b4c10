/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.net.InetSocketAddress;

/**
 * Node went up or down, as seen by the node the control connection talks to.
 *
 * @param status new status
 * @param address node address
 */
public record StatusChangeEvent(Status status, InetSocketAddress address)
    implements ProtocolEvent {

  public enum Status {
    UP,
    DOWN
  }

  @Override
  public EventType type() {
    return EventType.STATUS_CHANGE;
  }
}
