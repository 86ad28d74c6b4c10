/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.function.Consumer;

import com.macstab.oss.ringdriver.protocol.EventType;
import com.macstab.oss.ringdriver.protocol.ProtocolEvent;

import lombok.NonNull;

/**
 * Parameters of one connection attempt.
 *
 * @param endpoint node address (regular or shard-aware port)
 * @param localPort source port to bind, 0 for an ephemeral one
 * @param useKeyspace whether to switch to the session keyspace during the handshake
 * @param eventTypes events to REGISTER for, empty for regular pool connections
 * @param eventListener receives pushed events, null when {@code eventTypes} is empty
 */
public record ConnectRequest(
    @NonNull InetSocketAddress endpoint,
    int localPort,
    boolean useKeyspace,
    List<EventType> eventTypes,
    Consumer<ProtocolEvent> eventListener) {

  public ConnectRequest {
    eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
    if (!eventTypes.isEmpty() && eventListener == null) {
      throw new IllegalArgumentException("eventListener is required when registering for events");
    }
  }

  /** Regular pool connection on an ephemeral source port. */
  public static ConnectRequest pooled(final InetSocketAddress endpoint) {
    return new ConnectRequest(endpoint, 0, true, List.of(), null);
  }

  /** Pool connection from a fixed source port (shard-aware port routing). */
  public static ConnectRequest pooled(final InetSocketAddress endpoint, final int localPort) {
    return new ConnectRequest(endpoint, localPort, true, List.of(), null);
  }

  /** Control connection registered for push events. */
  public static ConnectRequest control(
      final InetSocketAddress endpoint,
      final List<EventType> eventTypes,
      final Consumer<ProtocolEvent> listener) {
    return new ConnectRequest(endpoint, 0, false, eventTypes, listener);
  }
}
