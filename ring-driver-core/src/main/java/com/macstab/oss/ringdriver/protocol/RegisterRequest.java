/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.util.List;

import io.netty.buffer.ByteBuf;

/**
 * REGISTER: subscribes the connection to server push events.
 *
 * @param eventTypes events to receive
 */
public record RegisterRequest(List<EventType> eventTypes) implements Request {

  public RegisterRequest {
    eventTypes = List.copyOf(eventTypes);
  }

  @Override
  public Opcode opcode() {
    return Opcode.REGISTER;
  }

  @Override
  public void encode(final ByteBuf out, final ProtocolVersion version) {
    out.writeShort(eventTypes.size());
    for (final var type : eventTypes) {
      CodecUtils.writeString(out, type.name());
    }
  }
}
