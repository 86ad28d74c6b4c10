/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/** Server-pushed EVENT frame body. */
public interface ProtocolEvent extends Message {

  EventType type();

  @Override
  default Opcode opcode() {
    return Opcode.EVENT;
  }
}
