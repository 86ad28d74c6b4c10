/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import io.netty.buffer.ByteBuf;

/** OPTIONS: asks for the SUPPORTED map. Empty body. */
public enum OptionsRequest implements Request {
  INSTANCE;

  @Override
  public Opcode opcode() {
    return Opcode.OPTIONS;
  }

  @Override
  public void encode(final ByteBuf out, final ProtocolVersion version) {
    // empty body
  }
}
