/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import io.netty.buffer.ByteBuf;

/**
 * AUTH_RESPONSE: one step of the SASL exchange.
 *
 * @param token authenticator-specific token, may be null
 */
public record AuthResponseRequest(byte[] token) implements Request {

  @Override
  public Opcode opcode() {
    return Opcode.AUTH_RESPONSE;
  }

  @Override
  public void encode(final ByteBuf out, final ProtocolVersion version) {
    CodecUtils.writeBytes(out, token);
  }
}
