/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.Map;

import io.netty.buffer.ByteBuf;

/** Client-to-server message. */
public interface Request extends Message {

  /** Custom payload sent ahead of the body; empty for none. */
  default Map<String, ByteBuffer> customPayload() {
    return Map.of();
  }

  /**
   * Writes the body (without the frame header).
   *
   * @param out target buffer
   * @param version negotiated protocol version
   */
  void encode(ByteBuf out, ProtocolVersion version);
}
