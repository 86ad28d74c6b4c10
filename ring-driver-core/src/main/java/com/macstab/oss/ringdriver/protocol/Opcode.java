/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import com.macstab.oss.ringdriver.error.FrameProtocolException;

/** Frame opcodes. */
public enum Opcode {
  ERROR(0x00),
  STARTUP(0x01),
  READY(0x02),
  AUTHENTICATE(0x03),
  OPTIONS(0x05),
  SUPPORTED(0x06),
  QUERY(0x07),
  RESULT(0x08),
  PREPARE(0x09),
  EXECUTE(0x0A),
  REGISTER(0x0B),
  EVENT(0x0C),
  BATCH(0x0D),
  AUTH_CHALLENGE(0x0E),
  AUTH_RESPONSE(0x0F),
  AUTH_SUCCESS(0x10);

  private static final Opcode[] BY_CODE = new Opcode[0x11];

  static {
    for (final var o : values()) {
      BY_CODE[o.code] = o;
    }
  }

  private final int code;

  Opcode(final int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Resolves a wire opcode.
   *
   * @param code opcode byte
   * @return opcode
   * @throws FrameProtocolException for unknown opcodes
   */
  public static Opcode fromCode(final int code) {
    if (code < 0 || code >= BY_CODE.length || BY_CODE[code] == null) {
      throw new FrameProtocolException(
          "Unknown opcode: 0x" + Integer.toHexString(code));
    }
    return BY_CODE[code];
  }
}
