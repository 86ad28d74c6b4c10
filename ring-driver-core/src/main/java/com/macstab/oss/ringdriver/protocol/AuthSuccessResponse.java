/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/**
 * AUTH_SUCCESS: authentication finished.
 *
 * @param token final server token, may be null
 */
public record AuthSuccessResponse(byte[] token) implements Message {

  @Override
  public Opcode opcode() {
    return Opcode.AUTH_SUCCESS;
  }
}
