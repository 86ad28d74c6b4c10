/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/**
 * AUTH_CHALLENGE: next SASL challenge.
 *
 * @param token challenge, may be null
 */
public record AuthChallengeResponse(byte[] token) implements Message {

  @Override
  public Opcode opcode() {
    return Opcode.AUTH_CHALLENGE;
  }
}
