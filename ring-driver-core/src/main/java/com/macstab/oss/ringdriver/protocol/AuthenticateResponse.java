/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/**
 * AUTHENTICATE: the server requires authentication.
 *
 * @param authenticator server-side authenticator class name
 */
public record AuthenticateResponse(String authenticator) implements Message {

  @Override
  public Opcode opcode() {
    return Opcode.AUTHENTICATE;
  }
}
