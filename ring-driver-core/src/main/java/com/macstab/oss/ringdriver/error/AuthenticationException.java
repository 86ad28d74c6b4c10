/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

/** Credential exchange rejected by the server or not configured although challenged. */
public class AuthenticationException extends DriverException {

  private static final long serialVersionUID = 1L;

  public AuthenticationException(final InetSocketAddress address, final String message) {
    super("[" + address + "] " + message);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.AUTHENTICATION;
  }
}
