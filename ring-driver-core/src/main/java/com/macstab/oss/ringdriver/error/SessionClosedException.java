/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

/** The session (or the component owned by it) was closed before or during the call. */
public class SessionClosedException extends DriverException {

  private static final long serialVersionUID = 1L;

  public SessionClosedException(final String message) {
    super(message);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.SESSION_CLOSED;
  }
}
