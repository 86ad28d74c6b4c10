/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

/**
 * Transport-level failure: connect refused, connection reset, channel closed.
 *
 * <p>{@link #isRequestSent()} tells the executor whether the request may have reached the
 * coordinator. Unsent requests move to the next host without consulting the retry policy.
 */
public class ConnectionException extends DriverException {

  private static final long serialVersionUID = 1L;

  private final transient InetSocketAddress address;
  private final boolean requestSent;

  public ConnectionException(final InetSocketAddress address, final String message) {
    this(address, message, null, true);
  }

  public ConnectionException(
      final InetSocketAddress address, final String message, final Throwable cause) {
    this(address, message, cause, true);
  }

  public ConnectionException(
      final InetSocketAddress address,
      final String message,
      final Throwable cause,
      final boolean requestSent) {
    super("[" + address + "] " + message, cause);
    this.address = address;
    this.requestSent = requestSent;
  }

  public InetSocketAddress getAddress() {
    return address;
  }

  public boolean isRequestSent() {
    return requestSent;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.CONNECTION;
  }
}
