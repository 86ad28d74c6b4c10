/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;
import java.time.Duration;

/** The coordinator did not answer within the per-attempt request timeout. */
public class RequestTimeoutException extends DriverException {

  private static final long serialVersionUID = 1L;

  private final transient InetSocketAddress address;

  public RequestTimeoutException(final InetSocketAddress address, final Duration timeout) {
    super("[" + address + "] no response within " + timeout.toMillis() + " ms");
    this.address = address;
  }

  public InetSocketAddress getAddress() {
    return address;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.CLIENT_TIMEOUT;
  }
}
