/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

/**
 * Error reported by a coordinator in an ERROR frame.
 *
 * <p>Handed to the retry policy together with the attempt number and the statement's idempotency.
 * Subclasses carry the consistency and acknowledgement detail of their error code.
 */
public abstract class RequestException extends DriverException {

  private static final long serialVersionUID = 1L;

  private final transient InetSocketAddress coordinator;
  private final ErrorCode code;

  protected RequestException(
      final InetSocketAddress coordinator, final ErrorCode code, final String message) {
    super("[" + coordinator + "] " + code + ": " + message);
    this.coordinator = coordinator;
    this.code = code;
  }

  /** Address of the node that answered with the error. */
  public InetSocketAddress getCoordinator() {
    return coordinator;
  }

  public ErrorCode getCode() {
    return code;
  }

  @Override
  public ErrorKind kind() {
    return code.kind();
  }
}
