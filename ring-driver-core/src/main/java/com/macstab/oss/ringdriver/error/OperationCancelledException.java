/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

/** A blocking wait observed its cancellation token before completing. */
public class OperationCancelledException extends DriverException {

  private static final long serialVersionUID = 1L;

  public OperationCancelledException(final String message) {
    super(message);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.CANCELLED;
  }
}
