/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

/**
 * Malformed frame, unexpected opcode or unsupported protocol version.
 *
 * <p>Fatal for the offending transport only: the transport is closed and its pool reconnects.
 */
public class FrameProtocolException extends DriverException {

  private static final long serialVersionUID = 1L;

  public FrameProtocolException(final String message) {
    super(message);
  }

  public FrameProtocolException(final String message, final Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.PROTOCOL;
  }
}
