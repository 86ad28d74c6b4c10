/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

/** Internal server error, truncate error, or any error code this driver does not model. */
public class ServerErrorException extends RequestException {

  private static final long serialVersionUID = 1L;

  public ServerErrorException(
      final InetSocketAddress coordinator, final ErrorCode code, final String message) {
    super(coordinator, code, message);
  }
}
