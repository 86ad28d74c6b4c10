/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

/** The coordinator is still bootstrapping; the request was not executed. */
public class BootstrappingException extends RequestException {

  private static final long serialVersionUID = 1L;

  public BootstrappingException(final InetSocketAddress coordinator, final String message) {
    super(coordinator, ErrorCode.IS_BOOTSTRAPPING, message);
  }
}
