/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

/** The coordinator is overloaded and shed the request. */
public class OverloadedException extends RequestException {

  private static final long serialVersionUID = 1L;

  public OverloadedException(final InetSocketAddress coordinator, final String message) {
    super(coordinator, ErrorCode.OVERLOADED, message);
  }
}
