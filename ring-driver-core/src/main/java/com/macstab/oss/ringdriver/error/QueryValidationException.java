/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

/**
 * The statement itself is wrong: syntax, invalid request, missing permission, bad configuration,
 * already existing schema element, failing function. Retrying elsewhere cannot help.
 */
public class QueryValidationException extends RequestException {

  private static final long serialVersionUID = 1L;

  public QueryValidationException(
      final InetSocketAddress coordinator, final ErrorCode code, final String message) {
    super(coordinator, code, message);
  }
}
