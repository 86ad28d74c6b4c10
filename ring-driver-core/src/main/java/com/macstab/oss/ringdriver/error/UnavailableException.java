/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

import com.macstab.oss.ringdriver.query.Consistency;

/** Not enough live replicas to even attempt the request at the requested consistency. */
public class UnavailableException extends RequestException {

  private static final long serialVersionUID = 1L;

  private final Consistency consistency;
  private final int required;
  private final int alive;

  public UnavailableException(
      final InetSocketAddress coordinator,
      final String message,
      final Consistency consistency,
      final int required,
      final int alive) {
    super(coordinator, ErrorCode.UNAVAILABLE, message);
    this.consistency = consistency;
    this.required = required;
    this.alive = alive;
  }

  public Consistency getConsistency() {
    return consistency;
  }

  public int getRequired() {
    return required;
  }

  public int getAlive() {
    return alive;
  }
}
