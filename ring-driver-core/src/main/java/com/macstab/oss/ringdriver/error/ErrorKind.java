/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

/**
 * Coarse classification of every failure the driver can surface.
 *
 * <p>Retry policies decide on the kind, not on the concrete exception class. Server-reported kinds
 * carry consistency and acknowledgement detail on the matching {@link RequestException} subclass.
 */
public enum ErrorKind {
  /** Connect refused, reset, or transport closed while the request was in flight. */
  CONNECTION,
  /** No response within the per-attempt request timeout. */
  CLIENT_TIMEOUT,
  /** Malformed frame or unsupported protocol version; fatal for the transport only. */
  PROTOCOL,
  AUTHENTICATION,
  UNAVAILABLE,
  READ_TIMEOUT,
  WRITE_TIMEOUT,
  READ_FAILURE,
  WRITE_FAILURE,
  OVERLOADED,
  BOOTSTRAPPING,
  SERVER_ERROR,
  /** Syntax, validation, authorization or schema errors. Never retried. */
  QUERY_INVALID,
  NO_HOST_AVAILABLE,
  SCHEMA_DISAGREEMENT,
  SESSION_CLOSED,
  CANCELLED;

  /**
   * Whether a coordinator reported this error in an ERROR frame.
   *
   * @return true for request-level kinds handed to the retry policy with server detail
   */
  public boolean isServerReported() {
    return switch (this) {
      case UNAVAILABLE,
          READ_TIMEOUT,
          WRITE_TIMEOUT,
          READ_FAILURE,
          WRITE_FAILURE,
          OVERLOADED,
          BOOTSTRAPPING,
          SERVER_ERROR,
          QUERY_INVALID -> true;
      default -> false;
    };
  }
}
