/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.retry;

import com.macstab.oss.ringdriver.error.ConnectionException;
import com.macstab.oss.ringdriver.error.DriverException;
import com.macstab.oss.ringdriver.error.ErrorKind;
import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.query.Consistency;

import lombok.NonNull;

/**
 * Input of one retry decision.
 *
 * @param error failure of the last attempt
 * @param retryCount retries already made for this query (0 on the first failure)
 * @param idempotent whether the statement may safely be applied twice
 * @param consistency consistency level of the failed attempt
 * @param host host the failed attempt was sent to
 */
public record RetryContext(
    @NonNull DriverException error,
    int retryCount,
    boolean idempotent,
    Consistency consistency,
    HostInfo host) {

  public ErrorKind kind() {
    return error.kind();
  }

  /**
   * Whether the failed request certainly never reached the server, so retrying cannot apply it
   * twice.
   */
  public boolean requestNotSent() {
    return error instanceof ConnectionException ce && !ce.isRequestSent();
  }
}
