/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

import com.macstab.oss.ringdriver.query.Consistency;

/** Replicas did not answer a read within the server-side timeout. */
public class ReadTimeoutException extends RequestException {

  private static final long serialVersionUID = 1L;

  private final Consistency consistency;
  private final int received;
  private final int blockFor;
  private final boolean dataPresent;

  public ReadTimeoutException(
      final InetSocketAddress coordinator,
      final String message,
      final Consistency consistency,
      final int received,
      final int blockFor,
      final boolean dataPresent) {
    super(coordinator, ErrorCode.READ_TIMEOUT, message);
    this.consistency = consistency;
    this.received = received;
    this.blockFor = blockFor;
    this.dataPresent = dataPresent;
  }

  public Consistency getConsistency() {
    return consistency;
  }

  public int getReceived() {
    return received;
  }

  public int getBlockFor() {
    return blockFor;
  }

  public boolean isDataPresent() {
    return dataPresent;
  }
}
