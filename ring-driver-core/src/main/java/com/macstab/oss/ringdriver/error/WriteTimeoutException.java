/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

import com.macstab.oss.ringdriver.query.Consistency;

/**
 * Replicas did not acknowledge a write within the server-side timeout.
 *
 * <p>The write may have been applied on some replicas. Non-idempotent statements are only retried
 * when the retry policy opts in explicitly.
 */
public class WriteTimeoutException extends RequestException {

  private static final long serialVersionUID = 1L;

  private final Consistency consistency;
  private final int received;
  private final int blockFor;
  private final String writeType;

  public WriteTimeoutException(
      final InetSocketAddress coordinator,
      final ErrorCode code,
      final String message,
      final Consistency consistency,
      final int received,
      final int blockFor,
      final String writeType) {
    super(coordinator, code, message);
    this.consistency = consistency;
    this.received = received;
    this.blockFor = blockFor;
    this.writeType = writeType;
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

  /** SIMPLE, BATCH, UNLOGGED_BATCH, COUNTER, BATCH_LOG, CAS, VIEW or CDC. */
  public String getWriteType() {
    return writeType;
  }
}
