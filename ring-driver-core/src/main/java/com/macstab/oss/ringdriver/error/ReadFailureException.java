/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Map;

import com.macstab.oss.ringdriver.query.Consistency;

/**
 * Some replicas failed a read (for example tombstone overflow).
 *
 * <p>{@link #getReasonMap()} is filled from protocol v5 on. Older protocol versions only report a
 * failure count and the map stays empty.
 */
public class ReadFailureException extends RequestException {

  private static final long serialVersionUID = 1L;

  private final Consistency consistency;
  private final int received;
  private final int blockFor;
  private final int failures;
  private final transient Map<InetAddress, Integer> reasonMap;
  private final boolean dataPresent;

  public ReadFailureException(
      final InetSocketAddress coordinator,
      final String message,
      final Consistency consistency,
      final int received,
      final int blockFor,
      final int failures,
      final Map<InetAddress, Integer> reasonMap,
      final boolean dataPresent) {
    super(coordinator, ErrorCode.READ_FAILURE, message);
    this.consistency = consistency;
    this.received = received;
    this.blockFor = blockFor;
    this.failures = failures;
    this.reasonMap = Map.copyOf(reasonMap);
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

  public int getFailures() {
    return failures;
  }

  public Map<InetAddress, Integer> getReasonMap() {
    return reasonMap;
  }

  public boolean isDataPresent() {
    return dataPresent;
  }
}
