/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Map;

import com.macstab.oss.ringdriver.query.Consistency;

/**
 * A write was acknowledged by only some replicas; the rest reported failures.
 *
 * <p><strong>Protocol-version gated detail:</strong> the per-replica reason map (replica address
 * to failure code) exists on the wire only from protocol v5. On v3/v4 the server sends a bare
 * failure count and {@link #getReasonMap()} is empty. Callers must not treat an empty map as "no
 * replica failed".
 */
public class WriteFailureException extends RequestException {

  private static final long serialVersionUID = 1L;

  private final Consistency consistency;
  private final int received;
  private final int blockFor;
  private final int failures;
  private final transient Map<InetAddress, Integer> reasonMap;
  private final String writeType;

  public WriteFailureException(
      final InetSocketAddress coordinator,
      final ErrorCode code,
      final String message,
      final Consistency consistency,
      final int received,
      final int blockFor,
      final int failures,
      final Map<InetAddress, Integer> reasonMap,
      final String writeType) {
    super(coordinator, code, message);
    this.consistency = consistency;
    this.received = received;
    this.blockFor = blockFor;
    this.failures = failures;
    this.reasonMap = Map.copyOf(reasonMap);
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

  public int getFailures() {
    return failures;
  }

  public Map<InetAddress, Integer> getReasonMap() {
    return reasonMap;
  }

  public String getWriteType() {
    return writeType;
  }
}
