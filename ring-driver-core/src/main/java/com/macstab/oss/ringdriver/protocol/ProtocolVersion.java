/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/**
 * Native protocol versions spoken by the driver.
 *
 * <p>All three use the legacy 9-byte frame header. The checksummed segment layer that v5 adds on
 * top of frames is not negotiated; servers accept v5 frames without it until a connection opts in.
 */
public enum ProtocolVersion {
  V3(3),
  V4(4),
  V5(5);

  private final int code;

  ProtocolVersion(final int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Whether ERROR frames of this version carry per-replica failure reason maps. */
  public boolean hasFailureReasonMap() {
    return code >= 5;
  }

  /** Whether frames may carry a custom payload (bytes map) ahead of the body. */
  public boolean hasCustomPayload() {
    return code >= 4;
  }

  /** Whether QUERY/BATCH flags are an int rather than a byte. */
  public boolean hasIntQueryFlags() {
    return code >= 5;
  }

  public static ProtocolVersion fromCode(final int code) {
    for (final var v : values()) {
      if (v.code == code) {
        return v;
      }
    }
    throw new IllegalArgumentException("Unsupported protocol version: " + code);
  }
}
