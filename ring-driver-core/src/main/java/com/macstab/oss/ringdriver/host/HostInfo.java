/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.host;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Set;
import java.util.UUID;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Immutable description of one cluster node.
 *
 * <p><strong>Copy-on-write:</strong> the registry never mutates an instance it handed out. Status
 * changes, token moves and schema version updates produce a new instance via {@link #toBuilder()}
 * that replaces the old one under the registry's write lock. Policies and pools keep references to
 * whatever version they were notified with.
 *
 * <p>Identity is {@link #getHostId()}; two instances with the same id describe the same node at
 * different points in time.
 */
@Getter
@EqualsAndHashCode
public final class HostInfo {

  private final UUID hostId;
  private final InetSocketAddress connectAddress;
  private final InetAddress broadcastAddress;
  private final String datacenter;
  private final String rack;
  private final Set<String> tokens;
  private final String releaseVersion;
  private final UUID schemaVersion;
  private final int shardCount;
  private final HostStatus status;

  @Builder(toBuilder = true)
  private HostInfo(
      @NonNull final UUID hostId,
      @NonNull final InetSocketAddress connectAddress,
      final InetAddress broadcastAddress,
      final String datacenter,
      final String rack,
      final Set<String> tokens,
      final String releaseVersion,
      final UUID schemaVersion,
      final int shardCount,
      final HostStatus status) {
    if (shardCount < 0) {
      throw new IllegalArgumentException("shardCount must be >= 0, got: " + shardCount);
    }
    this.hostId = hostId;
    this.connectAddress = connectAddress;
    this.broadcastAddress = broadcastAddress;
    this.datacenter = datacenter;
    this.rack = rack;
    this.tokens = tokens == null ? Set.of() : Set.copyOf(tokens);
    this.releaseVersion = releaseVersion;
    this.schemaVersion = schemaVersion;
    this.shardCount = shardCount;
    this.status = status == null ? HostStatus.UP : status;
  }

  public boolean isUp() {
    return status == HostStatus.UP;
  }

  /** Whether a pool learned that this node runs a sharded (shard-per-core) server. */
  public boolean isSharded() {
    return shardCount > 0;
  }

  public HostInfo withStatus(final HostStatus newStatus) {
    return newStatus == status ? this : toBuilder().status(newStatus).build();
  }

  /**
   * Whether everything except the status equals {@code other}.
   *
   * @param other another version of the same node
   * @return true if only the status (or nothing) differs
   */
  public boolean sameMetadata(final HostInfo other) {
    return other != null && equals(other.withStatus(status));
  }

  @Override
  public String toString() {
    return "Host[" + connectAddress + ", id=" + hostId + ", dc=" + datacenter + ", rack=" + rack
        + ", " + status + "]";
  }
}
