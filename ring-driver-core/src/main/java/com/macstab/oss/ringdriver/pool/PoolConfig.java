/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Per-host pool settings. */
@Value
@Builder(toBuilder = true)
public class PoolConfig {

  /** Connections per unsharded host. Sharded hosts get one connection per shard. */
  @Builder.Default int connectionsPerHost = 2;

  /** Whether to keep one connection per shard and use the shard-aware port. */
  @Builder.Default boolean shardAware = true;

  /**
   * Connections to the shard-aware port that may land on the wrong shard before the pool stops
   * targeting shards for that host (best-effort mode). Also bounds how often one slot is retried
   * through the regular port when it keeps landing on occupied shards.
   */
  @Builder.Default int maxShardPortMismatches = 3;

  /** Shard slots that must be filled before a sharded pool reports ready. */
  @Builder.Default int minShardCoverage = 1;

  /** Longest a request waits for a pool with no open connection. */
  @NonNull @Builder.Default Duration acquireTimeout = Duration.ofSeconds(1);

  @NonNull @Builder.Default
  ConnectionSelection connectionSelection = ConnectionSelection.ROUND_ROBIN;

  public static PoolConfig defaults() {
    return PoolConfig.builder().build();
  }
}
