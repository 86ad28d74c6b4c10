/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.shard;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sharding parameters a shard-per-core server advertises in its SUPPORTED response.
 *
 * @param shard shard that owns the connection the SUPPORTED frame arrived on
 * @param shardCount number of shards of the node
 * @param ignoreMsb most significant token bits ignored by the shard function
 * @param partitioner partitioner class name reported alongside
 * @param algorithm sharding algorithm name
 * @param shardAwarePort port routing connections by source port, 0 if not advertised
 * @param shardAwarePortSsl TLS variant of the shard-aware port, 0 if not advertised
 */
public record ShardingInfo(
    int shard,
    int shardCount,
    int ignoreMsb,
    String partitioner,
    String algorithm,
    int shardAwarePort,
    int shardAwarePortSsl) {

  public static final String SHARD = "SCYLLA_SHARD";
  public static final String NR_SHARDS = "SCYLLA_NR_SHARDS";
  public static final String IGNORE_MSB = "SCYLLA_SHARDING_IGNORE_MSB";
  public static final String PARTITIONER = "SCYLLA_PARTITIONER";
  public static final String ALGORITHM = "SCYLLA_SHARDING_ALGORITHM";
  public static final String SHARD_AWARE_PORT = "SCYLLA_SHARD_AWARE_PORT";
  public static final String SHARD_AWARE_PORT_SSL = "SCYLLA_SHARD_AWARE_PORT_SSL";

  /** Largest number of ignored token bits a 64-bit token allows. */
  public static final int MAX_IGNORE_MSB = 63;

  /**
   * Parses the multimap of a SUPPORTED response.
   *
   * @param supported option name to values
   * @return sharding info, empty for servers without sharding or with malformed or out-of-range
   *     values
   */
  public static Optional<ShardingInfo> fromSupported(final Map<String, List<String>> supported) {
    final var shard = intOption(supported, SHARD, -1);
    final var count = intOption(supported, NR_SHARDS, -1);
    if (shard < 0 || count <= 0 || shard >= count) {
      return Optional.empty();
    }
    final var ignoreMsb = intOption(supported, IGNORE_MSB, 0);
    if (ignoreMsb < 0 || ignoreMsb > MAX_IGNORE_MSB) {
      return Optional.empty();
    }
    return Optional.of(
        new ShardingInfo(
            shard,
            count,
            ignoreMsb,
            stringOption(supported, PARTITIONER),
            stringOption(supported, ALGORITHM),
            intOption(supported, SHARD_AWARE_PORT, 0),
            intOption(supported, SHARD_AWARE_PORT_SSL, 0)));
  }

  public boolean hasShardAwarePort() {
    return shardAwarePort > 0;
  }

  /** Shard calculator for this node's shard count and ignored bits. */
  public ShardCalculator calculator() {
    return new ShardCalculator(shardCount, ignoreMsb);
  }

  private static int intOption(
      final Map<String, List<String>> supported, final String key, final int fallback) {
    final var value = stringOption(supported, key);
    if (value == null) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (final NumberFormatException e) {
      return fallback;
    }
  }

  private static String stringOption(final Map<String, List<String>> supported, final String key) {
    final var values = supported.get(key);
    return values == null || values.isEmpty() ? null : values.get(0);
  }
}
