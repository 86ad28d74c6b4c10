/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.host.HostSnapshot;

import lombok.Getter;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable token ring: tokens sorted ascending, each with its owning host.
 *
 * <p><strong>Lookup:</strong> a token belongs to the first ring token that is greater than or
 * equal to it; tokens past the last ring token wrap around to index 0. This is the same
 * lower-bound search a consistent-hash ring uses for key ownership.
 *
 * <p><strong>Snapshot semantics:</strong> a ring is built wholesale from one {@link HostSnapshot}
 * and never changes afterwards. {@link ClusterMetadata} swaps the reference atomically when the
 * registry version moves, so readers see either the previous or the next ring, never a mix.
 *
 * <p>Replica lists are computed lazily per {@link ReplicationStrategy} and cached for the lifetime
 * of the ring instance. Strategies are records, so equal keyspace settings share one cache entry.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class TokenRing {

  private static final TokenRing EMPTY =
      new TokenRing(null, -1L, new Token[0], new HostInfo[0], 0, Map.of(), Map.of());

  @Getter Partitioner partitioner;
  @Getter long registryVersion;
  Token[] tokens;
  HostInfo[] owners;
  int hostCount;
  Map<String, Integer> hostsPerDc;
  Map<String, Integer> racksPerDc;
  Map<ReplicationStrategy, List<HostInfo>[]> replicaCache = new ConcurrentHashMap<>();

  private TokenRing(
      final Partitioner partitioner,
      final long registryVersion,
      final Token[] tokens,
      final HostInfo[] owners,
      final int hostCount,
      final Map<String, Integer> hostsPerDc,
      final Map<String, Integer> racksPerDc) {
    this.partitioner = partitioner;
    this.registryVersion = registryVersion;
    this.tokens = tokens;
    this.owners = owners;
    this.hostCount = hostCount;
    this.hostsPerDc = hostsPerDc;
    this.racksPerDc = racksPerDc;
  }

  public static TokenRing empty() {
    return EMPTY;
  }

  /**
   * Builds a ring from every host of the snapshot, regardless of status or host filter. Replica
   * placement is a property of the cluster, not of what this client is allowed to talk to.
   *
   * <p>Unparseable token strings are skipped with a warning. When two hosts claim the same token
   * the one seen later wins.
   *
   * @param partitioner partitioner of the cluster
   * @param snapshot registry snapshot
   * @return new ring stamped with {@code snapshot.version()}
   */
  public static TokenRing build(final Partitioner partitioner, final HostSnapshot snapshot) {
    final Map<Token, HostInfo> byToken = new HashMap<>();
    final Map<String, Integer> hostsPerDc = new HashMap<>();
    final Map<String, Set<String>> racks = new HashMap<>();
    int hosts = 0;
    for (final var host : snapshot.all()) {
      boolean owns = false;
      for (final var raw : host.getTokens()) {
        try {
          byToken.put(partitioner.parse(raw), host);
          owns = true;
        } catch (final IllegalArgumentException e) {
          log.warn("Ignoring unparseable token '{}' of {}", raw, host);
        }
      }
      if (owns) {
        hosts++;
        final var dc = String.valueOf(host.getDatacenter());
        hostsPerDc.merge(dc, 1, Integer::sum);
        if (host.getRack() != null) {
          racks.computeIfAbsent(dc, k -> new HashSet<>()).add(host.getRack());
        }
      }
    }

    final var sorted = new ArrayList<>(byToken.keySet());
    sorted.sort(null);
    final var tokenArray = sorted.toArray(new Token[0]);
    final var ownerArray = new HostInfo[tokenArray.length];
    for (int i = 0; i < tokenArray.length; i++) {
      ownerArray[i] = byToken.get(tokenArray[i]);
    }

    final Map<String, Integer> racksPerDc = new HashMap<>();
    racks.forEach((dc, set) -> racksPerDc.put(dc, set.size()));

    if (log.isDebugEnabled()) {
      log.debug(
          "Built token ring: {} tokens, {} hosts, registry version {}",
          tokenArray.length,
          hosts,
          snapshot.version());
    }
    return new TokenRing(
        partitioner, snapshot.version(), tokenArray, ownerArray, hosts, hostsPerDc, racksPerDc);
  }

  public int size() {
    return tokens.length;
  }

  public boolean isEmpty() {
    return tokens.length == 0;
  }

  /** Number of distinct hosts owning at least one token. */
  public int hostCount() {
    return hostCount;
  }

  public int hostsInDatacenter(final String datacenter) {
    return hostsPerDc.getOrDefault(datacenter, 0);
  }

  public int racksInDatacenter(final String datacenter) {
    return racksPerDc.getOrDefault(datacenter, 0);
  }

  public Token tokenAt(final int index) {
    return tokens[Math.floorMod(index, tokens.length)];
  }

  /**
   * Owner of the ring position {@code index}, wrapping modulo the ring size.
   *
   * @param index any int; negative values and values past the end wrap
   * @return owning host
   */
  public HostInfo ownerAt(final int index) {
    return owners[Math.floorMod(index, owners.length)];
  }

  /**
   * Index of the first ring token {@code >= token}, wrapping to 0 past the end.
   *
   * @param token token to place
   * @return ring index, -1 for an empty ring
   */
  public int indexOf(final Token token) {
    if (tokens.length == 0) {
      return -1;
    }
    final int pos = Arrays.binarySearch(tokens, token);
    if (pos >= 0) {
      return pos;
    }
    final int insertion = -pos - 1;
    return insertion == tokens.length ? 0 : insertion;
  }

  public Optional<HostInfo> primaryReplica(final Token token) {
    final int index = indexOf(token);
    return index < 0 ? Optional.empty() : Optional.of(owners[index]);
  }

  /**
   * Ordered replicas of {@code token} under {@code strategy}, primary first.
   *
   * @param token routing token
   * @param strategy keyspace replication
   * @return replicas in ring order; empty for an empty ring or {@link LocalStrategy}
   */
  public List<HostInfo> replicas(final Token token, final ReplicationStrategy strategy) {
    final int index = indexOf(token);
    if (index < 0) {
      return List.of();
    }
    final var perIndex = replicaCache.computeIfAbsent(strategy, s -> newCacheArray());
    var replicas = perIndex[index];
    if (replicas == null) {
      replicas = List.copyOf(strategy.computeReplicas(this, index));
      perIndex[index] = replicas;
    }
    return replicas;
  }

  /** Hosts owning at least one token, in ring order of their first token. */
  public List<HostInfo> hosts() {
    final var seen = new LinkedHashSet<HostInfo>();
    for (final var owner : owners) {
      seen.add(owner);
    }
    return List.copyOf(seen);
  }

  @Override
  public String toString() {
    return "TokenRing[tokens=" + tokens.length + ", hosts=" + hostCount + ", version="
        + registryVersion + "]";
  }

  // ==================== Private Methods ====================

  @SuppressWarnings("unchecked")
  private List<HostInfo>[] newCacheArray() {
    return new List[tokens.length];
  }
}
