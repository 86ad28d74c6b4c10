/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import static lombok.AccessLevel.PRIVATE;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.host.HostListener;
import com.macstab.oss.ringdriver.host.HostRegistry;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Session-scoped derived metadata: the current {@link TokenRing} and keyspace replication.
 *
 * <p>Subscribed to the {@link HostRegistry} before any policy, so a token-aware policy notified of
 * a change already sees the ring rebuilt for it. The ring reference is replaced atomically; a
 * reader holding the old ring keeps a consistent view.
 *
 * <p>Status-only changes bump the registry version without touching token ownership. {@link
 * #ring()} notices the version drift and rebuilds on the next read.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ClusterMetadata implements HostListener {

  HostRegistry registry;
  AtomicReference<TokenRing> ring = new AtomicReference<>(TokenRing.empty());
  AtomicReference<Partitioner> partitioner = new AtomicReference<>();
  Map<String, KeyspaceMetadata> keyspaces = new ConcurrentHashMap<>();
  Object rebuildLock = new Object();

  public ClusterMetadata(@NonNull final HostRegistry registry) {
    this.registry = registry;
  }

  /**
   * Sets the partitioner reported by the cluster and rebuilds the ring.
   *
   * @param newPartitioner cluster partitioner
   */
  public void setPartitioner(@NonNull final Partitioner newPartitioner) {
    final var previous = partitioner.getAndSet(newPartitioner);
    if (previous != newPartitioner) {
      log.info("Cluster partitioner: {}", newPartitioner.name());
      rebuild();
    }
  }

  public Optional<Partitioner> partitioner() {
    return Optional.ofNullable(partitioner.get());
  }

  /**
   * Current ring, rebuilt first if the registry moved since it was built.
   *
   * @return ring; {@link TokenRing#empty()} until a partitioner is known
   */
  public TokenRing ring() {
    final var current = ring.get();
    if (partitioner.get() != null && current.getRegistryVersion() != registry.version()) {
      return rebuild();
    }
    return current;
  }

  /**
   * Replaces the keyspace table with the latest schema query result.
   *
   * @param latest keyspaces by name
   */
  public void replaceKeyspaces(final Map<String, KeyspaceMetadata> latest) {
    keyspaces.keySet().retainAll(latest.keySet());
    keyspaces.putAll(latest);
  }

  public void putKeyspace(@NonNull final KeyspaceMetadata keyspace) {
    keyspaces.put(keyspace.name(), keyspace);
  }

  public void removeKeyspace(final String name) {
    keyspaces.remove(name);
  }

  public Optional<KeyspaceMetadata> keyspace(final String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(keyspaces.get(name));
  }

  /**
   * Hashes a routing key with the cluster partitioner.
   *
   * @param routingKey serialized partition key
   * @return token, empty while the partitioner is unknown
   */
  public Optional<Token> newToken(final ByteBuffer routingKey) {
    final var p = partitioner.get();
    return p == null ? Optional.empty() : Optional.of(p.hash(routingKey));
  }

  /**
   * Replicas of {@code token} in {@code keyspace}. Unknown keyspaces fall back to the primary
   * owner only.
   *
   * @param keyspace keyspace name, may be null
   * @param token routing token
   * @return replicas in ring order
   */
  public List<HostInfo> replicas(final String keyspace, final Token token) {
    final var current = ring();
    final var strategy =
        keyspace(keyspace).map(KeyspaceMetadata::replication).orElse(new SimpleStrategy(1));
    return current.replicas(token, strategy);
  }

  @Override
  public void onAdd(final HostInfo host) {
    rebuild();
  }

  @Override
  public void onRemove(final HostInfo host) {
    rebuild();
  }

  @Override
  public void onUpdate(final HostInfo previous, final HostInfo current) {
    rebuild();
  }

  // ==================== Private Methods ====================

  private TokenRing rebuild() {
    final var p = partitioner.get();
    if (p == null) {
      return ring.get();
    }
    synchronized (rebuildLock) {
      final var snapshot = registry.snapshot();
      final var current = ring.get();
      if (current.getPartitioner() == p && current.getRegistryVersion() == snapshot.version()) {
        return current;
      }
      final var rebuilt = TokenRing.build(p, snapshot);
      ring.set(rebuilt);
      return rebuilt;
    }
  }
}
