/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.macstab.oss.ringdriver.host.HostFilter;
import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.host.HostListener;
import com.macstab.oss.ringdriver.host.HostRegistry;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.transport.TransportFactory;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the per-host pools and keeps them in line with the registry.
 *
 * <p><strong>Invariant:</strong> a pool exists for a host if and only if the host is up and
 * accepted by the host filter. Registry notifications maintain it: add/up create a pool, down and
 * remove close it, an address change replaces it.
 *
 * <p><strong>Locking:</strong> a read/write lock guards the host-to-pool map. {@link
 * #ensurePool(HostInfo)} creates under the write lock, so concurrent callers for one host agree
 * on a single pool. Pools open their connections asynchronously after the lock is released; a
 * slow node never stalls notification processing for the others.
 *
 * <p><strong>Failure feedback:</strong> a pool that loses every connection and cannot reconnect
 * reports through {@link PoolListener}; the manager marks the host down in the registry, which in
 * turn closes the pool. The downed-host reconnector brings it back.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class PoolManager implements HostListener, PoolListener {

  HostRegistry registry;
  TransportFactory factory;
  PoolConfig config;
  ReconnectionPolicy reconnectionPolicy;
  ScheduledExecutorService scheduler;
  HostFilter filter;
  DriverMetrics metrics;
  String sessionName;
  Map<UUID, HostConnectionPool> pools = new LinkedHashMap<>();
  ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

  @NonFinal boolean closed;

  public PoolManager(
      @NonNull final HostRegistry registry,
      @NonNull final TransportFactory factory,
      @NonNull final PoolConfig config,
      @NonNull final ReconnectionPolicy reconnectionPolicy,
      @NonNull final ScheduledExecutorService scheduler,
      @NonNull final HostFilter filter,
      @NonNull final DriverMetrics metrics,
      @NonNull final String sessionName) {
    this.registry = registry;
    this.factory = factory;
    this.config = config;
    this.reconnectionPolicy = reconnectionPolicy;
    this.scheduler = scheduler;
    this.filter = filter;
    this.metrics = metrics;
    this.sessionName = sessionName;
  }

  /**
   * Creates pools for every up, accepted host of the registry.
   *
   * @return completes when every created pool is ready or failed
   */
  public CompletableFuture<Void> initialize() {
    final List<CompletableFuture<Void>> readiness = new ArrayList<>();
    for (final var host : registry.snapshot().upHosts()) {
      ensurePool(host)
          .ifPresent(pool -> readiness.add(pool.readyFuture().handle((ok, error) -> null)));
    }
    return CompletableFuture.allOf(readiness.toArray(new CompletableFuture<?>[0]));
  }

  /**
   * Returns the pool of {@code host}, creating it if the host is up and accepted.
   *
   * @param host host
   * @return pool, empty if the host is down, filtered or the manager is closed
   */
  public Optional<HostConnectionPool> ensurePool(@NonNull final HostInfo host) {
    if (!host.isUp() || !filter.accept(host)) {
      return Optional.empty();
    }
    final HostConnectionPool created;
    rwLock.writeLock().lock();
    try {
      if (closed) {
        return Optional.empty();
      }
      final var existing = pools.get(host.getHostId());
      if (existing != null && !existing.isClosed()) {
        return Optional.of(existing);
      }
      created =
          new HostConnectionPool(
              host, factory, config, reconnectionPolicy, scheduler, this, metrics, sessionName);
      pools.put(host.getHostId(), created);
    } finally {
      rwLock.writeLock().unlock();
    }
    if (log.isDebugEnabled()) {
      log.debug("Opening pool for {}", host);
    }
    created.init();
    return Optional.of(created);
  }

  /**
   * Closes and evicts the pool of a host.
   *
   * @param hostId host identity
   * @return true if a pool was removed
   */
  public boolean removePool(final UUID hostId) {
    final HostConnectionPool removed;
    rwLock.writeLock().lock();
    try {
      removed = pools.remove(hostId);
    } finally {
      rwLock.writeLock().unlock();
    }
    if (removed == null) {
      return false;
    }
    removed.close();
    metrics.setOpenConnections(sessionName, removed.getHost().getConnectAddress().toString(), 0);
    return true;
  }

  public Optional<HostConnectionPool> poolFor(final UUID hostId) {
    rwLock.readLock().lock();
    try {
      return Optional.ofNullable(pools.get(hostId));
    } finally {
      rwLock.readLock().unlock();
    }
  }

  /** Immutable copy of the host-to-pool map. */
  public Map<UUID, HostConnectionPool> allPools() {
    rwLock.readLock().lock();
    try {
      return Map.copyOf(pools);
    } finally {
      rwLock.readLock().unlock();
    }
  }

  /** Closes every pool. Later {@link #ensurePool(HostInfo)} calls create nothing. */
  public CompletableFuture<Void> close() {
    final List<HostConnectionPool> toClose;
    rwLock.writeLock().lock();
    try {
      closed = true;
      toClose = new ArrayList<>(pools.values());
      pools.clear();
    } finally {
      rwLock.writeLock().unlock();
    }
    final List<CompletableFuture<Void>> closing = new ArrayList<>();
    for (final var pool : toClose) {
      closing.add(pool.close());
    }
    return CompletableFuture.allOf(closing.toArray(new CompletableFuture<?>[0]));
  }

  // ==================== HostListener ====================

  @Override
  public void onAdd(final HostInfo host) {
    ensurePool(host);
  }

  @Override
  public void onUp(final HostInfo host) {
    ensurePool(host);
  }

  @Override
  public void onDown(final HostInfo host) {
    removePool(host.getHostId());
  }

  @Override
  public void onRemove(final HostInfo host) {
    removePool(host.getHostId());
  }

  @Override
  public void onUpdate(final HostInfo previous, final HostInfo current) {
    if (!previous.getConnectAddress().equals(current.getConnectAddress())) {
      removePool(current.getHostId());
      ensurePool(current);
    }
  }

  // ==================== PoolListener ====================

  @Override
  public void onPoolDown(final HostConnectionPool pool, final Throwable cause) {
    final var hostId = pool.getHost().getHostId();
    if (poolFor(hostId).orElse(null) != pool) {
      return;
    }
    log.warn("Marking {} down: {}", pool.getHost(), cause.getMessage());
    if (!registry.markDown(hostId)) {
      removePool(hostId);
    }
  }

  @Override
  public void onConnectionCountChanged(final HostConnectionPool pool, final int open) {
    if (log.isTraceEnabled()) {
      log.trace("{} open connections: {}", pool.getHost(), open);
    }
  }
}
