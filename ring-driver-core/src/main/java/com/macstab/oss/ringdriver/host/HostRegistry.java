/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.host;

import static lombok.AccessLevel.PRIVATE;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Authoritative in-memory map of known nodes.
 *
 * <p><strong>Locking:</strong>
 *
 * <ul>
 *   <li>{@code rwLock} guards the map. Readers ({@link #snapshot()}, {@link #get(UUID)}) take the
 *       read lock only for the copy; no network call ever happens under it.
 *   <li>{@code mutationLock} serializes mutation + notification. Subscribers therefore observe
 *       mutations in exactly the order they were applied, while readers are never blocked by a
 *       slow subscriber (the write lock is released before notifying).
 * </ul>
 *
 * <p><strong>Versioning:</strong> every effective mutation increments {@link #version()}.
 * Derived structures (token ring, policy views) record the version they were built from and
 * rebuild when it moves. No-op updates (same metadata, same status) do not bump the version.
 *
 * <p>Created at session start, torn down at session close; passed by reference to every component
 * that needs it.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class HostRegistry {

  Map<UUID, HostInfo> hosts = new LinkedHashMap<>();
  ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
  ReentrantLock mutationLock = new ReentrantLock();
  AtomicLong version = new AtomicLong();
  CopyOnWriteArrayList<HostListener> listeners = new CopyOnWriteArrayList<>();

  /**
   * Registers a subscriber. Subscribers are notified in registration order.
   *
   * @param listener non-blocking subscriber
   */
  public void subscribe(@NonNull final HostListener listener) {
    listeners.addIfAbsent(listener);
  }

  public void unsubscribe(final HostListener listener) {
    listeners.remove(listener);
  }

  public long version() {
    return version.get();
  }

  /**
   * Inserts a new host or replaces the known version of it.
   *
   * <p>Notifications: {@code onAdd} for unknown ids; for known ids {@code onUpdate} when metadata
   * changed, then {@code onUp}/{@code onDown} when the status changed.
   *
   * @param host new version of the host
   * @return previous version, empty if the host was unknown
   */
  public Optional<HostInfo> addOrUpdate(@NonNull final HostInfo host) {
    mutationLock.lock();
    try {
      final HostInfo previous;
      rwLock.writeLock().lock();
      try {
        previous = hosts.get(host.getHostId());
        if (host.equals(previous)) {
          return Optional.of(previous);
        }
        hosts.put(host.getHostId(), host);
        version.incrementAndGet();
      } finally {
        rwLock.writeLock().unlock();
      }

      if (previous == null) {
        log.info("Host added: {}", host);
        notifyListeners(l -> l.onAdd(host));
      } else {
        if (!previous.sameMetadata(host)) {
          notifyListeners(l -> l.onUpdate(previous, host));
        }
        notifyStatusChange(previous, host);
      }
      return Optional.ofNullable(previous);
    } finally {
      mutationLock.unlock();
    }
  }

  /**
   * Marks a known host up.
   *
   * @param hostId host identity
   * @return true if the status changed
   */
  public boolean markUp(final UUID hostId) {
    return setStatus(hostId, HostStatus.UP);
  }

  /**
   * Marks a known host down.
   *
   * @param hostId host identity
   * @return true if the status changed
   */
  public boolean markDown(final UUID hostId) {
    return setStatus(hostId, HostStatus.DOWN);
  }

  /**
   * Removes a host permanently (decommission).
   *
   * @param hostId host identity
   * @return removed host, empty if unknown
   */
  public Optional<HostInfo> remove(final UUID hostId) {
    mutationLock.lock();
    try {
      final HostInfo removed;
      rwLock.writeLock().lock();
      try {
        removed = hosts.remove(hostId);
        if (removed == null) {
          return Optional.empty();
        }
        version.incrementAndGet();
      } finally {
        rwLock.writeLock().unlock();
      }
      log.info("Host removed: {}", removed);
      notifyListeners(l -> l.onRemove(removed));
      return Optional.of(removed);
    } finally {
      mutationLock.unlock();
    }
  }

  /**
   * Removes every host whose id is not in {@code keep}. Used by full topology refreshes to prune
   * nodes that vanished without a REMOVED_NODE event.
   *
   * @param keep ids reported by the latest metadata query
   * @return removed hosts
   */
  public List<HostInfo> retainOnly(final Set<UUID> keep) {
    final List<UUID> stale = new ArrayList<>();
    rwLock.readLock().lock();
    try {
      for (final var id : hosts.keySet()) {
        if (!keep.contains(id)) {
          stale.add(id);
        }
      }
    } finally {
      rwLock.readLock().unlock();
    }
    final List<HostInfo> removed = new ArrayList<>(stale.size());
    for (final var id : stale) {
      remove(id).ifPresent(removed::add);
    }
    return removed;
  }

  public Optional<HostInfo> get(final UUID hostId) {
    rwLock.readLock().lock();
    try {
      return Optional.ofNullable(hosts.get(hostId));
    } finally {
      rwLock.readLock().unlock();
    }
  }

  /**
   * Finds a host by the address it is connected to (port included).
   *
   * @param address connect address
   * @return host, empty if unknown
   */
  public Optional<HostInfo> findByConnectAddress(final InetSocketAddress address) {
    rwLock.readLock().lock();
    try {
      for (final var h : hosts.values()) {
        if (h.getConnectAddress().equals(address)) {
          return Optional.of(h);
        }
      }
      return Optional.empty();
    } finally {
      rwLock.readLock().unlock();
    }
  }

  /**
   * Finds a host by IP, matching either the connect or the broadcast address. Push events carry
   * only an address, never a host id.
   *
   * @param address node address from an event
   * @return host, empty if unknown
   */
  public Optional<HostInfo> findByAddress(final InetAddress address) {
    rwLock.readLock().lock();
    try {
      for (final var h : hosts.values()) {
        if (h.getConnectAddress().getAddress().equals(address)
            || address.equals(h.getBroadcastAddress())) {
          return Optional.of(h);
        }
      }
      return Optional.empty();
    } finally {
      rwLock.readLock().unlock();
    }
  }

  /**
   * Returns an immutable, version-stamped copy of the registry.
   *
   * @return snapshot; never observes a half-applied mutation
   */
  public HostSnapshot snapshot() {
    rwLock.readLock().lock();
    try {
      return new HostSnapshot(version.get(), hosts);
    } finally {
      rwLock.readLock().unlock();
    }
  }

  public int size() {
    rwLock.readLock().lock();
    try {
      return hosts.size();
    } finally {
      rwLock.readLock().unlock();
    }
  }

  /** Drops all hosts and subscribers without notifying. Used on session close. */
  public void clear() {
    mutationLock.lock();
    try {
      rwLock.writeLock().lock();
      try {
        hosts.clear();
        version.incrementAndGet();
      } finally {
        rwLock.writeLock().unlock();
      }
      listeners.clear();
    } finally {
      mutationLock.unlock();
    }
  }

  // ==================== Private Methods ====================

  private boolean setStatus(final UUID hostId, final HostStatus status) {
    mutationLock.lock();
    try {
      final HostInfo previous;
      final HostInfo updated;
      rwLock.writeLock().lock();
      try {
        previous = hosts.get(hostId);
        if (previous == null || previous.getStatus() == status) {
          return false;
        }
        updated = previous.withStatus(status);
        hosts.put(hostId, updated);
        version.incrementAndGet();
      } finally {
        rwLock.writeLock().unlock();
      }
      notifyStatusChange(previous, updated);
      return true;
    } finally {
      mutationLock.unlock();
    }
  }

  private void notifyStatusChange(final HostInfo previous, final HostInfo current) {
    if (previous.getStatus() == current.getStatus()) {
      return;
    }
    if (current.isUp()) {
      log.info("Host up: {}", current);
      notifyListeners(l -> l.onUp(current));
    } else {
      log.info("Host down: {}", current);
      notifyListeners(l -> l.onDown(current));
    }
  }

  private void notifyListeners(final Consumer<HostListener> event) {
    for (final var listener : listeners) {
      try {
        event.accept(listener);
      } catch (final RuntimeException e) {
        log.error("Host listener {} failed", listener, e);
      }
    }
  }
}
