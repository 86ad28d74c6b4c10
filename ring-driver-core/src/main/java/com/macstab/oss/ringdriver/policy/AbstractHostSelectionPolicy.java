/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.macstab.oss.ringdriver.host.HostInfo;

import lombok.experimental.FieldDefaults;

/**
 * Base class keeping a copy-on-write list of the up hosts, in discovery order.
 *
 * <p>Mutations (the {@link com.macstab.oss.ringdriver.host.HostListener} callbacks) are
 * serialized on {@code this} and publish a fresh immutable list through a volatile field. Query
 * plans read that field once and iterate their own snapshot, so a plan is never disturbed by a
 * concurrent topology change. {@link #onHostsChanged(List)} lets subclasses rebuild further
 * derived views (per-datacenter lists) under the same lock.
 */
@FieldDefaults(level = PRIVATE)
public abstract class AbstractHostSelectionPolicy implements HostSelectionPolicy {

  volatile List<HostInfo> upHosts = List.of();

  @Override
  public synchronized void init(final Collection<HostInfo> hosts) {
    final List<HostInfo> up = new ArrayList<>();
    for (final var host : hosts) {
      if (host.isUp() && accepts(host)) {
        up.add(host);
      }
    }
    publish(up);
  }

  @Override
  public void onAdd(final HostInfo host) {
    if (host.isUp()) {
      onUp(host);
    }
  }

  @Override
  public synchronized void onUp(final HostInfo host) {
    if (!accepts(host)) {
      return;
    }
    final var updated = new ArrayList<>(upHosts);
    final int index = indexOf(updated, host.getHostId());
    if (index >= 0) {
      updated.set(index, host);
    } else {
      updated.add(host);
    }
    publish(updated);
  }

  @Override
  public synchronized void onDown(final HostInfo host) {
    final var updated = new ArrayList<>(upHosts);
    final int index = indexOf(updated, host.getHostId());
    if (index >= 0) {
      updated.remove(index);
      publish(updated);
    }
  }

  @Override
  public void onRemove(final HostInfo host) {
    onDown(host);
  }

  @Override
  public synchronized void onUpdate(final HostInfo previous, final HostInfo current) {
    final var updated = new ArrayList<>(upHosts);
    final int index = indexOf(updated, current.getHostId());
    if (index >= 0) {
      updated.set(index, current);
      publish(updated);
    } else if (current.isUp() && accepts(current)) {
      updated.add(current);
      publish(updated);
    }
  }

  /** Up hosts at the time of the call; immutable. */
  protected List<HostInfo> upHosts() {
    return upHosts;
  }

  /** Whether the subclass tracks {@code host} at all. Defaults to every host. */
  protected boolean accepts(final HostInfo host) {
    return true;
  }

  /** Called under the mutation lock after the up host list changed. */
  protected void onHostsChanged(final List<HostInfo> hosts) {}

  // ==================== Private Methods ====================

  private void publish(final List<HostInfo> hosts) {
    final var immutable = List.copyOf(hosts);
    upHosts = immutable;
    onHostsChanged(immutable);
  }

  private static int indexOf(final List<HostInfo> hosts, final UUID hostId) {
    for (int i = 0; i < hosts.size(); i++) {
      if (hosts.get(i).getHostId().equals(hostId)) {
        return i;
      }
    }
    return -1;
  }
}
