/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.ringdriver.host.HostInfo;

import lombok.Getter;
import lombok.NonNull;

/**
 * Round-robin over the local datacenter, with remote hosts as overflow.
 *
 * <p><strong>Plan order:</strong> all up hosts of {@code localDc} (rotated), then, unless remote
 * hosts are disabled, all up remote hosts (rotated by an independent cursor so one remote host
 * does not absorb every failover).
 *
 * <p>Hosts that report no datacenter count as remote.
 */
public class DcAwareRoundRobinPolicy extends AbstractHostSelectionPolicy {

  @Getter private final String localDc;
  private final boolean includeRemote;
  private final AtomicInteger localCounter = new AtomicInteger();
  private final AtomicInteger remoteCounter = new AtomicInteger();
  private volatile List<HostInfo> localHosts = List.of();
  private volatile List<HostInfo> remoteHosts = List.of();

  public DcAwareRoundRobinPolicy(@NonNull final String localDc) {
    this(localDc, true);
  }

  /**
   * @param localDc datacenter to prefer
   * @param includeRemote whether remote hosts follow the local ones in a plan
   */
  public DcAwareRoundRobinPolicy(@NonNull final String localDc, final boolean includeRemote) {
    this.localDc = localDc;
    this.includeRemote = includeRemote;
  }

  @Override
  public Iterator<HostInfo> newQueryPlan(final QueryPlanContext context) {
    final var local = localHosts;
    final var remote = includeRemote ? remoteHosts : List.<HostInfo>of();
    final var first = new RotatingIterator<>(local, next(localCounter, local.size()));
    final var second = new RotatingIterator<>(remote, next(remoteCounter, remote.size()));
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return first.hasNext() || second.hasNext();
      }

      @Override
      public HostInfo next() {
        if (first.hasNext()) {
          return first.next();
        }
        if (second.hasNext()) {
          return second.next();
        }
        throw new NoSuchElementException();
      }
    };
  }

  @Override
  public HostDistance distance(final HostInfo host) {
    if (localDc.equals(host.getDatacenter())) {
      return HostDistance.LOCAL;
    }
    return includeRemote ? HostDistance.REMOTE : HostDistance.IGNORED;
  }

  @Override
  public String getName() {
    return "dc-aware-round-robin";
  }

  @Override
  protected void onHostsChanged(final List<HostInfo> hosts) {
    final List<HostInfo> local = new ArrayList<>();
    final List<HostInfo> remote = new ArrayList<>();
    for (final var host : hosts) {
      if (localDc.equals(host.getDatacenter())) {
        local.add(host);
      } else {
        remote.add(host);
      }
    }
    localHosts = List.copyOf(local);
    remoteHosts = List.copyOf(remote);
  }

  private static int next(final AtomicInteger counter, final int size) {
    return size == 0 ? 0 : (counter.getAndIncrement() & Integer.MAX_VALUE) % size;
  }
}
