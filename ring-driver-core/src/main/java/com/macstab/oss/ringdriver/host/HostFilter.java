/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.host;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.HashSet;
import java.util.Set;

/**
 * Predicate deciding whether the driver may talk to a host at all.
 *
 * <p>Applied uniformly to control connection target selection, pool creation and every host
 * selection policy (via {@code FilteringPolicy}). Rejected hosts stay in the registry and the token
 * ring so replica calculation remains correct, but never receive a connection.
 */
@FunctionalInterface
public interface HostFilter {

  boolean accept(HostInfo host);

  static HostFilter acceptAll() {
    return host -> true;
  }

  /**
   * Accepts only hosts whose connect address resolves to one of {@code hosts}.
   *
   * @param hosts host names or literal IPs
   * @return filter
   * @throws IllegalArgumentException if a name cannot be resolved
   */
  static HostFilter whiteList(final String... hosts) {
    final Set<InetAddress> allowed = new HashSet<>();
    for (final var h : hosts) {
      try {
        for (final var addr : InetAddress.getAllByName(h)) {
          allowed.add(addr);
        }
      } catch (final UnknownHostException e) {
        throw new IllegalArgumentException("Cannot resolve white-listed host: " + h, e);
      }
    }
    return host -> allowed.contains(host.getConnectAddress().getAddress());
  }

  /**
   * Accepts only hosts of one datacenter.
   *
   * @param datacenter datacenter name as reported by the node
   * @return filter
   */
  static HostFilter dataCenter(final String datacenter) {
    return host -> datacenter.equals(host.getDatacenter());
  }

  default HostFilter and(final HostFilter other) {
    return host -> accept(host) && other.accept(host);
  }
}
