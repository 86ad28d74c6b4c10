/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.session;

import lombok.NonNull;

/** Factory of sessions. */
public final class RingDriver {

  private RingDriver() {}

  /**
   * Connects to a cluster.
   *
   * @param config session configuration
   * @return ready session
   * @throws com.macstab.oss.ringdriver.error.NoHostAvailableException if no contact point or node
   *     is reachable
   */
  public static Session connect(@NonNull final SessionConfig config) {
    return ClusterSession.create(config);
  }
}
