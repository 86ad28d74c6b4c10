/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.util.List;

import com.macstab.oss.ringdriver.host.HostInfo;

/** Node-local system keyspaces: every node owns its own copy, no token routing applies. */
public record LocalStrategy() implements ReplicationStrategy {

  public static final LocalStrategy INSTANCE = new LocalStrategy();

  @Override
  public List<HostInfo> computeReplicas(final TokenRing ring, final int index) {
    return List.of();
  }
}
