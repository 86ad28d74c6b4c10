/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import com.macstab.oss.ringdriver.token.ClusterMetadata;

/**
 * Creates the host selection policy of a session. Token-aware policies need the session's {@link
 * ClusterMetadata}, which only exists once the session is being built.
 */
@FunctionalInterface
public interface HostSelectionPolicyFactory {

  HostSelectionPolicy create(ClusterMetadata metadata);

  /**
   * Token-aware routing over round-robin, or over DC-aware round-robin when a local datacenter is
   * given.
   *
   * @param localDatacenter local datacenter, null for none
   * @return factory
   */
  static HostSelectionPolicyFactory defaultPolicy(final String localDatacenter) {
    return metadata ->
        new TokenAwarePolicy(
            metadata,
            localDatacenter == null
                ? new RoundRobinPolicy()
                : new DcAwareRoundRobinPolicy(localDatacenter));
  }
}
