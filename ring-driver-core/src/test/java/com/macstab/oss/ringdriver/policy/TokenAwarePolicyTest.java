/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import static com.macstab.oss.ringdriver.policy.RoundRobinPolicyTest.drain;
import static com.macstab.oss.ringdriver.testutil.TestHosts.hostIn;
import static com.macstab.oss.ringdriver.testutil.TestHosts.id;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.ringdriver.host.HostRegistry;
import com.macstab.oss.ringdriver.token.ClusterMetadata;
import com.macstab.oss.ringdriver.token.KeyspaceMetadata;
import com.macstab.oss.ringdriver.token.Murmur3Token;
import com.macstab.oss.ringdriver.token.Partitioners;
import com.macstab.oss.ringdriver.token.SimpleStrategy;

/**
 * Tests for {@link TokenAwarePolicy}.
 *
 * <p>Ring: host 1 owns token 0, host 2 owns 100, host 3 owns 200, host 4 owns 300. Keyspace
 * {@code ks} replicates twice, so token 150 lives on hosts 3 and 4.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("TokenAwarePolicy")
class TokenAwarePolicyTest {

  private static final QueryPlanContext ROUTED = new QueryPlanContext("ks", new Murmur3Token(150));

  private HostRegistry registry;
  private ClusterMetadata metadata;

  @BeforeEach
  void setUp() {
    registry = new HostRegistry();
    metadata = new ClusterMetadata(registry);
    registry.subscribe(metadata);
    metadata.setPartitioner(Partitioners.MURMUR3);
    registry.addOrUpdate(hostIn(1, "dc1", "r1", "0"));
    registry.addOrUpdate(hostIn(2, "dc1", "r1", "100"));
    registry.addOrUpdate(hostIn(3, "dc2", "r1", "200"));
    registry.addOrUpdate(hostIn(4, "dc2", "r1", "300"));
    metadata.putKeyspace(new KeyspaceMetadata("ks", new SimpleStrategy(2)));
  }

  private TokenAwarePolicy policy(final HostSelectionPolicy child) {
    final var policy = new TokenAwarePolicy(metadata, child);
    policy.init(registry.snapshot().all());
    registry.subscribe(policy);
    return policy;
  }

  @Test
  @DisplayName("plan starts with the replicas of the routing token in ring order")
  void newQueryPlan_ReplicasFirst() {
    // Arrange
    final var policy = policy(new RoundRobinPolicy());

    // Act
    final var ids = drain(policy.newQueryPlan(ROUTED));

    // Assert
    assertThat(ids).hasSize(4).doesNotHaveDuplicates();
    assertThat(ids.subList(0, 2)).containsExactly(id(3), id(4));
  }

  @Test
  @DisplayName("down replicas are not tried first")
  void newQueryPlan_DownReplicaSkipped() {
    // Arrange
    final var policy = policy(new RoundRobinPolicy());

    // Act
    registry.markDown(id(3));
    final var ids = drain(policy.newQueryPlan(ROUTED));

    // Assert
    assertThat(ids.get(0)).isEqualTo(id(4));
    assertThat(ids).doesNotContain(id(3)).hasSize(3);
  }

  @Test
  @DisplayName("without a routing token the child plan is used unchanged")
  void newQueryPlan_NoToken_ChildPlan() {
    // Arrange
    final var policy = policy(new RoundRobinPolicy());

    // Act
    final var ids = drain(policy.newQueryPlan(new QueryPlanContext("ks", null)));

    // Assert
    assertThat(ids).containsExactlyInAnyOrder(id(1), id(2), id(3), id(4));
  }

  @Test
  @DisplayName("local replicas come before remote replicas, then the child plan")
  void newQueryPlan_LocalReplicasBeforeRemote() {
    // Arrange: token 50 lives on host 2 (dc1) and host 3 (dc2)
    final var policy = policy(new DcAwareRoundRobinPolicy("dc1"));

    // Act
    final var ids = drain(policy.newQueryPlan(new QueryPlanContext("ks", new Murmur3Token(50))));

    // Assert
    assertThat(ids).containsExactly(id(2), id(3), id(1), id(4));
  }

  @Test
  @DisplayName("replicas the child ignores are never yielded")
  void newQueryPlan_IgnoredReplicasSkipped() {
    // Arrange
    final var policy = policy(new DcAwareRoundRobinPolicy("dc1", false));

    // Act
    final var ids = drain(policy.newQueryPlan(ROUTED));

    // Assert
    assertThat(ids).containsExactlyInAnyOrder(id(1), id(2));
    assertThat(policy.getName()).isEqualTo("token-aware(dc-aware-round-robin)");
  }
}
