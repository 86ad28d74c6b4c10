/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import static com.macstab.oss.ringdriver.policy.RoundRobinPolicyTest.drain;
import static com.macstab.oss.ringdriver.testutil.TestHosts.hostIn;
import static com.macstab.oss.ringdriver.testutil.TestHosts.id;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.testutil.TestHosts;

/**
 * Tests for {@link DcAwareRoundRobinPolicy}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("DcAwareRoundRobinPolicy")
class DcAwareRoundRobinPolicyTest {

  private static final List<HostInfo> HOSTS =
      List.of(
          hostIn(1, "dc1", "r1"),
          hostIn(2, "dc1", "r1"),
          hostIn(3, "dc2", "r1"),
          hostIn(4, "dc2", "r1"),
          hostIn(5, null, null));

  @Test
  @DisplayName("local hosts come first, remote hosts after")
  void newQueryPlan_LocalFirst() {
    // Arrange
    final var policy = new DcAwareRoundRobinPolicy("dc1");
    policy.init(HOSTS);

    // Act
    final var ids = drain(policy.newQueryPlan(QueryPlanContext.NONE));

    // Assert
    assertThat(ids.subList(0, 2)).containsExactlyInAnyOrder(id(1), id(2));
    assertThat(ids.subList(2, 5)).containsExactlyInAnyOrder(id(3), id(4), id(5));
  }

  @Test
  @DisplayName("local and remote hosts rotate independently")
  void newQueryPlan_BothPartsRotate() {
    // Arrange
    final var policy = new DcAwareRoundRobinPolicy("dc1");
    policy.init(HOSTS);
    final Set<UUID> localFirsts = new HashSet<>();
    final Set<UUID> remoteFirsts = new HashSet<>();

    // Act
    for (int i = 0; i < 6; i++) {
      final var ids = drain(policy.newQueryPlan(QueryPlanContext.NONE));
      localFirsts.add(ids.get(0));
      remoteFirsts.add(ids.get(2));
    }

    // Assert
    assertThat(localFirsts).hasSize(2);
    assertThat(remoteFirsts).hasSize(3);
  }

  @Test
  @DisplayName("remote hosts are excluded and ignored when disabled")
  void newQueryPlan_RemoteDisabled() {
    // Arrange
    final var policy = new DcAwareRoundRobinPolicy("dc1", false);
    policy.init(HOSTS);

    // Act
    final var ids = drain(policy.newQueryPlan(QueryPlanContext.NONE));

    // Assert
    assertThat(ids).containsExactlyInAnyOrder(id(1), id(2));
    assertThat(policy.distance(HOSTS.get(2))).isEqualTo(HostDistance.IGNORED);
  }

  @Test
  @DisplayName("distance ranks hosts by datacenter, hosts without one as remote")
  void distance_ByDatacenter() {
    // Arrange
    final var policy = new DcAwareRoundRobinPolicy("dc1");

    // Act & Assert
    assertThat(policy.distance(HOSTS.get(0))).isEqualTo(HostDistance.LOCAL);
    assertThat(policy.distance(HOSTS.get(3))).isEqualTo(HostDistance.REMOTE);
    assertThat(policy.distance(HOSTS.get(4))).isEqualTo(HostDistance.REMOTE);
  }

  @Test
  @DisplayName("a local host going down falls out of the local part")
  void onDown_LocalHostRemoved() {
    // Arrange
    final var policy = new DcAwareRoundRobinPolicy("dc1");
    policy.init(HOSTS);

    // Act
    policy.onDown(TestHosts.down(HOSTS.get(0)));
    final var ids = drain(policy.newQueryPlan(QueryPlanContext.NONE));

    // Assert
    assertThat(ids.get(0)).isEqualTo(id(2));
    assertThat(ids).hasSize(4);
  }
}
