/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

import static com.macstab.oss.ringdriver.policy.RoundRobinPolicyTest.drain;
import static com.macstab.oss.ringdriver.testutil.TestHosts.hostIn;
import static com.macstab.oss.ringdriver.testutil.TestHosts.id;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.ringdriver.host.HostFilter;

/**
 * Tests for {@link FilteringPolicy}: rejected hosts never appear in plans and are ranked ignored.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("FilteringPolicy")
class FilteringPolicyTest {

  private FilteringPolicy policy;

  @BeforeEach
  void setUp() {
    policy = new FilteringPolicy(new RoundRobinPolicy(), HostFilter.dataCenter("dc1"));
    policy.init(List.of(hostIn(1, "dc1", "r1"), hostIn(2, "dc2", "r1"), hostIn(3, "dc1", "r1")));
  }

  @Test
  @DisplayName("plans contain only accepted hosts")
  void newQueryPlan_OnlyAccepted() {
    // Act & Assert
    for (int i = 0; i < 3; i++) {
      assertThat(drain(policy.newQueryPlan(QueryPlanContext.NONE)))
          .containsExactlyInAnyOrder(id(1), id(3));
    }
  }

  @Test
  @DisplayName("rejected hosts are ranked ignored")
  void distance_RejectedIgnored() {
    // Act & Assert
    assertThat(policy.distance(hostIn(2, "dc2", "r1"))).isEqualTo(HostDistance.IGNORED);
    assertThat(policy.distance(hostIn(1, "dc1", "r1"))).isEqualTo(HostDistance.LOCAL);
  }

  @Test
  @DisplayName("events for rejected hosts never reach the child")
  void onAdd_RejectedHostNotForwarded() {
    // Act
    policy.onAdd(hostIn(4, "dc2", "r1"));

    // Assert
    assertThat(drain(policy.newQueryPlan(QueryPlanContext.NONE))).doesNotContain(id(4));
  }

  @Test
  @DisplayName("a host moving into an accepted datacenter joins the plans")
  void onUpdate_BecomesAccepted() {
    // Act
    policy.onUpdate(hostIn(2, "dc2", "r1"), hostIn(2, "dc1", "r1"));

    // Assert
    assertThat(drain(policy.newQueryPlan(QueryPlanContext.NONE))).contains(id(2)).hasSize(3);
  }

  @Test
  @DisplayName("a host moving out of an accepted datacenter leaves the plans")
  void onUpdate_BecomesRejected() {
    // Act
    policy.onUpdate(hostIn(1, "dc1", "r1"), hostIn(1, "dc3", "r1"));

    // Assert
    assertThat(drain(policy.newQueryPlan(QueryPlanContext.NONE))).containsExactly(id(3));
    assertThat(policy.getName()).isEqualTo("filtering(round-robin)");
  }
}
