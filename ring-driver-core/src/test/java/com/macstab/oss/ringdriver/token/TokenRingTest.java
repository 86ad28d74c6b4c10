/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import static com.macstab.oss.ringdriver.testutil.TestHosts.host;
import static com.macstab.oss.ringdriver.testutil.TestHosts.hostIn;
import static com.macstab.oss.ringdriver.testutil.TestHosts.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.host.HostRegistry;

/**
 * Tests for {@link TokenRing} and the replication strategies placing replicas on it.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Small hand-built rings with known token ownership
 *   <li>Wrap-around at the end of the ring
 *   <li>Rack-aware placement for {@link NetworkTopologyStrategy}
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("TokenRing")
class TokenRingTest {

  private static TokenRing ring(final HostInfo... hosts) {
    final var registry = new HostRegistry();
    for (final var host : hosts) {
      registry.addOrUpdate(host);
    }
    return TokenRing.build(Partitioners.MURMUR3, registry.snapshot());
  }

  private static Token token(final long value) {
    return new Murmur3Token(value);
  }

  @Nested
  @DisplayName("Ownership Lookup")
  class OwnershipLookup {

    private final TokenRing ring = ring(host(1, "-100"), host(2, "0"), host(3, "100"));

    @Test
    @DisplayName("a token belongs to the first ring token greater or equal to it")
    void primaryReplica_LowerBound() {
      // Act & Assert
      assertThat(ring.primaryReplica(token(50)).orElseThrow().getHostId()).isEqualTo(id(3));
      assertThat(ring.primaryReplica(token(0)).orElseThrow().getHostId()).isEqualTo(id(2));
      assertThat(ring.primaryReplica(token(-500)).orElseThrow().getHostId()).isEqualTo(id(1));
    }

    @Test
    @DisplayName("tokens past the last ring token wrap to the first owner")
    void primaryReplica_WrapsAround() {
      // Act & Assert
      assertThat(ring.indexOf(token(101))).isZero();
      assertThat(ring.primaryReplica(token(Long.MAX_VALUE)).orElseThrow().getHostId())
          .isEqualTo(id(1));
    }

    @Test
    @DisplayName("empty ring has no owner")
    void emptyRing_NoOwner() {
      // Act & Assert
      assertThat(TokenRing.empty().indexOf(token(1))).isEqualTo(-1);
      assertThat(TokenRing.empty().primaryReplica(token(1))).isEmpty();
      assertThat(TokenRing.empty().replicas(token(1), new SimpleStrategy(3))).isEmpty();
    }

    @Test
    @DisplayName("unparseable tokens are skipped")
    void build_SkipsGarbageTokens() {
      // Act
      final var withGarbage = ring(host(1, "10", "not-a-token"), host(2, "20"));

      // Assert
      assertThat(withGarbage.size()).isEqualTo(2);
      assertThat(withGarbage.hostCount()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("SimpleStrategy")
  class Simple {

    @Test
    @DisplayName("takes the next distinct hosts clockwise")
    void replicas_NextDistinctHosts() {
      // Arrange: host 1 owns two tokens
      final var ring = ring(host(1, "-100", "50"), host(2, "0"), host(3, "100"));

      // Act
      final var replicas = ring.replicas(token(-50), new SimpleStrategy(3));

      // Assert
      assertThat(replicas).extracting(HostInfo::getHostId).containsExactly(id(2), id(1), id(3));
    }

    @Test
    @DisplayName("replication factor above the host count yields every host once")
    void replicas_FactorAboveHostCount() {
      // Arrange
      final var ring = ring(host(1, "0"), host(2, "10"));

      // Act
      final var replicas = ring.replicas(token(5), new SimpleStrategy(5));

      // Assert
      assertThat(replicas).extracting(HostInfo::getHostId).containsExactly(id(2), id(1));
    }

    @Test
    @DisplayName("replica lists are cached per strategy value")
    void replicas_CachedPerStrategy() {
      // Arrange
      final var ring = ring(host(1, "0"), host(2, "10"));

      // Act
      final var first = ring.replicas(token(5), new SimpleStrategy(2));
      final var second = ring.replicas(token(5), new SimpleStrategy(2));

      // Assert
      assertThat(second).isSameAs(first);
    }
  }

  @Nested
  @DisplayName("NetworkTopologyStrategy")
  class NetworkTopology {

    @Test
    @DisplayName("prefers hosts on racks not yet holding a replica")
    void replicas_RackAware() {
      // Arrange: hosts 1 and 2 share rack r1
      final var ring =
          ring(
              hostIn(1, "dc1", "r1", "0"),
              hostIn(2, "dc1", "r1", "10"),
              hostIn(3, "dc1", "r2", "20"));

      // Act
      final var replicas =
          ring.replicas(token(-5), new NetworkTopologyStrategy(Map.of("dc1", 2)));

      // Assert
      assertThat(replicas).extracting(HostInfo::getHostId).containsExactly(id(1), id(3));
    }

    @Test
    @DisplayName("places replicas per datacenter")
    void replicas_PerDatacenter() {
      // Arrange
      final var ring =
          ring(
              hostIn(1, "dc1", "r1", "0"),
              hostIn(4, "dc2", "r1", "5"),
              hostIn(2, "dc1", "r1", "10"),
              hostIn(3, "dc1", "r2", "20"));

      // Act
      final var replicas =
          ring.replicas(token(-5), new NetworkTopologyStrategy(Map.of("dc1", 2, "dc2", 1)));

      // Assert
      assertThat(replicas)
          .extracting(HostInfo::getHostId)
          .containsExactly(id(1), id(4), id(3));
    }

    @Test
    @DisplayName("parked hosts fill the factor once every rack holds a replica")
    void replicas_ParkedHostsUsedAfterAllRacks() {
      // Arrange
      final var ring =
          ring(
              hostIn(1, "dc1", "r1", "0"),
              hostIn(2, "dc1", "r1", "10"),
              hostIn(3, "dc1", "r2", "20"));

      // Act
      final var replicas =
          ring.replicas(token(-5), new NetworkTopologyStrategy(Map.of("dc1", 3)));

      // Assert
      assertThat(replicas).extracting(HostInfo::getHostId).containsExactly(id(1), id(3), id(2));
    }

    @Test
    @DisplayName("datacenters without hosts are ignored")
    void replicas_UnknownDatacenter() {
      // Arrange
      final var ring = ring(hostIn(1, "dc1", "r1", "0"), hostIn(2, "dc1", "r1", "10"));

      // Act
      final var replicas =
          ring.replicas(token(5), new NetworkTopologyStrategy(Map.of("dc1", 1, "dcX", 3)));

      // Assert
      assertThat(replicas).extracting(HostInfo::getHostId).containsExactly(id(2));
    }
  }

  @Nested
  @DisplayName("Replication Options")
  class ReplicationOptions {

    @Test
    @DisplayName("parses SimpleStrategy with its factor")
    void fromOptions_Simple() {
      // Act
      final var strategy =
          ReplicationStrategy.fromOptions(
              Map.of(
                  "class", "org.apache.cassandra.locator.SimpleStrategy",
                  "replication_factor", "3"));

      // Assert
      assertThat(strategy).isEqualTo(new SimpleStrategy(3));
    }

    @Test
    @DisplayName("parses per-datacenter factors and keeps only full replicas")
    void fromOptions_NetworkTopologyWithTransientReplicas() {
      // Act
      final var strategy =
          ReplicationStrategy.fromOptions(
              Map.of("class", "NetworkTopologyStrategy", "dc1", "3/1", "dc2", "2"));

      // Assert
      assertThat(strategy).isEqualTo(new NetworkTopologyStrategy(Map.of("dc1", 3, "dc2", 2)));
    }

    @Test
    @DisplayName("local strategy has no replicas on the ring")
    void fromOptions_Local() {
      // Arrange
      final var ring = ring(host(1, "0"));

      // Act
      final var strategy =
          ReplicationStrategy.fromOptions(
              Map.of("class", "org.apache.cassandra.locator.LocalStrategy"));

      // Assert
      assertThat(strategy).isSameAs(LocalStrategy.INSTANCE);
      assertThat(ring.replicas(token(1), strategy)).isEmpty();
    }

    @Test
    @DisplayName("rejects malformed factors")
    void fromOptions_MalformedFactor() {
      // Act & Assert
      assertThatThrownBy(
              () ->
                  ReplicationStrategy.fromOptions(
                      Map.of("class", "SimpleStrategy", "replication_factor", "three")))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
