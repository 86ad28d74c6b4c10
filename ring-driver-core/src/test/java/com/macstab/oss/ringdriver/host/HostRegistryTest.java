/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.host;

import static com.macstab.oss.ringdriver.testutil.TestHosts.address;
import static com.macstab.oss.ringdriver.testutil.TestHosts.host;
import static com.macstab.oss.ringdriver.testutil.TestHosts.id;
import static org.assertj.core.api.Assertions.assertThat;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HostRegistry}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Notification order and content recorded by a listener
 *   <li>Version stamping of snapshots
 *   <li>Lookup by connect and broadcast address
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("HostRegistry")
class HostRegistryTest {

  private HostRegistry registry;
  private List<String> events;

  @BeforeEach
  void setUp() {
    registry = new HostRegistry();
    events = new ArrayList<>();
    registry.subscribe(
        new HostListener() {
          @Override
          public void onAdd(final HostInfo host) {
            events.add("add:" + host.getHostId().getLeastSignificantBits());
          }

          @Override
          public void onUp(final HostInfo host) {
            events.add("up:" + host.getHostId().getLeastSignificantBits());
          }

          @Override
          public void onDown(final HostInfo host) {
            events.add("down:" + host.getHostId().getLeastSignificantBits());
          }

          @Override
          public void onRemove(final HostInfo host) {
            events.add("remove:" + host.getHostId().getLeastSignificantBits());
          }

          @Override
          public void onUpdate(final HostInfo previous, final HostInfo current) {
            events.add("update:" + current.getHostId().getLeastSignificantBits());
          }
        });
  }

  @Nested
  @DisplayName("Mutations")
  class Mutations {

    @Test
    @DisplayName("adding an unknown host notifies onAdd and bumps the version")
    void addOrUpdate_UnknownHost_NotifiesAdd() {
      // Arrange
      final var before = registry.version();

      // Act
      final var previous = registry.addOrUpdate(host(1, "0"));

      // Assert
      assertThat(previous).isEmpty();
      assertThat(events).containsExactly("add:1");
      assertThat(registry.version()).isGreaterThan(before);
    }

    @Test
    @DisplayName("re-adding an identical host is a no-op")
    void addOrUpdate_SameHost_NoNotification() {
      // Arrange
      registry.addOrUpdate(host(1, "0"));
      final var version = registry.version();

      // Act
      registry.addOrUpdate(host(1, "0"));

      // Assert
      assertThat(events).containsExactly("add:1");
      assertThat(registry.version()).isEqualTo(version);
    }

    @Test
    @DisplayName("changed tokens notify onUpdate")
    void addOrUpdate_ChangedTokens_NotifiesUpdate() {
      // Arrange
      registry.addOrUpdate(host(1, "0"));

      // Act
      registry.addOrUpdate(host(1, "100"));

      // Assert
      assertThat(events).containsExactly("add:1", "update:1");
      assertThat(registry.get(id(1)).orElseThrow().getTokens()).containsExactly("100");
    }

    @Test
    @DisplayName("status-only change notifies onDown without onUpdate")
    void addOrUpdate_StatusOnly_NotifiesDown() {
      // Arrange
      registry.addOrUpdate(host(1, "0"));

      // Act
      registry.addOrUpdate(host(1, "0").withStatus(HostStatus.DOWN));

      // Assert
      assertThat(events).containsExactly("add:1", "down:1");
    }

    @Test
    @DisplayName("markDown and markUp report whether the status changed")
    void markDownMarkUp_ReportTransitions() {
      // Arrange
      registry.addOrUpdate(host(1, "0"));

      // Act & Assert
      assertThat(registry.markDown(id(1))).isTrue();
      assertThat(registry.markDown(id(1))).isFalse();
      assertThat(registry.markUp(id(1))).isTrue();
      assertThat(registry.markUp(id(99))).isFalse();
      assertThat(events).containsExactly("add:1", "down:1", "up:1");
    }

    @Test
    @DisplayName("retainOnly removes hosts missing from the latest topology")
    void retainOnly_RemovesStaleHosts() {
      // Arrange
      registry.addOrUpdate(host(1, "0"));
      registry.addOrUpdate(host(2, "10"));
      registry.addOrUpdate(host(3, "20"));

      // Act
      final var removed = registry.retainOnly(Set.of(id(1), id(3)));

      // Assert
      assertThat(removed).extracting(HostInfo::getHostId).containsExactly(id(2));
      assertThat(registry.size()).isEqualTo(2);
      assertThat(events).endsWith("remove:2");
    }

    @Test
    @DisplayName("a throwing listener does not stop later listeners")
    void notify_ThrowingListener_OthersStillNotified() {
      // Arrange
      final var fresh = new HostRegistry();
      final List<HostInfo> seen = new ArrayList<>();
      fresh.subscribe(
          new HostListener() {
            @Override
            public void onAdd(final HostInfo host) {
              throw new IllegalStateException("boom");
            }
          });
      fresh.subscribe(
          new HostListener() {
            @Override
            public void onAdd(final HostInfo host) {
              seen.add(host);
            }
          });

      // Act
      fresh.addOrUpdate(host(1, "0"));

      // Assert
      assertThat(seen).hasSize(1);
    }
  }

  @Nested
  @DisplayName("Lookups and Snapshots")
  class Lookups {

    @Test
    @DisplayName("snapshot is immutable and carries the version")
    void snapshot_IsStableCopy() {
      // Arrange
      registry.addOrUpdate(host(1, "0"));
      final var snapshot = registry.snapshot();

      // Act
      registry.addOrUpdate(host(2, "10"));

      // Assert
      assertThat(snapshot.size()).isEqualTo(1);
      assertThat(snapshot.version()).isLessThan(registry.version());
      assertThat(registry.snapshot().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("upHosts excludes down hosts")
    void snapshot_UpHosts_ExcludesDown() {
      // Arrange
      registry.addOrUpdate(host(1, "0"));
      registry.addOrUpdate(host(2, "10"));
      registry.markDown(id(2));

      // Act
      final var up = registry.snapshot().upHosts();

      // Assert
      assertThat(up).extracting(HostInfo::getHostId).containsExactly(id(1));
    }

    @Test
    @DisplayName("findByAddress matches the connect IP or the broadcast address")
    void findByAddress_MatchesConnectOrBroadcast() throws Exception {
      // Arrange
      final var broadcast = InetAddress.getByName("192.168.1.7");
      registry.addOrUpdate(host(1, "0").toBuilder().broadcastAddress(broadcast).build());

      // Act & Assert
      assertThat(registry.findByAddress(address(1).getAddress())).isPresent();
      assertThat(registry.findByAddress(broadcast)).isPresent();
      assertThat(registry.findByAddress(InetAddress.getByName("10.9.9.9"))).isEmpty();
      assertThat(registry.findByConnectAddress(address(1))).isPresent();
    }
  }
}
