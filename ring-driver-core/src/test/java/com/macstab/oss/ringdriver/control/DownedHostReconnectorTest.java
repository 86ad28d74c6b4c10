/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import static com.macstab.oss.ringdriver.testutil.TestHosts.address;
import static com.macstab.oss.ringdriver.testutil.TestHosts.down;
import static com.macstab.oss.ringdriver.testutil.TestHosts.host;
import static com.macstab.oss.ringdriver.testutil.TestHosts.hostIn;
import static com.macstab.oss.ringdriver.testutil.TestHosts.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.ringdriver.host.HostFilter;
import com.macstab.oss.ringdriver.host.HostRegistry;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.testutil.FakeTransport;
import com.macstab.oss.ringdriver.testutil.FakeTransportFactory;
import com.macstab.oss.ringdriver.transport.FrameTransport;

/**
 * Tests for {@link DownedHostReconnector}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("DownedHostReconnector")
class DownedHostReconnectorTest {

  private ScheduledExecutorService scheduler;
  private HostRegistry registry;
  private FakeTransportFactory factory;

  @BeforeEach
  void setUp() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
    registry = new HostRegistry();
    factory = FakeTransportFactory.voidResults();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    scheduler.shutdownNow();
    scheduler.awaitTermination(1, TimeUnit.SECONDS);
  }

  private DownedHostReconnector reconnector(final HostFilter filter, final Duration interval) {
    return new DownedHostReconnector(
        registry, factory, filter, scheduler, interval, DriverMetrics.NOOP, "test");
  }

  @Test
  @DisplayName("marks a reachable down host up and closes the probe connection")
  void probe_Reachable_MarksUp() {
    // Arrange
    registry.addOrUpdate(down(host(1)));

    // Act
    reconnector(HostFilter.acceptAll(), Duration.ZERO).probeDownedHosts();

    // Assert
    assertThat(registry.get(id(1)).orElseThrow().isUp()).isTrue();
    assertThat(factory.opened()).singleElement().satisfies(t -> assertThat(t.isOpen()).isFalse());
  }

  @Test
  @DisplayName("leaves an unreachable host down")
  void probe_Unreachable_StaysDown() {
    // Arrange
    registry.addOrUpdate(down(host(1)));
    factory.setBehavior(FakeTransportFactory::refused);

    // Act
    reconnector(HostFilter.acceptAll(), Duration.ZERO).probeDownedHosts();

    // Assert
    assertThat(registry.get(id(1)).orElseThrow().isUp()).isFalse();
  }

  @Test
  @DisplayName("probes only down hosts the filter accepts")
  void probe_SkipsUpAndFilteredHosts() {
    // Arrange
    registry.addOrUpdate(host(1));
    registry.addOrUpdate(down(hostIn(2, "dc2", "r1")));
    registry.addOrUpdate(down(host(3)));

    // Act
    reconnector(HostFilter.dataCenter("dc1"), Duration.ZERO).probeDownedHosts();

    // Assert
    assertThat(factory.requests())
        .singleElement()
        .satisfies(r -> assertThat(r.endpoint()).isEqualTo(address(3)));
    assertThat(registry.get(id(2)).orElseThrow().isUp()).isFalse();
  }

  @Test
  @DisplayName("periodic probing brings a host back once it answers again")
  void start_HostRecovers() {
    // Arrange
    registry.addOrUpdate(down(host(1)));
    factory.setBehavior(FakeTransportFactory::refused);
    final var reconnector = reconnector(HostFilter.acceptAll(), Duration.ofMillis(10));
    reconnector.start();
    await().atMost(Duration.ofSeconds(5)).until(() -> factory.requests().size() >= 2);

    // Act
    factory.setBehavior(
        request ->
            CompletableFuture.completedFuture(
                (FrameTransport) FakeTransport.voidResults(request.endpoint())));

    // Assert
    await()
        .atMost(Duration.ofSeconds(5))
        .until(() -> registry.get(id(1)).orElseThrow().isUp());
    reconnector.stop();
  }
}
