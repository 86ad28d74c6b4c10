/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.macstab.oss.ringdriver.host.HostFilter;
import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.host.HostRegistry;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.transport.ConnectRequest;
import com.macstab.oss.ringdriver.transport.Futures;
import com.macstab.oss.ringdriver.transport.TransportFactory;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically probes hosts marked down and marks them up once a connection succeeds.
 *
 * <p>Only hosts accepted by the host filter are probed, at most one probe per host at a time. The
 * probe connection is closed right away; marking the host up makes the pool manager open a fresh
 * pool for it.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class DownedHostReconnector {

  HostRegistry registry;
  TransportFactory factory;
  HostFilter filter;
  ScheduledExecutorService scheduler;
  Duration interval;
  DriverMetrics metrics;
  String sessionName;
  Set<UUID> probing = ConcurrentHashMap.newKeySet();

  @NonFinal volatile ScheduledFuture<?> task;
  @NonFinal volatile boolean stopped;

  public DownedHostReconnector(
      @NonNull final HostRegistry registry,
      @NonNull final TransportFactory factory,
      @NonNull final HostFilter filter,
      @NonNull final ScheduledExecutorService scheduler,
      @NonNull final Duration interval,
      @NonNull final DriverMetrics metrics,
      @NonNull final String sessionName) {
    this.registry = registry;
    this.factory = factory;
    this.filter = filter;
    this.scheduler = scheduler;
    this.interval = interval;
    this.metrics = metrics;
    this.sessionName = sessionName;
  }

  /** Starts the periodic probe. A non-positive interval disables it. */
  public void start() {
    final long period = interval.toNanos();
    if (period <= 0 || stopped) {
      return;
    }
    task =
        scheduler.scheduleWithFixedDelay(
            this::probeDownedHosts, period, period, TimeUnit.NANOSECONDS);
  }

  /** Probes every downed, accepted host once. */
  public void probeDownedHosts() {
    for (final var host : registry.snapshot().all()) {
      if (stopped) {
        return;
      }
      if (!host.isUp() && filter.accept(host) && probing.add(host.getHostId())) {
        probe(host);
      }
    }
  }

  public void stop() {
    stopped = true;
    final var current = task;
    if (current != null) {
      current.cancel(false);
    }
  }

  // ==================== Private Methods ====================

  private void probe(final HostInfo host) {
    final var address = host.getConnectAddress();
    factory
        .connect(ConnectRequest.pooled(address))
        .whenComplete(
            (transport, error) -> {
              probing.remove(host.getHostId());
              if (error != null) {
                metrics.recordReconnectionAttempt(sessionName, address.toString(), false);
                if (log.isDebugEnabled()) {
                  log.debug("{} still unreachable: {}", host, Futures.unwrap(error).getMessage());
                }
                return;
              }
              transport.close();
              metrics.recordReconnectionAttempt(sessionName, address.toString(), true);
              if (!stopped && registry.markUp(host.getHostId())) {
                log.info("{} is reachable again", host);
              }
            });
  }
}
