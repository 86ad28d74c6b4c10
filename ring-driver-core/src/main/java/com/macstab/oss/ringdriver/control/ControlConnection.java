/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import static lombok.AccessLevel.PRIVATE;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.macstab.oss.ringdriver.error.NoHostAvailableException;
import com.macstab.oss.ringdriver.error.OperationCancelledException;
import com.macstab.oss.ringdriver.error.SchemaAgreementTimeoutException;
import com.macstab.oss.ringdriver.error.SessionClosedException;
import com.macstab.oss.ringdriver.host.HostFilter;
import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.host.HostRegistry;
import com.macstab.oss.ringdriver.host.HostStatus;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.policy.HostSelectionPolicy;
import com.macstab.oss.ringdriver.policy.QueryPlanContext;
import com.macstab.oss.ringdriver.pool.ReconnectionPolicy;
import com.macstab.oss.ringdriver.pool.ReconnectionSchedule;
import com.macstab.oss.ringdriver.protocol.EventType;
import com.macstab.oss.ringdriver.protocol.ProtocolEvent;
import com.macstab.oss.ringdriver.protocol.SchemaChangeEvent;
import com.macstab.oss.ringdriver.protocol.StatusChangeEvent;
import com.macstab.oss.ringdriver.protocol.TopologyChangeEvent;
import com.macstab.oss.ringdriver.token.ClusterMetadata;
import com.macstab.oss.ringdriver.token.Partitioners;
import com.macstab.oss.ringdriver.transport.ConnectRequest;
import com.macstab.oss.ringdriver.transport.FrameTransport;
import com.macstab.oss.ringdriver.transport.Futures;
import com.macstab.oss.ringdriver.transport.TransportFactory;

import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Builder;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * The one dedicated connection used for cluster metadata and push events.
 *
 * <p><strong>Responsibilities:</strong>
 *
 * <ul>
 *   <li>Seed the {@link HostRegistry} and {@link ClusterMetadata} on startup, refresh them
 *       periodically, and after every reconnect (events may have been missed meanwhile)
 *   <li>Translate TOPOLOGY_CHANGE, STATUS_CHANGE and SCHEMA_CHANGE events into registry and
 *       keyspace mutations
 *   <li>Wait for schema agreement
 * </ul>
 *
 * <p><strong>Ordering:</strong> every registry mutation originating here (event handling and the
 * application of refresh results) runs on one dedicated thread, in the order the events arrived.
 * Netty I/O threads only enqueue. Refreshes triggered by NEW_NODE and MOVED_NODE events, and
 * keyspace refreshes triggered by schema events, are debounced: a burst of events results in a
 * single query after {@code debounceDelay}.
 *
 * <p><strong>Reconnection:</strong> when the transport closes, a replacement node is chosen from
 * the host selection policy's plan, restricted to hosts accepted by the host filter, with the
 * contact points as last resort. Attempts follow a {@link ReconnectionSchedule} (exponential,
 * capped, jittered by default) until one succeeds or the connection is closed.
 *
 * <p><strong>Schema agreement:</strong> {@link #awaitSchemaAgreement} polls the schema version of
 * every node the registry does not know to be down until a single version remains. The wait ends
 * with {@link SchemaAgreementTimeoutException} at the deadline, with {@link
 * OperationCancelledException} as soon as the cancellation token fires, and with {@link
 * SessionClosedException} as soon as the connection is closed; it never hangs past close.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ControlConnection {

  static final List<EventType> EVENT_TYPES =
      List.of(EventType.TOPOLOGY_CHANGE, EventType.STATUS_CHANGE, EventType.SCHEMA_CHANGE);

  List<InetSocketAddress> contactPoints;
  HostRegistry registry;
  ClusterMetadata metadata;
  TransportFactory factory;
  MetadataSource source;
  HostSelectionPolicy policy;
  HostFilter filter;
  AddressTranslator translator;
  ReconnectionPolicy reconnectionPolicy;
  ScheduledExecutorService scheduler;
  ControlConnectionSettings settings;
  DriverMetrics metrics;
  String sessionName;
  ExecutorService eventExecutor;
  AtomicReference<FrameTransport> transport = new AtomicReference<>();
  AtomicBoolean reconnecting = new AtomicBoolean();
  AtomicBoolean topologyRefreshPending = new AtomicBoolean();
  AtomicBoolean keyspaceRefreshPending = new AtomicBoolean();
  Set<CompletableFuture<Void>> pendingAgreements = ConcurrentHashMap.newKeySet();

  @NonFinal volatile boolean closed;
  @NonFinal volatile ReconnectionSchedule reconnectSchedule;
  @NonFinal volatile ScheduledFuture<?> refreshTask;

  @Builder
  private ControlConnection(
      @NonNull final List<InetSocketAddress> contactPoints,
      @NonNull final HostRegistry registry,
      @NonNull final ClusterMetadata metadata,
      @NonNull final TransportFactory factory,
      @NonNull final MetadataSource source,
      @NonNull final HostSelectionPolicy policy,
      @NonNull final HostFilter filter,
      @NonNull final AddressTranslator translator,
      @NonNull final ReconnectionPolicy reconnectionPolicy,
      @NonNull final ScheduledExecutorService scheduler,
      @NonNull final ControlConnectionSettings settings,
      @NonNull final DriverMetrics metrics,
      @NonNull final String sessionName) {
    if (contactPoints.isEmpty()) {
      throw new IllegalArgumentException("At least one contact point is required");
    }
    this.contactPoints = List.copyOf(contactPoints);
    this.registry = registry;
    this.metadata = metadata;
    this.factory = factory;
    this.source = source;
    this.policy = policy;
    this.filter = filter;
    this.translator = translator;
    this.reconnectionPolicy = reconnectionPolicy;
    this.scheduler = scheduler;
    this.settings = settings;
    this.metrics = metrics;
    this.sessionName = sessionName;
    this.eventExecutor =
        Executors.newSingleThreadExecutor(
            new DefaultThreadFactory("ring-driver-control-" + sessionName, true));
  }

  /**
   * Connects to the first reachable contact point and loads the topology and keyspaces.
   *
   * @return completes once the registry is seeded; fails with {@link NoHostAvailableException}
   *     if no contact point is reachable
   */
  public CompletableFuture<Void> init() {
    return connectAny(contactPoints.iterator(), new ArrayList<>(), new LinkedHashMap<>())
        .thenCompose(this::refreshAll)
        .thenRun(
            () -> {
              scheduleRefreshTask();
              switchAwayFromFilteredHost();
            });
  }

  /** Transport of the live connection, empty while reconnecting. */
  public Optional<FrameTransport> transport() {
    return Optional.ofNullable(transport.get());
  }

  public boolean isConnected() {
    final var t = transport.get();
    return t != null && t.isOpen();
  }

  /** Refreshes topology and keyspaces now. */
  public CompletableFuture<Void> refresh() {
    final var t = transport.get();
    if (t == null) {
      return CompletableFuture.completedFuture(null);
    }
    return refreshAll(t);
  }

  /**
   * Polls node schema versions until they converge.
   *
   * @param timeout deadline for convergence
   * @param cancellation cancels the wait
   * @return completes on agreement; exceptionally with {@link SchemaAgreementTimeoutException},
   *     {@link OperationCancelledException} or {@link SessionClosedException}
   */
  public CompletableFuture<Void> awaitSchemaAgreement(
      @NonNull final Duration timeout, @NonNull final CancellationToken cancellation) {
    if (closed) {
      return CompletableFuture.failedFuture(new SessionClosedException("Session is closed"));
    }
    if (cancellation.isCancelled()) {
      return CompletableFuture.failedFuture(
          new OperationCancelledException("Schema agreement wait cancelled"));
    }
    final var result = new CompletableFuture<Void>();
    pendingAgreements.add(result);
    final var registration =
        cancellation.onCancel(
            () ->
                result.completeExceptionally(
                    new OperationCancelledException("Schema agreement wait cancelled")));
    result.whenComplete(
        (ignored, error) -> {
          pendingAgreements.remove(result);
          registration.remove();
        });
    if (closed) {
      result.completeExceptionally(new SessionClosedException("Session is closed"));
      return result;
    }
    pollSchemaVersions(result, System.nanoTime() + timeout.toNanos(), timeout, Set.of());
    return result;
  }

  /**
   * Closes the connection, stops refreshes and fails pending schema agreement waits. Idempotent.
   *
   * @return completes once the transport is closed
   */
  public CompletableFuture<Void> close() {
    if (closed) {
      return CompletableFuture.completedFuture(null);
    }
    closed = true;
    final var task = refreshTask;
    if (task != null) {
      task.cancel(false);
    }
    for (final var pending : List.copyOf(pendingAgreements)) {
      pending.completeExceptionally(
          new SessionClosedException("Session closed while waiting for schema agreement"));
    }
    eventExecutor.shutdown();
    final var t = transport.getAndSet(null);
    return t == null ? CompletableFuture.completedFuture(null) : t.close();
  }

  // ==================== Connection ====================

  private CompletableFuture<FrameTransport> connectAny(
      final Iterator<InetSocketAddress> candidates,
      final List<InetSocketAddress> tried,
      final Map<InetSocketAddress, Throwable> errors) {
    if (closed) {
      return CompletableFuture.failedFuture(new SessionClosedException("Session is closed"));
    }
    if (!candidates.hasNext()) {
      final Throwable last = tried.isEmpty() ? null : errors.get(tried.get(tried.size() - 1));
      return CompletableFuture.failedFuture(new NoHostAvailableException(tried, errors, last));
    }
    final var endpoint = candidates.next();
    tried.add(endpoint);
    return factory
        .connect(ConnectRequest.control(endpoint, EVENT_TYPES, this::onEvent))
        .handle(
            (t, error) -> {
              if (error != null) {
                final var cause = Futures.unwrap(error);
                errors.put(endpoint, cause);
                if (log.isDebugEnabled()) {
                  log.debug("Control connection to {} failed: {}", endpoint, cause.getMessage());
                }
                return connectAny(candidates, tried, errors);
              }
              return CompletableFuture.completedFuture(install(t));
            })
        .thenCompose(f -> f);
  }

  private FrameTransport install(final FrameTransport t) {
    if (closed) {
      t.close();
      throw new SessionClosedException("Session is closed");
    }
    transport.set(t);
    t.closeFuture().thenRun(() -> onTransportClosed(t));
    log.info("Control connection established to {}", t.remoteAddress());
    return t;
  }

  private void onTransportClosed(final FrameTransport t) {
    if (closed || !transport.compareAndSet(t, null)) {
      return;
    }
    log.info("Control connection to {} lost, reconnecting", t.remoteAddress());
    reconnect();
  }

  private void reconnect() {
    if (closed || !reconnecting.compareAndSet(false, true)) {
      return;
    }
    attemptReconnect();
  }

  private void attemptReconnect() {
    if (closed) {
      reconnecting.set(false);
      return;
    }
    connectAny(reconnectCandidates().iterator(), new ArrayList<>(), new LinkedHashMap<>())
        .whenComplete(
            (t, error) -> {
              if (error == null) {
                reconnecting.set(false);
                reconnectSchedule = null;
                metrics.recordReconnectionAttempt(sessionName, t.remoteAddress().toString(), true);
                refreshAll(t)
                    .exceptionally(
                        e -> {
                          log.warn(
                              "Refresh after reconnect failed: {}",
                              Futures.unwrap(e).getMessage());
                          return null;
                        });
                return;
              }
              metrics.recordReconnectionAttempt(sessionName, "control", false);
              if (closed) {
                reconnecting.set(false);
                return;
              }
              if (reconnectSchedule == null) {
                reconnectSchedule = reconnectionPolicy.newSchedule();
              }
              final var delay = reconnectSchedule.nextDelay();
              log.warn(
                  "Control connection reconnect failed ({}), retrying in {} ms",
                  Futures.unwrap(error).getMessage(),
                  delay.toMillis());
              scheduleOrClose(this::attemptReconnect, delay);
            });
  }

  private List<InetSocketAddress> reconnectCandidates() {
    final Set<InetSocketAddress> candidates = new LinkedHashSet<>();
    final var plan = policy.newQueryPlan(QueryPlanContext.NONE);
    while (plan.hasNext()) {
      final var host = plan.next();
      if (filter.accept(host)) {
        candidates.add(host.getConnectAddress());
      }
    }
    if (candidates.isEmpty()) {
      candidates.addAll(contactPoints);
    }
    return new ArrayList<>(candidates);
  }

  private void switchAwayFromFilteredHost() {
    final var t = transport.get();
    if (t == null) {
      return;
    }
    final var current = registry.findByConnectAddress(t.remoteAddress());
    if (current.isEmpty() || filter.accept(current.get())) {
      return;
    }
    final boolean alternative =
        registry.snapshot().upHosts().stream().anyMatch(filter::accept);
    if (alternative) {
      log.info(
          "Contact point {} is excluded by the host filter, moving control connection",
          t.remoteAddress());
      t.close();
    }
  }

  // ==================== Refresh ====================

  private CompletableFuture<Void> refreshAll(final FrameTransport t) {
    return source
        .fetchTopology(t, settings.getRequestTimeout())
        .thenAcceptAsync(info -> applyTopology(info, t), eventExecutor)
        .thenCompose(ignored -> source.fetchKeyspaces(t, settings.getRequestTimeout()))
        .thenAcceptAsync(metadata::replaceKeyspaces, eventExecutor);
  }

  private void scheduleRefreshTask() {
    final long period = settings.getRefreshInterval().toNanos();
    if (period <= 0 || closed) {
      return;
    }
    refreshTask =
        scheduler.scheduleWithFixedDelay(
            () ->
                refresh()
                    .exceptionally(
                        e -> {
                          log.warn(
                              "Periodic metadata refresh failed: {}",
                              Futures.unwrap(e).getMessage());
                          return null;
                        }),
            period,
            period,
            TimeUnit.NANOSECONDS);
  }

  /** Runs on the event thread. */
  private void applyTopology(final TopologyInfo info, final FrameTransport t) {
    if (info.partitioner() != null) {
      Partitioners.forName(info.partitioner())
          .ifPresentOrElse(
              metadata::setPartitioner,
              () ->
                  log.warn(
                      "Unsupported partitioner {}, token-aware routing disabled",
                      info.partitioner()));
    }
    final Set<UUID> seen = new HashSet<>();
    final var local =
        info.localHost().toBuilder()
            .connectAddress(t.remoteAddress())
            .status(HostStatus.UP)
            .build();
    registry.addOrUpdate(local);
    seen.add(local.getHostId());
    for (final var peer : info.peers()) {
      final var translated = translator.translate(peer.getConnectAddress());
      final var status =
          registry.get(peer.getHostId()).map(HostInfo::getStatus).orElse(HostStatus.UP);
      registry.addOrUpdate(peer.toBuilder().connectAddress(translated).status(status).build());
      seen.add(peer.getHostId());
    }
    for (final var removed : registry.retainOnly(seen)) {
      log.info("Host {} no longer part of the cluster", removed);
    }
    metrics.recordTopologyEvent(sessionName, "refresh");
  }

  private void refreshTopologyNow() {
    final var t = transport.get();
    if (t == null || closed) {
      return;
    }
    source
        .fetchTopology(t, settings.getRequestTimeout())
        .thenAcceptAsync(info -> applyTopology(info, t), eventExecutor)
        .exceptionally(
            e -> {
              log.warn("Topology refresh failed: {}", Futures.unwrap(e).getMessage());
              return null;
            });
  }

  private void refreshKeyspacesNow() {
    final var t = transport.get();
    if (t == null || closed) {
      return;
    }
    source
        .fetchKeyspaces(t, settings.getRequestTimeout())
        .thenAcceptAsync(metadata::replaceKeyspaces, eventExecutor)
        .exceptionally(
            e -> {
              log.warn("Keyspace refresh failed: {}", Futures.unwrap(e).getMessage());
              return null;
            });
  }

  private void debounce(final AtomicBoolean pending, final Runnable refresh) {
    if (!pending.compareAndSet(false, true)) {
      return;
    }
    scheduleOrClose(
        () ->
            runOnEventThread(
                () -> {
                  pending.set(false);
                  refresh.run();
                }),
        settings.getDebounceDelay());
  }

  // ==================== Events ====================

  private void onEvent(final ProtocolEvent event) {
    runOnEventThread(() -> handleEvent(event));
  }

  /** Runs on the event thread. */
  private void handleEvent(final ProtocolEvent event) {
    if (log.isDebugEnabled()) {
      log.debug("Received event {}", event);
    }
    if (event instanceof TopologyChangeEvent topology) {
      metrics.recordTopologyEvent(sessionName, topology.change().name().toLowerCase(Locale.ROOT));
      switch (topology.change()) {
        case NEW_NODE, MOVED_NODE -> debounce(topologyRefreshPending, this::refreshTopologyNow);
        case REMOVED_NODE ->
            findHost(topology.address()).ifPresent(h -> registry.remove(h.getHostId()));
        default -> throw new IllegalStateException("Unknown topology change " + topology.change());
      }
    } else if (event instanceof StatusChangeEvent status) {
      metrics.recordTopologyEvent(
          sessionName, "status_" + status.status().name().toLowerCase(Locale.ROOT));
      final var host = findHost(status.address());
      if (host.isEmpty()) {
        if (status.status() == StatusChangeEvent.Status.UP) {
          debounce(topologyRefreshPending, this::refreshTopologyNow);
        }
        return;
      }
      if (status.status() == StatusChangeEvent.Status.UP) {
        registry.markUp(host.get().getHostId());
      } else {
        registry.markDown(host.get().getHostId());
      }
    } else if (event instanceof SchemaChangeEvent schema) {
      metrics.recordTopologyEvent(sessionName, "schema_change");
      final var change = schema.change();
      if (!change.isKeyspaceChange()) {
        return;
      }
      if ("DROPPED".equals(change.changeType())) {
        metadata.removeKeyspace(change.keyspace());
      } else {
        debounce(keyspaceRefreshPending, this::refreshKeyspacesNow);
      }
    }
  }

  private Optional<HostInfo> findHost(final InetSocketAddress advertised) {
    final var translated = translator.translate(advertised);
    return registry
        .findByConnectAddress(translated)
        .or(() -> registry.findByAddress(translated.getAddress()))
        .or(() -> registry.findByAddress(advertised.getAddress()));
  }

  // ==================== Schema Agreement ====================

  private void pollSchemaVersions(
      final CompletableFuture<Void> result,
      final long deadline,
      final Duration timeout,
      final Set<UUID> lastSeen) {
    if (result.isDone()) {
      return;
    }
    final var t = transport.get();
    if (t == null) {
      schedulePoll(result, deadline, timeout, lastSeen);
      return;
    }
    source
        .fetchSchemaVersions(t, settings.getRequestTimeout())
        .whenComplete(
            (versionsByHost, error) -> {
              if (result.isDone()) {
                return;
              }
              if (error != null) {
                if (log.isDebugEnabled()) {
                  log.debug("Schema version query failed: {}", Futures.unwrap(error).getMessage());
                }
                schedulePoll(result, deadline, timeout, lastSeen);
                return;
              }
              final var versions = liveVersions(versionsByHost);
              if (versions.size() <= 1) {
                result.complete(null);
              } else {
                schedulePoll(result, deadline, timeout, versions);
              }
            });
  }

  private void schedulePoll(
      final CompletableFuture<Void> result,
      final long deadline,
      final Duration timeout,
      final Set<UUID> lastSeen) {
    final long remaining = deadline - System.nanoTime();
    if (remaining <= 0) {
      result.completeExceptionally(new SchemaAgreementTimeoutException(timeout, lastSeen));
      return;
    }
    final long delay = Math.min(remaining, settings.getSchemaAgreementPollInterval().toNanos());
    try {
      scheduler.schedule(
          () -> pollSchemaVersions(result, deadline, timeout, lastSeen),
          delay,
          TimeUnit.NANOSECONDS);
    } catch (final RejectedExecutionException e) {
      result.completeExceptionally(new SessionClosedException("Session is closed"));
    }
  }

  private Set<UUID> liveVersions(final Map<UUID, UUID> versionsByHost) {
    final Set<UUID> versions = new HashSet<>();
    for (final var entry : versionsByHost.entrySet()) {
      final boolean live = registry.get(entry.getKey()).map(HostInfo::isUp).orElse(true);
      if (live) {
        versions.add(entry.getValue());
      }
    }
    return versions;
  }

  // ==================== Private Methods ====================

  private void runOnEventThread(final Runnable task) {
    if (closed) {
      return;
    }
    try {
      eventExecutor.execute(task);
    } catch (final RejectedExecutionException e) {
      if (log.isDebugEnabled()) {
        log.debug("Dropping control connection task after close", e);
      }
    }
  }

  private void scheduleOrClose(final Runnable task, final Duration delay) {
    try {
      scheduler.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
    } catch (final RejectedExecutionException e) {
      if (!closed) {
        throw e;
      }
      reconnecting.set(false);
    }
  }
}
