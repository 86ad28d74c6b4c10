/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.session;

import static lombok.AccessLevel.PRIVATE;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import com.macstab.oss.ringdriver.control.CancellationToken;
import com.macstab.oss.ringdriver.control.ControlConnection;
import com.macstab.oss.ringdriver.control.DownedHostReconnector;
import com.macstab.oss.ringdriver.error.NoHostAvailableException;
import com.macstab.oss.ringdriver.error.SessionClosedException;
import com.macstab.oss.ringdriver.exec.QueryExecutor;
import com.macstab.oss.ringdriver.host.HostRegistry;
import com.macstab.oss.ringdriver.host.HostSnapshot;
import com.macstab.oss.ringdriver.policy.FilteringPolicy;
import com.macstab.oss.ringdriver.policy.HostSelectionPolicy;
import com.macstab.oss.ringdriver.pool.HostConnectionPool;
import com.macstab.oss.ringdriver.pool.PoolManager;
import com.macstab.oss.ringdriver.query.PagingIterator;
import com.macstab.oss.ringdriver.query.ResultSet;
import com.macstab.oss.ringdriver.query.SimpleStatement;
import com.macstab.oss.ringdriver.query.Statement;
import com.macstab.oss.ringdriver.token.ClusterMetadata;
import com.macstab.oss.ringdriver.transport.Futures;
import com.macstab.oss.ringdriver.transport.NettyTransportFactory;
import com.macstab.oss.ringdriver.transport.TransportFactory;

import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Default {@link Session}: wires registry, metadata, policy, pools, control connection and
 * executor together and owns their lifecycle.
 *
 * <p><strong>Wiring order:</strong> the registry notifies, in this order, the cluster metadata
 * (token ring), the host selection policy and the pool manager. The ring is therefore rebuilt
 * before a policy can route to a new node, and a policy may list a host whose pool is still
 * opening; the executor's bounded acquire covers that window.
 *
 * <p><strong>Startup:</strong> connect the control connection, seed the registry (which opens a
 * pool per accepted up host), wait for the pools, start the downed-host reconnector. Fails with
 * {@link NoHostAvailableException} when no contact point answers or no pool could open.
 *
 * <p><strong>Shutdown:</strong> idempotent. New statements fail with {@link
 * SessionClosedException}, pending schema agreement waits resolve with it, then pools, control
 * connection, scheduler and (if owned) the transport factory are released.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ClusterSession implements Session {

  SessionConfig config;
  ScheduledExecutorService scheduler;
  TransportFactory factory;
  boolean ownsFactory;
  HostRegistry registry;
  ClusterMetadata metadata;
  HostSelectionPolicy policy;
  PoolManager pools;
  ControlConnection control;
  DownedHostReconnector reconnector;
  QueryExecutor executor;
  AtomicReference<CompletableFuture<Void>> closeFuture = new AtomicReference<>();

  ClusterSession(@NonNull final SessionConfig config) {
    this.config = config;
    final var name = config.getSessionName();
    this.scheduler =
        Executors.newScheduledThreadPool(
            2, new DefaultThreadFactory("ring-driver-scheduler-" + name, true));
    this.ownsFactory = config.getTransportFactory() == null;
    this.factory =
        ownsFactory
            ? new NettyTransportFactory(config.transportSettings())
            : config.getTransportFactory();
    this.registry = new HostRegistry();
    this.metadata = new ClusterMetadata(registry);
    this.policy =
        new FilteringPolicy(
            config.effectiveHostSelectionPolicy().create(metadata), config.getHostFilter());
    this.pools =
        new PoolManager(
            registry,
            factory,
            config.getPoolConfig(),
            config.getReconnectionPolicy(),
            scheduler,
            config.getHostFilter(),
            config.getMetrics(),
            name);
    this.control =
        ControlConnection.builder()
            .contactPoints(config.resolveContactPoints())
            .registry(registry)
            .metadata(metadata)
            .factory(factory)
            .source(config.getMetadataSource())
            .policy(policy)
            .filter(config.getHostFilter())
            .translator(config.getAddressTranslator())
            .reconnectionPolicy(config.getReconnectionPolicy())
            .scheduler(scheduler)
            .settings(config.controlConnectionSettings())
            .metrics(config.getMetrics())
            .sessionName(name)
            .build();
    this.reconnector =
        new DownedHostReconnector(
            registry,
            factory,
            config.getHostFilter(),
            scheduler,
            config.getDownedHostReconnectInterval(),
            config.getMetrics(),
            name);
    this.executor =
        QueryExecutor.builder()
            .policy(policy)
            .pools(pools)
            .metadata(metadata)
            .retryPolicy(config.getRetryPolicy())
            .speculativePolicy(config.getSpeculativeExecutionPolicy())
            .scheduler(scheduler)
            .metrics(config.getMetrics())
            .settings(config.executorSettings())
            .schemaAgreement(
                () ->
                    control.awaitSchemaAgreement(
                        config.getSchemaAgreementTimeout(), CancellationToken.none()))
            .build();

    policy.init(registry.snapshot().all());
    registry.subscribe(metadata);
    registry.subscribe(policy);
    registry.subscribe(pools);
  }

  /**
   * Creates a session and blocks until it is ready.
   *
   * @param config configuration
   * @return ready session
   */
  static ClusterSession create(final SessionConfig config) {
    final var session = new ClusterSession(config);
    try {
      Futures.await(session.init());
    } catch (final RuntimeException e) {
      session.close();
      throw e;
    }
    return session;
  }

  /** Startup sequence; package-private for tests driving it with fakes. */
  CompletableFuture<Void> init() {
    return control
        .init()
        .thenCompose(ignored -> pools.initialize())
        .thenRun(
            () -> {
              final var open = pools.allPools().values().stream().filter(p -> p.size() > 0).count();
              if (open == 0) {
                throw new NoHostAvailableException(triedHosts(), Map.of(), null);
              }
              reconnector.start();
              log.info(
                  "Session '{}' connected: {} hosts, {} pools open, policy {}",
                  config.getSessionName(),
                  registry.size(),
                  open,
                  policy.getName());
            });
  }

  @Override
  public ResultSet execute(@NonNull final Statement statement) {
    return Futures.await(executeAsync(statement));
  }

  @Override
  public CompletableFuture<ResultSet> executeAsync(@NonNull final Statement statement) {
    if (isClosed()) {
      return CompletableFuture.failedFuture(new SessionClosedException("Session is closed"));
    }
    return executor.execute(statement);
  }

  @Override
  public ResultSet fetchNextPage(
      @NonNull final SimpleStatement statement, @NonNull final ResultSet previous) {
    if (!previous.hasMorePages()) {
      throw new IllegalArgumentException("The result has no further page");
    }
    return execute(statement.withPagingState(previous.getPagingState()));
  }

  @Override
  public PagingIterator executeStreaming(@NonNull final SimpleStatement statement) {
    return new PagingIterator(execute(statement), previous -> fetchNextPage(statement, previous));
  }

  @Override
  public void awaitSchemaAgreement(@NonNull final CancellationToken cancellation) {
    Futures.await(awaitSchemaAgreementAsync(config.getSchemaAgreementTimeout(), cancellation));
  }

  @Override
  public CompletableFuture<Void> awaitSchemaAgreementAsync(
      @NonNull final Duration timeout, @NonNull final CancellationToken cancellation) {
    if (isClosed()) {
      return CompletableFuture.failedFuture(new SessionClosedException("Session is closed"));
    }
    return control.awaitSchemaAgreement(timeout, cancellation);
  }

  @Override
  public ClusterMetadata getMetadata() {
    return metadata;
  }

  @Override
  public HostSnapshot getHosts() {
    return registry.snapshot();
  }

  @Override
  public Map<UUID, HostConnectionPool> getPools() {
    return pools.allPools();
  }

  @Override
  public String getName() {
    return config.getSessionName();
  }

  @Override
  public boolean isClosed() {
    return closeFuture.get() != null;
  }

  @Override
  public CompletableFuture<Void> closeAsync() {
    final var closing = new CompletableFuture<Void>();
    if (!closeFuture.compareAndSet(null, closing)) {
      return closeFuture.get();
    }
    executor.close();
    reconnector.stop();
    registry.unsubscribe(pools);
    registry.unsubscribe(policy);
    registry.unsubscribe(metadata);
    final var controlClosed = control.close();
    final var poolsClosed = pools.close();
    CompletableFuture.allOf(controlClosed, poolsClosed)
        .whenComplete(
            (ignored, error) -> {
              scheduler.shutdownNow();
              if (ownsFactory) {
                factory.close();
              }
              config.getMetrics().close(config.getSessionName());
              log.info("Session '{}' closed", config.getSessionName());
              if (error != null) {
                closing.completeExceptionally(error);
              } else {
                closing.complete(null);
              }
            });
    return closing;
  }

  @Override
  public void close() {
    Futures.await(closeAsync());
  }

  // ==================== Private Methods ====================

  private List<InetSocketAddress> triedHosts() {
    final List<InetSocketAddress> tried = new ArrayList<>();
    for (final var host : registry.snapshot().all()) {
      tried.add(host.getConnectAddress());
    }
    return tried;
  }

  @Override
  public String toString() {
    final Map<String, Object> state = new LinkedHashMap<>();
    state.put("name", config.getSessionName());
    state.put("hosts", registry.size());
    state.put("pools", pools.allPools().size());
    state.put("closed", isClosed());
    return "ClusterSession" + state;
  }
}
