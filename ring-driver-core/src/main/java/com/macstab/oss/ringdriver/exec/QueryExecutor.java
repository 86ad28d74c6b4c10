/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.exec;

import static lombok.AccessLevel.PRIVATE;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.macstab.oss.ringdriver.error.ConnectionException;
import com.macstab.oss.ringdriver.error.DriverException;
import com.macstab.oss.ringdriver.error.ErrorKind;
import com.macstab.oss.ringdriver.error.FrameProtocolException;
import com.macstab.oss.ringdriver.error.NoHostAvailableException;
import com.macstab.oss.ringdriver.error.SessionClosedException;
import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.policy.HostSelectionPolicy;
import com.macstab.oss.ringdriver.policy.QueryPlanContext;
import com.macstab.oss.ringdriver.pool.HostConnectionPool;
import com.macstab.oss.ringdriver.pool.PoolManager;
import com.macstab.oss.ringdriver.protocol.ErrorResponse;
import com.macstab.oss.ringdriver.protocol.Frame;
import com.macstab.oss.ringdriver.protocol.Request;
import com.macstab.oss.ringdriver.protocol.ResultMessage;
import com.macstab.oss.ringdriver.protocol.RowsResult;
import com.macstab.oss.ringdriver.protocol.SchemaChangeResult;
import com.macstab.oss.ringdriver.query.Consistency;
import com.macstab.oss.ringdriver.query.ExecutionInfo;
import com.macstab.oss.ringdriver.query.ResultSet;
import com.macstab.oss.ringdriver.query.Row;
import com.macstab.oss.ringdriver.query.SimpleStatement;
import com.macstab.oss.ringdriver.query.Statement;
import com.macstab.oss.ringdriver.retry.RetryContext;
import com.macstab.oss.ringdriver.retry.RetryDecision;
import com.macstab.oss.ringdriver.retry.RetryPolicy;
import com.macstab.oss.ringdriver.speculative.SpeculativeExecutionPolicy;
import com.macstab.oss.ringdriver.token.ClusterMetadata;
import com.macstab.oss.ringdriver.token.Token;
import com.macstab.oss.ringdriver.transport.FrameTransport;
import com.macstab.oss.ringdriver.transport.Futures;

import lombok.Builder;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes one logical query against the cluster.
 *
 * <p><strong>State machine</strong> (one {@code Execution} per query):
 *
 * <pre>
 * NotStarted -> Attempting(host_i) -> Succeeded
 *                                  -> Attempting(host_i)      retry same host
 *                                  -> Attempting(host_i+1)    retry next host / no connection
 *                                  -> Failed                  rethrow / plan exhausted
 * </pre>
 *
 * <p><strong>Attempt:</strong> take the next host of the query plan, acquire a transport from its
 * pool (bounded wait; a host without a ready pool is skipped without consulting the retry policy),
 * send, await the response or the per-attempt timeout.
 *
 * <p><strong>Errors:</strong> every failed attempt is recorded in the per-host error map. Session
 * closed, cancellation and schema disagreement fail the query at once. Everything else is handed
 * to the {@link RetryPolicy}; a rethrow surfaces the error unchanged. Exhausting the plan fails
 * with {@link NoHostAvailableException} naming the hosts tried and the last error kind.
 *
 * <p><strong>Speculative execution:</strong> idempotent statements only. While the query is
 * running, the {@link SpeculativeExecutionPolicy} may start further executions after a delay.
 * All executions draw hosts from the same plan, so no host is tried twice by different
 * executions. The first to succeed completes the query; later responses are ignored. Abandoned
 * requests keep their stream id until the transport receives the late response.
 *
 * <p><strong>Schema changes:</strong> a statement answered with a SCHEMA_CHANGE result waits for
 * schema agreement (if enabled). Disagreement does not fail the statement: the result reports
 * {@code schemaInAgreement=false} and a warning is logged.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class QueryExecutor {

  HostSelectionPolicy policy;
  PoolManager pools;
  ClusterMetadata metadata;
  RetryPolicy retryPolicy;
  SpeculativeExecutionPolicy speculativePolicy;
  ScheduledExecutorService scheduler;
  DriverMetrics metrics;
  ExecutorSettings settings;
  Supplier<CompletableFuture<Void>> schemaAgreement;
  AtomicBoolean closed = new AtomicBoolean();

  /**
   * @param schemaAgreement starts a schema agreement wait; used after schema-changing statements
   */
  @Builder
  private QueryExecutor(
      @NonNull final HostSelectionPolicy policy,
      @NonNull final PoolManager pools,
      @NonNull final ClusterMetadata metadata,
      @NonNull final RetryPolicy retryPolicy,
      @NonNull final SpeculativeExecutionPolicy speculativePolicy,
      @NonNull final ScheduledExecutorService scheduler,
      @NonNull final DriverMetrics metrics,
      @NonNull final ExecutorSettings settings,
      @NonNull final Supplier<CompletableFuture<Void>> schemaAgreement) {
    this.policy = policy;
    this.pools = pools;
    this.metadata = metadata;
    this.retryPolicy = retryPolicy;
    this.speculativePolicy = speculativePolicy;
    this.scheduler = scheduler;
    this.metrics = metrics;
    this.settings = settings;
    this.schemaAgreement = schemaAgreement;
  }

  /**
   * Executes a statement.
   *
   * @param statement statement
   * @return result; fails with a {@link DriverException}, or with {@link IllegalArgumentException}
   *     for statements the driver refuses to send ({@code USE}, empty batches)
   */
  public CompletableFuture<ResultSet> execute(@NonNull final Statement statement) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(new SessionClosedException("Session is closed"));
    }
    if (statement instanceof SimpleStatement simple && simple.isUseStatement()) {
      return CompletableFuture.failedFuture(
          new IllegalArgumentException(
              "USE statements are not supported, configure the session keyspace instead"));
    }
    final Request request;
    try {
      request = statement.toRequest(settings.getStatementDefaults());
    } catch (final IllegalArgumentException e) {
      return CompletableFuture.failedFuture(e);
    }
    final var execution = new Execution(statement, request);
    execution.start();
    return execution.result;
  }

  /** Rejects new statements; in-flight ones fail with {@link SessionClosedException}. */
  public void close() {
    closed.set(true);
  }

  // ==================== Execution ====================

  /** State of one logical query; shared by its speculative executions. */
  private final class Execution {

    final Statement statement;
    final Request request;
    final boolean idempotent;
    final Consistency consistency;
    final Token token;
    final Duration timeout;
    final Iterator<HostInfo> plan;
    final CompletableFuture<ResultSet> result = new CompletableFuture<>();
    final AtomicBoolean finished = new AtomicBoolean();
    final AtomicInteger retryCount = new AtomicInteger();
    final AtomicInteger attempts = new AtomicInteger();
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger executionsStarted = new AtomicInteger();
    final List<InetSocketAddress> tried = new ArrayList<>();
    final Map<InetSocketAddress, Throwable> errors = new LinkedHashMap<>();
    final List<ScheduledFuture<?>> timers = new ArrayList<>();
    final long startNanos = System.nanoTime();
    volatile Throwable lastError;

    Execution(final Statement statement, final Request request) {
      this.statement = statement;
      this.request = request;
      this.idempotent = statement.isIdempotent();
      this.consistency =
          statement.getConsistency() != null
              ? statement.getConsistency()
              : settings.getStatementDefaults().consistency();
      final var keyspace =
          statement.getKeyspace() != null ? statement.getKeyspace() : settings.getSessionKeyspace();
      this.token =
          statement.getRoutingKey() == null
              ? null
              : metadata.newToken(statement.getRoutingKey()).orElse(null);
      this.timeout =
          statement.getTimeout() != null ? statement.getTimeout() : settings.getRequestTimeout();
      this.plan = policy.newQueryPlan(new QueryPlanContext(keyspace, token));
    }

    void start() {
      startExecution();
      if (idempotent) {
        scheduleSpeculative();
      }
    }

    // ---- executions ----

    private void startExecution() {
      executionsStarted.incrementAndGet();
      running.incrementAndGet();
      tryNextHost();
    }

    private void scheduleSpeculative() {
      final var delay = speculativePolicy.nextExecution(executionsStarted.get());
      if (delay.isEmpty() || finished.get()) {
        return;
      }
      schedule(
          () -> {
            if (finished.get()) {
              return;
            }
            metrics.recordSpeculativeExecution(settings.getSessionName());
            if (log.isDebugEnabled()) {
              log.debug(
                  "Starting speculative execution {} of {}", executionsStarted.get(), statement);
            }
            startExecution();
            scheduleSpeculative();
          },
          delay.get());
    }

    private void tryNextHost() {
      if (finished.get()) {
        return;
      }
      if (closed.get()) {
        fail(new SessionClosedException("Session closed during query execution"));
        return;
      }
      final var host = nextHost();
      if (host == null) {
        onExecutionExhausted();
        return;
      }
      final var pool = pools.poolFor(host.getHostId());
      if (pool.isEmpty()) {
        recordError(
            host,
            new ConnectionException(host.getConnectAddress(), "No connection pool", null, false));
        tryNextHost();
        return;
      }
      attempt(host, pool.get());
    }

    private void attempt(final HostInfo host, final HostConnectionPool pool) {
      pool.acquire(token)
          .whenComplete(
              (transport, error) -> {
                if (error != null) {
                  recordError(host, toDriverException(host, Futures.unwrap(error)));
                  tryNextHost();
                } else {
                  send(host, transport);
                }
              });
    }

    private void send(final HostInfo host, final FrameTransport transport) {
      if (finished.get()) {
        running.decrementAndGet();
        return;
      }
      if (!request.customPayload().isEmpty() && !transport.version().hasCustomPayload()) {
        running.decrementAndGet();
        fail(
            new IllegalArgumentException(
                "Custom payloads require protocol V4 or later, connection uses "
                    + transport.version()));
        return;
      }
      attempts.incrementAndGet();
      markTried(host.getConnectAddress());
      metrics.recordHostSelection(
          settings.getSessionName(), host.getConnectAddress().toString(), policy.getName());
      if (log.isTraceEnabled()) {
        log.trace("Sending {} to {} ({})", statement, host, transport.remoteAddress());
      }
      transport
          .exchange(request, timeout)
          .whenComplete((frame, error) -> onResponse(host, frame, error));
    }

    private void onResponse(final HostInfo host, final Frame frame, final Throwable error) {
      if (finished.get()) {
        // lost the race against another execution
        running.decrementAndGet();
        return;
      }
      if (error != null) {
        onError(host, toDriverException(host, Futures.unwrap(error)));
        return;
      }
      final var message = frame.message();
      if (message instanceof ErrorResponse response) {
        onError(host, response.toException(host.getConnectAddress()));
      } else if (message instanceof ResultMessage resultMessage) {
        onResult(host, resultMessage, frame.customPayload());
      } else {
        onError(
            host,
            new FrameProtocolException("Unexpected response to query: " + message.opcode()));
      }
    }

    // ---- errors & retries ----

    private void onError(final HostInfo host, final DriverException error) {
      recordError(host, error);
      final var kind = error.kind();
      if (kind == ErrorKind.SESSION_CLOSED
          || kind == ErrorKind.CANCELLED
          || kind == ErrorKind.SCHEMA_DISAGREEMENT) {
        fail(error);
        return;
      }
      if (closed.get()) {
        fail(new SessionClosedException("Session closed during query execution"));
        return;
      }
      final var context =
          new RetryContext(error, retryCount.get(), idempotent, consistency, host);
      final var decision = retryPolicy.decide(context);
      metrics.recordRetryDecision(settings.getSessionName(), kind.name(), decision.name());
      if (log.isDebugEnabled()) {
        log.debug(
            "{} failed on {} ({}: {}), retry decision {} after {} retries",
            statement,
            host.getConnectAddress(),
            kind,
            error.getMessage(),
            decision,
            retryCount.get());
      }
      switch (decision) {
        case RETHROW -> fail(error);
        case IGNORE -> succeed(ResultSet.empty(info(host, true, null, Map.of())));
        case RETRY_SAME_HOST -> {
          retryCount.incrementAndGet();
          schedule(() -> retrySameHost(host), retryPolicy.retryDelay(context));
        }
        case RETRY_NEXT_HOST -> {
          retryCount.incrementAndGet();
          schedule(this::tryNextHost, retryPolicy.retryDelay(context));
        }
        default -> throw new IllegalStateException("Unknown retry decision " + decision);
      }
    }

    private void retrySameHost(final HostInfo host) {
      if (finished.get()) {
        return;
      }
      final var pool = pools.poolFor(host.getHostId());
      if (pool.isEmpty()) {
        tryNextHost();
        return;
      }
      attempt(host, pool.get());
    }

    private void onExecutionExhausted() {
      if (running.decrementAndGet() > 0) {
        return;
      }
      final List<InetSocketAddress> triedCopy;
      final Map<InetSocketAddress, Throwable> errorsCopy;
      synchronized (this) {
        triedCopy = new ArrayList<>(tried);
        errorsCopy = new LinkedHashMap<>(errors);
      }
      fail(new NoHostAvailableException(triedCopy, errorsCopy, lastError));
    }

    // ---- completion ----

    private void onResult(
        final HostInfo host,
        final ResultMessage message,
        final Map<String, ByteBuffer> payload) {
      if (message instanceof SchemaChangeResult change && settings.isAwaitSchemaAgreementOnDdl()) {
        if (!finished.compareAndSet(false, true)) {
          return;
        }
        cancelTimers();
        schemaAgreement
            .get()
            .handle(
                (ignored, error) -> {
                  if (error != null) {
                    log.warn(
                        "Schema agreement not reached after {}: {}",
                        change.change(),
                        Futures.unwrap(error).getMessage());
                  }
                  return error == null;
                })
            .thenAccept(
                agreed -> complete(ResultSet.empty(info(host, agreed, change, payload))));
        return;
      }
      succeed(toResultSet(host, message, payload));
    }

    private ResultSet toResultSet(
        final HostInfo host,
        final ResultMessage message,
        final Map<String, ByteBuffer> payload) {
      if (message instanceof RowsResult rows) {
        return new ResultSet(
            rows.metadata().columns(),
            Row.of(rows.metadata().columns(), rows.rows()),
            rows.metadata().pagingState(),
            info(host, true, null, payload));
      }
      if (message instanceof SchemaChangeResult change) {
        return ResultSet.empty(info(host, true, change, payload));
      }
      return ResultSet.empty(info(host, true, null, payload));
    }

    private void succeed(final ResultSet resultSet) {
      if (!finished.compareAndSet(false, true)) {
        return;
      }
      cancelTimers();
      complete(resultSet);
    }

    private void fail(final Throwable error) {
      if (!finished.compareAndSet(false, true)) {
        return;
      }
      cancelTimers();
      metrics.recordRequestLatency(settings.getSessionName(), elapsed(), false);
      result.completeExceptionally(error);
    }

    private void complete(final ResultSet resultSet) {
      metrics.recordRequestLatency(settings.getSessionName(), elapsed(), true);
      result.complete(resultSet);
    }

    private ExecutionInfo info(
        final HostInfo coordinator,
        final boolean schemaInAgreement,
        final SchemaChangeResult change,
        final Map<String, ByteBuffer> payload) {
      synchronized (this) {
        return ExecutionInfo.builder()
            .coordinator(coordinator.getConnectAddress())
            .triedHosts(tried)
            .errors(errors)
            .attempts(attempts.get())
            .speculativeExecutions(executionsStarted.get() - 1)
            .schemaInAgreement(schemaInAgreement)
            .schemaChange(change == null ? null : change.change())
            .incomingPayload(payload)
            .build();
      }
    }

    // ---- bookkeeping ----

    private HostInfo nextHost() {
      synchronized (plan) {
        return plan.hasNext() ? plan.next() : null;
      }
    }

    private synchronized void markTried(final InetSocketAddress address) {
      if (!tried.contains(address)) {
        tried.add(address);
      }
    }

    private void recordError(final HostInfo host, final DriverException error) {
      synchronized (this) {
        markTried(host.getConnectAddress());
        errors.put(host.getConnectAddress(), error);
      }
      lastError = error;
    }

    private void schedule(final Runnable task, final Duration delay) {
      if (delay.isZero() || delay.isNegative()) {
        task.run();
        return;
      }
      try {
        final var future = scheduler.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
        synchronized (timers) {
          timers.add(future);
        }
      } catch (final RejectedExecutionException e) {
        fail(new SessionClosedException("Session closed during query execution"));
      }
    }

    private void cancelTimers() {
      synchronized (timers) {
        for (final var timer : timers) {
          timer.cancel(false);
        }
        timers.clear();
      }
    }

    private Duration elapsed() {
      return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private DriverException toDriverException(final HostInfo host, final Throwable error) {
      if (error instanceof DriverException driverException) {
        return driverException;
      }
      return new ConnectionException(host.getConnectAddress(), error.toString(), error, true);
    }
  }
}
