/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import static lombok.AccessLevel.PRIVATE;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import com.macstab.oss.ringdriver.error.ConnectionException;
import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.shard.ShardCalculator;
import com.macstab.oss.ringdriver.shard.ShardPortAllocator;
import com.macstab.oss.ringdriver.shard.ShardingInfo;
import com.macstab.oss.ringdriver.token.Token;
import com.macstab.oss.ringdriver.transport.ConnectRequest;
import com.macstab.oss.ringdriver.transport.FrameTransport;
import com.macstab.oss.ringdriver.transport.Futures;
import com.macstab.oss.ringdriver.transport.TransportFactory;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Connections to one node, with one slot per shard on shard-per-core servers.
 *
 * <p><strong>Startup:</strong> the first connection always goes to the node's regular port. Its
 * SUPPORTED response tells whether the node is sharded. Sharded nodes get {@code shardCount}
 * slots (one per shard); unsharded nodes get {@code connectionsPerHost} slots. The first
 * connection fills the slot of the shard it landed on.
 *
 * <p><strong>Shard-aware port:</strong> when the node advertises one, the remaining slots are
 * filled by connecting to it from a local port with {@code port % shardCount == shard}. Until one
 * such connection lands on its intended shard, at most one is in flight at a time.
 *
 * <p><strong>NAT fallback (best-effort mode):</strong> when address translation rewrites the
 * source port, connections land on whatever shard the rewritten port maps to. The slot retries
 * such a connection on its reconnection schedule. After {@code maxShardPortMismatches}
 * consecutive mismatches the pool stops targeting shards for this host and fills slots through the
 * regular port instead. A connection that lands on an occupied shard is
 * closed, and the slot that asked for it stops retrying after {@code maxShardPortMismatches} such
 * landings. This bounds the number of attempts instead of reconnecting indefinitely.
 *
 * <p><strong>Unreachable shard-aware port:</strong> a connect failure other than a local bind
 * error disables the shard-aware port for this host; slots are filled through the regular port.
 *
 * <p><strong>Reconnection:</strong> each slot has its own {@link ReconnectionSchedule}; one bad
 * shard never delays another. A pool whose last connection closed and whose reconnect attempt
 * fails reports {@link PoolListener#onPoolDown}. Scheduled attempts are cancelled by {@link
 * #close()}.
 *
 * <p><strong>Locking:</strong> slot state changes under {@code lock}; connects happen outside it.
 */
@Slf4j
@FieldDefaults(level = PRIVATE)
public final class HostConnectionPool {

  @Getter final HostInfo host;
  final TransportFactory factory;
  final PoolConfig config;
  final ReconnectionPolicy reconnectionPolicy;
  final ScheduledExecutorService scheduler;
  final PoolListener listener;
  final DriverMetrics metrics;
  final String sessionName;
  final ConnectionSelectionStrategy selection;
  final ReentrantLock lock = new ReentrantLock();
  final CompletableFuture<Void> ready = new CompletableFuture<>();
  final AtomicInteger shardPortMismatches = new AtomicInteger();
  final AtomicInteger shardAwareAttempts = new AtomicInteger();
  final AtomicInteger connectAttempts = new AtomicInteger();
  final AtomicBoolean probeInFlight = new AtomicBoolean();

  volatile Slot[] slots = new Slot[0];
  volatile ShardingInfo sharding;
  volatile ShardCalculator calculator;
  volatile boolean bestEffort;
  volatile boolean shardPortUnreachable;
  volatile boolean shardPortVerified;
  volatile boolean closed;

  public HostConnectionPool(
      @NonNull final HostInfo host,
      @NonNull final TransportFactory factory,
      @NonNull final PoolConfig config,
      @NonNull final ReconnectionPolicy reconnectionPolicy,
      @NonNull final ScheduledExecutorService scheduler,
      @NonNull final PoolListener listener,
      @NonNull final DriverMetrics metrics,
      @NonNull final String sessionName) {
    this.host = host;
    this.factory = factory;
    this.config = config;
    this.reconnectionPolicy = reconnectionPolicy;
    this.scheduler = scheduler;
    this.listener = listener;
    this.metrics = metrics;
    this.sessionName = sessionName;
    this.selection = config.getConnectionSelection().create();
  }

  /**
   * Opens the first connection and starts filling the remaining slots.
   *
   * @return completes when the pool is ready, exceptionally if the node is unreachable
   */
  public CompletableFuture<Void> init() {
    connectAttempts.incrementAndGet();
    factory
        .connect(ConnectRequest.pooled(host.getConnectAddress()))
        .whenComplete(
            (transport, error) -> {
              if (error != null) {
                onInitialFailure(Futures.unwrap(error));
              } else {
                onInitialConnected(transport);
              }
            });
    return ready;
  }

  /** Completes once the pool reached its minimum coverage. */
  public CompletableFuture<Void> readyFuture() {
    return ready;
  }

  /**
   * Picks a transport for a request. Prefers the transport of the shard owning {@code token};
   * falls back to any open transport when that slot is empty.
   *
   * @param token routing token, may be null
   * @return transport, empty if none is open
   */
  public Optional<FrameTransport> pick(final Token token) {
    final var current = slots;
    final var calc = calculator;
    if (calc != null && token != null) {
      final int shard = calc.shardOf(token);
      if (shard < current.length) {
        final var t = current[shard].transport;
        if (t != null && t.isOpen()) {
          return Optional.of(t);
        }
      }
    }
    final var open = openTransports(current);
    if (open.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(open.get(selection.select(open)));
  }

  /**
   * Like {@link #pick(Token)}, but waits up to the acquire timeout for a pool that is still
   * opening its first connection.
   *
   * @param token routing token, may be null
   * @return transport, or a failed future with a {@link ConnectionException} (request not sent)
   */
  public CompletableFuture<FrameTransport> acquire(final Token token) {
    final var picked = pick(token);
    if (picked.isPresent()) {
      return CompletableFuture.completedFuture(picked.get());
    }
    if (closed || ready.isDone()) {
      return CompletableFuture.failedFuture(noConnection());
    }
    final var timeout = config.getAcquireTimeout();
    return ready
        .copy()
        .orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS)
        .handle((ignored, error) -> pick(token))
        .thenCompose(
            t ->
                t.isPresent()
                    ? CompletableFuture.completedFuture(t.get())
                    : CompletableFuture.failedFuture(noConnection()));
  }

  /** Open transports. */
  public int size() {
    return openTransports(slots).size();
  }

  /** Slots configured for this host: shard count when sharded, connections per host otherwise. */
  public int slotCount() {
    return slots.length;
  }

  /** Shards (or slots) currently holding an open transport. */
  public List<Integer> filledSlots() {
    final List<Integer> filled = new ArrayList<>();
    final var current = slots;
    for (int i = 0; i < current.length; i++) {
      final var t = current[i].transport;
      if (t != null && t.isOpen()) {
        filled.add(i);
      }
    }
    return filled;
  }

  public Optional<ShardingInfo> sharding() {
    return Optional.ofNullable(sharding);
  }

  public boolean isSharded() {
    return calculator != null;
  }

  /** Whether shard targeting was given up for this host after repeated mismatches. */
  public boolean isBestEffort() {
    return bestEffort;
  }

  public boolean isShardPortUnreachable() {
    return shardPortUnreachable;
  }

  /** Connection attempts made to the shard-aware port. */
  public int shardAwareAttempts() {
    return shardAwareAttempts.get();
  }

  /** All connection attempts, initial one included. */
  public int connectAttempts() {
    return connectAttempts.get();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes every transport and cancels pending reconnection attempts. Idempotent.
   *
   * @return completes when all transports are closed
   */
  public CompletableFuture<Void> close() {
    final List<CompletableFuture<Void>> closing = new ArrayList<>();
    lock.lock();
    try {
      if (closed) {
        return CompletableFuture.completedFuture(null);
      }
      closed = true;
      for (final var slot : slots) {
        if (slot.retry != null) {
          slot.retry.cancel(false);
          slot.retry = null;
        }
        if (slot.transport != null) {
          closing.add(slot.transport.close());
          slot.transport = null;
        }
      }
    } finally {
      lock.unlock();
    }
    ready.completeExceptionally(noConnection());
    if (log.isDebugEnabled()) {
      log.debug("Closed pool for {}", host);
    }
    return CompletableFuture.allOf(closing.toArray(new CompletableFuture<?>[0]));
  }

  @Override
  public String toString() {
    return "HostConnectionPool[" + host.getConnectAddress() + ", open=" + size() + "/"
        + slots.length + (bestEffort ? ", best-effort" : "") + "]";
  }

  // ==================== Private Methods ====================

  private void onInitialConnected(final FrameTransport transport) {
    final var info = transport.sharding();
    RuntimeException setupError = null;
    lock.lock();
    try {
      if (closed) {
        transport.close();
        return;
      }
      openSlots(info, transport);
    } catch (final RuntimeException e) {
      slots = new Slot[0];
      sharding = null;
      calculator = null;
      setupError = e;
    } finally {
      lock.unlock();
    }
    if (setupError != null) {
      transport.close();
      onInitialFailure(
          new ConnectionException(
              host.getConnectAddress(),
              "Could not set up pool: " + setupError.getMessage(),
              setupError,
              false));
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug("Pool for {} opened: {} slots, sharding {}", host, slots.length, info);
    }
    fillEmptySlots();
  }

  /** Must hold {@code lock}. */
  private void openSlots(final Optional<ShardingInfo> info, final FrameTransport transport) {
    final boolean sharded = info.isPresent() && config.isShardAware();
    final var calc = sharded ? info.get().calculator() : null;
    final int count =
        sharded ? info.get().shardCount() : Math.max(1, config.getConnectionsPerHost());
    final var created = new Slot[count];
    for (int i = 0; i < count; i++) {
      created[i] = new Slot(i);
    }
    if (sharded) {
      sharding = info.get();
      calculator = calc;
    }
    slots = created;
    install(created[sharded ? info.get().shard() : 0], transport);
  }

  private void onInitialFailure(final Throwable error) {
    log.warn("Could not open pool for {}: {}", host, error.getMessage());
    metrics.recordReconnectionAttempt(sessionName, address(), false);
    ready.completeExceptionally(error);
    if (!closed) {
      listener.onPoolDown(this, error);
    }
  }

  private void fillEmptySlots() {
    final List<Slot> idle = new ArrayList<>();
    lock.lock();
    try {
      if (closed) {
        return;
      }
      for (final var slot : slots) {
        if (slot.isIdle()) {
          idle.add(slot);
        }
      }
    } finally {
      lock.unlock();
    }
    if (idle.isEmpty()) {
      return;
    }
    if (useShardAwarePort() && !shardPortVerified) {
      // one probe at a time until the shard-aware port proved to route correctly
      if (probeInFlight.compareAndSet(false, true) && !connect(idle.get(0))) {
        probeInFlight.set(false);
      }
      return;
    }
    for (final var slot : idle) {
      connect(slot);
    }
  }

  private boolean connect(final Slot slot) {
    final boolean viaShardPort;
    final ConnectRequest request;
    lock.lock();
    try {
      if (closed || slot.transport != null || slot.connecting) {
        return false;
      }
      slot.connecting = true;
      viaShardPort = useShardAwarePort();
      if (viaShardPort) {
        final var info = sharding;
        final int localPort = ShardPortAllocator.randomPort(slot.index, info.shardCount());
        final var endpoint =
            new InetSocketAddress(host.getConnectAddress().getAddress(), info.shardAwarePort());
        request = ConnectRequest.pooled(endpoint, localPort);
        shardAwareAttempts.incrementAndGet();
      } else {
        request = ConnectRequest.pooled(host.getConnectAddress());
      }
    } finally {
      lock.unlock();
    }
    connectAttempts.incrementAndGet();
    factory
        .connect(request)
        .whenComplete(
            (transport, error) -> {
              if (error != null) {
                onAttemptFailed(slot, viaShardPort, Futures.unwrap(error));
              } else {
                onAttemptConnected(slot, viaShardPort, transport);
              }
            });
    return true;
  }

  private void onAttemptConnected(
      final Slot slot, final boolean viaShardPort, final FrameTransport transport) {
    metrics.recordReconnectionAttempt(sessionName, address(), true);
    if (viaShardPort) {
      probeInFlight.set(false);
    }
    final int landed =
        isSharded() ? transport.sharding().map(ShardingInfo::shard).orElse(slot.index) : slot.index;

    boolean fillNow = false;
    lock.lock();
    try {
      slot.connecting = false;
      if (closed) {
        transport.close();
        return;
      }
      if (viaShardPort) {
        if (landed == slot.index) {
          shardPortMismatches.set(0);
          shardPortVerified = true;
          install(slot, transport);
          fillNow = true;
        } else {
          fillNow = onShardMismatch(slot, landed, transport);
        }
      } else if (landed < slots.length && slots[landed].transport == null) {
        install(slots[landed], transport);
        fillNow = landed != slot.index;
      } else {
        transport.close();
        slot.misses++;
        if (slot.misses >= config.getMaxShardPortMismatches()) {
          slot.parked = true;
          if (log.isDebugEnabled()) {
            log.debug(
                "{} slot {} parked after {} occupied landings", host, slot.index, slot.misses);
          }
        } else {
          scheduleRetry(slot);
        }
      }
    } finally {
      lock.unlock();
    }
    if (fillNow) {
      fillEmptySlots();
    }
  }

  /**
   * Must hold {@code lock}. The slot retries on its reconnection schedule until best-effort mode
   * starts.
   *
   * @return whether the pool is in best-effort mode and idle slots should be filled now
   */
  private boolean onShardMismatch(
      final Slot slot, final int landed, final FrameTransport transport) {
    final int mismatches = shardPortMismatches.incrementAndGet();
    if (log.isDebugEnabled()) {
      log.debug(
          "{} connection from port {} for shard {} landed on shard {} ({} consecutive)",
          host,
          transport.localPort(),
          slot.index,
          landed,
          mismatches);
    }
    if (landed < slots.length && slots[landed].transport == null) {
      install(slots[landed], transport);
    } else {
      transport.close();
    }
    if (mismatches >= config.getMaxShardPortMismatches() && !bestEffort) {
      bestEffort = true;
      log.info(
          "Shard-aware port of {} routes connections to unexpected shards ({} mismatches); "
              + "address translation suspected, switching to best-effort shard mode",
          host,
          mismatches);
      metrics.recordShardAwarenessDisabled(sessionName, address());
    }
    if (bestEffort) {
      return true;
    }
    scheduleRetry(slot);
    return false;
  }

  private void onAttemptFailed(final Slot slot, final boolean viaShardPort, final Throwable error) {
    metrics.recordReconnectionAttempt(sessionName, address(), false);
    if (viaShardPort) {
      probeInFlight.set(false);
    }
    lock.lock();
    try {
      slot.connecting = false;
    } finally {
      lock.unlock();
    }
    if (closed) {
      return;
    }
    if (viaShardPort && !isBindFailure(error)) {
      if (!shardPortUnreachable) {
        shardPortUnreachable = true;
        log.warn(
            "Shard-aware port of {} unreachable ({}), using the regular port",
            host,
            error.getMessage());
      }
      fillEmptySlots();
      return;
    }
    if (size() == 0) {
      log.warn(
          "{} has no open connection left and reconnecting failed: {}",
          host,
          error.getMessage());
      listener.onPoolDown(this, error);
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug("{} slot {} connect failed: {}", host, slot.index, error.getMessage());
    }
    lock.lock();
    try {
      scheduleRetry(slot);
    } finally {
      lock.unlock();
    }
  }

  private void onTransportClosed(final Slot slot, final FrameTransport transport) {
    lock.lock();
    try {
      if (slot.transport != transport) {
        return;
      }
      slot.transport = null;
      slot.misses = 0;
      slot.parked = false;
      if (closed) {
        return;
      }
      if (log.isDebugEnabled()) {
        log.debug("{} lost connection in slot {}", host, slot.index);
      }
      scheduleRetry(slot);
    } finally {
      lock.unlock();
    }
    listener.onConnectionCountChanged(this, size());
    metrics.setOpenConnections(sessionName, address(), size());
  }

  /** Must hold {@code lock}. */
  private void install(final Slot slot, final FrameTransport transport) {
    slot.transport = transport;
    slot.schedule = null;
    slot.misses = 0;
    transport.closeFuture().thenRun(() -> onTransportClosed(slot, transport));
    final int open = openTransports(slots).size();
    metrics.setOpenConnections(sessionName, address(), open);
    listener.onConnectionCountChanged(this, open);
    final int coverage = Math.min(Math.max(1, config.getMinShardCoverage()), slots.length);
    if (!ready.isDone() && open >= coverage) {
      ready.complete(null);
    }
  }

  /** Must hold {@code lock}. */
  private void scheduleRetry(final Slot slot) {
    if (closed || slot.retry != null) {
      return;
    }
    if (slot.schedule == null) {
      slot.schedule = reconnectionPolicy.newSchedule();
    }
    final var delay = slot.schedule.nextDelay();
    slot.retry =
        scheduler.schedule(
            () -> {
              lock.lock();
              try {
                slot.retry = null;
              } finally {
                lock.unlock();
              }
              fillEmptySlots();
            },
            delay.toNanos(),
            TimeUnit.NANOSECONDS);
  }

  private boolean useShardAwarePort() {
    final var info = sharding;
    return info != null
        && config.isShardAware()
        && info.hasShardAwarePort()
        && !bestEffort
        && !shardPortUnreachable;
  }

  private static boolean isBindFailure(final Throwable error) {
    for (var e = error; e != null; e = e.getCause()) {
      if (e instanceof BindException) {
        return true;
      }
    }
    return false;
  }

  private static List<FrameTransport> openTransports(final Slot[] current) {
    final List<FrameTransport> open = new ArrayList<>(current.length);
    for (final var slot : current) {
      final var t = slot.transport;
      if (t != null && t.isOpen()) {
        open.add(t);
      }
    }
    return open;
  }

  private ConnectionException noConnection() {
    return new ConnectionException(
        host.getConnectAddress(), "No open connection in pool", null, false);
  }

  private String address() {
    return host.getConnectAddress().toString();
  }

  private static final class Slot {
    final int index;
    volatile FrameTransport transport;
    boolean connecting;
    boolean parked;
    int misses;
    ReconnectionSchedule schedule;
    ScheduledFuture<?> retry;

    Slot(final int index) {
      this.index = index;
    }

    boolean isIdle() {
      return transport == null && !connecting && !parked && retry == null;
    }
  }
}
