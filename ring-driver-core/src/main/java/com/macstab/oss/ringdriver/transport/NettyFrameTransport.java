/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import static lombok.AccessLevel.PRIVATE;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.macstab.oss.ringdriver.error.BusyConnectionException;
import com.macstab.oss.ringdriver.error.ConnectionException;
import com.macstab.oss.ringdriver.error.FrameProtocolException;
import com.macstab.oss.ringdriver.error.RequestTimeoutException;
import com.macstab.oss.ringdriver.protocol.Frame;
import com.macstab.oss.ringdriver.protocol.ProtocolEvent;
import com.macstab.oss.ringdriver.protocol.ProtocolVersion;
import com.macstab.oss.ringdriver.protocol.Request;
import com.macstab.oss.ringdriver.shard.ShardingInfo;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link FrameTransport} over a Netty channel.
 *
 * <p><strong>Correlation:</strong> each request takes a stream id from {@link StreamIds} and a
 * pending entry keyed by that id. The inbound handler completes the entry when the response
 * arrives and only then frees the id. A client-side timeout completes the caller's future early
 * but leaves the entry (and the id) in place until the late response or the close drains it.
 *
 * <p><strong>Events:</strong> frames with a negative stream id are server pushes and go to the
 * listener given at connect time, on the channel's event loop. The listener must not block.
 *
 * <p><strong>Failure:</strong> a {@link FrameProtocolException} while decoding is fatal for this
 * connection only: the channel is closed and every pending request fails with a {@link
 * ConnectionException}.
 */
@Slf4j
@FieldDefaults(level = PRIVATE)
public final class NettyFrameTransport implements FrameTransport {

  final Channel channel;
  final ProtocolVersion version;
  final InetSocketAddress remoteAddress;
  final Consumer<ProtocolEvent> eventListener;
  final StreamIds streamIds = new StreamIds();
  final Map<Integer, Pending> pending = new ConcurrentHashMap<>();
  final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
  final AtomicBoolean closing = new AtomicBoolean();
  volatile Optional<ShardingInfo> sharding = Optional.empty();

  NettyFrameTransport(
      final Channel channel,
      final ProtocolVersion version,
      final InetSocketAddress remoteAddress,
      final Consumer<ProtocolEvent> eventListener) {
    this.channel = channel;
    this.version = version;
    this.remoteAddress = remoteAddress;
    this.eventListener = eventListener;
    channel.closeFuture().addListener(f -> onChannelClosed());
  }

  /** Inbound handler completing pending requests; installed last in the pipeline. */
  ChannelInboundHandlerAdapter handler() {
    return new ResponseHandler();
  }

  void setSharding(final Optional<ShardingInfo> info) {
    this.sharding = info;
  }

  @Override
  public CompletableFuture<Frame> exchange(final Request request, final Duration timeout) {
    if (!isOpen()) {
      return CompletableFuture.failedFuture(
          new ConnectionException(remoteAddress, "Connection closed", null, false));
    }
    if (!request.customPayload().isEmpty() && !version.hasCustomPayload()) {
      return CompletableFuture.failedFuture(
          new IllegalArgumentException(
              "Custom payloads require protocol V4 or later, connection uses " + version));
    }
    final int id = streamIds.acquire();
    if (id < 0) {
      if (log.isDebugEnabled()) {
        log.debug("{} out of stream ids", remoteAddress);
      }
      return CompletableFuture.failedFuture(
          new BusyConnectionException(remoteAddress, streamIds.inUse()));
    }

    final var entry = new Pending(new CompletableFuture<>());
    pending.put(id, entry);
    entry.timeout =
        channel
            .eventLoop()
            .schedule(
                () ->
                    entry.future.completeExceptionally(
                        new RequestTimeoutException(remoteAddress, timeout)),
                timeout.toNanos(),
                TimeUnit.NANOSECONDS);

    channel
        .writeAndFlush(Frame.request(version, id, request))
        .addListener(
            f -> {
              if (!f.isSuccess()) {
                complete(id);
                entry.cancelTimeout();
                entry.future.completeExceptionally(
                    new ConnectionException(remoteAddress, "Write failed", f.cause(), false));
              }
            });
    return entry.future;
  }

  @Override
  public boolean isOpen() {
    return !closing.get() && channel.isActive();
  }

  @Override
  public InetSocketAddress remoteAddress() {
    return remoteAddress;
  }

  @Override
  public int localPort() {
    final var local = channel.localAddress();
    return local instanceof InetSocketAddress inet ? inet.getPort() : 0;
  }

  @Override
  public Optional<ShardingInfo> sharding() {
    return sharding;
  }

  @Override
  public int inFlight() {
    return streamIds.inUse();
  }

  @Override
  public ProtocolVersion version() {
    return version;
  }

  @Override
  public CompletableFuture<Void> closeFuture() {
    return closeFuture;
  }

  @Override
  public CompletableFuture<Void> close() {
    if (closing.compareAndSet(false, true)) {
      channel.close();
    }
    return closeFuture;
  }

  @Override
  public String toString() {
    return "NettyFrameTransport[" + remoteAddress + ", local=" + localPort() + "]";
  }

  // ==================== Private Methods ====================

  private Pending complete(final int id) {
    final var entry = pending.remove(id);
    streamIds.release(id);
    return entry;
  }

  private void onChannelClosed() {
    closing.set(true);
    final var cause = new ConnectionException(remoteAddress, "Connection closed");
    for (final var id : pending.keySet()) {
      final var entry = complete(id);
      if (entry != null) {
        entry.cancelTimeout();
        entry.future.completeExceptionally(cause);
      }
    }
    closeFuture.complete(null);
  }

  private static final class Pending {
    final CompletableFuture<Frame> future;
    volatile ScheduledFuture<?> timeout;

    Pending(final CompletableFuture<Frame> future) {
      this.future = future;
    }

    void cancelTimeout() {
      final var t = timeout;
      if (t != null) {
        t.cancel(false);
      }
    }
  }

  private final class ResponseHandler extends ChannelInboundHandlerAdapter {

    @Override
    public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
      final var frame = (Frame) msg;
      if (frame.streamId() < 0) {
        if (frame.message() instanceof ProtocolEvent event && eventListener != null) {
          eventListener.accept(event);
        }
        return;
      }
      final var entry = complete(frame.streamId());
      if (entry == null) {
        if (log.isDebugEnabled()) {
          log.debug("{} response for unknown stream {}", remoteAddress, frame.streamId());
        }
        return;
      }
      entry.cancelTimeout();
      if (!entry.future.complete(frame) && log.isTraceEnabled()) {
        log.trace("{} late response on stream {} released", remoteAddress, frame.streamId());
      }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
      if (cause instanceof FrameProtocolException
          || cause.getCause() instanceof FrameProtocolException) {
        log.error("{} protocol error, closing connection", remoteAddress, cause);
      } else if (log.isDebugEnabled()) {
        log.debug("{} connection error, closing", remoteAddress, cause);
      }
      close();
    }
  }
}
