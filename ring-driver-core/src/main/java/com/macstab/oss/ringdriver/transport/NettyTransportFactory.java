/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import static lombok.AccessLevel.PRIVATE;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import com.macstab.oss.ringdriver.error.ConnectionException;
import com.macstab.oss.ringdriver.error.DriverException;
import com.macstab.oss.ringdriver.protocol.FrameDecoder;
import com.macstab.oss.ringdriver.protocol.FrameEncoder;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens {@link NettyFrameTransport}s on a shared NIO event loop group.
 *
 * <p><strong>Pipeline:</strong> {@link FrameDecoder} → {@link FrameEncoder} → response handler.
 *
 * <p><strong>Source port binding:</strong> a request with a non-zero {@code localPort} binds that
 * port before connecting; this is how a connection to the shard-aware port selects its shard. A
 * port already in use fails the attempt with a {@link ConnectionException} carrying the bind
 * error, and the pool moves on to another candidate port.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class NettyTransportFactory implements TransportFactory {

  TransportSettings settings;
  EventLoopGroup group;
  Bootstrap bootstrap;

  public NettyTransportFactory(@NonNull final TransportSettings settings) {
    this(settings, new NioEventLoopGroup(0, new DefaultThreadFactory("ring-driver-io", true)));
  }

  NettyTransportFactory(final TransportSettings settings, final EventLoopGroup group) {
    this.settings = settings;
    this.group = group;
    this.bootstrap =
        new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, settings.isTcpNoDelay())
            .option(ChannelOption.SO_KEEPALIVE, settings.isKeepAlive())
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                (int) Math.min(Integer.MAX_VALUE, settings.getConnectTimeout().toMillis()));
  }

  @Override
  public CompletableFuture<FrameTransport> connect(@NonNull final ConnectRequest request) {
    final var result = new CompletableFuture<FrameTransport>();
    final var endpoint = request.endpoint();
    final var holder = new NettyFrameTransport[1];

    final var b =
        bootstrap
            .clone()
            .handler(
                new ChannelInitializer<SocketChannel>() {
                  @Override
                  protected void initChannel(final SocketChannel ch) {
                    final var transport =
                        new NettyFrameTransport(
                            ch, settings.getProtocolVersion(), endpoint, request.eventListener());
                    holder[0] = transport;
                    ch.pipeline()
                        .addLast("frameDecoder", new FrameDecoder())
                        .addLast("frameEncoder", FrameEncoder.INSTANCE)
                        .addLast("responseHandler", transport.handler());
                  }
                });

    final ChannelFuture connectFuture =
        request.localPort() > 0
            ? b.connect(endpoint, new InetSocketAddress(request.localPort()))
            : b.connect(endpoint);

    connectFuture.addListener(
        (ChannelFuture f) -> {
          if (!f.isSuccess()) {
            result.completeExceptionally(
                new ConnectionException(
                    endpoint, "Connect failed: " + f.cause(), f.cause(), false));
            return;
          }
          final var transport = holder[0];
          new ConnectionInitializer(transport, settings, request)
              .initialize()
              .whenComplete(
                  (sharding, error) -> {
                    if (error != null) {
                      transport.close();
                      result.completeExceptionally(asDriverException(endpoint, error));
                      return;
                    }
                    transport.setSharding(sharding);
                    if (log.isDebugEnabled()) {
                      log.debug(
                          "Connected {} from local port {} (shard {})",
                          endpoint,
                          transport.localPort(),
                          sharding.map(s -> String.valueOf(s.shard())).orElse("-"));
                    }
                    result.complete(transport);
                  });
        });
    return result;
  }

  @Override
  public void close() {
    group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
  }

  // ==================== Private Methods ====================

  private static Throwable asDriverException(final InetSocketAddress endpoint, final Throwable e) {
    final var cause = Futures.unwrap(e);
    if (cause instanceof DriverException) {
      return cause;
    }
    return new ConnectionException(endpoint, "Handshake failed: " + cause, cause, false);
  }
}
