/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.macstab.oss.ringdriver.error.BusyConnectionException;
import com.macstab.oss.ringdriver.error.ConnectionException;
import com.macstab.oss.ringdriver.error.RequestTimeoutException;
import com.macstab.oss.ringdriver.protocol.Frame;
import com.macstab.oss.ringdriver.protocol.Message;
import com.macstab.oss.ringdriver.protocol.ProtocolVersion;
import com.macstab.oss.ringdriver.protocol.Request;
import com.macstab.oss.ringdriver.shard.ShardingInfo;

/**
 * One established, initialized connection to a node.
 *
 * <p>Requests are multiplexed over stream ids; many may be in flight at once. Lifecycle
 * transitions (connect, handshake, close) are serialized by the implementation.
 *
 * <p>The future returned by {@link #send(Request, Duration)} completes with the decoded response,
 * including ERROR responses: turning those into exceptions is the caller's concern. It completes
 * exceptionally with:
 *
 * <ul>
 *   <li>{@link BusyConnectionException} when no stream id is free (request not sent)
 *   <li>{@link ConnectionException} when the connection is closed or the write fails
 *   <li>{@link RequestTimeoutException} when no response arrives in time
 * </ul>
 */
public interface FrameTransport {

  /**
   * Sends a request and completes with the whole response frame, so its header flags and custom
   * payload are visible. Fails like {@link #send(Request, Duration)}, and with {@link
   * IllegalArgumentException} when the request carries a custom payload the negotiated version
   * cannot (request not sent).
   *
   * @param request request
   * @param timeout per-request timeout
   * @return response frame
   */
  CompletableFuture<Frame> exchange(Request request, Duration timeout);

  default CompletableFuture<Message> send(final Request request, final Duration timeout) {
    return exchange(request, timeout).thenApply(Frame::message);
  }

  boolean isOpen();

  InetSocketAddress remoteAddress();

  /** Local (source) port of the connection. */
  int localPort();

  /** Sharding info the node returned in SUPPORTED, empty for unsharded servers. */
  Optional<ShardingInfo> sharding();

  /** Requests awaiting a response, including ones the caller already gave up on. */
  int inFlight();

  ProtocolVersion version();

  /** Completes once the connection is closed, by either side. */
  CompletableFuture<Void> closeFuture();

  /**
   * Closes the connection. Pending requests fail with {@link ConnectionException}. Idempotent.
   *
   * @return {@link #closeFuture()}
   */
  CompletableFuture<Void> close();
}
