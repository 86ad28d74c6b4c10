/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Opens initialized {@link FrameTransport}s.
 *
 * <p>The returned future completes once the handshake (options, startup, authentication, keyspace,
 * event registration) is done, or exceptionally with the failure. A failed connect never leaks a
 * half-open socket.
 */
public interface TransportFactory extends AutoCloseable {

  CompletableFuture<FrameTransport> connect(ConnectRequest request);

  /** Releases I/O threads. Open transports are closed. */
  @Override
  void close();
}
