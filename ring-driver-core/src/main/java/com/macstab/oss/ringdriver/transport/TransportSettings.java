/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import java.time.Duration;

import com.macstab.oss.ringdriver.auth.AuthProvider;
import com.macstab.oss.ringdriver.protocol.ProtocolVersion;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Settings shared by every connection a factory opens. */
@Value
@Builder
public class TransportSettings {

  @NonNull @Builder.Default ProtocolVersion protocolVersion = ProtocolVersion.V4;

  @NonNull @Builder.Default Duration connectTimeout = Duration.ofSeconds(5);

  /** Timeout of each handshake round trip. */
  @NonNull @Builder.Default Duration handshakeTimeout = Duration.ofSeconds(5);

  @NonNull @Builder.Default AuthProvider authProvider = AuthProvider.NONE;

  /** Keyspace applied with {@code USE} on pooled connections; null for none. */
  String keyspace;

  @NonNull @Builder.Default String driverName = "ring-driver";

  @NonNull @Builder.Default String driverVersion = "1.0.0";

  @Builder.Default boolean tcpNoDelay = true;

  @Builder.Default boolean keepAlive = true;
}
