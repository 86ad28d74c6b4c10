/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.session;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.ringdriver.auth.AuthProvider;
import com.macstab.oss.ringdriver.control.AddressTranslator;
import com.macstab.oss.ringdriver.control.ControlConnectionSettings;
import com.macstab.oss.ringdriver.control.MetadataSource;
import com.macstab.oss.ringdriver.control.SystemTablesMetadataSource;
import com.macstab.oss.ringdriver.exec.ExecutorSettings;
import com.macstab.oss.ringdriver.host.HostFilter;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.policy.HostSelectionPolicyFactory;
import com.macstab.oss.ringdriver.pool.ExponentialReconnectionPolicy;
import com.macstab.oss.ringdriver.pool.PoolConfig;
import com.macstab.oss.ringdriver.pool.ReconnectionPolicy;
import com.macstab.oss.ringdriver.protocol.ProtocolVersion;
import com.macstab.oss.ringdriver.query.Consistency;
import com.macstab.oss.ringdriver.query.StatementDefaults;
import com.macstab.oss.ringdriver.retry.DefaultRetryPolicy;
import com.macstab.oss.ringdriver.retry.RetryPolicy;
import com.macstab.oss.ringdriver.speculative.NoSpeculativeExecutionPolicy;
import com.macstab.oss.ringdriver.speculative.SpeculativeExecutionPolicy;
import com.macstab.oss.ringdriver.transport.TransportFactory;
import com.macstab.oss.ringdriver.transport.TransportSettings;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable configuration of a {@link Session}.
 *
 * <pre>{@code
 * SessionConfig config = SessionConfig.builder()
 *     .contactPoint("10.0.0.1")
 *     .contactPoint("10.0.0.2:19042")
 *     .keyspace("app")
 *     .localDatacenter("dc1")
 *     .build();
 * try (Session session = RingDriver.connect(config)) {
 *   ...
 * }
 * }</pre>
 *
 * <p>Every option has a default; only the contact points are required.
 */
@Value
@Builder(toBuilder = true)
public class SessionConfig {

  public static final int DEFAULT_PORT = 9042;

  /** {@code host} or {@code host:port}; the port defaults to {@link #port}. */
  @Singular List<String> contactPoints;

  @Builder.Default int port = DEFAULT_PORT;

  /** Keyspace set on every connection; null for none. */
  String keyspace;

  /** Datacenter preferred by the default policy; null to treat all datacenters alike. */
  String localDatacenter;

  @NonNull @Builder.Default ProtocolVersion protocolVersion = ProtocolVersion.V4;

  @NonNull @Builder.Default Consistency consistency = Consistency.QUORUM;

  @NonNull @Builder.Default Consistency serialConsistency = Consistency.SERIAL;

  @Builder.Default int pageSize = 5000;

  @NonNull @Builder.Default Duration connectTimeout = Duration.ofSeconds(5);

  /** Per-attempt timeout of a request. */
  @NonNull @Builder.Default Duration requestTimeout = Duration.ofSeconds(12);

  @NonNull @Builder.Default PoolConfig poolConfig = PoolConfig.defaults();

  @NonNull @Builder.Default
  ReconnectionPolicy reconnectionPolicy =
      new ExponentialReconnectionPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), true);

  /** Null selects {@link HostSelectionPolicyFactory#defaultPolicy(String)}. */
  HostSelectionPolicyFactory hostSelectionPolicy;

  @NonNull @Builder.Default RetryPolicy retryPolicy = new DefaultRetryPolicy();

  @NonNull @Builder.Default
  SpeculativeExecutionPolicy speculativeExecutionPolicy = NoSpeculativeExecutionPolicy.INSTANCE;

  @NonNull @Builder.Default HostFilter hostFilter = HostFilter.acceptAll();

  @NonNull @Builder.Default AuthProvider authProvider = AuthProvider.NONE;

  @NonNull @Builder.Default AddressTranslator addressTranslator = AddressTranslator.IDENTITY;

  @NonNull @Builder.Default Duration topologyRefreshInterval = Duration.ofSeconds(60);

  @NonNull @Builder.Default Duration eventDebounceDelay = Duration.ofSeconds(1);

  @NonNull @Builder.Default Duration schemaAgreementTimeout = Duration.ofSeconds(60);

  @NonNull @Builder.Default Duration schemaAgreementPollInterval = Duration.ofMillis(200);

  @Builder.Default boolean awaitSchemaAgreementOnDdl = true;

  @NonNull @Builder.Default Duration downedHostReconnectInterval = Duration.ofSeconds(60);

  @NonNull @Builder.Default DriverMetrics metrics = DriverMetrics.NOOP;

  @NonNull @Builder.Default String sessionName = "default";

  /** Null creates a Netty transport factory owned (and closed) by the session. */
  TransportFactory transportFactory;

  @NonNull @Builder.Default MetadataSource metadataSource = new SystemTablesMetadataSource();

  /**
   * Resolves the contact points.
   *
   * @return socket addresses, in configuration order
   * @throws IllegalArgumentException if no contact point is configured or a port is malformed
   */
  public List<InetSocketAddress> resolveContactPoints() {
    if (contactPoints.isEmpty()) {
      throw new IllegalArgumentException("At least one contact point is required");
    }
    final List<InetSocketAddress> resolved = new ArrayList<>(contactPoints.size());
    for (final var contactPoint : contactPoints) {
      final int colon = contactPoint.lastIndexOf(':');
      // more than one colon: IPv6 literal without port
      if (colon > 0 && contactPoint.indexOf(':') == colon) {
        final var host = contactPoint.substring(0, colon);
        final var portText = contactPoint.substring(colon + 1);
        try {
          resolved.add(new InetSocketAddress(host, Integer.parseInt(portText)));
        } catch (final NumberFormatException e) {
          throw new IllegalArgumentException("Invalid port in contact point " + contactPoint, e);
        }
      } else {
        resolved.add(new InetSocketAddress(contactPoint, port));
      }
    }
    return resolved;
  }

  public TransportSettings transportSettings() {
    return TransportSettings.builder()
        .protocolVersion(protocolVersion)
        .connectTimeout(connectTimeout)
        .handshakeTimeout(connectTimeout)
        .authProvider(authProvider)
        .keyspace(keyspace)
        .build();
  }

  public ControlConnectionSettings controlConnectionSettings() {
    return ControlConnectionSettings.builder()
        .requestTimeout(requestTimeout)
        .refreshInterval(topologyRefreshInterval)
        .debounceDelay(eventDebounceDelay)
        .schemaAgreementPollInterval(schemaAgreementPollInterval)
        .build();
  }

  public ExecutorSettings executorSettings() {
    return ExecutorSettings.builder()
        .statementDefaults(new StatementDefaults(consistency, serialConsistency, pageSize))
        .sessionKeyspace(keyspace)
        .requestTimeout(requestTimeout)
        .awaitSchemaAgreementOnDdl(awaitSchemaAgreementOnDdl)
        .sessionName(sessionName)
        .build();
  }

  public HostSelectionPolicyFactory effectiveHostSelectionPolicy() {
    return hostSelectionPolicy != null
        ? hostSelectionPolicy
        : HostSelectionPolicyFactory.defaultPolicy(localDatacenter);
  }
}
