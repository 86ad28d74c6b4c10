/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.spring3;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.util.StringUtils;

import com.macstab.oss.ringdriver.auth.AuthProvider;
import com.macstab.oss.ringdriver.auth.PlainTextAuthProvider;
import com.macstab.oss.ringdriver.control.MetadataSource;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.pool.ExponentialReconnectionPolicy;
import com.macstab.oss.ringdriver.pool.PoolConfig;
import com.macstab.oss.ringdriver.retry.DefaultRetryPolicy;
import com.macstab.oss.ringdriver.session.RingDriver;
import com.macstab.oss.ringdriver.session.Session;
import com.macstab.oss.ringdriver.session.SessionConfig;
import com.macstab.oss.ringdriver.speculative.ConstantSpeculativeExecutionPolicy;
import com.macstab.oss.ringdriver.speculative.NoSpeculativeExecutionPolicy;
import com.macstab.oss.ringdriver.speculative.SpeculativeExecutionPolicy;
import com.macstab.oss.ringdriver.transport.TransportFactory;

import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration of a ring driver {@link Session}.
 *
 * <p>Always contributes a {@link SessionConfig} built from {@link RingDriverProperties}; the
 * {@link Session} itself is only created when {@code ringdriver.contact-points} is set. Either
 * bean can be replaced by declaring one.
 *
 * <p>Optional beans picked up:
 *
 * <ul>
 *   <li>{@link DriverMetrics} - from the metrics module, Micrometer-backed when a registry exists
 *   <li>{@link TransportFactory} - replaces the Netty transport owned by the session
 *   <li>{@link MetadataSource} - replaces the system table reader
 *   <li>{@link SessionConfigCustomizer} - applied last, in order
 * </ul>
 *
 * <pre>{@code
 * ringdriver:
 *   contact-points: 10.0.0.1, 10.0.0.2
 *   local-datacenter: dc1
 *   keyspace: app
 * }</pre>
 *
 * @see RingDriverProperties
 */
@Slf4j
@AutoConfiguration(afterName = RingDriverAutoConfiguration.METRICS_AUTO_CONFIGURATION)
@EnableConfigurationProperties(RingDriverProperties.class)
public class RingDriverAutoConfiguration {

  static final String METRICS_AUTO_CONFIGURATION =
      "com.macstab.oss.ringdriver.metrics.autoconfigure.RingDriverMetricsAutoConfiguration";

  /**
   * Session configuration from properties and customizers.
   *
   * @param properties {@code ringdriver.*} properties
   * @param metrics metrics collector (optional)
   * @param transportFactory transport override (optional)
   * @param metadataSource metadata override (optional)
   * @param customizers configuration customizers (optional)
   * @return session configuration
   */
  @Bean
  @ConditionalOnMissingBean
  public SessionConfig ringDriverSessionConfig(
      final RingDriverProperties properties,
      final ObjectProvider<DriverMetrics> metrics,
      final ObjectProvider<TransportFactory> transportFactory,
      final ObjectProvider<MetadataSource> metadataSource,
      final ObjectProvider<SessionConfigCustomizer> customizers) {

    final var builder =
        SessionConfig.builder()
            .contactPoints(properties.getContactPoints())
            .port(properties.getPort())
            .sessionName(properties.getSessionName())
            .keyspace(emptyToNull(properties.getKeyspace()))
            .localDatacenter(emptyToNull(properties.getLocalDatacenter()))
            .protocolVersion(properties.getProtocolVersion())
            .consistency(properties.getConsistency())
            .serialConsistency(properties.getSerialConsistency())
            .pageSize(properties.getPageSize())
            .connectTimeout(properties.getConnectTimeout())
            .requestTimeout(properties.getRequestTimeout())
            .poolConfig(poolConfig(properties.getPool()))
            .reconnectionPolicy(
                new ExponentialReconnectionPolicy(
                    properties.getReconnection().getBaseDelay(),
                    properties.getReconnection().getMaxDelay(),
                    properties.getReconnection().isJitter()))
            .retryPolicy(
                new DefaultRetryPolicy(
                    properties.getRetry().getMaxRetries(),
                    properties.getRetry().isRetryNonIdempotentWriteTimeouts()))
            .speculativeExecutionPolicy(speculativePolicy(properties.getSpeculativeExecution()))
            .authProvider(authProvider(properties.getAuth()))
            .topologyRefreshInterval(properties.getTopology().getRefreshInterval())
            .eventDebounceDelay(properties.getTopology().getEventDebounceDelay())
            .downedHostReconnectInterval(properties.getTopology().getDownedHostReconnectInterval())
            .schemaAgreementTimeout(properties.getSchemaAgreement().getTimeout())
            .schemaAgreementPollInterval(properties.getSchemaAgreement().getPollInterval())
            .awaitSchemaAgreementOnDdl(properties.getSchemaAgreement().isAwaitOnDdl());

    metrics.ifAvailable(builder::metrics);
    transportFactory.ifAvailable(builder::transportFactory);
    metadataSource.ifAvailable(builder::metadataSource);
    customizers.orderedStream().forEach(customizer -> customizer.customize(builder));

    return builder.build();
  }

  /**
   * Connected session, closed with the application context.
   *
   * @param config session configuration
   * @return ready session
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @Conditional(OnContactPointsCondition.class)
  public Session ringDriverSession(final SessionConfig config) {
    final var session = RingDriver.connect(config);

    if (log.isInfoEnabled()) {
      log.info(
          "Ring driver session '{}' connected: {} hosts, contact points={}, keyspace={}",
          config.getSessionName(),
          Integer.valueOf(session.getHosts().size()),
          config.getContactPoints(),
          config.getKeyspace());
    }

    return session;
  }

  private static PoolConfig poolConfig(final RingDriverProperties.Pool pool) {
    return PoolConfig.builder()
        .connectionsPerHost(pool.getConnectionsPerHost())
        .shardAware(pool.isShardAware())
        .maxShardPortMismatches(pool.getMaxShardPortMismatches())
        .minShardCoverage(pool.getMinShardCoverage())
        .acquireTimeout(pool.getAcquireTimeout())
        .connectionSelection(pool.getConnectionSelection())
        .build();
  }

  private static SpeculativeExecutionPolicy speculativePolicy(
      final RingDriverProperties.SpeculativeExecution speculative) {
    if (!speculative.isEnabled()) {
      return NoSpeculativeExecutionPolicy.INSTANCE;
    }
    return new ConstantSpeculativeExecutionPolicy(
        speculative.getDelay(), speculative.getMaxExecutions());
  }

  private static AuthProvider authProvider(final RingDriverProperties.Auth auth) {
    if (!StringUtils.hasText(auth.getUsername())) {
      return AuthProvider.NONE;
    }
    if (auth.getPassword() == null) {
      throw new IllegalStateException(
          "ringdriver.auth.password is required when ringdriver.auth.username is set");
    }
    return new PlainTextAuthProvider(
        auth.getUsername(), auth.getPassword(), auth.getAllowedAuthenticators());
  }

  private static String emptyToNull(final String value) {
    return StringUtils.hasText(value) ? value : null;
  }
}
