/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.spring3;

import static com.macstab.oss.ringdriver.testutil.TestHosts.host;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.macstab.oss.ringdriver.auth.AuthProvider;
import com.macstab.oss.ringdriver.auth.PlainTextAuthProvider;
import com.macstab.oss.ringdriver.control.TopologyInfo;
import com.macstab.oss.ringdriver.metrics.DriverMetrics;
import com.macstab.oss.ringdriver.metrics.autoconfigure.RingDriverMetricsAutoConfiguration;
import com.macstab.oss.ringdriver.metrics.micrometer.MicrometerDriverMetrics;
import com.macstab.oss.ringdriver.pool.ConnectionSelection;
import com.macstab.oss.ringdriver.protocol.ProtocolVersion;
import com.macstab.oss.ringdriver.query.Consistency;
import com.macstab.oss.ringdriver.retry.DefaultRetryPolicy;
import com.macstab.oss.ringdriver.session.Session;
import com.macstab.oss.ringdriver.session.SessionConfig;
import com.macstab.oss.ringdriver.speculative.ConstantSpeculativeExecutionPolicy;
import com.macstab.oss.ringdriver.speculative.NoSpeculativeExecutionPolicy;
import com.macstab.oss.ringdriver.testutil.FakeMetadataSource;
import com.macstab.oss.ringdriver.testutil.FakeTransportFactory;
import com.macstab.oss.ringdriver.token.Murmur3Partitioner;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link RingDriverAutoConfiguration}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>{@link ApplicationContextRunner} with the metrics auto-configuration alongside
 *   <li>Property binding checked on the resulting {@link SessionConfig}
 *   <li>Session creation against in-memory transports and metadata from the core test fixtures
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("RingDriverAutoConfiguration")
class RingDriverAutoConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  RingDriverMetricsAutoConfiguration.class, RingDriverAutoConfiguration.class));

  @Nested
  @DisplayName("Session configuration")
  class SessionConfiguration {

    @Test
    @DisplayName("defaults without any property")
    void sessionConfig_NoProperties_Defaults() {
      // Arrange & Act
      contextRunner.run(
          context -> {
            // Assert
            final var config = context.getBean(SessionConfig.class);
            assertThat(config.getContactPoints()).isEmpty();
            assertThat(config.getConsistency()).isEqualTo(Consistency.QUORUM);
            assertThat(config.getSpeculativeExecutionPolicy())
                .isSameAs(NoSpeculativeExecutionPolicy.INSTANCE);
            assertThat(config.getAuthProvider()).isSameAs(AuthProvider.NONE);
            assertThat(config.getMetrics()).isSameAs(DriverMetrics.NOOP);
            assertThat(config.getTransportFactory()).isNull();
          });
    }

    @Test
    @DisplayName("maps session and pool properties")
    void sessionConfig_Properties_Mapped() {
      // Arrange & Act
      contextRunner
          .withPropertyValues(
              "ringdriver.port=19042",
              "ringdriver.keyspace=app",
              "ringdriver.local-datacenter=dc2",
              "ringdriver.session-name=orders",
              "ringdriver.protocol-version=V5",
              "ringdriver.consistency=LOCAL_QUORUM",
              "ringdriver.page-size=100",
              "ringdriver.request-timeout=3s",
              "ringdriver.pool.connections-per-host=4",
              "ringdriver.pool.shard-aware=false",
              "ringdriver.pool.connection-selection=LEAST_IN_FLIGHT",
              "ringdriver.topology.event-debounce-delay=250ms",
              "ringdriver.schema-agreement.await-on-ddl=false")
          .run(
              context -> {
                // Assert
                final var config = context.getBean(SessionConfig.class);
                assertThat(config.getPort()).isEqualTo(19042);
                assertThat(config.getKeyspace()).isEqualTo("app");
                assertThat(config.getLocalDatacenter()).isEqualTo("dc2");
                assertThat(config.getSessionName()).isEqualTo("orders");
                assertThat(config.getProtocolVersion()).isEqualTo(ProtocolVersion.V5);
                assertThat(config.getConsistency()).isEqualTo(Consistency.LOCAL_QUORUM);
                assertThat(config.getPageSize()).isEqualTo(100);
                assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(3));
                assertThat(config.getPoolConfig().getConnectionsPerHost()).isEqualTo(4);
                assertThat(config.getPoolConfig().isShardAware()).isFalse();
                assertThat(config.getPoolConfig().getConnectionSelection())
                    .isEqualTo(ConnectionSelection.LEAST_IN_FLIGHT);
                assertThat(config.getEventDebounceDelay()).isEqualTo(Duration.ofMillis(250));
                assertThat(config.isAwaitSchemaAgreementOnDdl()).isFalse();
              });
    }

    @Test
    @DisplayName("maps retry, speculative execution and credentials")
    void sessionConfig_PolicyProperties_Mapped() {
      // Arrange & Act
      contextRunner
          .withPropertyValues(
              "ringdriver.retry.max-retries=5",
              "ringdriver.retry.retry-non-idempotent-write-timeouts=true",
              "ringdriver.speculative-execution.enabled=true",
              "ringdriver.speculative-execution.delay=40ms",
              "ringdriver.speculative-execution.max-executions=2",
              "ringdriver.auth.username=app",
              "ringdriver.auth.password=secret")
          .run(
              context -> {
                // Assert
                final var config = context.getBean(SessionConfig.class);
                assertThat(config.getRetryPolicy())
                    .isInstanceOfSatisfying(
                        DefaultRetryPolicy.class,
                        retry -> {
                          assertThat(retry.getMaxRetries()).isEqualTo(5);
                          assertThat(retry.isRetryNonIdempotentWriteTimeouts()).isTrue();
                        });
                assertThat(config.getSpeculativeExecutionPolicy())
                    .isInstanceOfSatisfying(
                        ConstantSpeculativeExecutionPolicy.class,
                        speculative -> {
                          assertThat(speculative.getDelay()).isEqualTo(Duration.ofMillis(40));
                          assertThat(speculative.getMaxSpeculativeExecutions()).isEqualTo(2);
                        });
                assertThat(config.getAuthProvider()).isInstanceOf(PlainTextAuthProvider.class);
              });
    }

    @Test
    @DisplayName("fails startup when a username has no password")
    void sessionConfig_UsernameWithoutPassword_Fails() {
      // Arrange & Act
      contextRunner
          .withPropertyValues("ringdriver.auth.username=app")
          .run(
              context -> {
                // Assert
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .rootCause()
                    .hasMessageContaining("ringdriver.auth.password");
              });
    }

    @Test
    @DisplayName("uses Micrometer metrics when a registry exists")
    void sessionConfig_MeterRegistry_MicrometerMetrics() {
      // Arrange & Act
      contextRunner
          .withUserConfiguration(MeterRegistryConfiguration.class)
          .run(
              context -> {
                // Assert
                assertThat(context.getBean(SessionConfig.class).getMetrics())
                    .isInstanceOf(MicrometerDriverMetrics.class);
              });
    }

    @Test
    @DisplayName("applies customizers after the properties")
    void sessionConfig_Customizer_Applied() {
      // Arrange & Act
      contextRunner
          .withPropertyValues("ringdriver.page-size=100")
          .withUserConfiguration(CustomizerConfiguration.class)
          .run(
              context -> {
                // Assert
                final var config = context.getBean(SessionConfig.class);
                assertThat(config.getPageSize()).isEqualTo(250);
                assertThat(config.getSessionName()).isEqualTo("customized");
              });
    }

    @Test
    @DisplayName("keeps a user-defined SessionConfig")
    void sessionConfig_UserBean_Kept() {
      // Arrange & Act
      contextRunner
          .withPropertyValues("ringdriver.page-size=100")
          .withUserConfiguration(UserSessionConfigConfiguration.class)
          .run(
              context -> {
                // Assert
                assertThat(context).hasSingleBean(SessionConfig.class);
                assertThat(context.getBean(SessionConfig.class).getPageSize()).isEqualTo(10);
              });
    }
  }

  @Nested
  @DisplayName("Session")
  class SessionBean {

    @Test
    @DisplayName("is not created without contact points")
    void session_NoContactPoints_Absent() {
      // Arrange & Act
      contextRunner
          .withUserConfiguration(FakeClusterConfiguration.class)
          .run(
              context -> {
                // Assert
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(SessionConfig.class);
                assertThat(context).doesNotHaveBean(Session.class);
              });
    }

    @Test
    @DisplayName("connects through the provided transport and metadata beans")
    void session_ContactPoints_Connected() {
      // Arrange & Act
      contextRunner
          .withUserConfiguration(FakeClusterConfiguration.class)
          .withPropertyValues("ringdriver.contact-points=10.0.0.1", "ringdriver.session-name=app")
          .run(
              context -> {
                // Assert
                assertThat(context).hasSingleBean(Session.class);
                final var session = context.getBean(Session.class);
                assertThat(session.getName()).isEqualTo("app");
                assertThat(context.getBean(SessionConfig.class).getContactPoints())
                    .containsExactly("10.0.0.1");
                assertThat(session.getHosts().size()).isEqualTo(2);
                assertThat(session.isClosed()).isFalse();
                assertThat(context.getBean(FakeTransportFactory.class).requests()).isNotEmpty();
              });
    }

    @Test
    @DisplayName("is closed with the application context")
    void session_ContextClosed_SessionClosed() {
      // Arrange
      final Session[] captured = new Session[1];

      // Act
      contextRunner
          .withUserConfiguration(FakeClusterConfiguration.class)
          .withPropertyValues("ringdriver.contact-points=10.0.0.1")
          .run(context -> captured[0] = context.getBean(Session.class));

      // Assert
      assertThat(captured[0]).isNotNull();
      assertThat(captured[0].isClosed()).isTrue();
    }
  }

  /** In-memory cluster of two nodes. */
  @Configuration
  static class FakeClusterConfiguration {

    @Bean
    FakeTransportFactory fakeTransportFactory() {
      return FakeTransportFactory.voidResults();
    }

    @Bean
    FakeMetadataSource fakeMetadataSource() {
      return new FakeMetadataSource(
          new TopologyInfo(Murmur3Partitioner.NAME, host(1, "0"), List.of(host(2, "100"))));
    }
  }

  /** Provides a {@link SimpleMeterRegistry}. */
  @Configuration
  static class MeterRegistryConfiguration {

    @Bean
    SimpleMeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  /** Overrides bound properties. */
  @Configuration
  static class CustomizerConfiguration {

    @Bean
    SessionConfigCustomizer pageSizeCustomizer() {
      return builder -> builder.pageSize(250).sessionName("customized");
    }
  }

  /** User-defined session configuration. */
  @Configuration
  static class UserSessionConfigConfiguration {

    @Bean
    SessionConfig sessionConfig() {
      return SessionConfig.builder().pageSize(10).build();
    }
  }
}
