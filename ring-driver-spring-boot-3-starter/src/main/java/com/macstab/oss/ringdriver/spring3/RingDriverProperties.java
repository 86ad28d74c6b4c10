/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.spring3;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.ringdriver.pool.ConnectionSelection;
import com.macstab.oss.ringdriver.protocol.ProtocolVersion;
import com.macstab.oss.ringdriver.query.Consistency;

import lombok.Getter;
import lombok.Setter;

/**
 * Session configuration properties.
 *
 * <pre>{@code
 * ringdriver:
 *   contact-points: 10.0.0.1, 10.0.0.2:19042
 *   keyspace: app
 *   local-datacenter: dc1
 *   consistency: LOCAL_QUORUM
 *   pool:
 *     connections-per-host: 2
 *     shard-aware: true
 *   speculative-execution:
 *     enabled: true
 *     delay: 50ms
 *     max-executions: 2
 *   auth:
 *     username: app
 *     password: secret
 * }</pre>
 *
 * <p>Defaults match {@code SessionConfig}. The session bean is only created when {@code
 * contact-points} is set.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ringdriver")
public class RingDriverProperties {

  public static final int MIN_CONNECTIONS_PER_HOST = 1;
  public static final int MAX_CONNECTIONS_PER_HOST = 64;

  /** {@code host} or {@code host:port}. */
  private List<String> contactPoints = new ArrayList<>();

  /** Port of contact points given without one. */
  private int port = 9042;

  private String sessionName = "default";

  private String keyspace;

  /** Datacenter preferred by the default routing policy. */
  private String localDatacenter;

  private ProtocolVersion protocolVersion = ProtocolVersion.V4;

  private Consistency consistency = Consistency.QUORUM;

  private Consistency serialConsistency = Consistency.SERIAL;

  private int pageSize = 5000;

  private Duration connectTimeout = Duration.ofSeconds(5);

  /** Per-attempt request timeout. */
  private Duration requestTimeout = Duration.ofSeconds(12);

  private Pool pool = new Pool();

  private Reconnection reconnection = new Reconnection();

  private Retry retry = new Retry();

  private SpeculativeExecution speculativeExecution = new SpeculativeExecution();

  private Topology topology = new Topology();

  private SchemaAgreement schemaAgreement = new SchemaAgreement();

  private Auth auth = new Auth();

  /** Per-host connection pool. */
  @Getter
  @Setter
  public static class Pool {

    /**
     * Connections per host without sharding information. Values outside 1-64 are clamped.
     * Sharded hosts get one connection per shard.
     */
    private int connectionsPerHost = 2;

    /** Keep one connection per shard and use the shard-aware port. */
    private boolean shardAware = true;

    /** Wrong-shard landings on the shard-aware port before falling back to best effort. */
    private int maxShardPortMismatches = 3;

    private int minShardCoverage = 1;

    private Duration acquireTimeout = Duration.ofSeconds(1);

    private ConnectionSelection connectionSelection = ConnectionSelection.ROUND_ROBIN;

    public void setConnectionsPerHost(final int connectionsPerHost) {
      final int capped = Math.min(connectionsPerHost, MAX_CONNECTIONS_PER_HOST);
      this.connectionsPerHost = Math.max(MIN_CONNECTIONS_PER_HOST, capped);
    }
  }

  /** Exponential reconnection schedule of host pools and the control connection. */
  @Getter
  @Setter
  public static class Reconnection {

    private Duration baseDelay = Duration.ofSeconds(1);

    private Duration maxDelay = Duration.ofSeconds(60);

    private boolean jitter = true;
  }

  @Getter
  @Setter
  public static class Retry {

    /** Retries per request before the error is surfaced. */
    private int maxRetries = 3;

    /** Retry write timeouts of non-idempotent statements on the next host. */
    private boolean retryNonIdempotentWriteTimeouts = false;
  }

  @Getter
  @Setter
  public static class SpeculativeExecution {

    private boolean enabled = false;

    /** Delay before each speculative execution of an idempotent request. */
    private Duration delay = Duration.ofMillis(100);

    private int maxExecutions = 1;
  }

  @Getter
  @Setter
  public static class Topology {

    private Duration refreshInterval = Duration.ofSeconds(60);

    /** Quiet period coalescing NEW_NODE/MOVED_NODE events into one refresh. */
    private Duration eventDebounceDelay = Duration.ofSeconds(1);

    /** Interval of probes to hosts marked down. */
    private Duration downedHostReconnectInterval = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class SchemaAgreement {

    private Duration timeout = Duration.ofSeconds(60);

    private Duration pollInterval = Duration.ofMillis(200);

    /** Wait for agreement after schema-altering statements. */
    private boolean awaitOnDdl = true;
  }

  /** Plain-text SASL credentials; authentication is off when the username is empty. */
  @Getter
  @Setter
  public static class Auth {

    private String username;

    private String password;

    /** Server authenticator classes credentials may be sent to, empty to accept any. */
    private List<String> allowedAuthenticators = new ArrayList<>();
  }
}
