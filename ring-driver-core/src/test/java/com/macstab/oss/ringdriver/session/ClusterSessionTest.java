/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.session;

import static com.macstab.oss.ringdriver.testutil.TestHosts.address;
import static com.macstab.oss.ringdriver.testutil.TestHosts.host;
import static com.macstab.oss.ringdriver.testutil.TestHosts.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.ringdriver.control.CancellationToken;
import com.macstab.oss.ringdriver.control.TopologyInfo;
import com.macstab.oss.ringdriver.error.NoHostAvailableException;
import com.macstab.oss.ringdriver.error.SessionClosedException;
import com.macstab.oss.ringdriver.pool.ConstantReconnectionPolicy;
import com.macstab.oss.ringdriver.pool.PoolConfig;
import com.macstab.oss.ringdriver.protocol.ColumnSpec;
import com.macstab.oss.ringdriver.protocol.DataType;
import com.macstab.oss.ringdriver.protocol.Message;
import com.macstab.oss.ringdriver.protocol.QueryRequest;
import com.macstab.oss.ringdriver.protocol.Request;
import com.macstab.oss.ringdriver.protocol.RowsMetadata;
import com.macstab.oss.ringdriver.protocol.RowsResult;
import com.macstab.oss.ringdriver.protocol.VoidResult;
import com.macstab.oss.ringdriver.query.SimpleStatement;
import com.macstab.oss.ringdriver.testutil.FakeMetadataSource;
import com.macstab.oss.ringdriver.testutil.FakeTransport;
import com.macstab.oss.ringdriver.testutil.FakeTransportFactory;
import com.macstab.oss.ringdriver.token.Murmur3Partitioner;
import com.macstab.oss.ringdriver.transport.ConnectRequest;
import com.macstab.oss.ringdriver.transport.FrameTransport;

/**
 * Tests for {@link ClusterSession}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Whole session wired with in-memory transports and metadata
 *   <li>A two-page table exercises paging
 *   <li>Startup failure and close semantics
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("ClusterSession")
class ClusterSessionTest {

  private static final List<ColumnSpec> COLUMNS =
      List.of(new ColumnSpec("ks", "t", "v", DataType.of(DataType.VARCHAR)));

  private FakeTransportFactory factory;
  private FakeMetadataSource source;
  private ClusterSession session;

  @BeforeEach
  void setUp() {
    factory =
        new FakeTransportFactory(
            request ->
                CompletableFuture.completedFuture(
                    new FakeTransport(request.endpoint(), 0, null, ClusterSessionTest::respond)));
    source =
        new FakeMetadataSource(
            new TopologyInfo(Murmur3Partitioner.NAME, host(1, "0"), List.of(host(2, "100"))));
  }

  @AfterEach
  void tearDown() {
    if (session != null) {
      session.close();
    }
  }

  /** Serves a two-page table for {@code SELECT v FROM ks.t}, a void result otherwise. */
  private static CompletableFuture<Message> respond(final Request request) {
    if (request instanceof QueryRequest query && query.query().startsWith("SELECT")) {
      final boolean firstPage = query.parameters().pagingState() == null;
      final var pagingState = firstPage ? utf8("page-2") : null;
      final var rows =
          firstPage
              ? List.of(List.of(utf8("a")), List.of(utf8("b")))
              : List.of(List.of(utf8("c")));
      return CompletableFuture.completedFuture(
          new RowsResult(new RowsMetadata(COLUMNS, 1, pagingState), rows));
    }
    return CompletableFuture.completedFuture(VoidResult.INSTANCE);
  }

  private static ByteBuffer utf8(final String value) {
    return ByteBuffer.wrap(value.getBytes(StandardCharsets.UTF_8));
  }

  private SessionConfig config() {
    return SessionConfig.builder()
        .contactPoint("10.0.0.1")
        .sessionName("test")
        .transportFactory(factory)
        .metadataSource(source)
        .poolConfig(PoolConfig.builder().connectionsPerHost(1).build())
        .reconnectionPolicy(new ConstantReconnectionPolicy(Duration.ofMillis(20)))
        .schemaAgreementTimeout(Duration.ofSeconds(2))
        .schemaAgreementPollInterval(Duration.ofMillis(10))
        .build();
  }

  @Nested
  @DisplayName("Startup")
  class Startup {

    @Test
    @DisplayName("discovers the cluster and opens a pool per node")
    void create_DiscoversCluster() {
      // Act
      session = ClusterSession.create(config());

      // Assert
      assertThat(session.getHosts().size()).isEqualTo(2);
      assertThat(session.getPools()).containsOnlyKeys(id(1), id(2));
      assertThat(session.getMetadata().ring().hostCount()).isEqualTo(2);
      assertThat(session.getName()).isEqualTo("test");
      assertThat(session.isClosed()).isFalse();
    }

    @Test
    @DisplayName("fails when no pool can be opened")
    void create_NoPoolOpens_NoHostAvailable() {
      // Arrange
      factory.setBehavior(
          request ->
              isControl(request)
                  ? CompletableFuture.completedFuture(
                      (FrameTransport) FakeTransport.voidResults(request.endpoint()))
                  : FakeTransportFactory.refused(request));

      // Act & Assert
      assertThatThrownBy(() -> ClusterSession.create(config()))
          .isInstanceOf(NoHostAvailableException.class);
      assertThat(factory.opened()).allSatisfy(t -> assertThat(t.isOpen()).isFalse());
    }

    @Test
    @DisplayName("fails when no contact point answers")
    void create_ContactPointsDown_NoHostAvailable() {
      // Arrange
      factory.setBehavior(FakeTransportFactory::refused);

      // Act & Assert
      assertThatThrownBy(() -> ClusterSession.create(config()))
          .isInstanceOf(NoHostAvailableException.class);
    }

    private boolean isControl(final ConnectRequest request) {
      return !request.eventTypes().isEmpty();
    }
  }

  @Nested
  @DisplayName("Execution")
  class Execution {

    @Test
    @DisplayName("executes a statement and returns the first page")
    void execute_FirstPage() {
      // Arrange
      session = ClusterSession.create(config());

      // Act
      final var page = session.execute("SELECT v FROM ks.t");

      // Assert
      assertThat(page.size()).isEqualTo(2);
      assertThat(page.hasMorePages()).isTrue();
      assertThat(page.getExecutionInfo().getCoordinator()).isIn(address(1), address(2));
    }

    @Test
    @DisplayName("streams rows across pages")
    void executeStreaming_AllPages() {
      // Arrange
      session = ClusterSession.create(config());
      final List<String> values = new ArrayList<>();

      // Act
      final var rows = session.executeStreaming(SimpleStatement.of("SELECT v FROM ks.t"));
      rows.forEachRemaining(row -> values.add(row.getString("v")));

      // Assert
      assertThat(values).containsExactly("a", "b", "c");
      assertThat(rows.pagesFetched()).isEqualTo(2);
    }

    @Test
    @DisplayName("refuses to fetch past the last page")
    void fetchNextPage_LastPage_Throws() {
      // Arrange
      session = ClusterSession.create(config());
      final var statement = SimpleStatement.of("SELECT v FROM ks.t");
      final var last = session.fetchNextPage(statement, session.execute(statement));

      // Act & Assert
      assertThat(last.size()).isEqualTo(1);
      assertThatThrownBy(() -> session.fetchNextPage(statement, last))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("waits for schema agreement")
    void awaitSchemaAgreement_Agreed() {
      // Arrange
      session = ClusterSession.create(config());
      final var version = new UUID(9, 9);
      source.setSchemaVersions(Map.of(id(1), version, id(2), version));

      // Act
      session.awaitSchemaAgreement(CancellationToken.none());

      // Assert
      assertThat(source.schemaFetches()).isPositive();
    }
  }

  @Nested
  @DisplayName("Close")
  class Close {

    @Test
    @DisplayName("is idempotent and closes every connection")
    void close_Idempotent() {
      // Arrange
      session = ClusterSession.create(config());

      // Act
      session.close();
      session.close();

      // Assert
      assertThat(session.isClosed()).isTrue();
      assertThat(session.getPools()).isEmpty();
      assertThat(factory.opened()).allSatisfy(t -> assertThat(t.isOpen()).isFalse());
      assertThat(factory.isClosed()).isFalse();
    }

    @Test
    @DisplayName("rejects statements once closed")
    void execute_AfterClose_Throws() {
      // Arrange
      session = ClusterSession.create(config());
      session.close();

      // Act & Assert
      assertThatThrownBy(() -> session.execute("SELECT v FROM ks.t"))
          .isInstanceOf(SessionClosedException.class);
      assertThatThrownBy(() -> session.awaitSchemaAgreement(CancellationToken.none()))
          .isInstanceOf(SessionClosedException.class);
    }
  }
}
