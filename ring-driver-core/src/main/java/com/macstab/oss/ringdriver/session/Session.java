/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.session;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import com.macstab.oss.ringdriver.control.CancellationToken;
import com.macstab.oss.ringdriver.host.HostSnapshot;
import com.macstab.oss.ringdriver.pool.HostConnectionPool;
import com.macstab.oss.ringdriver.query.PagingIterator;
import com.macstab.oss.ringdriver.query.ResultSet;
import com.macstab.oss.ringdriver.query.SimpleStatement;
import com.macstab.oss.ringdriver.query.Statement;
import com.macstab.oss.ringdriver.token.ClusterMetadata;

/**
 * Entry point for executing statements against a cluster.
 *
 * <p>Created by {@link RingDriver#connect(SessionConfig)}, which returns once the control
 * connection is up and the initial pools have opened. Thread-safe; one session per application
 * and cluster is the intended use.
 *
 * <p><strong>Errors:</strong> synchronous methods throw the driver exception itself (never a
 * {@code CompletionException}); asynchronous ones complete their future exceptionally with it.
 */
public interface Session extends AutoCloseable {

  /**
   * Executes a statement and waits for the first page.
   *
   * @param statement simple or batch statement
   * @return first page
   */
  ResultSet execute(Statement statement);

  /** Executes a query string without values. */
  default ResultSet execute(final String query) {
    return execute(SimpleStatement.of(query));
  }

  CompletableFuture<ResultSet> executeAsync(Statement statement);

  /**
   * Fetches the page following {@code previous}.
   *
   * @param statement statement that produced {@code previous}
   * @param previous last page fetched
   * @return next page
   * @throws IllegalArgumentException if {@code previous} has no further page
   */
  ResultSet fetchNextPage(SimpleStatement statement, ResultSet previous);

  /**
   * Executes a statement and iterates all rows of all pages, fetching pages lazily. A page fetch
   * failure is thrown from the iterator.
   *
   * @param statement statement
   * @return row iterator
   */
  PagingIterator executeStreaming(SimpleStatement statement);

  /**
   * Blocks until all live nodes report the same schema version.
   *
   * @param cancellation cancels the wait
   * @throws com.macstab.oss.ringdriver.error.SchemaAgreementTimeoutException after the configured
   *     timeout
   * @throws com.macstab.oss.ringdriver.error.OperationCancelledException once cancelled
   * @throws com.macstab.oss.ringdriver.error.SessionClosedException if the session is or gets
   *     closed
   */
  void awaitSchemaAgreement(CancellationToken cancellation);

  CompletableFuture<Void> awaitSchemaAgreementAsync(
      Duration timeout, CancellationToken cancellation);

  ClusterMetadata getMetadata();

  /** Current view of the cluster nodes. */
  HostSnapshot getHosts();

  /** Open pools by host id. */
  Map<UUID, HostConnectionPool> getPools();

  String getName();

  boolean isClosed();

  /** Closes asynchronously. Idempotent. */
  CompletableFuture<Void> closeAsync();

  /** Closes all pools and the control connection and waits for completion. Idempotent. */
  @Override
  void close();
}
