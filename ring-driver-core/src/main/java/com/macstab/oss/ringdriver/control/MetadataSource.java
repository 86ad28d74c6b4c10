/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import com.macstab.oss.ringdriver.token.KeyspaceMetadata;
import com.macstab.oss.ringdriver.transport.FrameTransport;

/**
 * Queries cluster metadata over the control connection.
 *
 * <p>The default implementation reads the system tables ({@link SystemTablesMetadataSource});
 * tests plug in fakes.
 */
public interface MetadataSource {

  /**
   * Nodes and token ownership.
   *
   * @param transport control connection transport
   * @param timeout per-request timeout
   * @return topology
   */
  CompletableFuture<TopologyInfo> fetchTopology(FrameTransport transport, Duration timeout);

  /** Keyspaces and their replication settings, by name. */
  CompletableFuture<Map<String, KeyspaceMetadata>> fetchKeyspaces(
      FrameTransport transport, Duration timeout);

  /** Schema version reported for every node, by host id. */
  CompletableFuture<Map<UUID, UUID>> fetchSchemaVersions(
      FrameTransport transport, Duration timeout);
}
