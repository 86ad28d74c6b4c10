/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.testutil;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.ringdriver.control.MetadataSource;
import com.macstab.oss.ringdriver.control.TopologyInfo;
import com.macstab.oss.ringdriver.token.KeyspaceMetadata;
import com.macstab.oss.ringdriver.transport.FrameTransport;

/**
 * {@link MetadataSource} serving whatever the test put in. Values can be swapped at any time to
 * simulate topology or schema changes.
 */
public final class FakeMetadataSource implements MetadataSource {

  private volatile TopologyInfo topology;
  private volatile Map<String, KeyspaceMetadata> keyspaces = Map.of();
  private volatile Map<UUID, UUID> schemaVersions = Map.of();
  private final AtomicInteger topologyFetches = new AtomicInteger();
  private final AtomicInteger schemaFetches = new AtomicInteger();

  public FakeMetadataSource(final TopologyInfo topology) {
    this.topology = topology;
  }

  @Override
  public CompletableFuture<TopologyInfo> fetchTopology(
      final FrameTransport transport, final Duration timeout) {
    topologyFetches.incrementAndGet();
    return CompletableFuture.completedFuture(topology);
  }

  @Override
  public CompletableFuture<Map<String, KeyspaceMetadata>> fetchKeyspaces(
      final FrameTransport transport, final Duration timeout) {
    return CompletableFuture.completedFuture(keyspaces);
  }

  @Override
  public CompletableFuture<Map<UUID, UUID>> fetchSchemaVersions(
      final FrameTransport transport, final Duration timeout) {
    schemaFetches.incrementAndGet();
    return CompletableFuture.completedFuture(schemaVersions);
  }

  public void setTopology(final TopologyInfo topology) {
    this.topology = topology;
  }

  public void setKeyspaces(final Map<String, KeyspaceMetadata> keyspaces) {
    this.keyspaces = Map.copyOf(keyspaces);
  }

  public void setSchemaVersions(final Map<UUID, UUID> schemaVersions) {
    this.schemaVersions = Map.copyOf(schemaVersions);
  }

  public int topologyFetches() {
    return topologyFetches.get();
  }

  public int schemaFetches() {
    return schemaFetches.get();
  }
}
