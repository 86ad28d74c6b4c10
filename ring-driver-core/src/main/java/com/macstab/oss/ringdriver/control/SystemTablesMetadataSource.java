/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.macstab.oss.ringdriver.error.FrameProtocolException;
import com.macstab.oss.ringdriver.host.HostInfo;
import com.macstab.oss.ringdriver.host.HostStatus;
import com.macstab.oss.ringdriver.protocol.ErrorResponse;
import com.macstab.oss.ringdriver.protocol.QueryParameters;
import com.macstab.oss.ringdriver.protocol.QueryRequest;
import com.macstab.oss.ringdriver.protocol.RowsResult;
import com.macstab.oss.ringdriver.query.Consistency;
import com.macstab.oss.ringdriver.query.Row;
import com.macstab.oss.ringdriver.token.KeyspaceMetadata;
import com.macstab.oss.ringdriver.token.ReplicationStrategy;
import com.macstab.oss.ringdriver.transport.FrameTransport;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads topology and schema from {@code system.local}, {@code system.peers} and {@code
 * system_schema.keyspaces}.
 *
 * <p>Peers are reachable at their {@code rpc_address} (falling back to {@code peer} when the node
 * listens on the wildcard address) on the port of the control connection. Peer rows without a
 * host id or address are skipped with a warning; a node in the middle of joining can briefly
 * produce such rows.
 */
@Slf4j
public class SystemTablesMetadataSource implements MetadataSource {

  static final String SELECT_LOCAL = "SELECT * FROM system.local WHERE key='local'";
  static final String SELECT_PEERS = "SELECT * FROM system.peers";
  static final String SELECT_KEYSPACES =
      "SELECT keyspace_name, replication FROM system_schema.keyspaces";
  static final String SELECT_SCHEMA_LOCAL =
      "SELECT host_id, schema_version FROM system.local WHERE key='local'";
  static final String SELECT_SCHEMA_PEERS = "SELECT host_id, schema_version FROM system.peers";

  @Override
  public CompletableFuture<TopologyInfo> fetchTopology(
      final FrameTransport transport, final Duration timeout) {
    final var local = query(transport, SELECT_LOCAL, timeout);
    final var peers = query(transport, SELECT_PEERS, timeout);
    return local.thenCombine(
        peers,
        (localRows, peerRows) -> {
          if (localRows.isEmpty()) {
            throw new CompletionException(
                new FrameProtocolException("system.local returned no row"));
          }
          final var localRow = localRows.get(0);
          final var localHost = toHost(localRow, transport.remoteAddress(), "broadcast_address");
          final int port = transport.remoteAddress().getPort();
          final List<HostInfo> discovered = new ArrayList<>(peerRows.size());
          for (final var row : peerRows) {
            final var address = peerAddress(row);
            if (address == null || row.isNull("host_id")) {
              log.warn("Skipping incomplete system.peers row: {}", row);
              continue;
            }
            discovered.add(toHost(row, new InetSocketAddress(address, port), "peer"));
          }
          final var partitioner =
              localRow.hasColumn("partitioner") ? localRow.getString("partitioner") : null;
          return new TopologyInfo(partitioner, localHost, discovered);
        });
  }

  @Override
  public CompletableFuture<Map<String, KeyspaceMetadata>> fetchKeyspaces(
      final FrameTransport transport, final Duration timeout) {
    return query(transport, SELECT_KEYSPACES, timeout)
        .thenApply(
            rows -> {
              final Map<String, KeyspaceMetadata> keyspaces = new HashMap<>();
              for (final var row : rows) {
                final var name = row.getString("keyspace_name");
                final var strategy =
                    ReplicationStrategy.fromOptions(row.getStringMap("replication"));
                keyspaces.put(name, new KeyspaceMetadata(name, strategy));
              }
              return keyspaces;
            });
  }

  @Override
  public CompletableFuture<Map<UUID, UUID>> fetchSchemaVersions(
      final FrameTransport transport, final Duration timeout) {
    final var local = query(transport, SELECT_SCHEMA_LOCAL, timeout);
    final var peers = query(transport, SELECT_SCHEMA_PEERS, timeout);
    return local.thenCombine(
        peers,
        (localRows, peerRows) -> {
          final Map<UUID, UUID> versions = new HashMap<>();
          collectVersions(localRows, versions);
          collectVersions(peerRows, versions);
          return versions;
        });
  }

  // ==================== Private Methods ====================

  private static CompletableFuture<List<Row>> query(
      final FrameTransport transport, final String cql, final Duration timeout) {
    final var request = new QueryRequest(cql, QueryParameters.of(Consistency.ONE));
    return transport
        .send(request, timeout)
        .thenApply(
            message -> {
              if (message instanceof RowsResult rows) {
                return Row.of(rows.metadata().columns(), rows.rows());
              }
              if (message instanceof ErrorResponse error) {
                throw new CompletionException(error.toException(transport.remoteAddress()));
              }
              throw new CompletionException(
                  new FrameProtocolException(
                      "Unexpected response to '" + cql + "': " + message.opcode()));
            });
  }

  private static HostInfo toHost(
      final Row row, final InetSocketAddress connectAddress, final String broadcastColumn) {
    return HostInfo.builder()
        .hostId(row.getUuid("host_id"))
        .connectAddress(connectAddress)
        .broadcastAddress(row.hasColumn(broadcastColumn) ? row.getInet(broadcastColumn) : null)
        .datacenter(row.hasColumn("data_center") ? row.getString("data_center") : null)
        .rack(row.hasColumn("rack") ? row.getString("rack") : null)
        .tokens(row.hasColumn("tokens") ? row.getStringSet("tokens") : null)
        .releaseVersion(row.hasColumn("release_version") ? row.getString("release_version") : null)
        .schemaVersion(row.hasColumn("schema_version") ? row.getUuid("schema_version") : null)
        .status(HostStatus.UP)
        .build();
  }

  private static InetAddress peerAddress(final Row row) {
    final var rpc = row.hasColumn("rpc_address") ? row.getInet("rpc_address") : null;
    if (rpc != null && !rpc.isAnyLocalAddress()) {
      return rpc;
    }
    return row.hasColumn("peer") ? row.getInet("peer") : null;
  }

  private static void collectVersions(final List<Row> rows, final Map<UUID, UUID> versions) {
    for (final var row : rows) {
      if (row.isNull("host_id") || row.isNull("schema_version")) {
        continue;
      }
      versions.put(row.getUuid("host_id"), row.getUuid("schema_version"));
    }
  }
}
