/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.macstab.oss.ringdriver.protocol.BatchRequest;
import com.macstab.oss.ringdriver.protocol.Request;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Simple statements sent as one BATCH request.
 *
 * <p>A batch is idempotent only if every child is. Routing uses the first child carrying a
 * routing key; the keyspace is the batch's own, or else the first child's.
 */
@Value
@Builder(toBuilder = true)
public class BatchStatement implements Statement {

  @NonNull @Builder.Default BatchType type = BatchType.LOGGED;
  @Singular List<SimpleStatement> statements;
  Consistency consistency;
  Consistency serialConsistency;
  String keyspace;
  Duration timeout;
  @Builder.Default long defaultTimestamp = Long.MIN_VALUE;

  /** Payload of the batch itself; payloads of the children are not sent. */
  @NonNull @Builder.Default Map<String, ByteBuffer> customPayload = Map.of();

  @Override
  public boolean isIdempotent() {
    if (statements.isEmpty()) {
      return false;
    }
    for (final var statement : statements) {
      if (!statement.isIdempotent()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String getKeyspace() {
    if (keyspace != null) {
      return keyspace;
    }
    for (final var statement : statements) {
      if (statement.getKeyspace() != null) {
        return statement.getKeyspace();
      }
    }
    return null;
  }

  @Override
  public ByteBuffer getRoutingKey() {
    for (final var statement : statements) {
      if (statement.getRoutingKey() != null) {
        return statement.getRoutingKey();
      }
    }
    return null;
  }

  @Override
  public Request toRequest(final StatementDefaults defaults) {
    if (statements.isEmpty()) {
      throw new IllegalArgumentException("Batch contains no statement");
    }
    final List<String> queries = new ArrayList<>(statements.size());
    final List<List<ByteBuffer>> values = new ArrayList<>(statements.size());
    for (final var statement : statements) {
      queries.add(statement.getQuery());
      values.add(statement.getValues());
    }
    return new BatchRequest(
        type.code(),
        queries,
        values,
        consistency != null ? consistency : defaults.consistency(),
        serialConsistency != null ? serialConsistency : defaults.serialConsistency(),
        defaultTimestamp,
        customPayload);
  }
}
