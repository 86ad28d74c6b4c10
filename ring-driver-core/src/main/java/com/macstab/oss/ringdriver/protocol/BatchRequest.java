/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import com.macstab.oss.ringdriver.query.Consistency;

import io.netty.buffer.ByteBuf;
import lombok.NonNull;

/**
 * BATCH of query strings with their values.
 *
 * @param type 0 logged, 1 unlogged, 2 counter
 * @param queries query strings
 * @param values bound values per query
 * @param consistency consistency level
 * @param serialConsistency may be null
 * @param defaultTimestamp microseconds, {@link Long#MIN_VALUE} for none
 * @param customPayload sent in the frame ahead of the body, empty for none
 */
public record BatchRequest(
    int type,
    @NonNull List<String> queries,
    @NonNull List<List<ByteBuffer>> values,
    @NonNull Consistency consistency,
    Consistency serialConsistency,
    long defaultTimestamp,
    Map<String, ByteBuffer> customPayload)
    implements Request {

  private static final int FLAG_SERIAL_CONSISTENCY = 0x10;
  private static final int FLAG_DEFAULT_TIMESTAMP = 0x20;
  private static final int KIND_QUERY_STRING = 0;

  public BatchRequest {
    if (queries.size() != values.size()) {
      throw new IllegalArgumentException(
          "queries and values differ in size: " + queries.size() + " vs " + values.size());
    }
    queries = List.copyOf(queries);
    values = List.copyOf(values);
    customPayload = CustomPayloads.copyOf(customPayload);
  }

  public BatchRequest(
      final int type,
      final List<String> queries,
      final List<List<ByteBuffer>> values,
      final Consistency consistency,
      final Consistency serialConsistency,
      final long defaultTimestamp) {
    this(type, queries, values, consistency, serialConsistency, defaultTimestamp, Map.of());
  }

  @Override
  public Opcode opcode() {
    return Opcode.BATCH;
  }

  @Override
  public void encode(final ByteBuf out, final ProtocolVersion version) {
    out.writeByte(type);
    out.writeShort(queries.size());
    for (int i = 0; i < queries.size(); i++) {
      out.writeByte(KIND_QUERY_STRING);
      CodecUtils.writeLongString(out, queries.get(i));
      final var queryValues = values.get(i);
      out.writeShort(queryValues.size());
      for (final var v : queryValues) {
        CodecUtils.writeBytes(out, v);
      }
    }
    out.writeShort(consistency.code());
    int flags = 0;
    if (serialConsistency != null) {
      flags |= FLAG_SERIAL_CONSISTENCY;
    }
    if (defaultTimestamp != Long.MIN_VALUE) {
      flags |= FLAG_DEFAULT_TIMESTAMP;
    }
    if (version.hasIntQueryFlags()) {
      out.writeInt(flags);
    } else {
      out.writeByte(flags);
    }
    if (serialConsistency != null) {
      out.writeShort(serialConsistency.code());
    }
    if (defaultTimestamp != Long.MIN_VALUE) {
      out.writeLong(defaultTimestamp);
    }
  }
}
