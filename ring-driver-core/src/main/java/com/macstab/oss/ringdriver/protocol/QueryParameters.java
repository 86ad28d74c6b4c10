/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.List;

import com.macstab.oss.ringdriver.query.Consistency;

import io.netty.buffer.ByteBuf;
import lombok.NonNull;

/**
 * {@code <query_parameters>} of a QUERY request.
 *
 * @param consistency consistency level
 * @param values positional bound values (serialized), may be empty
 * @param pageSize result page size, {@code <= 0} for no paging
 * @param pagingState opaque state from the previous page, may be null
 * @param serialConsistency serial consistency for conditional updates, may be null
 * @param defaultTimestamp client-side write timestamp in microseconds, {@link Long#MIN_VALUE} for
 *     none
 */
public record QueryParameters(
    @NonNull Consistency consistency,
    List<ByteBuffer> values,
    int pageSize,
    ByteBuffer pagingState,
    Consistency serialConsistency,
    long defaultTimestamp) {

  static final int FLAG_VALUES = 0x01;
  static final int FLAG_PAGE_SIZE = 0x04;
  static final int FLAG_PAGING_STATE = 0x08;
  static final int FLAG_SERIAL_CONSISTENCY = 0x10;
  static final int FLAG_DEFAULT_TIMESTAMP = 0x20;

  public QueryParameters {
    values = values == null ? List.of() : List.copyOf(values);
  }

  public static QueryParameters of(final Consistency consistency) {
    return new QueryParameters(consistency, List.of(), 0, null, null, Long.MIN_VALUE);
  }

  public QueryParameters withPagingState(final ByteBuffer state) {
    return new QueryParameters(
        consistency, values, pageSize, state, serialConsistency, defaultTimestamp);
  }

  void encode(final ByteBuf out, final ProtocolVersion version) {
    out.writeShort(consistency.code());
    int flags = 0;
    if (!values.isEmpty()) {
      flags |= FLAG_VALUES;
    }
    if (pageSize > 0) {
      flags |= FLAG_PAGE_SIZE;
    }
    if (pagingState != null) {
      flags |= FLAG_PAGING_STATE;
    }
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
    if (!values.isEmpty()) {
      out.writeShort(values.size());
      for (final var v : values) {
        CodecUtils.writeBytes(out, v);
      }
    }
    if (pageSize > 0) {
      out.writeInt(pageSize);
    }
    if (pagingState != null) {
      CodecUtils.writeBytes(out, pagingState);
    }
    if (serialConsistency != null) {
      out.writeShort(serialConsistency.code());
    }
    if (defaultTimestamp != Long.MIN_VALUE) {
      out.writeLong(defaultTimestamp);
    }
  }
}
