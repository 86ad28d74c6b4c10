/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import io.netty.buffer.ByteBuf;

/**
 * {@code <metadata>} of a rows result.
 *
 * @param columns column specs, empty when the server skipped metadata
 * @param columnCount number of cells per row
 * @param pagingState state for the next page, null on the last page
 */
public record RowsMetadata(List<ColumnSpec> columns, int columnCount, ByteBuffer pagingState) {

  private static final int FLAG_GLOBAL_TABLES_SPEC = 0x0001;
  private static final int FLAG_HAS_MORE_PAGES = 0x0002;
  private static final int FLAG_NO_METADATA = 0x0004;
  private static final int FLAG_METADATA_CHANGED = 0x0008;

  public RowsMetadata {
    columns = List.copyOf(columns);
  }

  static RowsMetadata decode(final ByteBuf in) {
    final int flags = in.readInt();
    final int columnCount = in.readInt();
    ByteBuffer pagingState = null;
    if ((flags & FLAG_HAS_MORE_PAGES) != 0) {
      pagingState = CodecUtils.readBytes(in);
    }
    if ((flags & FLAG_METADATA_CHANGED) != 0) {
      CodecUtils.readShortBytes(in);
    }
    if ((flags & FLAG_NO_METADATA) != 0) {
      return new RowsMetadata(List.of(), columnCount, pagingState);
    }

    String globalKeyspace = null;
    String globalTable = null;
    if ((flags & FLAG_GLOBAL_TABLES_SPEC) != 0) {
      globalKeyspace = CodecUtils.readString(in);
      globalTable = CodecUtils.readString(in);
    }
    final List<ColumnSpec> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      final String keyspace;
      final String table;
      if (globalKeyspace != null) {
        keyspace = globalKeyspace;
        table = globalTable;
      } else {
        keyspace = CodecUtils.readString(in);
        table = CodecUtils.readString(in);
      }
      final var name = CodecUtils.readString(in);
      columns.add(new ColumnSpec(keyspace, table, name, readType(in)));
    }
    return new RowsMetadata(columns, columnCount, pagingState);
  }

  private static DataType readType(final ByteBuf in) {
    final int id = in.readUnsignedShort();
    switch (id) {
      case DataType.CUSTOM:
        return new DataType(id, CodecUtils.readString(in), List.of());
      case DataType.LIST:
      case DataType.SET:
        return new DataType(id, null, List.of(readType(in)));
      case DataType.MAP:
        final var key = readType(in);
        return new DataType(id, null, List.of(key, readType(in)));
      case DataType.UDT:
        CodecUtils.readString(in);
        CodecUtils.readString(in);
        return new DataType(id, null, readFields(in, true));
      case DataType.TUPLE:
        return new DataType(id, null, readFields(in, false));
      default:
        return DataType.of(id);
    }
  }

  private static List<DataType> readFields(final ByteBuf in, final boolean named) {
    final int n = in.readUnsignedShort();
    final List<DataType> fields = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      if (named) {
        CodecUtils.readString(in);
      }
      fields.add(readType(in));
    }
    return fields;
  }
}
