/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.macstab.oss.ringdriver.protocol.ColumnSpec;

/**
 * One row of a result, with accessors for the native types the driver reads itself.
 *
 * <p>Getters return {@code null} (or an empty collection) for null cells. Numeric getters of
 * primitive type return 0 / false for null cells; use {@link #isNull(String)} to tell them apart.
 */
public final class Row {

  private final List<ColumnSpec> columns;
  private final Map<String, Integer> indexByName;
  private final List<ByteBuffer> values;

  Row(
      final List<ColumnSpec> columns,
      final Map<String, Integer> indexByName,
      final List<ByteBuffer> values) {
    this.columns = columns;
    this.indexByName = indexByName;
    this.values = values;
  }

  /**
   * Creates rows sharing one column index.
   *
   * @param columns column specs
   * @param rawRows cell values per row
   * @return rows
   */
  public static List<Row> of(final List<ColumnSpec> columns, final List<List<ByteBuffer>> rawRows) {
    final Map<String, Integer> index = new HashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      index.put(columns.get(i).name(), i);
    }
    final List<Row> rows = new ArrayList<>(rawRows.size());
    for (final var raw : rawRows) {
      rows.add(new Row(columns, index, raw));
    }
    return rows;
  }

  public List<ColumnSpec> getColumns() {
    return columns;
  }

  public boolean hasColumn(final String name) {
    return indexByName.containsKey(name);
  }

  public boolean isNull(final String name) {
    return raw(name) == null;
  }

  public ByteBuffer getBytes(final String name) {
    final var value = raw(name);
    return value == null ? null : value.duplicate();
  }

  public String getString(final String name) {
    final var value = raw(name);
    return value == null ? null : utf8(value);
  }

  public int getInt(final String name) {
    final var value = raw(name);
    return value == null || value.remaining() < 4 ? 0 : value.getInt(value.position());
  }

  public long getLong(final String name) {
    final var value = raw(name);
    return value == null || value.remaining() < 8 ? 0L : value.getLong(value.position());
  }

  public boolean getBool(final String name) {
    final var value = raw(name);
    return value != null && value.hasRemaining() && value.get(value.position()) != 0;
  }

  public UUID getUuid(final String name) {
    final var value = raw(name);
    if (value == null || value.remaining() < 16) {
      return null;
    }
    final int p = value.position();
    return new UUID(value.getLong(p), value.getLong(p + 8));
  }

  public InetAddress getInet(final String name) {
    final var value = raw(name);
    if (value == null) {
      return null;
    }
    final var bytes = new byte[value.remaining()];
    value.duplicate().get(bytes);
    try {
      return InetAddress.getByAddress(bytes);
    } catch (final UnknownHostException e) {
      throw new IllegalStateException("Column " + name + " holds an invalid inet", e);
    }
  }

  /** Reads a {@code set<text>} column. */
  public Set<String> getStringSet(final String name) {
    return new LinkedHashSet<>(getStringList(name));
  }

  /** Reads a {@code list<text>} (or {@code set<text>}) column. */
  public List<String> getStringList(final String name) {
    final var value = raw(name);
    if (value == null) {
      return List.of();
    }
    final var in = value.duplicate();
    final int n = in.getInt();
    final List<String> result = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      result.add(readElement(in));
    }
    return result;
  }

  /** Reads a {@code map<text, text>} column. */
  public Map<String, String> getStringMap(final String name) {
    final var value = raw(name);
    if (value == null) {
      return Map.of();
    }
    final var in = value.duplicate();
    final int n = in.getInt();
    final Map<String, String> result = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      final var key = readElement(in);
      result.put(key, readElement(in));
    }
    return result;
  }

  @Override
  public String toString() {
    return "Row" + columns.stream().map(ColumnSpec::name).toList();
  }

  // ==================== Private Methods ====================

  private ByteBuffer raw(final String name) {
    final var index = indexByName.get(name);
    if (index == null) {
      throw new IllegalArgumentException("No column named '" + name + "' in " + this);
    }
    return values.get(index);
  }

  private static String readElement(final ByteBuffer in) {
    final int length = in.getInt();
    if (length < 0) {
      return null;
    }
    final var slice = in.slice();
    slice.limit(length);
    in.position(in.position() + length);
    return utf8(slice);
  }

  private static String utf8(final ByteBuffer value) {
    return StandardCharsets.UTF_8.decode(value.duplicate()).toString();
  }
}
