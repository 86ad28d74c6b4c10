/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.util.List;

import io.netty.buffer.ByteBuf;

/**
 * Body shared by the SCHEMA_CHANGE result and event.
 *
 * @param changeType CREATED, UPDATED or DROPPED
 * @param target KEYSPACE, TABLE, TYPE, FUNCTION or AGGREGATE
 * @param keyspace affected keyspace
 * @param name affected object, null for keyspace changes
 * @param argumentTypes argument types for functions and aggregates, empty otherwise
 */
public record SchemaChange(
    String changeType, String target, String keyspace, String name, List<String> argumentTypes) {

  public SchemaChange {
    argumentTypes = argumentTypes == null ? List.of() : List.copyOf(argumentTypes);
  }

  public boolean isKeyspaceChange() {
    return "KEYSPACE".equals(target);
  }

  static SchemaChange decode(final ByteBuf in) {
    final var change = CodecUtils.readString(in);
    final var target = CodecUtils.readString(in);
    final var keyspace = CodecUtils.readString(in);
    switch (target) {
      case "KEYSPACE":
        return new SchemaChange(change, target, keyspace, null, List.of());
      case "FUNCTION":
      case "AGGREGATE":
        final var name = CodecUtils.readString(in);
        return new SchemaChange(change, target, keyspace, name, CodecUtils.readStringList(in));
      default:
        return new SchemaChange(change, target, keyspace, CodecUtils.readString(in), List.of());
    }
  }
}
