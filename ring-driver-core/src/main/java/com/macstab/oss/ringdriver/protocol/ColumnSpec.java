/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/**
 * Column of a rows result.
 *
 * @param keyspace keyspace of the column's table
 * @param table table name
 * @param name column name
 * @param type column type
 */
public record ColumnSpec(String keyspace, String table, String name, DataType type) {}
