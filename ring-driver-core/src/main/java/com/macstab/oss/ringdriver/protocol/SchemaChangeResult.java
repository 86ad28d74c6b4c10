/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/**
 * RESULT of a DDL statement.
 *
 * @param change what changed
 */
public record SchemaChangeResult(SchemaChange change) implements ResultMessage {}
