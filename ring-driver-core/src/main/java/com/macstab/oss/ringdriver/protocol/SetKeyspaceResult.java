/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/**
 * RESULT of a {@code USE} statement.
 *
 * @param keyspace keyspace now in use on the connection
 */
public record SetKeyspaceResult(String keyspace) implements ResultMessage {}
