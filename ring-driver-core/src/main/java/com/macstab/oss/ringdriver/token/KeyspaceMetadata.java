/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import lombok.NonNull;

/**
 * Replication settings of one keyspace.
 *
 * @param name keyspace name
 * @param replication replica placement strategy
 */
public record KeyspaceMetadata(@NonNull String name, @NonNull ReplicationStrategy replication) {}
