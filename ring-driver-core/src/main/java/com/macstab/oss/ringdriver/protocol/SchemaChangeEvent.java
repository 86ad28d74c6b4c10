/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/**
 * Schema object created, altered or dropped.
 *
 * @param change what changed
 */
public record SchemaChangeEvent(SchemaChange change) implements ProtocolEvent {

  @Override
  public EventType type() {
    return EventType.SCHEMA_CHANGE;
  }
}
