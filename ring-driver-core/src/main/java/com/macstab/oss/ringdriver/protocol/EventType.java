/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/** Push event categories a connection can REGISTER for. */
public enum EventType {
  TOPOLOGY_CHANGE,
  STATUS_CHANGE,
  SCHEMA_CHANGE
}
