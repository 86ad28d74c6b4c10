/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/** RESULT frame body. */
public interface ResultMessage extends Message {

  int KIND_VOID = 0x0001;
  int KIND_ROWS = 0x0002;
  int KIND_SET_KEYSPACE = 0x0003;
  int KIND_PREPARED = 0x0004;
  int KIND_SCHEMA_CHANGE = 0x0005;

  @Override
  default Opcode opcode() {
    return Opcode.RESULT;
  }
}
