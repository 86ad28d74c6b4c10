/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/** READY: the connection accepts queries. */
public enum ReadyResponse implements Message {
  INSTANCE;

  @Override
  public Opcode opcode() {
    return Opcode.READY;
  }
}
