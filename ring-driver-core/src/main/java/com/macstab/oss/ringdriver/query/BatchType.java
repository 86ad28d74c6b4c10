/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

/** Batch flavours of the native protocol. */
public enum BatchType {
  LOGGED(0),
  UNLOGGED(1),
  COUNTER(2);

  private final int code;

  BatchType(final int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
