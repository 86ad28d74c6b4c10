/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.query;

import java.util.HashMap;
import java.util.Map;

/** Consistency levels with their native protocol codes. */
public enum Consistency {
  ANY(0x0000),
  ONE(0x0001),
  TWO(0x0002),
  THREE(0x0003),
  QUORUM(0x0004),
  ALL(0x0005),
  LOCAL_QUORUM(0x0006),
  EACH_QUORUM(0x0007),
  SERIAL(0x0008),
  LOCAL_SERIAL(0x0009),
  LOCAL_ONE(0x000A);

  private static final Map<Integer, Consistency> BY_CODE = new HashMap<>();

  static {
    for (final var c : values()) {
      BY_CODE.put(c.code, c);
    }
  }

  private final int code;

  Consistency(final int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isSerial() {
    return this == SERIAL || this == LOCAL_SERIAL;
  }

  /**
   * Resolves a protocol code.
   *
   * @param code consistency [short] from a frame
   * @return matching level
   * @throws IllegalArgumentException for unknown codes
   */
  public static Consistency fromCode(final int code) {
    final var c = BY_CODE.get(code);
    if (c == null) {
      throw new IllegalArgumentException("Unknown consistency code: " + code);
    }
    return c;
  }
}
