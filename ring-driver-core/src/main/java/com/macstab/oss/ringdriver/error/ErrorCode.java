/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.util.HashMap;
import java.util.Map;

/** ERROR frame codes of the native protocol. */
public enum ErrorCode {
  SERVER_ERROR(0x0000, ErrorKind.SERVER_ERROR),
  PROTOCOL_ERROR(0x000A, ErrorKind.PROTOCOL),
  AUTH_ERROR(0x0100, ErrorKind.AUTHENTICATION),
  UNAVAILABLE(0x1000, ErrorKind.UNAVAILABLE),
  OVERLOADED(0x1001, ErrorKind.OVERLOADED),
  IS_BOOTSTRAPPING(0x1002, ErrorKind.BOOTSTRAPPING),
  TRUNCATE_ERROR(0x1003, ErrorKind.SERVER_ERROR),
  WRITE_TIMEOUT(0x1100, ErrorKind.WRITE_TIMEOUT),
  READ_TIMEOUT(0x1200, ErrorKind.READ_TIMEOUT),
  READ_FAILURE(0x1300, ErrorKind.READ_FAILURE),
  FUNCTION_FAILURE(0x1400, ErrorKind.QUERY_INVALID),
  WRITE_FAILURE(0x1500, ErrorKind.WRITE_FAILURE),
  CDC_WRITE_FAILURE(0x1600, ErrorKind.WRITE_FAILURE),
  CAS_WRITE_UNKNOWN(0x1700, ErrorKind.WRITE_TIMEOUT),
  SYNTAX_ERROR(0x2000, ErrorKind.QUERY_INVALID),
  UNAUTHORIZED(0x2100, ErrorKind.QUERY_INVALID),
  INVALID(0x2200, ErrorKind.QUERY_INVALID),
  CONFIG_ERROR(0x2300, ErrorKind.QUERY_INVALID),
  ALREADY_EXISTS(0x2400, ErrorKind.QUERY_INVALID),
  UNPREPARED(0x2500, ErrorKind.QUERY_INVALID);

  private static final Map<Integer, ErrorCode> BY_CODE = new HashMap<>();

  static {
    for (final var c : values()) {
      BY_CODE.put(c.code, c);
    }
  }

  private final int code;
  private final ErrorKind kind;

  ErrorCode(final int code, final ErrorKind kind) {
    this.code = code;
    this.kind = kind;
  }

  public int code() {
    return code;
  }

  public ErrorKind kind() {
    return kind;
  }

  /**
   * Resolves a wire code, mapping unknown codes to {@link #SERVER_ERROR}.
   *
   * @param code [int] error code
   * @return error code constant
   */
  public static ErrorCode fromCode(final int code) {
    return BY_CODE.getOrDefault(code, SERVER_ERROR);
  }
}
