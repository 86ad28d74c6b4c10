/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.util.List;

/**
 * Column type from an {@code [option]}: id plus nested types for collections, tuples and UDTs.
 *
 * @param id option id
 * @param customClass class name for custom types, null otherwise
 * @param parameters element types
 */
public record DataType(int id, String customClass, List<DataType> parameters) {

  public static final int CUSTOM = 0x0000;
  public static final int ASCII = 0x0001;
  public static final int BIGINT = 0x0002;
  public static final int BLOB = 0x0003;
  public static final int BOOLEAN = 0x0004;
  public static final int INT = 0x0009;
  public static final int TIMESTAMP = 0x000B;
  public static final int UUID = 0x000C;
  public static final int VARCHAR = 0x000D;
  public static final int TIMEUUID = 0x000F;
  public static final int INET = 0x0010;
  public static final int LIST = 0x0020;
  public static final int MAP = 0x0021;
  public static final int SET = 0x0022;
  public static final int UDT = 0x0030;
  public static final int TUPLE = 0x0031;

  public DataType {
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public static DataType of(final int id) {
    return new DataType(id, null, List.of());
  }
}
