/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.util.LinkedHashMap;
import java.util.Map;

import io.netty.buffer.ByteBuf;

/**
 * STARTUP: initializes the connection with a string map of options.
 *
 * @param options at least {@code CQL_VERSION}
 */
public record StartupRequest(Map<String, String> options) implements Request {

  public static final String CQL_VERSION = "CQL_VERSION";
  public static final String DRIVER_NAME = "DRIVER_NAME";
  public static final String DRIVER_VERSION = "DRIVER_VERSION";

  public StartupRequest {
    options = Map.copyOf(options);
  }

  public static StartupRequest defaults(final String driverName, final String driverVersion) {
    final Map<String, String> options = new LinkedHashMap<>();
    options.put(CQL_VERSION, "3.0.0");
    options.put(DRIVER_NAME, driverName);
    options.put(DRIVER_VERSION, driverVersion);
    return new StartupRequest(options);
  }

  @Override
  public Opcode opcode() {
    return Opcode.STARTUP;
  }

  @Override
  public void encode(final ByteBuf out, final ProtocolVersion version) {
    CodecUtils.writeStringMap(out, options);
  }
}
