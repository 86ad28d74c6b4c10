/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.util.List;
import java.util.Map;

/**
 * SUPPORTED: server options, including sharding parameters on shard-per-core servers.
 *
 * @param options option name to values
 */
public record SupportedResponse(Map<String, List<String>> options) implements Message {

  public SupportedResponse {
    options = Map.copyOf(options);
  }

  @Override
  public Opcode opcode() {
    return Opcode.SUPPORTED;
  }
}
