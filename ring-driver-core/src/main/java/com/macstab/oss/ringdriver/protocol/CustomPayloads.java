/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Immutable copies of custom payload maps, which may hold null values. */
public final class CustomPayloads {

  private CustomPayloads() {}

  /**
   * @param payload payload, may be null
   * @return unmodifiable copy keeping insertion order, {@link Map#of()} for null or empty
   */
  public static Map<String, ByteBuffer> copyOf(final Map<String, ByteBuffer> payload) {
    if (payload == null || payload.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
