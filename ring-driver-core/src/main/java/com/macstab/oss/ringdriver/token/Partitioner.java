/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.nio.ByteBuffer;

/** Maps serialized partition keys to ring tokens. */
public interface Partitioner {

  /** Fully qualified server-side class name, as reported by {@code system.local.partitioner}. */
  String name();

  /**
   * Hashes a serialized partition key. The buffer's position and limit are not modified.
   *
   * @param partitionKey routing key bytes
   * @return token
   */
  Token hash(ByteBuffer partitionKey);

  /**
   * Parses the string form used in {@code system.local.tokens} / {@code system.peers.tokens}.
   *
   * @param token token string
   * @return parsed token
   * @throws IllegalArgumentException if malformed
   */
  Token parse(String token);
}
