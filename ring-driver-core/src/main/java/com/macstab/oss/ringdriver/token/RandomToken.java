/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.math.BigInteger;

import lombok.NonNull;

/** Non-negative 127-bit token of the MD5-based random partitioner. */
public record RandomToken(@NonNull BigInteger value) implements Token {

  @Override
  public int compareTo(final Token other) {
    return value.compareTo(((RandomToken) other).value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
