/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

/** Signed 64-bit token of the Murmur3 partitioner. */
public record Murmur3Token(long value) implements Token {

  @Override
  public int compareTo(final Token other) {
    return Long.compare(value, ((Murmur3Token) other).value);
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
