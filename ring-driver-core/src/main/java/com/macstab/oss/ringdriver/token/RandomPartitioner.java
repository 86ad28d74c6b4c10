/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** MD5-based partitioner: token is the absolute value of the digest as a signed integer. */
public final class RandomPartitioner implements Partitioner {

  public static final String NAME = "org.apache.cassandra.dht.RandomPartitioner";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Token hash(final ByteBuffer partitionKey) {
    final MessageDigest md5;
    try {
      md5 = MessageDigest.getInstance("MD5");
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
    md5.update(partitionKey.duplicate());
    return new RandomToken(new BigInteger(md5.digest()).abs());
  }

  @Override
  public Token parse(final String token) {
    try {
      return new RandomToken(new BigInteger(token.trim()));
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid random partitioner token: " + token, e);
    }
  }
}
