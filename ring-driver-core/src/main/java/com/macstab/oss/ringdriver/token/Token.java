/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.token;

/**
 * Position on the token ring.
 *
 * <p>Tokens of different partitioners are not comparable; a ring only ever contains tokens of one
 * partitioner.
 */
public interface Token extends Comparable<Token> {}
