/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.auth;

/** Client side of one SASL exchange. Not shared between connections. */
public interface Authenticator {

  /** Token sent in the first AUTH_RESPONSE. */
  byte[] initialResponse();

  /**
   * Answers a server challenge.
   *
   * @param challenge token from AUTH_CHALLENGE
   * @return next response token
   */
  byte[] evaluateChallenge(byte[] challenge);

  /**
   * Called on AUTH_SUCCESS.
   *
   * @param token final server token, may be null
   */
  default void onAuthenticationSuccess(final byte[] token) {}
}
