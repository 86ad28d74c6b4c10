/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.auth;

import java.net.InetSocketAddress;

import com.macstab.oss.ringdriver.error.AuthenticationException;

/**
 * Supplies an {@link Authenticator} when a node challenges a new connection.
 *
 * <p>Only consulted when the server answers STARTUP with AUTHENTICATE. {@link #NONE} fails such a
 * connection with an {@link AuthenticationException}.
 */
@FunctionalInterface
public interface AuthProvider {

  AuthProvider NONE =
      (address, authenticator) -> {
        throw new AuthenticationException(
            address, "Host requires authentication (" + authenticator + ") but no provider is set");
      };

  /**
   * Creates the authenticator for one connection.
   *
   * @param address node being connected to
   * @param serverAuthenticator authenticator class announced by the server
   * @return authenticator driving the SASL exchange
   * @throws AuthenticationException if the server authenticator is not acceptable
   */
  Authenticator newAuthenticator(InetSocketAddress address, String serverAuthenticator);
}
