/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.auth;

import static lombok.AccessLevel.PRIVATE;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.macstab.oss.ringdriver.error.AuthenticationException;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Username/password authentication (SASL PLAIN: {@code \0user\0password}).
 *
 * <p>By default any server authenticator is accepted. A non-empty allow list restricts the
 * exchange to authenticators whose class name is listed, so credentials are never sent to an
 * unexpected implementation.
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class PlainTextAuthProvider implements AuthProvider {

  public static final String DEFAULT_AUTHENTICATOR =
      "org.apache.cassandra.auth.PasswordAuthenticator";

  String username;
  String password;
  List<String> allowedAuthenticators;

  public PlainTextAuthProvider(@NonNull final String username, @NonNull final String password) {
    this(username, password, List.of());
  }

  public PlainTextAuthProvider(
      @NonNull final String username,
      @NonNull final String password,
      @NonNull final List<String> allowedAuthenticators) {
    this.username = username;
    this.password = password;
    this.allowedAuthenticators = List.copyOf(allowedAuthenticators);
  }

  @Override
  public Authenticator newAuthenticator(
      final InetSocketAddress address, final String serverAuthenticator) {
    if (!allowedAuthenticators.isEmpty() && !allowedAuthenticators.contains(serverAuthenticator)) {
      throw new AuthenticationException(
          address,
          "Unexpected authenticator "
              + serverAuthenticator
              + ", allowed: "
              + allowedAuthenticators);
    }
    return new PlainTextAuthenticator(username, password);
  }

  private static final class PlainTextAuthenticator implements Authenticator {

    private final byte[] initial;

    PlainTextAuthenticator(final String username, final String password) {
      final var user = username.getBytes(StandardCharsets.UTF_8);
      final var pass = password.getBytes(StandardCharsets.UTF_8);
      initial = new byte[user.length + pass.length + 2];
      System.arraycopy(user, 0, initial, 1, user.length);
      System.arraycopy(pass, 0, initial, user.length + 2, pass.length);
    }

    @Override
    public byte[] initialResponse() {
      return initial.clone();
    }

    @Override
    public byte[] evaluateChallenge(final byte[] challenge) {
      return initialResponse();
    }
  }
}
