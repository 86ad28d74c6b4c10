/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import static lombok.AccessLevel.PRIVATE;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.macstab.oss.ringdriver.auth.Authenticator;
import com.macstab.oss.ringdriver.error.AuthenticationException;
import com.macstab.oss.ringdriver.error.FrameProtocolException;
import com.macstab.oss.ringdriver.protocol.AuthChallengeResponse;
import com.macstab.oss.ringdriver.protocol.AuthResponseRequest;
import com.macstab.oss.ringdriver.protocol.AuthSuccessResponse;
import com.macstab.oss.ringdriver.protocol.AuthenticateResponse;
import com.macstab.oss.ringdriver.protocol.ErrorResponse;
import com.macstab.oss.ringdriver.protocol.Message;
import com.macstab.oss.ringdriver.protocol.OptionsRequest;
import com.macstab.oss.ringdriver.protocol.QueryParameters;
import com.macstab.oss.ringdriver.protocol.QueryRequest;
import com.macstab.oss.ringdriver.protocol.ReadyResponse;
import com.macstab.oss.ringdriver.protocol.RegisterRequest;
import com.macstab.oss.ringdriver.protocol.Request;
import com.macstab.oss.ringdriver.protocol.SetKeyspaceResult;
import com.macstab.oss.ringdriver.protocol.StartupRequest;
import com.macstab.oss.ringdriver.protocol.SupportedResponse;
import com.macstab.oss.ringdriver.query.Consistency;
import com.macstab.oss.ringdriver.shard.ShardingInfo;

import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Brings a freshly connected transport to the ready state.
 *
 * <p><strong>Sequence:</strong>
 *
 * <ol>
 *   <li>OPTIONS → SUPPORTED: learns the sharding parameters of the node and the shard that owns
 *       this connection.
 *   <li>STARTUP → READY, or AUTHENTICATE followed by AUTH_RESPONSE/AUTH_CHALLENGE rounds until
 *       AUTH_SUCCESS.
 *   <li>{@code USE <keyspace>} when the request asks for the session keyspace.
 *   <li>REGISTER for push events (control connection only).
 * </ol>
 *
 * <p>Any ERROR response or unexpected message fails the returned future; the caller closes the
 * transport.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ConnectionInitializer {

  private static final int MAX_AUTH_ROUNDS = 16;

  FrameTransport transport;
  TransportSettings settings;
  ConnectRequest request;

  public ConnectionInitializer(
      final FrameTransport transport,
      final TransportSettings settings,
      final ConnectRequest request) {
    this.transport = transport;
    this.settings = settings;
    this.request = request;
  }

  /**
   * Runs the handshake.
   *
   * @return sharding info from SUPPORTED (empty for unsharded nodes)
   */
  public CompletableFuture<Optional<ShardingInfo>> initialize() {
    return call(OptionsRequest.INSTANCE)
        .thenCompose(
            options -> {
              final var sharding = parseSupported(options);
              return startup()
                  .thenCompose(ignored -> useKeyspace())
                  .thenCompose(ignored -> register())
                  .thenApply(ignored -> sharding);
            });
  }

  // ==================== Private Methods ====================

  private Optional<ShardingInfo> parseSupported(final Message message) {
    if (message instanceof SupportedResponse supported) {
      final var sharding = ShardingInfo.fromSupported(supported.options());
      if (log.isDebugEnabled()) {
        log.debug("{} supported: {}", transport.remoteAddress(), sharding);
      }
      return sharding;
    }
    throw unexpected("SUPPORTED", message);
  }

  private CompletableFuture<Void> startup() {
    final var startup =
        StartupRequest.defaults(settings.getDriverName(), settings.getDriverVersion());
    return call(startup)
        .thenCompose(
            response -> {
              if (response instanceof ReadyResponse) {
                return CompletableFuture.completedFuture(null);
              }
              if (response instanceof AuthenticateResponse authenticate) {
                final var authenticator =
                    settings
                        .getAuthProvider()
                        .newAuthenticator(transport.remoteAddress(), authenticate.authenticator());
                return authenticate(authenticator, authenticator.initialResponse(), 0);
              }
              throw unexpected("READY or AUTHENTICATE", response);
            });
  }

  private CompletableFuture<Void> authenticate(
      final Authenticator authenticator, final byte[] token, final int round) {
    if (round >= MAX_AUTH_ROUNDS) {
      return CompletableFuture.failedFuture(
          new AuthenticationException(transport.remoteAddress(), "Too many SASL rounds"));
    }
    return call(new AuthResponseRequest(token))
        .thenCompose(
            response -> {
              if (response instanceof AuthSuccessResponse success) {
                authenticator.onAuthenticationSuccess(success.token());
                return CompletableFuture.completedFuture(null);
              }
              if (response instanceof AuthChallengeResponse challenge) {
                return authenticate(
                    authenticator, authenticator.evaluateChallenge(challenge.token()), round + 1);
              }
              throw unexpected("AUTH_SUCCESS or AUTH_CHALLENGE", response);
            });
  }

  private CompletableFuture<Void> useKeyspace() {
    final var keyspace = settings.getKeyspace();
    if (!request.useKeyspace() || keyspace == null || keyspace.isBlank()) {
      return CompletableFuture.completedFuture(null);
    }
    final var use = new QueryRequest("USE " + quote(keyspace), QueryParameters.of(Consistency.ONE));
    return call(use)
        .thenAccept(
            response -> {
              if (!(response instanceof SetKeyspaceResult)) {
                throw unexpected("SET_KEYSPACE result", response);
              }
            });
  }

  private CompletableFuture<Void> register() {
    if (request.eventTypes().isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    return call(new RegisterRequest(request.eventTypes()))
        .thenAccept(
            response -> {
              if (!(response instanceof ReadyResponse)) {
                throw unexpected("READY", response);
              }
            });
  }

  private CompletableFuture<Message> call(final Request r) {
    return transport.send(r, settings.getHandshakeTimeout());
  }

  private RuntimeException unexpected(final String expected, final Message actual) {
    if (actual instanceof ErrorResponse error) {
      return new CompletionException(error.toException(transport.remoteAddress()));
    }
    return new CompletionException(
        new FrameProtocolException(
            "["
                + transport.remoteAddress()
                + "] expected "
                + expected
                + " during handshake, got "
                + actual.opcode()));
  }

  static String quote(final String identifier) {
    if (identifier.matches("[a-z][a-z0-9_]*")) {
      return identifier;
    }
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }
}
