/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CancellationToken}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("CancellationToken")
class CancellationTokenTest {

  @Test
  @DisplayName("runs each registered callback once and releases it")
  void cancel_RunsCallbacksOnce() {
    // Arrange
    final var token = new CancellationToken();
    final var runs = new AtomicInteger();
    token.onCancel(runs::incrementAndGet);
    token.onCancel(runs::incrementAndGet);

    // Act
    token.cancel();
    token.cancel();

    // Assert
    assertThat(runs).hasValue(2);
    assertThat(token.isCancelled()).isTrue();
    assertThat(token.registeredCallbacks()).isZero();
  }

  @Test
  @DisplayName("runs a callback registered after cancellation at once")
  void onCancel_AlreadyCancelled_RunsImmediately() {
    // Arrange
    final var token = new CancellationToken();
    token.cancel();
    final var runs = new AtomicInteger();

    // Act
    token.onCancel(runs::incrementAndGet);

    // Assert
    assertThat(runs).hasValue(1);
    assertThat(token.registeredCallbacks()).isZero();
  }

  @Test
  @DisplayName("does not run a removed callback")
  void remove_NotRunOnCancel() {
    // Arrange
    final var token = new CancellationToken();
    final var runs = new AtomicInteger();
    final var registration = token.onCancel(runs::incrementAndGet);

    // Act
    registration.remove();
    token.cancel();

    // Assert
    assertThat(runs).hasValue(0);
    assertThat(token.registeredCallbacks()).isZero();
  }
}
