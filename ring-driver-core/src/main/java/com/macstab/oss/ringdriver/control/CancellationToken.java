/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.NonNull;

/**
 * Cooperative cancellation signal for blocking waits such as schema agreement.
 *
 * <pre>{@code
 * CancellationToken token = new CancellationToken();
 * executor.submit(() -> session.awaitSchemaAgreement(token));
 * ...
 * token.cancel(); // the wait ends with OperationCancelledException
 * }</pre>
 *
 * <p>One token may be passed to any number of waits. Each wait registers a callback with {@link
 * #onCancel(Runnable)} and removes it when it ends, so a long-lived token holds callbacks only for
 * waits still in progress.
 */
public final class CancellationToken {

  private final Set<Callback> callbacks = ConcurrentHashMap.newKeySet();
  private volatile boolean cancelled;

  /** Token that is never cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  /** Cancels the token and runs every registered callback once. Idempotent. */
  public void cancel() {
    cancelled = true;
    for (final var callback : callbacks) {
      callback.fire();
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Registers a callback run on {@link #cancel()}, or at once when already cancelled.
   *
   * @param action callback
   * @return registration whose {@link Registration#remove()} deregisters the callback
   */
  public Registration onCancel(@NonNull final Runnable action) {
    final var callback = new Callback(action);
    callbacks.add(callback);
    if (cancelled) {
      callback.fire();
    }
    return callback;
  }

  /** Callbacks still registered. */
  int registeredCallbacks() {
    return callbacks.size();
  }

  /** Handle of a registered cancellation callback. */
  @FunctionalInterface
  public interface Registration {

    /** Deregisters the callback. Idempotent. */
    void remove();
  }

  private final class Callback implements Registration {
    private final Runnable action;

    Callback(final Runnable action) {
      this.action = action;
    }

    void fire() {
      // removal decides the single run when cancel() and onCancel() race
      if (callbacks.remove(this)) {
        action.run();
      }
    }

    @Override
    public void remove() {
      callbacks.remove(this);
    }
  }
}
