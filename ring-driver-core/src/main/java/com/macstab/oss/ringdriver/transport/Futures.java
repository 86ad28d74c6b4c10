/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.transport;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.macstab.oss.ringdriver.error.DriverException;
import com.macstab.oss.ringdriver.error.OperationCancelledException;

/** Helpers for {@link java.util.concurrent.CompletableFuture} error handling. */
public final class Futures {

  private Futures() {}

  /**
   * Strips {@link CompletionException}/{@link ExecutionException} wrappers.
   *
   * @param error error from a future stage
   * @return innermost meaningful cause
   */
  public static Throwable unwrap(final Throwable error) {
    var current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Rethrows a future's failure as an unchecked exception, preserving driver exceptions.
   *
   * @param error error from a future stage
   * @return never returns normally
   */
  public static RuntimeException propagate(final Throwable error) {
    final var cause = unwrap(error);
    if (cause instanceof DriverException driverException) {
      throw driverException;
    }
    if (cause instanceof RuntimeException runtimeException) {
      throw runtimeException;
    }
    if (cause instanceof Error err) {
      throw err;
    }
    throw new CompletionException(cause);
  }

  /**
   * Waits for a future on behalf of a synchronous API.
   *
   * @param future future to wait for
   * @param <T> result type
   * @return result
   * @throws OperationCancelledException if the calling thread is interrupted
   */
  public static <T> T await(final CompletableFuture<T> future) {
    try {
      return future.get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationCancelledException("Interrupted while waiting for the driver");
    } catch (final ExecutionException e) {
      throw propagate(e);
    }
  }
}
