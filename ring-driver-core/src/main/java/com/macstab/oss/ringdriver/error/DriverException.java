/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

/**
 * Root of every exception thrown by the driver.
 *
 * <p>All driver exceptions are unchecked. Asynchronous APIs complete their futures exceptionally
 * with the same types; the synchronous session API unwraps {@code CompletionException} so callers
 * always catch the original subclass.
 */
public abstract class DriverException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  protected DriverException(final String message) {
    super(message);
  }

  protected DriverException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Classification consumed by retry policies and metrics.
   *
   * @return error kind, never null
   */
  public abstract ErrorKind kind();
}
