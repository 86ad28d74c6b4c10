/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal error after every candidate host was tried (or skipped) without a result.
 *
 * <p>Names the hosts tried in order, the last error recorded per host and the kind of the last
 * error overall. The last error is also the exception cause.
 */
public class NoHostAvailableException extends DriverException {

  private static final long serialVersionUID = 1L;

  private final transient List<InetSocketAddress> triedHosts;
  private final transient Map<InetSocketAddress, Throwable> errors;
  private final ErrorKind lastErrorKind;

  public NoHostAvailableException(
      final List<InetSocketAddress> triedHosts,
      final Map<InetSocketAddress, Throwable> errors,
      final Throwable lastError) {
    super(buildMessage(triedHosts, errors, lastError), lastError);
    this.triedHosts = Collections.unmodifiableList(new ArrayList<>(triedHosts));
    this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    this.lastErrorKind = kindOf(lastError);
  }

  public List<InetSocketAddress> getTriedHosts() {
    return triedHosts;
  }

  public Map<InetSocketAddress, Throwable> getErrors() {
    return errors;
  }

  /** Kind of the last error, or {@code null} when no host was even attempted. */
  public ErrorKind getLastErrorKind() {
    return lastErrorKind;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.NO_HOST_AVAILABLE;
  }

  private static ErrorKind kindOf(final Throwable error) {
    if (error instanceof DriverException driverException) {
      return driverException.kind();
    }
    return error == null ? null : ErrorKind.CONNECTION;
  }

  private static String buildMessage(
      final List<InetSocketAddress> triedHosts,
      final Map<InetSocketAddress, Throwable> errors,
      final Throwable lastError) {
    if (triedHosts.isEmpty() && errors.isEmpty()) {
      return "No host available: query plan was empty";
    }
    final var sb = new StringBuilder("No host available (tried: ").append(triedHosts);
    if (lastError != null) {
      sb.append(", last error ")
          .append(kindOf(lastError))
          .append(": ")
          .append(lastError.getMessage());
    }
    if (!errors.isEmpty()) {
      sb.append(", errors: {");
      var first = true;
      for (final var e : errors.entrySet()) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append(e.getKey()).append('=').append(e.getValue().getClass().getSimpleName());
      }
      sb.append('}');
    }
    return sb.append(')').toString();
  }
}
