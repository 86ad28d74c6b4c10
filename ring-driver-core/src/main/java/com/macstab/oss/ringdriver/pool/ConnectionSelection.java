/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

import java.util.function.Supplier;

/** Built-in connection selection strategies, bindable from configuration. */
public enum ConnectionSelection {
  ROUND_ROBIN(RoundRobinConnectionStrategy::new),
  LEAST_IN_FLIGHT(LeastInFlightConnectionStrategy::new);

  private final Supplier<ConnectionSelectionStrategy> factory;

  ConnectionSelection(final Supplier<ConnectionSelectionStrategy> factory) {
    this.factory = factory;
  }

  /** New strategy instance; each pool gets its own. */
  public ConnectionSelectionStrategy create() {
    return factory.get();
  }
}
