/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.host;

/**
 * Subscriber to {@link HostRegistry} mutations.
 *
 * <p><strong>Contract:</strong>
 *
 * <ul>
 *   <li>Called synchronously on the mutating thread (usually the control connection's event
 *       thread), in mutation order, after the registry's write lock was released
 *   <li>MUST NOT block: enqueue slow work (opening connections, closing pools) on an executor
 *   <li>MUST NOT throw: exceptions are logged and swallowed by the registry so one bad subscriber
 *       cannot stall the event loop
 * </ul>
 */
public interface HostListener {

  /** A node was discovered. {@code host.getStatus()} tells whether it is already up. */
  default void onAdd(final HostInfo host) {}

  /** A known node transitioned from DOWN to UP. */
  default void onUp(final HostInfo host) {}

  /** A known node transitioned from UP to DOWN. */
  default void onDown(final HostInfo host) {}

  /** A node left the cluster permanently. */
  default void onRemove(final HostInfo host) {}

  /** Tokens, rack, shard count or schema version of a known node changed. */
  default void onUpdate(final HostInfo previous, final HostInfo current) {}
}
