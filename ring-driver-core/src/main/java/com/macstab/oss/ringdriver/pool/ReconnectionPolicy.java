/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.pool;

/**
 * Produces backoff schedules for reconnection attempts.
 *
 * <p>One schedule is created per failing target (pool slot, control connection) and discarded on
 * success, so every slot backs off independently.
 */
@FunctionalInterface
public interface ReconnectionPolicy {

  ReconnectionSchedule newSchedule();
}
