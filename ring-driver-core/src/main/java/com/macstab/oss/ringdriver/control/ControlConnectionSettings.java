/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Timing of the control connection; derived from {@code SessionConfig}. */
@Value
@Builder
public class ControlConnectionSettings {

  /** Timeout of each metadata query. */
  @NonNull @Builder.Default Duration requestTimeout = Duration.ofSeconds(12);

  /** Period of the full topology and schema refresh. */
  @NonNull @Builder.Default Duration refreshInterval = Duration.ofSeconds(60);

  /** Delay coalescing refreshes triggered by NEW_NODE, MOVED_NODE and schema events. */
  @NonNull @Builder.Default Duration debounceDelay = Duration.ofSeconds(1);

  @NonNull @Builder.Default Duration schemaAgreementPollInterval = Duration.ofMillis(200);
}
