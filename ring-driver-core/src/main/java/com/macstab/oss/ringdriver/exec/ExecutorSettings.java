/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.exec;

import java.time.Duration;

import com.macstab.oss.ringdriver.query.StatementDefaults;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Per-session execution defaults; derived from {@code SessionConfig}. */
@Value
@Builder
public class ExecutorSettings {

  @NonNull StatementDefaults statementDefaults;

  /** Keyspace used for routing statements that name none. */
  String sessionKeyspace;

  @NonNull Duration requestTimeout;

  /** Whether a schema-changing statement waits for schema agreement before completing. */
  boolean awaitSchemaAgreementOnDdl;

  @NonNull String sessionName;
}
