/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

/** Live hosts still reported more than one schema version when the wait deadline passed. */
public class SchemaAgreementTimeoutException extends DriverException {

  private static final long serialVersionUID = 1L;

  private final transient Set<UUID> versions;

  public SchemaAgreementTimeoutException(final Duration waited, final Set<UUID> versions) {
    super("schema versions did not converge within " + waited.toMillis() + " ms: " + versions);
    this.versions = Set.copyOf(versions);
  }

  /** Distinct schema versions observed on the last poll. */
  public Set<UUID> getVersions() {
    return versions;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.SCHEMA_DISAGREEMENT;
  }
}
