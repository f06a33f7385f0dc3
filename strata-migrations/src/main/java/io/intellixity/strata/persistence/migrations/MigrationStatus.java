package io.intellixity.strata.persistence.migrations;

import java.time.Instant;
import java.util.Optional;

/**
 * State of one version across the registered set and the tracking table.
 * A version that is applied but no longer registered has an empty name.
 */
public record MigrationStatus(String version, String name, boolean applied, Instant appliedAt, boolean registered) {
  public Optional<Instant> appliedAtIfAny() { return Optional.ofNullable(appliedAt); }
}
