package io.intellixity.strata.persistence.migrations;

import java.time.Instant;

/** One row of the tracking table. */
public record MigrationRecord(String version, String name, Instant appliedAt) {}
