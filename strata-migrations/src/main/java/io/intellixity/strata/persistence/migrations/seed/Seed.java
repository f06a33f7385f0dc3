package io.intellixity.strata.persistence.migrations.seed;

import java.util.Objects;

/** Named block of reference or fixture data. */
public record Seed(String name, SeedCallback callback) {
  public Seed {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(callback, "callback");
    if (name.isBlank()) throw new IllegalArgumentException("seed name must not be blank");
  }

  public static Seed of(String name, SeedCallback callback) {
    return new Seed(name, callback);
  }
}
