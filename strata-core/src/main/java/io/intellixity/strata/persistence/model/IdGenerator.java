package io.intellixity.strata.persistence.model;

import java.util.UUID;

@FunctionalInterface
public interface IdGenerator {
  String next();

  /** Random (version 4) UUID in its 36-character text form. */
  static IdGenerator uuid() {
    return () -> UUID.randomUUID().toString();
  }
}
