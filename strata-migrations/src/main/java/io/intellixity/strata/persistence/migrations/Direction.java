package io.intellixity.strata.persistence.migrations;

public enum Direction {
  UP("up"),
  DOWN("down");

  private final String label;

  Direction(String label) {
    this.label = label;
  }

  public String label() { return label; }
}
