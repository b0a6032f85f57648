package io.intellixity.nativa.experiments.spi.sql;

public enum IntervalUnit {
  HOUR("hour"),
  MINUTE("minute");

  private final String sqlName;

  IntervalUnit(String sqlName) {
    this.sqlName = sqlName;
  }

  /** Lower-case singular unit keyword, e.g. {@code hour}. */
  public String sqlName() { return sqlName; }
}
