package io.intellixity.nativa.experiments.spi.sql;

/** Logical column types a dialect maps to its native type names. */
public enum DataType {
  STRING, INTEGER, FLOAT, BOOLEAN, DATE, TIMESTAMP, HLL
}
