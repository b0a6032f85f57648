package io.intellixity.nativa.experiments.sql.query;

/**
 * @param formatSql       pretty-print compiled SQL when the dialect has a format language
 * @param maxFormatLength SQL longer than this is returned unformatted
 */
public record CompilerOptions(boolean formatSql, int maxFormatLength) {
  public static final int DEFAULT_MAX_FORMAT_LENGTH = 15_000;
  public static final CompilerOptions DEFAULTS = new CompilerOptions(true, DEFAULT_MAX_FORMAT_LENGTH);

  public CompilerOptions {
    if (maxFormatLength < 0) throw new IllegalArgumentException("maxFormatLength must be >= 0: " + maxFormatLength);
  }
}
