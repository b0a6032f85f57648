package io.intellixity.nativa.experiments.sql.format;

import com.github.vertical_blank.sqlformatter.SqlFormatter;
import com.github.vertical_blank.sqlformatter.languages.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Pretty-prints generated SQL for a dialect's format language.
 * Output that cannot be formatted is returned as-is; formatting never fails a query build.
 */
public final class SqlPrettyPrinter {
  private static final Logger log = LoggerFactory.getLogger(SqlPrettyPrinter.class);

  private final int maxLength;

  public SqlPrettyPrinter(int maxLength) {
    if (maxLength < 0) throw new IllegalArgumentException("maxLength must be >= 0: " + maxLength);
    this.maxLength = maxLength;
  }

  /** @param formatDialect format language id; blank disables formatting */
  public String format(String sql, String formatDialect) {
    if (formatDialect == null || formatDialect.isBlank()) return sql;
    if (sql.length() > maxLength) {
      if (log.isDebugEnabled()) {
        log.debug("nativa.experiments op=format skipped=true sqlLength={} maxLength={}", sql.length(), maxLength);
      }
      return sql;
    }
    try {
      return SqlFormatter.of(language(formatDialect)).format(sql);
    } catch (RuntimeException e) {
      log.warn("nativa.experiments op=format failed dialect={} error={}", formatDialect, e.toString());
      return sql;
    }
  }

  static Dialect language(String formatDialect) {
    return switch (formatDialect.toLowerCase(Locale.ROOT)) {
      case "postgresql", "postgres" -> Dialect.PostgreSql;
      case "redshift" -> Dialect.Redshift;
      case "mysql" -> Dialect.MySql;
      case "mariadb" -> Dialect.MariaDb;
      case "tsql", "transactsql" -> Dialect.TSql;
      case "spark", "sparksql" -> Dialect.SparkSql;
      case "plsql" -> Dialect.PlSql;
      case "db2" -> Dialect.Db2;
      default -> Dialect.StandardSql;
    };
  }
}
