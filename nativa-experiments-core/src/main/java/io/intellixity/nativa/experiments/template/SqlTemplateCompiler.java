package io.intellixity.nativa.experiments.template;

import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Template;
import io.intellixity.nativa.experiments.error.SqlTemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders Handlebars placeholders ({@code {{startDate}}}, {@code {{endYear}}}, {@code {{customFields.x}}}, ...)
 * inside user-authored SQL. Output is never HTML-escaped.
 */
public final class SqlTemplateCompiler {
  private static final Logger log = LoggerFactory.getLogger(SqlTemplateCompiler.class);

  public static final DateTimeFormatter SQL_DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  static final List<String> VARIABLES = List.of(
      "startDateUnix", "startDateISO", "startDate", "startYear", "startMonth", "startDay",
      "endDateUnix", "endDateISO", "endDate", "endYear", "endMonth", "endDay", "experimentId");

  static final List<String> HELPERS = List.of("lowercase", "uppercase", "snakecase", "date");

  private final Handlebars handlebars;
  private final Clock clock;

  public SqlTemplateCompiler() {
    this(Clock.systemUTC());
  }

  public SqlTemplateCompiler(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.handlebars = new Handlebars().with(EscapingStrategy.NOOP);
    handlebars.setInfiniteLoops(false);

    handlebars.registerHelper("lowercase", (Helper<Object>) (context, options) ->
        context == null ? "" : context.toString().toLowerCase(Locale.ROOT));
    handlebars.registerHelper("uppercase", (Helper<Object>) (context, options) ->
        context == null ? "" : context.toString().toUpperCase(Locale.ROOT));
    handlebars.registerHelper("snakecase", (Helper<Object>) (context, options) -> {
      if (context == null || context.toString().isBlank()) {
        throw new IllegalArgumentException("snakecase needs a value; set eventName/valueColumn first.");
      }
      return snakeCase(context.toString());
    });
    handlebars.registerHelper("date", (Helper<Object>) (context, options) -> {
      if (context == null) return "";
      String pattern = options.param(0, "yyyy-MM-dd");
      Instant instant = Instant.parse(context.toString());
      return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withZone(ZoneOffset.UTC).format(instant);
    });
    handlebars.registerHelperMissing((Helper<Object>) (context, options) -> {
      if (options.params.length == 0 && options.hash.isEmpty()) {
        throw new IllegalArgumentException("Unknown variable: " + options.helperName
            + ". Available variables: " + String.join(", ", VARIABLES));
      }
      throw new IllegalArgumentException("Unknown helper: " + options.helperName
          + ". Available helpers: " + String.join(", ", HELPERS));
    });
  }

  /** Resolves {@code {{...}}} placeholders; SQL without placeholders is returned as is. */
  public String compile(String sql, SqlTemplateVars vars) {
    Objects.requireNonNull(vars, "vars");
    if (sql == null || !sql.contains("{{")) return sql;
    try {
      Template template = handlebars.compileInline(sql);
      String out = template.apply(context(vars));
      if (log.isDebugEnabled()) {
        log.debug("nativa.experiments op=compileTemplate experimentId={} sqlLength={}", vars.experimentId(), out.length());
      }
      return out;
    } catch (IOException | RuntimeException e) {
      throw new SqlTemplateException("Error compiling SQL template: " + rootMessage(e), e);
    }
  }

  /** Default end date for cache-stable SQL: two days from now, at midnight UTC. */
  public Instant defaultEndDate() {
    return clock.instant().plus(2, ChronoUnit.DAYS).truncatedTo(ChronoUnit.DAYS);
  }

  Map<String, Object> context(SqlTemplateVars vars) {
    Instant end = vars.endDate() != null ? vars.endDate() : defaultEndDate();
    Map<String, Object> ctx = new LinkedHashMap<>();
    putDate(ctx, "start", vars.startDate());
    putDate(ctx, "end", end);
    ctx.put("experimentId", vars.experimentId() == null ? "%" : vars.experimentId());
    if (vars.phaseIndex() != null) {
      ctx.put("phase", Map.of("index", String.valueOf(vars.phaseIndex())));
    }
    ctx.put("customFields", vars.customFields());
    ctx.put("templateVariables", vars.templateVariables());
    // templated metrics reference these unqualified
    for (String key : List.of("eventName", "valueColumn")) {
      String v = vars.templateVariables().get(key);
      if (v != null) ctx.put(key, v);
    }
    return ctx;
  }

  private static void putDate(Map<String, Object> ctx, String prefix, Instant instant) {
    var utc = instant.atOffset(ZoneOffset.UTC);
    ctx.put(prefix + "Date", SQL_DATE_TIME.format(instant));
    ctx.put(prefix + "DateUnix", instant.getEpochSecond());
    ctx.put(prefix + "DateISO", DateTimeFormatter.ISO_INSTANT.format(instant));
    ctx.put(prefix + "Year", String.format(Locale.ROOT, "%04d", utc.getYear()));
    ctx.put(prefix + "Month", String.format(Locale.ROOT, "%02d", utc.getMonthValue()));
    ctx.put(prefix + "Day", String.format(Locale.ROOT, "%02d", utc.getDayOfMonth()));
  }

  static String snakeCase(String s) {
    return s.trim()
        .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
        .replaceAll("[^A-Za-z0-9]+", "_")
        .replaceAll("^_+|_+$", "")
        .toLowerCase(Locale.ROOT);
  }

  private static String rootMessage(Throwable e) {
    Throwable t = e;
    while (t.getCause() != null && t.getCause() != t) t = t.getCause();
    return t.getMessage() == null ? e.getMessage() : t.getMessage();
  }
}
