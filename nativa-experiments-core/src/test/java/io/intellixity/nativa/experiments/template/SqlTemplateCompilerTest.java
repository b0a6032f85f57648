package io.intellixity.nativa.experiments.template;

import io.intellixity.nativa.experiments.error.SqlTemplateException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SqlTemplateCompilerTest {
  private static final Instant START = Instant.parse("2021-01-05T10:20:15Z");
  private static final Instant END = Instant.parse("2022-02-09T11:30:12Z");

  private final SqlTemplateCompiler compiler =
      new SqlTemplateCompiler(Clock.fixed(Instant.parse("2024-03-10T15:45:00Z"), ZoneOffset.UTC));

  @Test
  void replacesStartDateVariables() {
    String sql = compiler.compile(
        "SELECT '{{ startDate }}' as full, '{{startYear}}' as year, '{{ startMonth}}' as month, '{{startDay }}' as day",
        SqlTemplateVars.of(START, END));
    assertEquals("SELECT '2021-01-05 10:20:15' as full, '2021' as year, '01' as month, '05' as day", sql);
  }

  @Test
  void replacesEndDateAndUnixVariables() {
    SqlTemplateVars vars = SqlTemplateVars.of(START, END);
    assertEquals("SELECT '2022-02-09 11:30:12' as full, '2022' as year",
        compiler.compile("SELECT '{{ endDate }}' as full, '{{endYear}}' as year", vars));
    assertEquals("time > 1609842015 && time < 1644406212",
        compiler.compile("time > {{startDateUnix}} && time < {{ endDateUnix }}", vars));
  }

  @Test
  void experimentIdDefaultsToWildcard() {
    assertEquals("SELECT * WHERE expid LIKE '%'",
        compiler.compile("SELECT * WHERE expid LIKE '{{experimentId}}'", SqlTemplateVars.of(START, END)));
    assertEquals("SELECT * WHERE expid LIKE 'my-experiment'",
        compiler.compile("SELECT * WHERE expid LIKE '{{experimentId}}'",
            SqlTemplateVars.of(START, END).withExperimentId("my-experiment")));
  }

  @Test
  void templateVariablesAndCustomFields() {
    SqlTemplateVars vars = new SqlTemplateVars(START, END, "exp", 2,
        Map.of("region", "EU"), Map.of("eventName", "purchase", "valueColumn", "amount"));
    assertEquals("SELECT amount as value from db.purchase WHERE region = 'EU' AND phase = 2",
        compiler.compile("SELECT {{valueColumn}} as value from db.{{templateVariables.eventName}}"
            + " WHERE region = '{{customFields.region}}' AND phase = {{phase.index}}", vars));
  }

  @Test
  void helpers() {
    SqlTemplateVars vars = SqlTemplateVars.of(START, END);
    assertEquals("SELECT hello", compiler.compile("SELECT {{lowercase \"HELLO\"}}", vars));
    assertEquals("SELECT 10 as hour", compiler.compile("SELECT {{date startDateISO \"hh\"}} as hour", vars));
    assertEquals("SELECT page_view", compiler.compile("SELECT {{snakecase \"Page View\"}}", vars));
  }

  @Test
  void sqlWithoutPlaceholdersIsUntouched() {
    String sql = "SELECT '<b>' AS html, a & b FROM t";
    assertSame(sql, compiler.compile(sql, SqlTemplateVars.of(START, END)));
  }

  @Test
  void doesNotHtmlEscape() {
    SqlTemplateVars vars = new SqlTemplateVars(START, END, "a&b", null, Map.of(), Map.of());
    assertEquals("WHERE id = 'a&b'", compiler.compile("WHERE id = '{{experimentId}}'", vars));
  }

  @Test
  void missingEndDateDefaultsToMidnightTwoDaysAhead() {
    assertEquals(Instant.parse("2024-03-12T00:00:00Z"), compiler.defaultEndDate());
    assertEquals("'2024-03-12 00:00:00'",
        compiler.compile("'{{endDate}}'", SqlTemplateVars.of(START, null)));
  }

  @Test
  void malformedTemplateIsReported() {
    SqlTemplateException e = assertThrows(SqlTemplateException.class,
        () -> compiler.compile("SELECT {{#if}}", SqlTemplateVars.of(START, END)));
    assertTrue(e.getMessage().startsWith("Error compiling SQL template"));
  }
}
