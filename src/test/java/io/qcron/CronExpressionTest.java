package io.qcron;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Unit tests for compiling expressions and walking the cursor. */
public class CronExpressionTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
  private static final LocalDateTime NEW_YEAR_2024 = LocalDateTime.of(2024, 1, 1, 0, 0);

  private static CronExpression compile(String expr, LocalDateTime reference)
      throws CronException {
    return CronExpression.compile(
        expr, CompileOptions.defaults().withClock(CLOCK).withReferenceTime(reference));
  }

  @Test
  void testNoonAnyDay() throws CronException {
    CronExpression e = compile("0 0 12 * * ? *", NEW_YEAR_2024);
    assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), e.next().value());
  }

  @Test
  void testNextAdvancesCursor() throws CronException {
    CronExpression e = compile("0 0 12 * * ? *", NEW_YEAR_2024);
    Occurrence first = e.next();
    assertEquals(first.value(), e.current());
    Occurrence second = e.next();
    assertEquals(LocalDateTime.of(2024, 1, 2, 12, 0), second.value());
    assertTrue(second.compareTo(first) > 0);
  }

  @Test
  void testRepeatedNextIsStrictlyIncreasing() throws CronException {
    CronExpression e = compile("0 */20 * * * ? *", NEW_YEAR_2024);
    LocalDateTime previous = e.current();
    for (int i = 0; i < 6; i++) {
      LocalDateTime before = e.current();
      LocalDateTime next = e.next().value();
      assertTrue(next.isAfter(before));
      assertTrue(next.isAfter(previous));
      assertEquals(0, next.getSecond());
      assertEquals(0, next.getMinute() % 20);
      previous = next;
    }
    assertEquals(LocalDateTime.of(2024, 1, 1, 2, 0), previous);
  }

  @Test
  void testFutureYear() throws CronException {
    CronExpression e = compile("0 0 0 1 1 ? 2030", NEW_YEAR_2024);
    assertEquals(LocalDateTime.of(2030, 1, 1, 0, 0), e.next().value());
  }

  @Test
  void testPastYearNotFoundLeavesCursor() throws CronException {
    LocalDateTime reference = LocalDateTime.of(2024, 6, 1, 10, 0);
    CronExpression e = compile("0 0 0 1 1 ? 2020", reference);

    CronException ex = assertThrows(CronException.class, e::next);
    assertEquals(ErrorKind.NOT_FOUND, ex.kind());
    assertEquals(reference, e.current());

    // Still usable after a failed search.
    assertThrows(CronException.class, e::next);
    assertTrue(e.matches(LocalDateTime.of(2020, 1, 1, 0, 0)));
  }

  @Test
  void testImpossibleDateNotFoundLeavesCursor() throws CronException {
    CronExpression e = compile("0 0 0 31 2 ? *", NEW_YEAR_2024);

    CronException ex = assertThrows(CronException.class, e::next);
    assertEquals(ErrorKind.NOT_FOUND, ex.kind());
    assertEquals(NEW_YEAR_2024, e.current());
  }

  @Test
  void testReferenceAtMaxDateNotFound() throws CronException {
    CronExpression e = compile("* * * * * ? *", LocalDateTime.MAX);
    LocalDateTime cursor = e.current();
    assertEquals(LocalDateTime.MAX.withNano(0), cursor);

    CronException ex = assertThrows(CronException.class, e::next);
    assertEquals(ErrorKind.NOT_FOUND, ex.kind());
    assertEquals(cursor, e.current());
  }

  @Test
  void testSixFieldsFailBeforeSearch() {
    CronException ex =
        assertThrows(CronException.class, () -> compile("0 0 12 * * ?", NEW_YEAR_2024));
    assertEquals(ErrorKind.VALIDATION, ex.kind());
  }

  @Test
  void testDayFieldQuestionMarks() throws CronException {
    CronExpression domOff = compile("0 0 9 ? * 2 *", NEW_YEAR_2024);
    assertTrue(domOff.constraints().daysOfMonth().isUnconstrained());
    assertFalse(domOff.constraints().daysOfWeek().isUnconstrained());

    CronExpression dowOff = compile("0 0 9 15 * ? *", NEW_YEAR_2024);
    assertFalse(dowOff.constraints().daysOfMonth().isUnconstrained());
    assertTrue(dowOff.constraints().daysOfWeek().isUnconstrained());
  }

  @Test
  void testReferenceTruncatedToSeconds() throws CronException {
    CronExpression e = compile("* * * * * ? *", LocalDateTime.of(2024, 1, 1, 0, 0, 0, 750_000_000));
    assertEquals(NEW_YEAR_2024, e.current());
    assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0, 1), e.next().value());
  }

  @Test
  void testCursorDefaultsToClock() throws CronException {
    CronExpression e =
        CronExpression.compile("0 0 12 * * ? *", CompileOptions.defaults().withClock(CLOCK));
    assertEquals(NEW_YEAR_2024, e.current());
  }

  @Test
  void testNextNStopsWhenScheduleRunsOut() throws CronException {
    CronExpression e = compile("0 0 0 1 1 ? 2025", NEW_YEAR_2024);
    List<Occurrence> results = e.nextN(3);
    assertEquals(List.of(new Occurrence(LocalDateTime.of(2025, 1, 1, 0, 0))), results);
    assertEquals(LocalDateTime.of(2025, 1, 1, 0, 0), e.current());
  }

  @Test
  void testNextFromLeavesCursor() throws CronException {
    CronExpression e = compile("0 0 12 * * ? *", NEW_YEAR_2024);
    assertEquals(
        LocalDateTime.of(2024, 3, 5, 12, 0),
        e.nextFrom(LocalDateTime.of(2024, 3, 5, 11, 59, 59, 999)).orElseThrow());
    assertEquals(NEW_YEAR_2024, e.current());
  }

  @Test
  void testReset() throws CronException {
    CronExpression e = compile("0 0 12 * * ? *", NEW_YEAR_2024);
    e.next();
    e.next();
    e.reset(NEW_YEAR_2024);
    assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), e.next().value());
  }

  @Test
  void testBetween() throws CronException {
    CronExpression e = compile("0 0 */6 * * ? *", NEW_YEAR_2024);
    List<LocalDateTime> results =
        e.between(NEW_YEAR_2024, LocalDateTime.of(2024, 1, 2, 0, 0)).collect(Collectors.toList());
    assertEquals(
        List.of(
            LocalDateTime.of(2024, 1, 1, 6, 0),
            LocalDateTime.of(2024, 1, 1, 12, 0),
            LocalDateTime.of(2024, 1, 1, 18, 0),
            LocalDateTime.of(2024, 1, 2, 0, 0)),
        results);
    assertEquals(NEW_YEAR_2024, e.current());
  }

  @Test
  void testOccurrencesMatch() throws CronException {
    CronExpression e = compile("*/30 5-6 8 ? * 2-6 *", NEW_YEAR_2024);
    e.occurrences(NEW_YEAR_2024)
        .limit(10)
        .forEach(
            dt -> {
              assertTrue(e.matches(dt), dt.toString());
              assertEquals(8, dt.getHour());
              assertTrue(dt.getMinute() == 5 || dt.getMinute() == 6);
            });
  }

  @Test
  void testValidate() {
    assertTrue(CronExpression.validate("0 0 12 * * ? *"));
    assertFalse(CronExpression.validate("0 0 12 * * ?"));
    assertFalse(CronExpression.validate("0 0 ? * * ? *"));
    assertFalse(CronExpression.validate("0 0 12x * * ? *"));
  }

  @Test
  void testToStringIsCanonical() throws CronException {
    CronExpression e = compile("*/15 0-5 1,2,3 ? * 2-6 2030", NEW_YEAR_2024);
    assertEquals("0,15,30,45 0-5 1-3 ? * 2-6 2030", e.toString());
    assertEquals("*/15 0-5 1,2,3 ? * 2-6 2030", e.expression());
  }
}
