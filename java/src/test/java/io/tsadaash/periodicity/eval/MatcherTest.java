package io.tsadaash.periodicity.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.tsadaash.periodicity.Periodicity;
import io.tsadaash.periodicity.PeriodicityException;
import io.tsadaash.periodicity.model.NthWeekday;
import io.tsadaash.periodicity.model.OrdinalPosition;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

/** Unit tests for date matching. */
public class MatcherTest {
  private static final LocalDate ANCHOR = LocalDate.of(2026, 1, 1);

  private static LocalDate date(int year, int month, int day) {
    return LocalDate.of(year, month, day);
  }

  // Rolling intervals

  @Test
  void testEveryNDaysFromAnchor() throws PeriodicityException {
    Periodicity p = Periodicity.builder().daily(1).everyNDays(3).anchoredAt(ANCHOR).build();

    assertTrue(Matcher.matches(p, date(2026, 1, 1)));
    assertFalse(Matcher.matches(p, date(2026, 1, 2)));
    assertFalse(Matcher.matches(p, date(2026, 1, 3)));
    assertTrue(Matcher.matches(p, date(2026, 1, 4)));
    assertTrue(Matcher.matches(p, date(2026, 2, 1)));
  }

  @Test
  void testEveryNDaysBeforeAnchor() throws PeriodicityException {
    Periodicity p = Periodicity.builder().daily(1).everyNDays(3).anchoredAt(ANCHOR).build();

    assertTrue(Matcher.matches(p, date(2025, 12, 29)));
    assertFalse(Matcher.matches(p, date(2025, 12, 30)));
    assertFalse(Matcher.matches(p, date(2025, 12, 31)));
  }

  @Test
  void testEveryNDaysAnchoredAtTimeframeStart() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder()
            .daily(1)
            .everyNDays(2)
            .between(date(2026, 2, 1), date(2026, 3, 1))
            .build();

    assertTrue(p.matches(date(2026, 2, 1)));
    assertFalse(p.matches(date(2026, 2, 2)));
    assertTrue(p.matches(date(2026, 2, 3)));
  }

  @Test
  void testExplicitAnchorWinsOverTimeframeStart() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder()
            .daily(1)
            .everyNDays(2)
            .startingFrom(date(2026, 2, 1))
            .anchoredAt(date(2026, 2, 2))
            .build();

    assertFalse(p.matches(date(2026, 2, 1)));
    assertTrue(p.matches(date(2026, 2, 2)));
  }

  @Test
  void testEveryNWeeksAlignsToWeekStart() throws PeriodicityException {
    // 2026-01-01 is a Thursday; its Monday week began on 2025-12-29
    Periodicity p = Periodicity.builder().weekly(1).everyNWeeks(2).anchoredAt(ANCHOR).build();

    assertTrue(p.matches(date(2025, 12, 29)));
    assertTrue(p.matches(date(2026, 1, 2)));
    assertTrue(p.matches(date(2026, 1, 4)));
    assertFalse(p.matches(date(2026, 1, 5)));
    assertFalse(p.matches(date(2026, 1, 11)));
    assertTrue(p.matches(date(2026, 1, 12)));
    assertFalse(p.matches(date(2025, 12, 28)));
  }

  @Test
  void testEveryNWeeksWithSundayStart() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder()
            .weekly(1)
            .everyNWeeks(2)
            .weekStart(DayOfWeek.SUNDAY)
            .anchoredAt(ANCHOR)
            .build();

    assertTrue(p.matches(date(2026, 1, 3)));
    assertFalse(p.matches(date(2026, 1, 4)));
    assertFalse(p.matches(date(2026, 1, 10)));
    assertTrue(p.matches(date(2026, 1, 11)));
  }

  @Test
  void testEveryNMonths() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder().monthly(1).everyNMonths(3).anchoredAt(date(2026, 1, 15)).build();

    assertTrue(p.matches(date(2026, 1, 1)));
    assertFalse(p.matches(date(2026, 2, 28)));
    assertTrue(p.matches(date(2026, 4, 1)));
    assertTrue(p.matches(date(2026, 7, 31)));
    assertTrue(p.matches(date(2025, 10, 10)));
    assertFalse(p.matches(date(2025, 12, 10)));
  }

  @Test
  void testEveryNYears() throws PeriodicityException {
    Periodicity p = Periodicity.builder().yearly(1).everyNYears(2).anchoredAt(ANCHOR).build();

    assertTrue(p.matches(date(2026, 12, 31)));
    assertFalse(p.matches(date(2027, 12, 31)));
    assertTrue(p.matches(date(2028, 6, 1)));
    assertTrue(p.matches(date(2024, 6, 1)));
  }

  @Test
  void testEveryNYearsUsesFiscalYear() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder()
            .yearly(1)
            .everyNYears(2)
            .yearStart(Month.APRIL)
            .anchoredAt(date(2026, 4, 1))
            .build();

    assertTrue(p.matches(date(2027, 3, 31)));
    assertFalse(p.matches(date(2027, 4, 1)));
    assertFalse(p.matches(date(2028, 3, 31)));
    assertTrue(p.matches(date(2028, 4, 1)));
  }

  // Filters

  @Test
  void testDaysOfWeek() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder().daily(1).onWeekdays(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY).build();

    assertTrue(p.matches(date(2026, 10, 17)));
    assertTrue(p.matches(date(2026, 10, 18)));
    assertFalse(p.matches(date(2026, 10, 19)));
  }

  @Test
  void testLastDayOfMonthAcrossLeapYears() throws PeriodicityException {
    Periodicity p = Periodicity.builder().monthly(1).onMonthDaysFromEnd(1).build();

    assertTrue(p.matches(date(2024, 2, 29)));
    assertFalse(p.matches(date(2024, 2, 28)));
    assertTrue(p.matches(date(2025, 2, 28)));
    assertTrue(p.matches(date(2026, 4, 30)));
    assertFalse(p.matches(date(2026, 5, 30)));
    assertTrue(p.matches(date(2026, 5, 31)));
  }

  @Test
  void testThirtyFirstNeverMatchesShortMonths() throws PeriodicityException {
    Periodicity p = Periodicity.builder().monthly(1).onMonthDays(31).build();

    assertTrue(p.matches(date(2026, 1, 31)));
    assertFalse(p.matches(date(2026, 4, 30)));
    assertFalse(p.matches(date(2026, 2, 28)));
  }

  @Test
  void testNthWeekdays() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder()
            .monthly(2)
            .onNthWeekdays(NthWeekday.second(DayOfWeek.TUESDAY), NthWeekday.last(DayOfWeek.FRIDAY))
            .build();

    assertTrue(p.matches(date(2026, 5, 12)));
    assertFalse(p.matches(date(2026, 5, 5)));
    assertTrue(p.matches(date(2026, 5, 29)));
    assertTrue(p.matches(date(2026, 2, 27)));
    assertFalse(p.matches(date(2026, 2, 20)));
  }

  @Test
  void testFifthWeekday() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder()
            .monthly(1)
            .onNthWeekdays(new NthWeekday(OrdinalPosition.FIFTH, DayOfWeek.FRIDAY))
            .build();

    assertTrue(p.matches(date(2026, 5, 29)));
    assertFalse(p.matches(date(2026, 2, 27)));
  }

  @Test
  void testWeeksOfMonth() throws PeriodicityException {
    Periodicity first = Periodicity.builder().weekly(1).onWeeksOfMonth(1).build();
    Periodicity last = Periodicity.builder().weekly(1).onWeeksOfMonthFromEnd(1).build();
    Periodicity fifth = Periodicity.builder().weekly(1).onWeeksOfMonth(5).build();

    // May 2026 begins on a Friday: weeks start on the 4th, 11th, 18th and 25th
    assertFalse(first.matches(date(2026, 5, 1)));
    assertTrue(first.matches(date(2026, 5, 4)));
    assertTrue(first.matches(date(2026, 5, 10)));
    assertFalse(first.matches(date(2026, 5, 11)));
    assertTrue(last.matches(date(2026, 5, 25)));
    assertTrue(last.matches(date(2026, 5, 31)));
    assertFalse(last.matches(date(2026, 5, 24)));
    assertFalse(fifth.matches(date(2026, 5, 29)));

    // June 2026 begins on a Monday and holds five weeks
    assertTrue(first.matches(date(2026, 6, 1)));
    assertTrue(fifth.matches(date(2026, 6, 29)));
    assertTrue(last.matches(date(2026, 6, 30)));
    assertFalse(last.matches(date(2026, 6, 22)));
  }

  @Test
  void testSpecificYears() throws PeriodicityException {
    Periodicity p = Periodicity.builder().yearly(1).inYears(2026, 2028).build();

    assertTrue(p.matches(date(2026, 6, 1)));
    assertFalse(p.matches(date(2027, 6, 1)));
    assertTrue(p.matches(date(2028, 1, 1)));
  }

  @Test
  void testSpecificYearsUseCalendarYear() throws PeriodicityException {
    Periodicity p = Periodicity.builder().yearly(1).inYears(2026).yearStart(Month.APRIL).build();

    assertTrue(p.matches(date(2026, 1, 15)));
    assertFalse(p.matches(date(2027, 1, 15)));
  }

  @Test
  void testAllSlotsMustAccept() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder()
            .monthly(1)
            .onWeekdays(DayOfWeek.MONDAY)
            .onWeeksOfMonth(1)
            .inMonths(Month.JUNE)
            .inYears(2026)
            .build();

    assertTrue(p.matches(date(2026, 6, 1)));
    assertFalse(p.matches(date(2026, 6, 8)));
    assertFalse(p.matches(date(2026, 6, 2)));
    assertFalse(p.matches(date(2027, 6, 7)));
  }

  @Test
  void testSpecialPatternIgnoresTimeframeInMatches() throws PeriodicityException {
    Periodicity p =
        Periodicity.builder().unique(date(2026, 3, 1)).until(date(2026, 2, 1)).build();

    assertTrue(Matcher.matches(p, date(2026, 3, 1)));
    assertFalse(Matcher.withinTimeframe(p, date(2026, 3, 1)));
  }

  @Test
  void testNoTimeframeIsAlwaysWithin() {
    assertTrue(Matcher.withinTimeframe(Periodicity.daily(), LocalDate.MIN));
    assertTrue(Matcher.withinTimeframe(Periodicity.daily(), LocalDate.MAX));
  }

  @Test
  void testExtremeDatesMatchForEveryWeekStart() throws PeriodicityException {
    for (DayOfWeek weekStart : DayOfWeek.values()) {
      Periodicity rolling =
          Periodicity.builder()
              .daily(1)
              .everyNDays(3)
              .everyNWeeks(2)
              .everyNMonths(5)
              .everyNYears(7)
              .anchoredAt(ANCHOR)
              .weekStart(weekStart)
              .build();
      Periodicity lastWeek =
          Periodicity.builder().weekly(1).onWeeksOfMonthFromEnd(1).weekStart(weekStart).build();

      assertDoesNotThrow(() -> rolling.matches(LocalDate.MIN), weekStart.toString());
      assertDoesNotThrow(() -> rolling.matches(LocalDate.MAX), weekStart.toString());
      assertDoesNotThrow(() -> lastWeek.matches(LocalDate.MIN), weekStart.toString());
      assertDoesNotThrow(() -> lastWeek.matches(LocalDate.MAX), weekStart.toString());
    }
  }

  @Test
  void testEveryNWeeksAnchoredAtMinimumDate() throws PeriodicityException {
    for (DayOfWeek weekStart : DayOfWeek.values()) {
      Periodicity p =
          Periodicity.builder()
              .weekly(1)
              .everyNWeeks(2)
              .anchoredAt(LocalDate.MIN)
              .weekStart(weekStart)
              .build();

      assertTrue(p.matches(LocalDate.MIN), weekStart.toString());
      assertFalse(p.matches(LocalDate.MIN.plusDays(7)), weekStart.toString());
      assertTrue(p.matches(LocalDate.MIN.plusDays(14)), weekStart.toString());
    }
  }

  // Purity

  @Test
  void testConcurrentEvaluationIsDeterministic() throws Exception {
    Periodicity p =
        Periodicity.builder()
            .daily(1)
            .everyNDays(5)
            .inMonths(Month.JANUARY, Month.MARCH, Month.OCTOBER)
            .anchoredAt(ANCHOR)
            .build();

    List<LocalDate> dates = new ArrayList<>();
    for (LocalDate d = date(2024, 1, 1); d.isBefore(date(2028, 1, 1)); d = d.plusDays(1)) {
      dates.add(d);
    }
    List<Boolean> expected = new ArrayList<>();
    for (LocalDate d : dates) {
      expected.add(p.matches(d));
    }

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<List<Boolean>>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        futures.add(
            pool.submit(
                () -> {
                  List<Boolean> results = new ArrayList<>();
                  for (LocalDate d : dates) {
                    results.add(p.matches(d));
                  }
                  return results;
                }));
      }
      for (Future<List<Boolean>> future : futures) {
        assertEquals(expected, future.get());
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
