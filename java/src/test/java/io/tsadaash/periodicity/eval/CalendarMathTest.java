package io.tsadaash.periodicity.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.tsadaash.periodicity.model.NthWeekday;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/** Unit tests for calendar arithmetic. */
public class CalendarMathTest {

  private static LocalDate date(int year, int month, int day) {
    return LocalDate.of(year, month, day);
  }

  @Test
  void testLeapYears() {
    assertTrue(CalendarMath.isLeapYear(2024));
    assertTrue(CalendarMath.isLeapYear(2000));
    assertFalse(CalendarMath.isLeapYear(1900));
    assertFalse(CalendarMath.isLeapYear(2026));
  }

  @Test
  void testDaysInMonth() {
    assertEquals(29, CalendarMath.daysInMonth(2024, Month.FEBRUARY));
    assertEquals(28, CalendarMath.daysInMonth(2026, Month.FEBRUARY));
    assertEquals(30, CalendarMath.daysInMonth(2026, Month.APRIL));
    assertEquals(31, CalendarMath.daysInMonth(2026, Month.DECEMBER));
  }

  @Test
  void testDaysInMonthAgreesWithJavaTime() {
    for (int year = 1900; year <= 2200; year++) {
      for (Month month : Month.values()) {
        assertEquals(
            YearMonth.of(year, month).lengthOfMonth(),
            CalendarMath.daysInMonth(year, month),
            year + "-" + month);
      }
    }
  }

  @Test
  void testDayOffsets() {
    assertEquals(0, CalendarMath.dayOffsetFromStart(date(2026, 3, 1)));
    assertEquals(30, CalendarMath.dayOffsetFromStart(date(2026, 3, 31)));
    assertEquals(0, CalendarMath.dayOffsetFromEnd(date(2024, 2, 29)));
    assertEquals(1, CalendarMath.dayOffsetFromEnd(date(2024, 2, 28)));
    assertEquals(0, CalendarMath.dayOffsetFromEnd(date(2026, 2, 28)));
  }

  @Test
  void testNthWeekday() {
    // February 2026: Fridays on the 6th, 13th, 20th and 27th
    assertTrue(CalendarMath.isNthWeekday(date(2026, 2, 6), NthWeekday.first(DayOfWeek.FRIDAY)));
    assertTrue(CalendarMath.isNthWeekday(date(2026, 2, 27), NthWeekday.last(DayOfWeek.FRIDAY)));
    assertTrue(
        CalendarMath.isNthWeekday(date(2026, 2, 27), NthWeekday.fourth(DayOfWeek.FRIDAY)));
    assertTrue(
        CalendarMath.isNthWeekday(
            date(2026, 2, 20), NthWeekday.secondToLast(DayOfWeek.FRIDAY)));
    assertFalse(
        CalendarMath.isNthWeekday(date(2026, 2, 20), NthWeekday.last(DayOfWeek.FRIDAY)));
    assertFalse(
        CalendarMath.isNthWeekday(date(2026, 2, 6), NthWeekday.first(DayOfWeek.THURSDAY)));
  }

  @Test
  void testWeekOfMonthWithLeadingDays() {
    // May 2026 begins on a Friday; the first Monday is the 4th
    assertEquals(OptionalInt.empty(), fromStart(date(2026, 5, 3), DayOfWeek.MONDAY));
    assertEquals(OptionalInt.of(0), fromStart(date(2026, 5, 4), DayOfWeek.MONDAY));
    assertEquals(OptionalInt.of(0), fromStart(date(2026, 5, 10), DayOfWeek.MONDAY));
    assertEquals(OptionalInt.of(1), fromStart(date(2026, 5, 11), DayOfWeek.MONDAY));
    assertEquals(OptionalInt.of(3), fromStart(date(2026, 5, 31), DayOfWeek.MONDAY));

    assertEquals(OptionalInt.of(3), fromEnd(date(2026, 5, 4), DayOfWeek.MONDAY));
    assertEquals(OptionalInt.of(0), fromEnd(date(2026, 5, 25), DayOfWeek.MONDAY));
    assertEquals(OptionalInt.empty(), fromEnd(date(2026, 5, 1), DayOfWeek.MONDAY));
  }

  @Test
  void testWeekOfMonthDependsOnWeekStart() {
    // May 1 2026 is a Friday, so a Friday week start has no leading days
    assertEquals(OptionalInt.of(0), fromStart(date(2026, 5, 1), DayOfWeek.FRIDAY));
    assertEquals(OptionalInt.of(4), fromStart(date(2026, 5, 29), DayOfWeek.FRIDAY));
    assertEquals(OptionalInt.of(0), fromStart(date(2026, 5, 3), DayOfWeek.SUNDAY));
  }

  private static OptionalInt fromStart(LocalDate date, DayOfWeek weekStart) {
    return CalendarMath.weekOfMonthFromStart(date, weekStart);
  }

  private static OptionalInt fromEnd(LocalDate date, DayOfWeek weekStart) {
    return CalendarMath.weekOfMonthFromEnd(date, weekStart);
  }

  @Test
  void testWeeksInMonth() {
    assertEquals(4, CalendarMath.weeksInMonth(YearMonth.of(2026, 5), DayOfWeek.MONDAY));
    assertEquals(5, CalendarMath.weeksInMonth(YearMonth.of(2026, 6), DayOfWeek.MONDAY));
    assertEquals(5, CalendarMath.weeksInMonth(YearMonth.of(2026, 5), DayOfWeek.FRIDAY));
    // February 2026 begins on a Sunday and has exactly four of each weekday
    assertEquals(4, CalendarMath.weeksInMonth(YearMonth.of(2026, 2), DayOfWeek.SUNDAY));
  }

  @Test
  void testWeekIndex() {
    // 2026-01-01 is a Thursday
    long thursday = CalendarMath.weekIndex(date(2026, 1, 1), DayOfWeek.MONDAY);
    assertEquals(thursday, CalendarMath.weekIndex(date(2025, 12, 29), DayOfWeek.MONDAY));
    assertEquals(thursday, CalendarMath.weekIndex(date(2026, 1, 4), DayOfWeek.MONDAY));
    assertEquals(thursday + 1, CalendarMath.weekIndex(date(2026, 1, 5), DayOfWeek.MONDAY));
    assertEquals(
        CalendarMath.weekIndex(date(2025, 12, 28), DayOfWeek.SUNDAY),
        CalendarMath.weekIndex(date(2026, 1, 3), DayOfWeek.SUNDAY));
    assertEquals(0, CalendarMath.weekIndex(date(1970, 1, 5), DayOfWeek.MONDAY));
    assertEquals(-1, CalendarMath.weekIndex(date(1970, 1, 4), DayOfWeek.MONDAY));
  }

  @Test
  void testWeekIndexAtExtremeDates() {
    for (DayOfWeek weekStart : DayOfWeek.values()) {
      long min = CalendarMath.weekIndex(LocalDate.MIN, weekStart);
      long max = CalendarMath.weekIndex(LocalDate.MAX, weekStart);
      assertEquals(min + 1, CalendarMath.weekIndex(LocalDate.MIN.plusDays(7), weekStart));
      assertEquals(max - 1, CalendarMath.weekIndex(LocalDate.MAX.minusDays(7), weekStart));
      assertEquals(
          2, CalendarMath.weeksBetween(LocalDate.MIN, LocalDate.MIN.plusDays(14), weekStart));
    }
  }

  @Test
  void testFiscalYear() {
    assertEquals(2026, CalendarMath.fiscalYear(date(2026, 3, 31), Month.JANUARY));
    assertEquals(2025, CalendarMath.fiscalYear(date(2026, 3, 31), Month.APRIL));
    assertEquals(2026, CalendarMath.fiscalYear(date(2026, 4, 1), Month.APRIL));
  }

  @Test
  void testUnitsBetween() {
    LocalDate anchor = date(2026, 1, 1);
    assertEquals(-3, CalendarMath.daysBetween(anchor, date(2025, 12, 29)));
    assertEquals(0, CalendarMath.weeksBetween(anchor, date(2026, 1, 4), DayOfWeek.MONDAY));
    assertEquals(1, CalendarMath.weeksBetween(anchor, date(2026, 1, 4), DayOfWeek.SUNDAY));
    assertEquals(1, CalendarMath.monthsBetween(date(2026, 1, 31), date(2026, 2, 1)));
    assertEquals(-1, CalendarMath.monthsBetween(anchor, date(2025, 12, 31)));
    assertEquals(1, CalendarMath.yearsBetween(date(2026, 3, 31), date(2026, 4, 1), Month.APRIL));
  }
}
