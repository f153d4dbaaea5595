package io.tsadaash.periodicity.eval;

import io.tsadaash.periodicity.model.NthWeekday;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.OptionalInt;

/**
 * Calendar arithmetic shared by every matching rule.
 *
 * <h2>Week of Month</h2>
 *
 * <p>Weeks are aligned to the configured first day of the week and belong to the month in which
 * they start. Week 0 begins on the first {@code weekStart} day of the month; the days before it
 * close the previous month's last week and have no week-of-month position of their own.
 *
 * <p>Example for May 2026 (begins on a Friday) with weeks starting on Monday:
 *
 * <ul>
 *   <li>May 1-3: no position
 *   <li>May 4-10: week 0 from start, week 3 from end
 *   <li>May 25-31: week 3 from start, week 0 from end
 * </ul>
 *
 * <h2>Fiscal Year</h2>
 *
 * <p>A fiscal year is labelled by the calendar year in which it begins. With a year start of
 * April, 2026-03-31 belongs to fiscal year 2025 and 2026-04-01 to fiscal year 2026.
 */
public final class CalendarMath {
  private CalendarMath() {}

  /**
   * Checks whether a year has a February 29th.
   *
   * @param year the proleptic year
   * @return true for leap years
   */
  public static boolean isLeapYear(int year) {
    return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
  }

  /**
   * Returns the number of days in a month.
   *
   * @param year the year
   * @param month the month
   * @return 28 to 31
   */
  public static int daysInMonth(int year, Month month) {
    return switch (month) {
      case FEBRUARY -> isLeapYear(year) ? 29 : 28;
      case APRIL, JUNE, SEPTEMBER, NOVEMBER -> 30;
      default -> 31;
    };
  }

  /**
   * Returns the number of days in the month containing a date.
   *
   * @param date the date
   * @return 28 to 31
   */
  public static int daysInMonth(LocalDate date) {
    return daysInMonth(date.getYear(), date.getMonth());
  }

  /**
   * Returns the 0-indexed position of a date counted from the first day of its month.
   *
   * @param date the date
   * @return 0 for the 1st
   */
  public static int dayOffsetFromStart(LocalDate date) {
    return date.getDayOfMonth() - 1;
  }

  /**
   * Returns the 0-indexed position of a date counted back from the last day of its month.
   *
   * @param date the date
   * @return 0 for the last day of the month
   */
  public static int dayOffsetFromEnd(LocalDate date) {
    return daysInMonth(date) - date.getDayOfMonth();
  }

  /**
   * Checks whether a date is the given ordinal occurrence of a weekday within its month.
   *
   * @param date the date
   * @param pattern the ordinal and weekday
   * @return true if the date falls on the weekday at that position
   */
  public static boolean isNthWeekday(LocalDate date, NthWeekday pattern) {
    if (date.getDayOfWeek() != pattern.weekday()) {
      return false;
    }
    int position =
        pattern.ordinal().fromEnd()
            ? dayOffsetFromEnd(date) / 7
            : dayOffsetFromStart(date) / 7;
    return position == pattern.ordinal().offset();
  }

  /**
   * Returns the 0-indexed week of the month, counted from the first week starting in the month.
   *
   * @param date the date
   * @param weekStart the first day of the week
   * @return the week position, or empty if the date precedes the first week of its month
   */
  public static OptionalInt weekOfMonthFromStart(LocalDate date, DayOfWeek weekStart) {
    int first = firstWeekStartDay(YearMonth.from(date), weekStart);
    if (date.getDayOfMonth() < first) {
      return OptionalInt.empty();
    }
    return OptionalInt.of((date.getDayOfMonth() - first) / 7);
  }

  /**
   * Returns the 0-indexed week of the month, counted back from the last week starting in the
   * month.
   *
   * @param date the date
   * @param weekStart the first day of the week
   * @return the week position, or empty if the date precedes the first week of its month
   */
  public static OptionalInt weekOfMonthFromEnd(LocalDate date, DayOfWeek weekStart) {
    OptionalInt fromStart = weekOfMonthFromStart(date, weekStart);
    if (fromStart.isEmpty()) {
      return fromStart;
    }
    int weeks = weeksInMonth(YearMonth.from(date), weekStart);
    return OptionalInt.of(weeks - 1 - fromStart.getAsInt());
  }

  /**
   * Returns the number of weeks that start within a month.
   *
   * @param month the month
   * @param weekStart the first day of the week
   * @return 4 or 5
   */
  public static int weeksInMonth(YearMonth month, DayOfWeek weekStart) {
    int first = firstWeekStartDay(month, weekStart);
    return (daysInMonth(month.getYear(), month.getMonth()) - first) / 7 + 1;
  }

  /**
   * Returns the index of the week containing a date, counted in weeks beginning on {@code
   * weekStart}. Two dates share an index exactly when they fall in the same week. Works from
   * epoch days, so it is defined for every representable date.
   *
   * @param date the date
   * @param weekStart the first day of the week
   * @return the week index, 0 for the week beginning on the first {@code weekStart} on or after
   *     1970-01-01
   */
  public static long weekIndex(LocalDate date, DayOfWeek weekStart) {
    // 1970-01-01 is a Thursday
    long shift = Math.floorMod(weekStart.getValue() - DayOfWeek.THURSDAY.getValue(), 7);
    return Math.floorDiv(date.toEpochDay() - shift, 7);
  }

  /**
   * Returns the fiscal year containing a date.
   *
   * @param date the date
   * @param yearStart the first month of the fiscal year
   * @return the calendar year in which the containing fiscal year begins
   */
  public static int fiscalYear(LocalDate date, Month yearStart) {
    return date.getMonthValue() >= yearStart.getValue() ? date.getYear() : date.getYear() - 1;
  }

  /**
   * Returns the number of days from one date to another.
   *
   * @param from the reference date
   * @param to the target date
   * @return a negative count if {@code to} precedes {@code from}
   */
  public static long daysBetween(LocalDate from, LocalDate to) {
    return ChronoUnit.DAYS.between(from, to);
  }

  /**
   * Returns the number of week boundaries crossed from one date to another.
   *
   * @param from the reference date
   * @param to the target date
   * @param weekStart the first day of the week
   * @return 0 for two dates in the same week
   */
  public static long weeksBetween(LocalDate from, LocalDate to, DayOfWeek weekStart) {
    return weekIndex(to, weekStart) - weekIndex(from, weekStart);
  }

  /**
   * Returns the number of calendar-month boundaries crossed from one date to another.
   *
   * @param from the reference date
   * @param to the target date
   * @return 0 for two dates in the same month
   */
  public static long monthsBetween(LocalDate from, LocalDate to) {
    return ChronoUnit.MONTHS.between(YearMonth.from(from), YearMonth.from(to));
  }

  /**
   * Returns the number of fiscal-year boundaries crossed from one date to another.
   *
   * @param from the reference date
   * @param to the target date
   * @param yearStart the first month of the fiscal year
   * @return 0 for two dates in the same fiscal year
   */
  public static long yearsBetween(LocalDate from, LocalDate to, Month yearStart) {
    return (long) fiscalYear(to, yearStart) - fiscalYear(from, yearStart);
  }

  private static int firstWeekStartDay(YearMonth month, DayOfWeek weekStart) {
    DayOfWeek first = month.atDay(1).getDayOfWeek();
    return 1 + Math.floorMod(weekStart.getValue() - first.getValue(), 7);
  }
}
