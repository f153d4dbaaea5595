package io.tsadaash.periodicity.eval;

import io.tsadaash.periodicity.Periodicity;
import io.tsadaash.periodicity.model.DayConstraint;
import io.tsadaash.periodicity.model.MonthConstraint;
import io.tsadaash.periodicity.model.PeriodicityConstraints;
import io.tsadaash.periodicity.model.PeriodicityData;
import io.tsadaash.periodicity.model.SpecialPattern;
import io.tsadaash.periodicity.model.Timeframe;
import io.tsadaash.periodicity.model.WeekConstraint;
import io.tsadaash.periodicity.model.YearConstraint;
import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Decides whether a calendar date satisfies a validated periodicity.
 *
 * <h2>Evaluation Order</h2>
 *
 * <ol>
 *   <li>A special pattern decides alone: a unique date matches only itself, a custom pattern
 *       matches its listed dates.
 *   <li>Otherwise every populated constraint slot must accept the date. An absent slot accepts
 *       every date.
 * </ol>
 *
 * <p>The timeframe is not part of {@link #matches}; callers combine it with {@link
 * #withinTimeframe} to decide eligibility.
 *
 * <h2>Interval Alignment (Anchor Date)</h2>
 *
 * <p>For every-N constraints with N &gt; 1, a date matches when the number of units elapsed from
 * the effective anchor (the explicit anchor, else the timeframe start) is a multiple of N:
 *
 * <pre>
 * floorMod(units(anchor, date), N) == 0
 * </pre>
 *
 * <p>Units are days, weeks aligned to the configured week start, calendar months, and fiscal
 * years beginning at the configured year start. Floor modulo aligns dates before the anchor the
 * same way as dates after it.
 *
 * <p>Both predicates are pure and hold no state, so they may be called from any thread.
 */
public final class Matcher {
  private Matcher() {}

  /**
   * Checks whether a date satisfies a periodicity, ignoring its timeframe.
   *
   * @param periodicity the validated periodicity
   * @param date the date to check
   * @return true if the date matches
   */
  public static boolean matches(Periodicity periodicity, LocalDate date) {
    Objects.requireNonNull(periodicity, "periodicity");
    Objects.requireNonNull(date, "date");
    PeriodicityData data = periodicity.data();

    if (data.specialPattern() != null) {
      return matchesSpecial(data.specialPattern(), date);
    }

    PeriodicityConstraints c = data.constraints();
    return (c.day() == null || matchesDay(c.day(), data, date))
        && (c.week() == null || matchesWeek(c.week(), data, date))
        && (c.month() == null || matchesMonth(c.month(), data, date))
        && (c.year() == null || matchesYear(c.year(), data, date));
  }

  /**
   * Checks whether a date lies inside the active period of a periodicity.
   *
   * @param periodicity the validated periodicity
   * @param date the date to check
   * @return true if there is no timeframe or {@code start <= date < end}
   */
  public static boolean withinTimeframe(Periodicity periodicity, LocalDate date) {
    Objects.requireNonNull(periodicity, "periodicity");
    Objects.requireNonNull(date, "date");
    Timeframe timeframe = periodicity.data().timeframe();
    return timeframe == null || timeframe.contains(date);
  }

  private static boolean matchesSpecial(SpecialPattern pattern, LocalDate date) {
    return switch (pattern.kind()) {
      case UNIQUE -> date.equals(pattern.date());
      case CUSTOM -> pattern.dates().contains(date);
    };
  }

  private static boolean matchesDay(DayConstraint day, PeriodicityData data, LocalDate date) {
    return switch (day.kind()) {
      case EVERY_DAY -> true;
      case EVERY_N_DAYS ->
          day.interval() <= 1
              || aligned(CalendarMath.daysBetween(anchor(data), date), day.interval());
      case DAYS_OF_WEEK -> day.weekdays().contains(date.getDayOfWeek());
      case DAYS_OF_MONTH_FROM_START ->
          day.offsets().contains(CalendarMath.dayOffsetFromStart(date));
      case DAYS_OF_MONTH_FROM_END -> day.offsets().contains(CalendarMath.dayOffsetFromEnd(date));
      case NTH_WEEKDAYS_OF_MONTH ->
          day.nthWeekdays().stream().anyMatch(p -> CalendarMath.isNthWeekday(date, p));
    };
  }

  private static boolean matchesWeek(WeekConstraint week, PeriodicityData data, LocalDate date) {
    return switch (week.kind()) {
      case EVERY_WEEK -> true;
      case EVERY_N_WEEKS ->
          week.interval() <= 1
              || aligned(
                  CalendarMath.weeksBetween(anchor(data), date, data.weekStart()),
                  week.interval());
      case WEEKS_OF_MONTH_FROM_START ->
          contains(week, CalendarMath.weekOfMonthFromStart(date, data.weekStart()));
      case WEEKS_OF_MONTH_FROM_END ->
          contains(week, CalendarMath.weekOfMonthFromEnd(date, data.weekStart()));
    };
  }

  private static boolean matchesMonth(
      MonthConstraint month, PeriodicityData data, LocalDate date) {
    return switch (month.kind()) {
      case EVERY_MONTH -> true;
      case EVERY_N_MONTHS ->
          month.interval() <= 1
              || aligned(CalendarMath.monthsBetween(anchor(data), date), month.interval());
      case MONTHS -> month.months().contains(date.getMonth());
    };
  }

  private static boolean matchesYear(YearConstraint year, PeriodicityData data, LocalDate date) {
    return switch (year.kind()) {
      case EVERY_YEAR -> true;
      case EVERY_N_YEARS ->
          year.interval() <= 1
              || aligned(
                  CalendarMath.yearsBetween(anchor(data), date, data.yearStart()),
                  year.interval());
      case YEARS -> year.years().contains(date.getYear());
    };
  }

  private static boolean contains(WeekConstraint week, OptionalInt position) {
    return position.isPresent() && week.offsets().contains(position.getAsInt());
  }

  private static boolean aligned(long elapsed, int interval) {
    return Math.floorMod(elapsed, (long) interval) == 0;
  }

  private static LocalDate anchor(PeriodicityData data) {
    return data.effectiveAnchor()
        .orElseThrow(
            () -> new IllegalStateException("rolling interval evaluated without an anchor date"));
  }
}
