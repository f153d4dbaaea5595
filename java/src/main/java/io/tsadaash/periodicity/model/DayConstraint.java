package io.tsadaash.periodicity.model;

import java.time.DayOfWeek;
import java.util.List;

/**
 * Restricts which days of a period a pattern applies to.
 *
 * <p>Day-of-month offsets are 0-indexed: offset 0 is the 1st of the month when counting from the
 * start and the last day of the month when counting from the end.
 *
 * @param kind the type of day constraint
 * @param interval the number of days between occurrences (only used when kind is EVERY_N_DAYS)
 * @param weekdays the days of the week (only used when kind is DAYS_OF_WEEK)
 * @param offsets the 0-indexed day offsets (only used for the DAYS_OF_MONTH_* kinds)
 * @param nthWeekdays the ordinal weekdays (only used when kind is NTH_WEEKDAYS_OF_MONTH)
 */
public record DayConstraint(
    Kind kind,
    int interval,
    List<DayOfWeek> weekdays,
    List<Integer> offsets,
    List<NthWeekday> nthWeekdays) {

  /** The type of day constraint. */
  public enum Kind {
    /** Matches every day. */
    EVERY_DAY("every_day"),
    /** Matches every n-th day counted from the anchor. */
    EVERY_N_DAYS("every_n_days"),
    /** Matches specific days of the week. */
    DAYS_OF_WEEK("days_of_week"),
    /** Matches specific days of the month counted from the 1st. */
    DAYS_OF_MONTH_FROM_START("days_of_month_from_start"),
    /** Matches specific days of the month counted back from the last day. */
    DAYS_OF_MONTH_FROM_END("days_of_month_from_end"),
    /** Matches ordinal weekdays of the month (e.g., last friday). */
    NTH_WEEKDAYS_OF_MONTH("nth_weekdays_of_month");

    private final String tag;

    Kind(String tag) {
      this.tag = tag;
    }

    /**
     * Returns the snake_case tag used in encodings and error messages.
     *
     * @return the tag
     */
    public String tag() {
      return tag;
    }
  }

  /** Creates a new DayConstraint with sorted, immutable copies of its collections. */
  public DayConstraint {
    weekdays = SortedLists.copyOf(weekdays);
    offsets = SortedLists.copyOf(offsets);
    nthWeekdays = SortedLists.copyOf(nthWeekdays);
  }

  /**
   * Creates a constraint that matches every day.
   *
   * @return a new every-day constraint
   */
  public static DayConstraint everyDay() {
    return new DayConstraint(Kind.EVERY_DAY, 0, List.of(), List.of(), List.of());
  }

  /**
   * Creates a rolling constraint that matches every n-th day.
   *
   * @param interval the number of days between occurrences (1-366)
   * @return a new every-n-days constraint
   */
  public static DayConstraint everyNDays(int interval) {
    return new DayConstraint(Kind.EVERY_N_DAYS, interval, List.of(), List.of(), List.of());
  }

  /**
   * Creates a constraint that matches specific days of the week.
   *
   * @param weekdays the days to match
   * @return a new days-of-week constraint
   */
  public static DayConstraint daysOfWeek(List<DayOfWeek> weekdays) {
    return new DayConstraint(Kind.DAYS_OF_WEEK, 0, weekdays, List.of(), List.of());
  }

  /**
   * Creates a constraint that matches days of the month counted from the 1st.
   *
   * @param offsets the 0-indexed offsets (0 = the 1st, 30 = the 31st)
   * @return a new days-of-month constraint
   */
  public static DayConstraint daysOfMonthFromStart(List<Integer> offsets) {
    return new DayConstraint(Kind.DAYS_OF_MONTH_FROM_START, 0, List.of(), offsets, List.of());
  }

  /**
   * Creates a constraint that matches days of the month counted back from the last day.
   *
   * @param offsets the 0-indexed offsets (0 = the last day, 1 = the second-to-last day)
   * @return a new days-of-month-from-end constraint
   */
  public static DayConstraint daysOfMonthFromEnd(List<Integer> offsets) {
    return new DayConstraint(Kind.DAYS_OF_MONTH_FROM_END, 0, List.of(), offsets, List.of());
  }

  /**
   * Creates a constraint that matches ordinal weekdays of the month.
   *
   * @param nthWeekdays the ordinal weekdays to match
   * @return a new nth-weekdays constraint
   */
  public static DayConstraint nthWeekdaysOfMonth(List<NthWeekday> nthWeekdays) {
    return new DayConstraint(Kind.NTH_WEEKDAYS_OF_MONTH, 0, List.of(), List.of(), nthWeekdays);
  }
}
