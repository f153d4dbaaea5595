package io.tsadaash.periodicity.model;

import java.util.List;

/**
 * Restricts which weeks a pattern applies to.
 *
 * <p>Week-of-month offsets are 0-indexed and count weeks that start in the month, aligned to the
 * configured week start.
 *
 * @param kind the type of week constraint
 * @param interval the number of weeks between occurrences (only used when kind is EVERY_N_WEEKS)
 * @param offsets the 0-indexed week offsets (only used for the WEEKS_OF_MONTH_* kinds)
 */
public record WeekConstraint(Kind kind, int interval, List<Integer> offsets) {

  /** The type of week constraint. */
  public enum Kind {
    /** Matches every week. */
    EVERY_WEEK("every_week"),
    /** Matches every n-th week counted from the anchor. */
    EVERY_N_WEEKS("every_n_weeks"),
    /** Matches specific weeks of the month counted from the first week. */
    WEEKS_OF_MONTH_FROM_START("weeks_of_month_from_start"),
    /** Matches specific weeks of the month counted back from the last week. */
    WEEKS_OF_MONTH_FROM_END("weeks_of_month_from_end");

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

  /** Creates a new WeekConstraint with a sorted, immutable copy of its offsets. */
  public WeekConstraint {
    offsets = SortedLists.copyOf(offsets);
  }

  /**
   * Creates a constraint that matches every week.
   *
   * @return a new every-week constraint
   */
  public static WeekConstraint everyWeek() {
    return new WeekConstraint(Kind.EVERY_WEEK, 0, List.of());
  }

  /**
   * Creates a rolling constraint that matches every n-th week.
   *
   * @param interval the number of weeks between occurrences (1-52)
   * @return a new every-n-weeks constraint
   */
  public static WeekConstraint everyNWeeks(int interval) {
    return new WeekConstraint(Kind.EVERY_N_WEEKS, interval, List.of());
  }

  /**
   * Creates a constraint that matches weeks of the month counted from the first week.
   *
   * @param offsets the 0-indexed offsets (0 = first week, 4 = fifth week)
   * @return a new weeks-of-month constraint
   */
  public static WeekConstraint weeksOfMonthFromStart(List<Integer> offsets) {
    return new WeekConstraint(Kind.WEEKS_OF_MONTH_FROM_START, 0, offsets);
  }

  /**
   * Creates a constraint that matches weeks of the month counted back from the last week.
   *
   * @param offsets the 0-indexed offsets (0 = last week, 1 = second-to-last week)
   * @return a new weeks-of-month-from-end constraint
   */
  public static WeekConstraint weeksOfMonthFromEnd(List<Integer> offsets) {
    return new WeekConstraint(Kind.WEEKS_OF_MONTH_FROM_END, 0, offsets);
  }
}
