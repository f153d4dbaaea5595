package io.tsadaash.periodicity.model;

import java.time.Month;
import java.util.List;

/**
 * Restricts which months a pattern applies to.
 *
 * @param kind the type of month constraint
 * @param interval the number of months between occurrences (only used when kind is
 *     EVERY_N_MONTHS)
 * @param months the calendar months (only used when kind is MONTHS)
 */
public record MonthConstraint(Kind kind, int interval, List<Month> months) {

  /** The type of month constraint. */
  public enum Kind {
    /** Matches every month. */
    EVERY_MONTH("every_month"),
    /** Matches every n-th month counted from the anchor. */
    EVERY_N_MONTHS("every_n_months"),
    /** Matches specific calendar months. */
    MONTHS("months");

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

  /** Creates a new MonthConstraint with a sorted, immutable copy of its months. */
  public MonthConstraint {
    months = SortedLists.copyOf(months);
  }

  /**
   * Creates a constraint that matches every month.
   *
   * @return a new every-month constraint
   */
  public static MonthConstraint everyMonth() {
    return new MonthConstraint(Kind.EVERY_MONTH, 0, List.of());
  }

  /**
   * Creates a rolling constraint that matches every n-th month.
   *
   * @param interval the number of months between occurrences (1-12)
   * @return a new every-n-months constraint
   */
  public static MonthConstraint everyNMonths(int interval) {
    return new MonthConstraint(Kind.EVERY_N_MONTHS, interval, List.of());
  }

  /**
   * Creates a constraint that matches specific calendar months.
   *
   * @param months the months to match
   * @return a new specific-months constraint
   */
  public static MonthConstraint months(List<Month> months) {
    return new MonthConstraint(Kind.MONTHS, 0, months);
  }
}
