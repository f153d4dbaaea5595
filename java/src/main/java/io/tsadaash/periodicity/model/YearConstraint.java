package io.tsadaash.periodicity.model;

import java.util.List;

/**
 * Restricts which years a pattern applies to.
 *
 * @param kind the type of year constraint
 * @param interval the number of years between occurrences (only used when kind is EVERY_N_YEARS)
 * @param years the absolute years (only used when kind is YEARS)
 */
public record YearConstraint(Kind kind, int interval, List<Integer> years) {

  /** The type of year constraint. */
  public enum Kind {
    /** Matches every year. */
    EVERY_YEAR("every_year"),
    /** Matches every n-th year, counted in years beginning at the configured year start. */
    EVERY_N_YEARS("every_n_years"),
    /** Matches specific calendar years. */
    YEARS("years");

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

  /** Creates a new YearConstraint with a sorted, immutable copy of its years. */
  public YearConstraint {
    years = SortedLists.copyOf(years);
  }

  /**
   * Creates a constraint that matches every year.
   *
   * @return a new every-year constraint
   */
  public static YearConstraint everyYear() {
    return new YearConstraint(Kind.EVERY_YEAR, 0, List.of());
  }

  /**
   * Creates a rolling constraint that matches every n-th year.
   *
   * @param interval the number of years between occurrences (1-100)
   * @return a new every-n-years constraint
   */
  public static YearConstraint everyNYears(int interval) {
    return new YearConstraint(Kind.EVERY_N_YEARS, interval, List.of());
  }

  /**
   * Creates a constraint that matches specific calendar years.
   *
   * @param years the years to match (1900-2200)
   * @return a new specific-years constraint
   */
  public static YearConstraint years(List<Integer> years) {
    return new YearConstraint(Kind.YEARS, 0, years);
  }
}
