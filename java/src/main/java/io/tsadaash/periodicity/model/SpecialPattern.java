package io.tsadaash.periodicity.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A non-regular pattern that replaces cadence and constraints entirely.
 *
 * @param kind the type of special pattern
 * @param date the single date (only used when kind is UNIQUE)
 * @param dates the explicit dates (only used when kind is CUSTOM)
 */
public record SpecialPattern(Kind kind, LocalDate date, List<LocalDate> dates) {

  /** The type of special pattern. */
  public enum Kind {
    /** A one-off occurrence on a single date. */
    UNIQUE("unique"),
    /** Irregular occurrences on an explicit set of dates. */
    CUSTOM("custom");

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

  /** Creates a new SpecialPattern with a sorted, immutable copy of its dates. */
  public SpecialPattern {
    dates = SortedLists.copyOf(dates);
  }

  /**
   * Creates a pattern occurring once on the given date.
   *
   * @param date the date
   * @return a new unique pattern
   */
  public static SpecialPattern unique(LocalDate date) {
    return new SpecialPattern(Kind.UNIQUE, date, List.of());
  }

  /**
   * Creates a pattern occurring on each of the given dates.
   *
   * @param dates the dates
   * @return a new custom pattern
   */
  public static SpecialPattern custom(List<LocalDate> dates) {
    return new SpecialPattern(Kind.CUSTOM, null, dates);
  }
}
