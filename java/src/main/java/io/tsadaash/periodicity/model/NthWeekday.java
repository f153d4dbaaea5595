package io.tsadaash.periodicity.model;

import java.time.DayOfWeek;
import java.util.Comparator;

/**
 * An ordinal weekday of a month, such as "first monday" or "last friday".
 *
 * @param ordinal the ordinal position within the month
 * @param weekday the day of the week
 */
public record NthWeekday(OrdinalPosition ordinal, DayOfWeek weekday)
    implements Comparable<NthWeekday> {

  private static final Comparator<NthWeekday> ORDER =
      Comparator.<NthWeekday, OrdinalPosition>comparing(
              NthWeekday::ordinal, Comparator.nullsFirst(Comparator.naturalOrder()))
          .thenComparing(
              NthWeekday::weekday, Comparator.nullsFirst(Comparator.<DayOfWeek>naturalOrder()));

  /**
   * Creates the first occurrence of a weekday in the month.
   *
   * @param weekday the day of the week
   * @return a new nth weekday
   */
  public static NthWeekday first(DayOfWeek weekday) {
    return new NthWeekday(OrdinalPosition.FIRST, weekday);
  }

  /**
   * Creates the second occurrence of a weekday in the month.
   *
   * @param weekday the day of the week
   * @return a new nth weekday
   */
  public static NthWeekday second(DayOfWeek weekday) {
    return new NthWeekday(OrdinalPosition.SECOND, weekday);
  }

  /**
   * Creates the third occurrence of a weekday in the month.
   *
   * @param weekday the day of the week
   * @return a new nth weekday
   */
  public static NthWeekday third(DayOfWeek weekday) {
    return new NthWeekday(OrdinalPosition.THIRD, weekday);
  }

  /**
   * Creates the fourth occurrence of a weekday in the month.
   *
   * @param weekday the day of the week
   * @return a new nth weekday
   */
  public static NthWeekday fourth(DayOfWeek weekday) {
    return new NthWeekday(OrdinalPosition.FOURTH, weekday);
  }

  /**
   * Creates the last occurrence of a weekday in the month.
   *
   * @param weekday the day of the week
   * @return a new nth weekday
   */
  public static NthWeekday last(DayOfWeek weekday) {
    return new NthWeekday(OrdinalPosition.LAST, weekday);
  }

  /**
   * Creates the second-to-last occurrence of a weekday in the month.
   *
   * @param weekday the day of the week
   * @return a new nth weekday
   */
  public static NthWeekday secondToLast(DayOfWeek weekday) {
    return new NthWeekday(OrdinalPosition.SECOND_TO_LAST, weekday);
  }

  @Override
  public int compareTo(NthWeekday other) {
    return ORDER.compare(this, other);
  }
}
