package io.tsadaash.periodicity.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * An ordinal occurrence of a weekday within a month, counted from the front (first..fifth) or
 * from the back (last..fifth-to-last).
 */
public enum OrdinalPosition {
  FIRST(1, "first"),
  SECOND(2, "second"),
  THIRD(3, "third"),
  FOURTH(4, "fourth"),
  FIFTH(5, "fifth"),
  LAST(-1, "last"),
  SECOND_TO_LAST(-2, "second-to-last"),
  THIRD_TO_LAST(-3, "third-to-last"),
  FOURTH_TO_LAST(-4, "fourth-to-last"),
  FIFTH_TO_LAST(-5, "fifth-to-last");

  private final int number;
  private final String displayName;

  OrdinalPosition(int number, String displayName) {
    this.number = number;
    this.displayName = displayName;
  }

  /**
   * Returns whether this position is counted from the end of the month.
   *
   * @return true for LAST and the *_TO_LAST positions
   */
  public boolean fromEnd() {
    return number < 0;
  }

  /**
   * Returns the 0-indexed week offset within the month, counted from the side this position
   * refers to (FIRST and LAST are both 0).
   *
   * @return the week offset, 0 to 4
   */
  public int offset() {
    return Math.abs(number) - 1;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, OrdinalPosition> PARSE_MAP =
      Map.of(
          "first", FIRST,
          "second", SECOND,
          "third", THIRD,
          "fourth", FOURTH,
          "fifth", FIFTH,
          "last", LAST,
          "second-to-last", SECOND_TO_LAST,
          "third-to-last", THIRD_TO_LAST,
          "fourth-to-last", FOURTH_TO_LAST,
          "fifth-to-last", FIFTH_TO_LAST);

  /**
   * Parses an ordinal position name (case insensitive).
   *
   * @param s the string to parse
   * @return the ordinal position if valid
   */
  public static Optional<OrdinalPosition> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase(Locale.ROOT)));
  }
}
