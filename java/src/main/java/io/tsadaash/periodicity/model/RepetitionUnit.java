package io.tsadaash.periodicity.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** The cadence unit of a periodicity: how often it repeats, independent of which dates qualify. */
public enum RepetitionUnit {
  DAY("day", 100),
  WEEK("week", 50),
  MONTH("month", 100),
  YEAR("year", 366),
  /** No cadence; only valid together with a special pattern. */
  NONE("none", 0);

  private final String value;
  private final int maxPerUnit;

  RepetitionUnit(String value, int maxPerUnit) {
    this.value = value;
    this.maxPerUnit = maxPerUnit;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the unit as a lowercase string
   */
  public String value() {
    return value;
  }

  /**
   * Returns the largest accepted repetition count for this unit.
   *
   * @return the per-unit ceiling, or 0 for {@link #NONE}
   */
  public int maxPerUnit() {
    return maxPerUnit;
  }

  @Override
  public String toString() {
    return value;
  }

  private static final Map<String, RepetitionUnit> PARSE_MAP =
      Map.of("day", DAY, "week", WEEK, "month", MONTH, "year", YEAR, "none", NONE);

  /**
   * Parses a unit name (case insensitive).
   *
   * @param s the string to parse
   * @return the unit if valid
   */
  public static Optional<RepetitionUnit> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase(Locale.ROOT)));
  }
}
