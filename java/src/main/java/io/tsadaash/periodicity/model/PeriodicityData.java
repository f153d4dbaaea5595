package io.tsadaash.periodicity.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.Optional;

/**
 * The complete, not yet validated description of a periodicity.
 *
 * <p>Instances may hold any combination of values; only a {@code Periodicity} guarantees that the
 * combination passed validation.
 *
 * @param repUnit the cadence unit (may be null)
 * @param repPerUnit the number of occurrences per unit (may be null)
 * @param constraints the filter slots
 * @param timeframe the active period (may be null)
 * @param weekStart the first day of the week for week arithmetic
 * @param yearStart the first month of the year for year arithmetic
 * @param specialPattern the special pattern (may be null)
 * @param anchor the reference date for rolling intervals (may be null)
 */
public record PeriodicityData(
    RepetitionUnit repUnit,
    Integer repPerUnit,
    PeriodicityConstraints constraints,
    Timeframe timeframe,
    DayOfWeek weekStart,
    Month yearStart,
    SpecialPattern specialPattern,
    LocalDate anchor) {

  /** The default first day of the week. */
  public static final DayOfWeek DEFAULT_WEEK_START = DayOfWeek.MONDAY;

  /** The default first month of the year. */
  public static final Month DEFAULT_YEAR_START = Month.JANUARY;

  /** Creates a new PeriodicityData, substituting empty constraints for null. */
  public PeriodicityData {
    constraints = constraints == null ? PeriodicityConstraints.none() : constraints;
  }

  /**
   * Creates data for a regular pattern with default calendar settings.
   *
   * @param repUnit the cadence unit
   * @param repPerUnit the number of occurrences per unit
   * @return new data with no constraints, timeframe, special pattern or anchor
   */
  public static PeriodicityData of(RepetitionUnit repUnit, Integer repPerUnit) {
    return new PeriodicityData(
        repUnit,
        repPerUnit,
        PeriodicityConstraints.none(),
        null,
        DEFAULT_WEEK_START,
        DEFAULT_YEAR_START,
        null,
        null);
  }

  /**
   * Creates data for a special pattern with default calendar settings.
   *
   * @param specialPattern the special pattern
   * @return new data with {@link RepetitionUnit#NONE} and no constraints
   */
  public static PeriodicityData special(SpecialPattern specialPattern) {
    return new PeriodicityData(
        RepetitionUnit.NONE,
        null,
        PeriodicityConstraints.none(),
        null,
        DEFAULT_WEEK_START,
        DEFAULT_YEAR_START,
        specialPattern,
        null);
  }

  /**
   * Returns the reference date for rolling intervals: the explicit anchor, or else the timeframe
   * start.
   *
   * @return the effective anchor, or empty if neither is set
   */
  public Optional<LocalDate> effectiveAnchor() {
    if (anchor != null) {
      return Optional.of(anchor);
    }
    return timeframe == null ? Optional.empty() : timeframe.startDate();
  }

  /**
   * Returns a copy with the specified cadence.
   *
   * @param repUnit the cadence unit
   * @param repPerUnit the number of occurrences per unit
   * @return new data with the updated cadence
   */
  public PeriodicityData withRepetition(RepetitionUnit repUnit, Integer repPerUnit) {
    return new PeriodicityData(
        repUnit, repPerUnit, constraints, timeframe, weekStart, yearStart, specialPattern, anchor);
  }

  /**
   * Returns a copy with the specified constraints.
   *
   * @param constraints the constraints
   * @return new data with the updated constraints
   */
  public PeriodicityData withConstraints(PeriodicityConstraints constraints) {
    return new PeriodicityData(
        repUnit, repPerUnit, constraints, timeframe, weekStart, yearStart, specialPattern, anchor);
  }

  /**
   * Returns a copy with the specified timeframe.
   *
   * @param timeframe the timeframe
   * @return new data with the updated timeframe
   */
  public PeriodicityData withTimeframe(Timeframe timeframe) {
    return new PeriodicityData(
        repUnit, repPerUnit, constraints, timeframe, weekStart, yearStart, specialPattern, anchor);
  }

  /**
   * Returns a copy with the specified calendar settings.
   *
   * @param weekStart the first day of the week
   * @param yearStart the first month of the year
   * @return new data with the updated calendar settings
   */
  public PeriodicityData withCalendar(DayOfWeek weekStart, Month yearStart) {
    return new PeriodicityData(
        repUnit, repPerUnit, constraints, timeframe, weekStart, yearStart, specialPattern, anchor);
  }

  /**
   * Returns a copy with the specified anchor.
   *
   * @param anchor the reference date for rolling intervals
   * @return new data with the updated anchor
   */
  public PeriodicityData withAnchor(LocalDate anchor) {
    return new PeriodicityData(
        repUnit, repPerUnit, constraints, timeframe, weekStart, yearStart, specialPattern, anchor);
  }
}
