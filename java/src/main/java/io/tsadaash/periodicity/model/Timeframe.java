package io.tsadaash.periodicity.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * The half-open period {@code [start, end)} during which a pattern is active. Either bound may be
 * absent.
 *
 * @param start the first active date, inclusive (may be null)
 * @param end the first inactive date, exclusive (may be null)
 */
public record Timeframe(LocalDate start, LocalDate end) {

  /**
   * Creates a timeframe bounded on both sides.
   *
   * @param start the first active date
   * @param end the first inactive date
   * @return a new bounded timeframe
   */
  public static Timeframe between(LocalDate start, LocalDate end) {
    return new Timeframe(start, end);
  }

  /**
   * Creates a timeframe with only a lower bound.
   *
   * @param start the first active date
   * @return a new open-ended timeframe
   */
  public static Timeframe startingFrom(LocalDate start) {
    return new Timeframe(start, null);
  }

  /**
   * Creates a timeframe with only an upper bound.
   *
   * @param end the first inactive date
   * @return a new timeframe open towards the past
   */
  public static Timeframe until(LocalDate end) {
    return new Timeframe(null, end);
  }

  /**
   * Returns the inclusive start, if bounded.
   *
   * @return the start date, or empty
   */
  public Optional<LocalDate> startDate() {
    return Optional.ofNullable(start);
  }

  /**
   * Checks whether a date lies inside this timeframe.
   *
   * @param date the date to check
   * @return true if {@code start <= date < end}, treating absent bounds as unbounded
   */
  public boolean contains(LocalDate date) {
    return (start == null || !date.isBefore(start)) && (end == null || date.isBefore(end));
  }
}
