package io.tsadaash.periodicity;

import io.tsadaash.periodicity.display.Display;
import io.tsadaash.periodicity.eval.Matcher;
import io.tsadaash.periodicity.model.DayConstraint;
import io.tsadaash.periodicity.model.MonthConstraint;
import io.tsadaash.periodicity.model.NthWeekday;
import io.tsadaash.periodicity.model.PeriodicityConstraints;
import io.tsadaash.periodicity.model.PeriodicityData;
import io.tsadaash.periodicity.model.RepetitionUnit;
import io.tsadaash.periodicity.model.SpecialPattern;
import io.tsadaash.periodicity.model.Timeframe;
import io.tsadaash.periodicity.model.WeekConstraint;
import io.tsadaash.periodicity.model.YearConstraint;
import io.tsadaash.periodicity.validation.ValidationError;
import io.tsadaash.periodicity.validation.Validator;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A validated, immutable description of when something recurs.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Periodicity payday = Periodicity.builder()
 *     .daily(1)
 *     .onMonthDays(13, 24)
 *     .inMonths(Month.JANUARY, Month.FEBRUARY)
 *     .build();
 * if (payday.matches(date) && payday.withinTimeframe(date)) {
 *     ...
 * }
 * }</pre>
 *
 * <p>Instances exist only after passing {@link Validator}; every construction path, including the
 * convenience constructors and decoding, goes through {@link #of(PeriodicityData)}. Equality is
 * structural.
 */
public final class Periodicity {
  private static final Logger log = LoggerFactory.getLogger(Periodicity.class);

  private final PeriodicityData data;

  private Periodicity(PeriodicityData data) {
    this.data = data;
  }

  /**
   * Validates a candidate and wraps it.
   *
   * @param data the candidate
   * @return the validated periodicity
   * @throws PeriodicityException if the candidate violates a rule
   */
  public static Periodicity of(PeriodicityData data) throws PeriodicityException {
    Objects.requireNonNull(data, "data");
    Optional<ValidationError> error = Validator.validate(data);
    if (error.isPresent()) {
      log.debug("Rejected periodicity {}: {}", data, error.get().message());
      throw new PeriodicityException(error.get());
    }
    return new Periodicity(data);
  }

  /**
   * Returns a new builder with default calendar settings.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a pattern matching every day.
   *
   * @return once per day, every day
   */
  public static Periodicity daily() {
    return buildFixed(builder().daily(1).everyDay());
  }

  /**
   * Returns a pattern matching every day of every week.
   *
   * @return once per week, every week
   */
  public static Periodicity weekly() {
    return buildFixed(builder().weekly(1).everyWeek());
  }

  /**
   * Returns a pattern matching every day of every month.
   *
   * @return once per month, every month
   */
  public static Periodicity monthly() {
    return buildFixed(builder().monthly(1).everyMonth());
  }

  /**
   * Returns a pattern matching every day of every year.
   *
   * @return once per year, every year
   */
  public static Periodicity yearly() {
    return buildFixed(builder().yearly(1).everyYear());
  }

  /**
   * Returns a one-off pattern.
   *
   * @param date the single date
   * @return a pattern matching only {@code date}
   * @throws PeriodicityException if the date is missing
   */
  public static Periodicity unique(LocalDate date) throws PeriodicityException {
    return builder().unique(date).build();
  }

  /**
   * Returns a pattern matching an explicit set of dates.
   *
   * @param dates the dates
   * @return a pattern matching exactly the given dates
   * @throws PeriodicityException if the dates are empty or repeated
   */
  public static Periodicity customDates(LocalDate... dates) throws PeriodicityException {
    return builder().customDates(dates).build();
  }

  /**
   * Returns a daily pattern restricted to some days of the week.
   *
   * @param weekdays the accepted days of the week
   * @return once per day on the given weekdays
   * @throws PeriodicityException if the weekdays are empty or repeated
   */
  public static Periodicity onWeekdays(DayOfWeek... weekdays) throws PeriodicityException {
    return builder().daily(1).onWeekdays(weekdays).build();
  }

  /**
   * Returns a daily pattern restricted to some days of the month.
   *
   * @param days the accepted days of the month, 1 for the 1st
   * @return once per day on the given days of the month
   * @throws PeriodicityException if the days are empty, repeated or outside 1-31
   */
  public static Periodicity onDaysOfMonth(int... days) throws PeriodicityException {
    return builder().daily(1).onMonthDays(days).build();
  }

  private static Periodicity buildFixed(Builder builder) {
    try {
      return builder.build();
    } catch (PeriodicityException e) {
      throw new IllegalStateException("built-in pattern failed validation", e);
    }
  }

  /**
   * Checks whether a date satisfies this pattern, ignoring the timeframe.
   *
   * @param date the date to check
   * @return true if the date matches
   */
  public boolean matches(LocalDate date) {
    return Matcher.matches(this, date);
  }

  /**
   * Checks whether a date lies inside this pattern's active period.
   *
   * @param date the date to check
   * @return true if there is no timeframe or the date lies inside it
   */
  public boolean withinTimeframe(LocalDate date) {
    return Matcher.withinTimeframe(this, date);
  }

  /**
   * Returns the cadence unit.
   *
   * @return the repetition unit, {@link RepetitionUnit#NONE} for special patterns
   */
  public RepetitionUnit repUnit() {
    return data.repUnit();
  }

  /**
   * Returns the number of occurrences per cadence unit.
   *
   * @return the count, or empty for special patterns
   */
  public Optional<Integer> repPerUnit() {
    return Optional.ofNullable(data.repPerUnit());
  }

  public PeriodicityConstraints constraints() {
    return data.constraints();
  }

  public Optional<Timeframe> timeframe() {
    return Optional.ofNullable(data.timeframe());
  }

  public DayOfWeek weekStart() {
    return data.weekStart();
  }

  public Month yearStart() {
    return data.yearStart();
  }

  public Optional<SpecialPattern> specialPattern() {
    return Optional.ofNullable(data.specialPattern());
  }

  /**
   * Returns the explicit anchor date.
   *
   * @return the anchor, or empty if rolling intervals fall back to the timeframe start
   */
  public Optional<LocalDate> anchor() {
    return Optional.ofNullable(data.anchor());
  }

  /**
   * Returns the underlying periodicity data.
   *
   * @return the validated data
   */
  public PeriodicityData data() {
    return data;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Periodicity)) {
      return false;
    }
    return data.equals(((Periodicity) o).data);
  }

  @Override
  public int hashCode() {
    return data.hashCode();
  }

  /**
   * Returns a human-readable description of this pattern.
   *
   * @return the canonical description
   */
  @Override
  public String toString() {
    return Display.render(data);
  }

  /**
   * Collects user input for a periodicity.
   *
   * <p>Day-of-month and week-of-month values are taken 1-indexed (1 = the 1st, or the first week)
   * and stored 0-indexed. Values are never clamped: out-of-range input is reported by {@link
   * #build()}. Setting a constraint of a family replaces the previous one of that family.
   *
   * <p>A builder is not thread-safe.
   */
  public static final class Builder {
    private RepetitionUnit repUnit;
    private Integer repPerUnit;
    private PeriodicityConstraints constraints = PeriodicityConstraints.none();
    private Timeframe timeframe;
    private DayOfWeek weekStart = PeriodicityData.DEFAULT_WEEK_START;
    private Month yearStart = PeriodicityData.DEFAULT_YEAR_START;
    private SpecialPattern specialPattern;
    private LocalDate anchor;

    private Builder() {}

    // Cadence

    public Builder daily(int times) {
      return repeat(RepetitionUnit.DAY, times);
    }

    public Builder weekly(int times) {
      return repeat(RepetitionUnit.WEEK, times);
    }

    public Builder monthly(int times) {
      return repeat(RepetitionUnit.MONTH, times);
    }

    public Builder yearly(int times) {
      return repeat(RepetitionUnit.YEAR, times);
    }

    /**
     * Sets the cadence from raw input.
     *
     * @param unit the repetition unit
     * @param times the occurrences per unit, or null if not given
     * @return this builder
     */
    public Builder repeat(RepetitionUnit unit, Integer times) {
      this.repUnit = unit;
      this.repPerUnit = times;
      return this;
    }

    // Day constraints

    public Builder everyDay() {
      return day(DayConstraint.everyDay());
    }

    public Builder everyNDays(int interval) {
      return day(DayConstraint.everyNDays(interval));
    }

    public Builder onWeekdays(DayOfWeek... weekdays) {
      return day(DayConstraint.daysOfWeek(List.of(weekdays)));
    }

    /**
     * Restricts the pattern to days of the month counted from the 1st.
     *
     * @param days the days, 1 for the 1st
     * @return this builder
     */
    public Builder onMonthDays(int... days) {
      return day(DayConstraint.daysOfMonthFromStart(toOffsets(days)));
    }

    /**
     * Restricts the pattern to days of the month counted back from the last day.
     *
     * @param days the days, 1 for the last day of the month
     * @return this builder
     */
    public Builder onMonthDaysFromEnd(int... days) {
      return day(DayConstraint.daysOfMonthFromEnd(toOffsets(days)));
    }

    public Builder onNthWeekdays(NthWeekday... patterns) {
      return day(DayConstraint.nthWeekdaysOfMonth(List.of(patterns)));
    }

    // Week constraints

    public Builder everyWeek() {
      return week(WeekConstraint.everyWeek());
    }

    public Builder everyNWeeks(int interval) {
      return week(WeekConstraint.everyNWeeks(interval));
    }

    /**
     * Restricts the pattern to weeks of the month counted from the first week.
     *
     * @param weeks the weeks, 1 for the first week
     * @return this builder
     */
    public Builder onWeeksOfMonth(int... weeks) {
      return week(WeekConstraint.weeksOfMonthFromStart(toOffsets(weeks)));
    }

    /**
     * Restricts the pattern to weeks of the month counted back from the last week.
     *
     * @param weeks the weeks, 1 for the last week
     * @return this builder
     */
    public Builder onWeeksOfMonthFromEnd(int... weeks) {
      return week(WeekConstraint.weeksOfMonthFromEnd(toOffsets(weeks)));
    }

    // Month constraints

    public Builder everyMonth() {
      return month(MonthConstraint.everyMonth());
    }

    public Builder everyNMonths(int interval) {
      return month(MonthConstraint.everyNMonths(interval));
    }

    public Builder inMonths(Month... months) {
      return month(MonthConstraint.months(List.of(months)));
    }

    // Year constraints

    public Builder everyYear() {
      return year(YearConstraint.everyYear());
    }

    public Builder everyNYears(int interval) {
      return year(YearConstraint.everyNYears(interval));
    }

    public Builder inYears(int... years) {
      List<Integer> values = new ArrayList<>(years.length);
      for (int y : years) {
        values.add(y);
      }
      return year(YearConstraint.years(values));
    }

    // Special patterns

    /**
     * Makes this a one-off pattern. The cadence becomes {@link RepetitionUnit#NONE}.
     *
     * @param date the single date
     * @return this builder
     */
    public Builder unique(LocalDate date) {
      return special(SpecialPattern.unique(date));
    }

    public Builder customDates(LocalDate... dates) {
      return customDates(List.of(dates));
    }

    /**
     * Makes this an irregular pattern. The cadence becomes {@link RepetitionUnit#NONE}.
     *
     * @param dates the dates
     * @return this builder
     */
    public Builder customDates(Collection<LocalDate> dates) {
      return special(SpecialPattern.custom(List.copyOf(dates)));
    }

    // Timeframe, calendar and anchor

    public Builder between(LocalDate start, LocalDate end) {
      this.timeframe = Timeframe.between(start, end);
      return this;
    }

    public Builder startingFrom(LocalDate start) {
      this.timeframe = Timeframe.startingFrom(start);
      return this;
    }

    public Builder until(LocalDate end) {
      this.timeframe = Timeframe.until(end);
      return this;
    }

    public Builder weekStart(DayOfWeek weekStart) {
      this.weekStart = weekStart;
      return this;
    }

    public Builder yearStart(Month yearStart) {
      this.yearStart = yearStart;
      return this;
    }

    /**
     * Sets the reference date for every-N constraints. Without it, the timeframe start is used.
     *
     * @param anchor the anchor date
     * @return this builder
     */
    public Builder anchoredAt(LocalDate anchor) {
      this.anchor = anchor;
      return this;
    }

    /**
     * Validates the collected input.
     *
     * @return the validated periodicity
     * @throws PeriodicityException if the input violates a rule
     */
    public Periodicity build() throws PeriodicityException {
      return of(
          new PeriodicityData(
              repUnit,
              repPerUnit,
              constraints,
              timeframe,
              weekStart,
              yearStart,
              specialPattern,
              anchor));
    }

    private Builder special(SpecialPattern pattern) {
      this.specialPattern = pattern;
      if (repUnit == null) {
        this.repUnit = RepetitionUnit.NONE;
      }
      return this;
    }

    private Builder day(DayConstraint day) {
      constraints = constraints.withDay(day);
      return this;
    }

    private Builder week(WeekConstraint week) {
      constraints = constraints.withWeek(week);
      return this;
    }

    private Builder month(MonthConstraint month) {
      constraints = constraints.withMonth(month);
      return this;
    }

    private Builder year(YearConstraint year) {
      constraints = constraints.withYear(year);
      return this;
    }

    private static List<Integer> toOffsets(int[] oneIndexed) {
      List<Integer> offsets = new ArrayList<>(oneIndexed.length);
      for (int n : oneIndexed) {
        offsets.add(n - 1);
      }
      return offsets;
    }
  }
}
