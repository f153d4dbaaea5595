package io.tsadaash.periodicity.validation;

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
import io.tsadaash.periodicity.validation.ValidationError.ConflictingConstraints;
import io.tsadaash.periodicity.validation.ValidationError.DuplicateValues;
import io.tsadaash.periodicity.validation.ValidationError.EmptyCollection;
import io.tsadaash.periodicity.validation.ValidationError.IncompatibleConstraint;
import io.tsadaash.periodicity.validation.ValidationError.InvalidTimeframe;
import io.tsadaash.periodicity.validation.ValidationError.InvalidValue;
import io.tsadaash.periodicity.validation.ValidationError.MissingRequired;
import io.tsadaash.periodicity.validation.ValidationError.OutOfRange;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Checks a candidate periodicity against every structural rule.
 *
 * <h2>Rule Order</h2>
 *
 * <p>Rules are checked in a fixed order and the first violation is reported:
 *
 * <ol>
 *   <li>Special-pattern exclusivity (short-circuits the regular rules)
 *   <li>Repetition consistency and per-unit ceilings
 *   <li>Structure of each populated constraint slot: non-empty, no null elements, in range, no
 *       duplicates
 *   <li>Compatibility of rolling constraints with the repetition unit
 *   <li>Timeframe bounds
 *   <li>Anchor availability for rolling intervals
 *   <li>Calendar configuration
 * </ol>
 *
 * <p>Validation never throws and never modifies its input.
 */
public final class Validator {
  /** Largest 0-indexed day-of-month offset (the 31st, or the 31st-to-last day). */
  public static final int MAX_DAY_OFFSET = 30;

  /** Largest 0-indexed week-of-month offset (the fifth week). */
  public static final int MAX_WEEK_OFFSET = 4;

  public static final int MAX_DAY_INTERVAL = 366;
  public static final int MAX_WEEK_INTERVAL = 52;
  public static final int MAX_MONTH_INTERVAL = 12;
  public static final int MAX_YEAR_INTERVAL = 100;

  public static final int MIN_YEAR = 1900;
  public static final int MAX_YEAR = 2200;

  /** Most nth-weekday combinations a single constraint may list. */
  public static final int MAX_NTH_WEEKDAYS = 20;

  /** Most years a single constraint may list. */
  public static final int MAX_YEARS = 100;

  private Validator() {}

  /**
   * Validates a candidate periodicity.
   *
   * @param data the candidate
   * @return the first violation found, or empty if the candidate is valid
   */
  public static Optional<ValidationError> validate(PeriodicityData data) {
    if (data == null) {
      return fail(new MissingRequired("periodicity", "a candidate is required"));
    }

    if (data.specialPattern() != null) {
      Optional<ValidationError> special = validateSpecialPattern(data);
      if (special.isPresent()) {
        return special;
      }
      return firstOf(() -> validateTimeframe(data.timeframe()), () -> validateCalendar(data));
    }

    return firstOf(
        () -> validateRepetition(data),
        () -> validateConstraints(data.constraints()),
        () -> validateCompatibility(data),
        () -> validateTimeframe(data.timeframe()),
        () -> validateAnchor(data),
        () -> validateCalendar(data));
  }

  /**
   * Checks whether a candidate periodicity is valid.
   *
   * @param data the candidate
   * @return true if no rule is violated
   */
  public static boolean isValid(PeriodicityData data) {
    return validate(data).isEmpty();
  }

  // Special patterns

  private static Optional<ValidationError> validateSpecialPattern(PeriodicityData data) {
    SpecialPattern pattern = data.specialPattern();

    if (!data.constraints().isEmpty()) {
      return fail(
          new ConflictingConstraints(
              "special_pattern",
              "constraints",
              "special patterns cannot be combined with regular constraints"));
    }
    if (data.repUnit() != RepetitionUnit.NONE) {
      return fail(
          new IncompatibleConstraint(
              data.repUnit(), "special_pattern", "special patterns require rep_unit none"));
    }
    if (data.repPerUnit() != null) {
      return fail(
          new InvalidValue(
              "rep_per_unit",
              String.valueOf(data.repPerUnit()),
              "must be absent for special patterns"));
    }
    if (pattern.kind() == null) {
      return fail(new MissingRequired("special_pattern.kind", "unique or custom is required"));
    }

    return switch (pattern.kind()) {
      case UNIQUE ->
          pattern.date() == null
              ? fail(new MissingRequired("unique_date", "a unique pattern needs its date"))
              : Optional.empty();
      case CUSTOM -> {
        if (pattern.dates().isEmpty()) {
          yield fail(new EmptyCollection("custom_dates", "must contain at least one date"));
        }
        yield firstOf(
            () -> checkNoNulls("custom_dates", pattern.dates()),
            () -> checkDistinct("custom_dates", pattern.dates()));
      }
    };
  }

  // Repetition

  private static Optional<ValidationError> validateRepetition(PeriodicityData data) {
    RepetitionUnit unit = data.repUnit();
    Integer count = data.repPerUnit();

    if (unit == null) {
      return fail(new MissingRequired("rep_unit", "a repetition unit is required"));
    }
    if (unit == RepetitionUnit.NONE) {
      if (count != null) {
        return fail(
            new InvalidValue(
                "rep_per_unit", String.valueOf(count), "must be absent when rep_unit is none"));
      }
      return fail(
          new MissingRequired("special_pattern", "required when rep_unit is none"));
    }
    if (count == null) {
      return fail(new MissingRequired("rep_per_unit", "required when rep_unit is " + unit));
    }
    if (count < 1) {
      return fail(new InvalidValue("rep_per_unit", String.valueOf(count), "must be at least 1"));
    }
    if (count > unit.maxPerUnit()) {
      return fail(new OutOfRange("rep_per_unit", count, 1, unit.maxPerUnit()));
    }
    return Optional.empty();
  }

  // Constraint structure

  private static Optional<ValidationError> validateConstraints(PeriodicityConstraints c) {
    return firstOf(
        () -> c.day() == null ? Optional.empty() : validateDay(c.day()),
        () -> c.week() == null ? Optional.empty() : validateWeek(c.week()),
        () -> c.month() == null ? Optional.empty() : validateMonth(c.month()),
        () -> c.year() == null ? Optional.empty() : validateYear(c.year()));
  }

  private static Optional<ValidationError> validateDay(DayConstraint day) {
    if (day.kind() == null) {
      return fail(new MissingRequired("day.kind", "a day constraint needs its kind"));
    }
    String field = day.kind().tag();
    return switch (day.kind()) {
      case EVERY_DAY -> Optional.empty();
      case EVERY_N_DAYS -> checkInterval(field, day.interval(), MAX_DAY_INTERVAL);
      case DAYS_OF_WEEK -> {
        if (day.weekdays().isEmpty()) {
          yield fail(new EmptyCollection(field, "must contain at least one weekday"));
        }
        yield firstOf(
            () -> checkNoNulls(field, day.weekdays()), () -> checkDistinct(field, day.weekdays()));
      }
      case DAYS_OF_MONTH_FROM_START, DAYS_OF_MONTH_FROM_END ->
          checkOffsets(field, day.offsets(), MAX_DAY_OFFSET, "day");
      case NTH_WEEKDAYS_OF_MONTH -> validateNthWeekdays(field, day.nthWeekdays());
    };
  }

  private static Optional<ValidationError> validateNthWeekdays(
      String field, List<NthWeekday> patterns) {
    if (patterns.isEmpty()) {
      return fail(new EmptyCollection(field, "must contain at least one pattern"));
    }
    if (patterns.size() > MAX_NTH_WEEKDAYS) {
      return fail(new OutOfRange(field + ".size", patterns.size(), 1, MAX_NTH_WEEKDAYS));
    }
    Optional<ValidationError> nulls = checkNoNulls(field, patterns);
    if (nulls.isPresent()) {
      return nulls;
    }
    for (NthWeekday pattern : patterns) {
      if (pattern.ordinal() == null || pattern.weekday() == null) {
        return fail(
            new InvalidValue(field, pattern.toString(), "needs both an ordinal and a weekday"));
      }
    }
    return checkDistinct(field, patterns);
  }

  private static Optional<ValidationError> validateWeek(WeekConstraint week) {
    if (week.kind() == null) {
      return fail(new MissingRequired("week.kind", "a week constraint needs its kind"));
    }
    String field = week.kind().tag();
    return switch (week.kind()) {
      case EVERY_WEEK -> Optional.empty();
      case EVERY_N_WEEKS -> checkInterval(field, week.interval(), MAX_WEEK_INTERVAL);
      case WEEKS_OF_MONTH_FROM_START, WEEKS_OF_MONTH_FROM_END ->
          checkOffsets(field, week.offsets(), MAX_WEEK_OFFSET, "week");
    };
  }

  private static Optional<ValidationError> validateMonth(MonthConstraint month) {
    if (month.kind() == null) {
      return fail(new MissingRequired("month.kind", "a month constraint needs its kind"));
    }
    String field = month.kind().tag();
    return switch (month.kind()) {
      case EVERY_MONTH -> Optional.empty();
      case EVERY_N_MONTHS -> checkInterval(field, month.interval(), MAX_MONTH_INTERVAL);
      case MONTHS -> {
        if (month.months().isEmpty()) {
          yield fail(new EmptyCollection(field, "must contain at least one month"));
        }
        yield firstOf(
            () -> checkNoNulls(field, month.months()), () -> checkDistinct(field, month.months()));
      }
    };
  }

  private static Optional<ValidationError> validateYear(YearConstraint year) {
    if (year.kind() == null) {
      return fail(new MissingRequired("year.kind", "a year constraint needs its kind"));
    }
    String field = year.kind().tag();
    return switch (year.kind()) {
      case EVERY_YEAR -> Optional.empty();
      case EVERY_N_YEARS -> checkInterval(field, year.interval(), MAX_YEAR_INTERVAL);
      case YEARS -> {
        List<Integer> years = year.years();
        if (years.isEmpty()) {
          yield fail(new EmptyCollection(field, "must contain at least one year"));
        }
        if (years.size() > MAX_YEARS) {
          yield fail(new OutOfRange(field + ".size", years.size(), 1, MAX_YEARS));
        }
        yield firstOf(
            () -> checkNoNulls(field, years),
            () -> checkRange(field, years, MIN_YEAR, MAX_YEAR),
            () -> checkDistinct(field, years));
      }
    };
  }

  // Compatibility

  private static Optional<ValidationError> validateCompatibility(PeriodicityData data) {
    PeriodicityConstraints c = data.constraints();
    return switch (data.repUnit()) {
      case DAY, NONE -> Optional.empty();
      case WEEK ->
          c.day() != null && c.day().kind() == DayConstraint.Kind.EVERY_N_DAYS
              ? fail(
                  new IncompatibleConstraint(
                      RepetitionUnit.WEEK,
                      DayConstraint.Kind.EVERY_N_DAYS.tag(),
                      "a weekly cadence cannot roll in days; use every_n_weeks instead"))
              : Optional.empty();
      case MONTH ->
          c.week() != null && c.week().kind() == WeekConstraint.Kind.EVERY_N_WEEKS
              ? fail(
                  new IncompatibleConstraint(
                      RepetitionUnit.MONTH,
                      WeekConstraint.Kind.EVERY_N_WEEKS.tag(),
                      "a monthly cadence cannot roll in weeks; use every_n_months instead"))
              : Optional.empty();
      case YEAR ->
          c.month() != null && c.month().kind() == MonthConstraint.Kind.EVERY_N_MONTHS
              ? fail(
                  new IncompatibleConstraint(
                      RepetitionUnit.YEAR,
                      MonthConstraint.Kind.EVERY_N_MONTHS.tag(),
                      "a yearly cadence cannot roll in months; use every_n_years instead"))
              : Optional.empty();
    };
  }

  // Timeframe, anchor, calendar

  private static Optional<ValidationError> validateTimeframe(Timeframe timeframe) {
    if (timeframe == null || timeframe.start() == null || timeframe.end() == null) {
      return Optional.empty();
    }
    if (!timeframe.start().isBefore(timeframe.end())) {
      return fail(
          new InvalidTimeframe(
              String.format(
                  "start (%s) must be before end (%s)", timeframe.start(), timeframe.end())));
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> validateAnchor(PeriodicityData data) {
    if (data.constraints().hasRollingInterval() && data.effectiveAnchor().isEmpty()) {
      return fail(
          new MissingRequired(
              "anchor", "rolling intervals need an anchor date or a timeframe start"));
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> validateCalendar(PeriodicityData data) {
    if (data.weekStart() == null) {
      return fail(new MissingRequired("week_start", "the first day of the week is required"));
    }
    if (data.yearStart() == null) {
      return fail(new MissingRequired("year_start", "the first month of the year is required"));
    }
    return Optional.empty();
  }

  // Helpers

  private static Optional<ValidationError> checkInterval(String field, int interval, int max) {
    if (interval < 1) {
      return fail(new InvalidValue(field, String.valueOf(interval), "must be at least 1"));
    }
    if (interval > max) {
      return fail(new OutOfRange(field, interval, 1, max));
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> checkOffsets(
      String field, List<Integer> offsets, int max, String unit) {
    if (offsets.isEmpty()) {
      return fail(new EmptyCollection(field, "must contain at least one " + unit));
    }
    return firstOf(
        () -> checkNoNulls(field, offsets),
        () -> checkRange(field, offsets, 0, max),
        () -> checkDistinct(field, offsets));
  }

  private static Optional<ValidationError> checkRange(
      String field, List<Integer> values, int min, int max) {
    for (int value : values) {
      if (value < min || value > max) {
        return fail(new OutOfRange(field, value, min, max));
      }
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> checkNoNulls(String field, List<?> values) {
    for (Object value : values) {
      if (value == null) {
        return fail(new InvalidValue(field, "null", "must not contain null elements"));
      }
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> checkDistinct(String field, List<?> values) {
    Set<Object> seen = new HashSet<>();
    for (Object value : values) {
      if (!seen.add(value)) {
        return fail(new DuplicateValues(field, String.valueOf(value)));
      }
    }
    return Optional.empty();
  }

  @SafeVarargs
  private static Optional<ValidationError> firstOf(Supplier<Optional<ValidationError>>... checks) {
    for (Supplier<Optional<ValidationError>> check : checks) {
      Optional<ValidationError> error = check.get();
      if (error.isPresent()) {
        return error;
      }
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> fail(ValidationError error) {
    return Optional.of(error);
  }
}
