package io.tsadaash.periodicity.display;

import io.tsadaash.periodicity.model.DayConstraint;
import io.tsadaash.periodicity.model.MonthConstraint;
import io.tsadaash.periodicity.model.NthWeekday;
import io.tsadaash.periodicity.model.PeriodicityConstraints;
import io.tsadaash.periodicity.model.PeriodicityData;
import io.tsadaash.periodicity.model.SpecialPattern;
import io.tsadaash.periodicity.model.Timeframe;
import io.tsadaash.periodicity.model.WeekConstraint;
import io.tsadaash.periodicity.model.YearConstraint;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Renders periodicity data as canonical English descriptions. */
public final class Display {
  private Display() {}

  /**
   * Renders periodicity data as a canonical description.
   *
   * <p>Example: {@code 1 time per day on the 13th, 24th during january, february}.
   *
   * @param data the periodicity data to render
   * @return the canonical description
   */
  public static String render(PeriodicityData data) {
    StringBuilder sb = new StringBuilder();

    if (data.specialPattern() != null) {
      sb.append(renderSpecial(data.specialPattern()));
    } else {
      sb.append(renderCadence(data));
      sb.append(renderConstraints(data.constraints()));
    }

    if (data.timeframe() != null) {
      sb.append(renderTimeframe(data.timeframe()));
    }

    if (data.anchor() != null) {
      sb.append(" starting ");
      sb.append(data.anchor());
    }

    if (data.weekStart() != null && data.weekStart() != PeriodicityData.DEFAULT_WEEK_START) {
      sb.append(" with weeks starting ");
      sb.append(lower(data.weekStart()));
    }

    if (data.yearStart() != null && data.yearStart() != PeriodicityData.DEFAULT_YEAR_START) {
      sb.append(" with years starting ");
      sb.append(lower(data.yearStart()));
    }

    return sb.toString();
  }

  private static String renderSpecial(SpecialPattern pattern) {
    if (pattern.kind() == null) {
      return "special";
    }
    return switch (pattern.kind()) {
      case UNIQUE -> "once on " + pattern.date();
      case CUSTOM -> "on " + join(pattern.dates(), String::valueOf);
    };
  }

  private static String renderCadence(PeriodicityData data) {
    if (data.repUnit() == null || data.repPerUnit() == null) {
      return "unscheduled";
    }
    int n = data.repPerUnit();
    return String.format("%d %s per %s", n, n == 1 ? "time" : "times", data.repUnit());
  }

  private static String renderConstraints(PeriodicityConstraints c) {
    StringBuilder sb = new StringBuilder();
    if (c.day() != null && c.day().kind() != null) {
      sb.append(' ').append(renderDay(c.day()));
    }
    if (c.week() != null && c.week().kind() != null) {
      sb.append(' ').append(renderWeek(c.week()));
    }
    if (c.month() != null && c.month().kind() != null) {
      sb.append(' ').append(renderMonth(c.month()));
    }
    if (c.year() != null && c.year().kind() != null) {
      sb.append(' ').append(renderYear(c.year()));
    }
    return sb.toString();
  }

  private static String renderDay(DayConstraint day) {
    return switch (day.kind()) {
      case EVERY_DAY -> "every day";
      case EVERY_N_DAYS -> String.format("every %d days", day.interval());
      case DAYS_OF_WEEK -> "on " + join(day.weekdays(), Display::lower);
      case DAYS_OF_MONTH_FROM_START ->
          "on the " + join(day.offsets(), offset -> ordinalNumber(offset + 1));
      case DAYS_OF_MONTH_FROM_END ->
          "on the " + join(day.offsets(), offset -> fromEnd(offset) + " day");
      case NTH_WEEKDAYS_OF_MONTH -> "on the " + join(day.nthWeekdays(), Display::renderNth);
    };
  }

  private static String renderNth(NthWeekday pattern) {
    return pattern.ordinal() + " " + lower(pattern.weekday());
  }

  private static String renderWeek(WeekConstraint week) {
    return switch (week.kind()) {
      case EVERY_WEEK -> "every week";
      case EVERY_N_WEEKS -> String.format("every %d weeks", week.interval());
      case WEEKS_OF_MONTH_FROM_START ->
          "in the " + join(week.offsets(), offset -> ordinalNumber(offset + 1)) + " week";
      case WEEKS_OF_MONTH_FROM_END ->
          "in the " + join(week.offsets(), Display::fromEnd) + " week";
    };
  }

  private static String renderMonth(MonthConstraint month) {
    return switch (month.kind()) {
      case EVERY_MONTH -> "every month";
      case EVERY_N_MONTHS -> String.format("every %d months", month.interval());
      case MONTHS -> "during " + join(month.months(), Display::lower);
    };
  }

  private static String renderYear(YearConstraint year) {
    return switch (year.kind()) {
      case EVERY_YEAR -> "every year";
      case EVERY_N_YEARS -> String.format("every %d years", year.interval());
      case YEARS -> "in " + join(year.years(), String::valueOf);
    };
  }

  private static String renderTimeframe(Timeframe timeframe) {
    StringBuilder sb = new StringBuilder();
    if (timeframe.start() != null) {
      sb.append(" from ").append(timeframe.start());
    }
    if (timeframe.end() != null) {
      sb.append(" until ").append(timeframe.end());
    }
    return sb.toString();
  }

  private static String fromEnd(int offset) {
    return offset == 0 ? "last" : ordinalNumber(offset + 1) + "-to-last";
  }

  private static <T> String join(List<T> values, Function<T, String> render) {
    return values.stream().map(render).collect(Collectors.joining(", "));
  }

  private static String lower(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  private static String ordinalNumber(int n) {
    return n + ordinalSuffix(n);
  }

  private static String ordinalSuffix(int n) {
    int mod100 = Math.floorMod(n, 100);
    if (mod100 >= 11 && mod100 <= 13) {
      return "th";
    }
    return switch (Math.floorMod(n, 10)) {
      case 1 -> "st";
      case 2 -> "nd";
      case 3 -> "rd";
      default -> "th";
    };
  }
}
