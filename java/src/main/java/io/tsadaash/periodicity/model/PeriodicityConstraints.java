package io.tsadaash.periodicity.model;

/**
 * The four independent filter slots of a regular pattern, combined with AND semantics. An absent
 * slot places no restriction on the date.
 *
 * @param day the day constraint (may be null)
 * @param week the week constraint (may be null)
 * @param month the month constraint (may be null)
 * @param year the year constraint (may be null)
 */
public record PeriodicityConstraints(
    DayConstraint day, WeekConstraint week, MonthConstraint month, YearConstraint year) {

  private static final PeriodicityConstraints NONE =
      new PeriodicityConstraints(null, null, null, null);

  /**
   * Returns constraints with every slot empty.
   *
   * @return the empty constraints
   */
  public static PeriodicityConstraints none() {
    return NONE;
  }

  /**
   * Returns whether no slot is populated.
   *
   * @return true if all four slots are empty
   */
  public boolean isEmpty() {
    return day == null && week == null && month == null && year == null;
  }

  /**
   * Returns whether any populated slot is a rolling interval longer than one unit, which needs a
   * reference anchor to be evaluated.
   *
   * @return true if an every-n constraint with n &gt; 1 is present
   */
  public boolean hasRollingInterval() {
    return (day != null && day.kind() == DayConstraint.Kind.EVERY_N_DAYS && day.interval() > 1)
        || (week != null
            && week.kind() == WeekConstraint.Kind.EVERY_N_WEEKS
            && week.interval() > 1)
        || (month != null
            && month.kind() == MonthConstraint.Kind.EVERY_N_MONTHS
            && month.interval() > 1)
        || (year != null
            && year.kind() == YearConstraint.Kind.EVERY_N_YEARS
            && year.interval() > 1);
  }

  /**
   * Returns a copy with the specified day constraint.
   *
   * @param day the day constraint
   * @return new constraints with the updated day slot
   */
  public PeriodicityConstraints withDay(DayConstraint day) {
    return new PeriodicityConstraints(day, week, month, year);
  }

  /**
   * Returns a copy with the specified week constraint.
   *
   * @param week the week constraint
   * @return new constraints with the updated week slot
   */
  public PeriodicityConstraints withWeek(WeekConstraint week) {
    return new PeriodicityConstraints(day, week, month, year);
  }

  /**
   * Returns a copy with the specified month constraint.
   *
   * @param month the month constraint
   * @return new constraints with the updated month slot
   */
  public PeriodicityConstraints withMonth(MonthConstraint month) {
    return new PeriodicityConstraints(day, week, month, year);
  }

  /**
   * Returns a copy with the specified year constraint.
   *
   * @param year the year constraint
   * @return new constraints with the updated year slot
   */
  public PeriodicityConstraints withYear(YearConstraint year) {
    return new PeriodicityConstraints(day, week, month, year);
  }
}
