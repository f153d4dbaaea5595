package io.tsadaash.periodicity.validation;

/** The type of problem that made a periodicity configuration invalid. */
public enum ErrorKind {
  /** A field holds a value that is not acceptable. */
  INVALID_VALUE("invalid_value"),
  /** A required field is absent. */
  MISSING_REQUIRED("missing_required"),
  /** A constraint contradicts the chosen repetition unit. */
  INCOMPATIBLE_CONSTRAINT("incompatible_constraint"),
  /** Two parts of the configuration exclude each other. */
  CONFLICTING_CONSTRAINTS("conflicting_constraints"),
  /** A collection repeats a value. */
  DUPLICATE_VALUES("duplicate_values"),
  /** A collection that must hold values is empty. */
  EMPTY_COLLECTION("empty_collection"),
  /** A value lies outside its documented range. */
  OUT_OF_RANGE("out_of_range"),
  /** The timeframe bounds are not in order. */
  INVALID_TIMEFRAME("invalid_timeframe");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
