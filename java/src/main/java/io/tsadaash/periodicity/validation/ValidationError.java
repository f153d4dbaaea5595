package io.tsadaash.periodicity.validation;

import io.tsadaash.periodicity.model.RepetitionUnit;

/**
 * A caller-correctable problem with a periodicity configuration.
 *
 * <p>Every variant names the offending field or constraint and carries enough context to build a
 * precise message for the end user without re-deriving it.
 */
public sealed interface ValidationError {

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  ErrorKind kind();

  /**
   * Returns a human-readable description of the problem.
   *
   * @return the message
   */
  String message();

  /**
   * A field holds an unacceptable value.
   *
   * @param field the field name
   * @param value the rejected value
   * @param reason why the value is rejected
   */
  record InvalidValue(String field, String value, String reason) implements ValidationError {
    @Override
    public ErrorKind kind() {
      return ErrorKind.INVALID_VALUE;
    }

    @Override
    public String message() {
      return String.format("invalid value for %s: '%s' - %s", field, value, reason);
    }
  }

  /**
   * A required field is absent.
   *
   * @param field the field name
   * @param reason why the field is required
   */
  record MissingRequired(String field, String reason) implements ValidationError {
    @Override
    public ErrorKind kind() {
      return ErrorKind.MISSING_REQUIRED;
    }

    @Override
    public String message() {
      return String.format("missing required field %s: %s", field, reason);
    }
  }

  /**
   * A constraint contradicts the repetition unit.
   *
   * @param repUnit the repetition unit
   * @param constraintKind the tag of the offending constraint
   * @param reason why the two are incompatible
   */
  record IncompatibleConstraint(RepetitionUnit repUnit, String constraintKind, String reason)
      implements ValidationError {
    @Override
    public ErrorKind kind() {
      return ErrorKind.INCOMPATIBLE_CONSTRAINT;
    }

    @Override
    public String message() {
      return String.format(
          "constraint %s incompatible with %s repetition: %s", constraintKind, repUnit, reason);
    }
  }

  /**
   * Two parts of the configuration exclude each other.
   *
   * @param first the first part
   * @param second the second part
   * @param reason why they conflict
   */
  record ConflictingConstraints(String first, String second, String reason)
      implements ValidationError {
    @Override
    public ErrorKind kind() {
      return ErrorKind.CONFLICTING_CONSTRAINTS;
    }

    @Override
    public String message() {
      return String.format("%s and %s conflict: %s", first, second, reason);
    }
  }

  /**
   * A collection repeats a value.
   *
   * @param field the field name
   * @param value the repeated value
   */
  record DuplicateValues(String field, String value) implements ValidationError {
    @Override
    public ErrorKind kind() {
      return ErrorKind.DUPLICATE_VALUES;
    }

    @Override
    public String message() {
      return String.format("duplicate value in %s: '%s'", field, value);
    }
  }

  /**
   * A collection that must hold at least one value is empty.
   *
   * @param field the field name
   * @param reason what the collection must contain
   */
  record EmptyCollection(String field, String reason) implements ValidationError {
    @Override
    public ErrorKind kind() {
      return ErrorKind.EMPTY_COLLECTION;
    }

    @Override
    public String message() {
      return String.format("empty collection for %s: %s", field, reason);
    }
  }

  /**
   * A value lies outside its documented range.
   *
   * @param field the field name
   * @param value the rejected value
   * @param min the smallest accepted value
   * @param max the largest accepted value
   */
  record OutOfRange(String field, long value, long min, long max) implements ValidationError {
    @Override
    public ErrorKind kind() {
      return ErrorKind.OUT_OF_RANGE;
    }

    @Override
    public String message() {
      return String.format("%s value %d out of range [%d, %d]", field, value, min, max);
    }
  }

  /**
   * The timeframe bounds are not in order.
   *
   * @param reason what is wrong with the bounds
   */
  record InvalidTimeframe(String reason) implements ValidationError {
    @Override
    public ErrorKind kind() {
      return ErrorKind.INVALID_TIMEFRAME;
    }

    @Override
    public String message() {
      return "invalid timeframe: " + reason;
    }
  }
}
