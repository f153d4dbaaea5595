package io.tsadaash.periodicity;

import io.tsadaash.periodicity.validation.ErrorKind;
import io.tsadaash.periodicity.validation.ValidationError;
import java.util.Objects;

/** Exception thrown when a periodicity cannot be constructed or decoded. */
public final class PeriodicityException extends Exception {
  /** The validation error that caused the failure. */
  private final ValidationError error;

  /**
   * Creates a new exception for a validation error.
   *
   * @param error the validation error
   */
  public PeriodicityException(ValidationError error) {
    super(Objects.requireNonNull(error, "error").message());
    this.error = error;
  }

  /**
   * Creates a new exception for a validation error with an underlying cause.
   *
   * @param error the validation error
   * @param cause the underlying cause
   */
  public PeriodicityException(ValidationError error, Throwable cause) {
    super(Objects.requireNonNull(error, "error").message(), cause);
    this.error = error;
  }

  /**
   * Returns the validation error that caused the failure.
   *
   * @return the validation error
   */
  public ValidationError error() {
    return error;
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return error.kind();
  }
}
