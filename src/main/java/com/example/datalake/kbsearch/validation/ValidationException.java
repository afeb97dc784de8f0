package com.example.datalake.kbsearch.validation;

import java.util.List;
import java.util.Objects;

/** Thrown when a search request is rejected before any backend access. Maps to HTTP 400. */
public class ValidationException extends RuntimeException {

  private final List<ValidationError> errors;

  public ValidationException(String field, String message) {
    this(List.of(new ValidationError(field, message)));
  }

  public ValidationException(List<ValidationError> errors) {
    super(formatMessage(errors));
    this.errors = List.copyOf(errors);
  }

  public List<ValidationError> getErrors() {
    return errors;
  }

  private static String formatMessage(List<ValidationError> errors) {
    Objects.requireNonNull(errors, "errors");
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("errors must not be empty");
    }
    if (errors.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("errors must not contain null entries");
    }
    return String.join("; ", errors.stream().map(ValidationError::message).toList());
  }
}
