package com.example.datalake.kbsearch.validation;

import java.util.Objects;

/** A field-level validation problem, e.g. {@code tagFilters[1].value}. */
public record ValidationError(String field, String message) {

  public ValidationError {
    Objects.requireNonNull(message, "message");
  }
}
