package com.example.datalake.kbsearch.model;

import java.util.Locale;
import java.util.Optional;

/** Comparison operators accepted in tag filters. Wire names are snake_case. */
public enum FilterOperator {
  EQ("eq"),
  NEQ("neq"),
  CONTAINS("contains"),
  NOT_CONTAINS("not_contains"),
  STARTS_WITH("starts_with"),
  ENDS_WITH("ends_with"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),
  BETWEEN("between");

  private final String wireName;

  FilterOperator(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<FilterOperator> fromWire(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (FilterOperator operator : values()) {
      if (operator.wireName.equals(normalized)) {
        return Optional.of(operator);
      }
    }
    return Optional.empty();
  }
}
