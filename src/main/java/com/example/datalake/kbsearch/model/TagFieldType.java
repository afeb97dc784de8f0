package com.example.datalake.kbsearch.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kind of value stored in a tag slot. Each kind carries its own set of legal operators, so an
 * operator is checked against the field type before any predicate is built.
 */
public enum TagFieldType {
  TEXT("text", EnumSet.of(
      FilterOperator.EQ,
      FilterOperator.NEQ,
      FilterOperator.CONTAINS,
      FilterOperator.NOT_CONTAINS,
      FilterOperator.STARTS_WITH,
      FilterOperator.ENDS_WITH)),
  NUMBER("number", EnumSet.of(
      FilterOperator.EQ,
      FilterOperator.NEQ,
      FilterOperator.GT,
      FilterOperator.GTE,
      FilterOperator.LT,
      FilterOperator.LTE,
      FilterOperator.BETWEEN)),
  DATE("date", EnumSet.of(
      FilterOperator.EQ,
      FilterOperator.NEQ,
      FilterOperator.GT,
      FilterOperator.GTE,
      FilterOperator.LT,
      FilterOperator.LTE,
      FilterOperator.BETWEEN)),
  BOOLEAN("boolean", EnumSet.of(FilterOperator.EQ, FilterOperator.NEQ));

  private final String wireName;
  private final Set<FilterOperator> operators;

  TagFieldType(String wireName, Set<FilterOperator> operators) {
    this.wireName = wireName;
    this.operators = operators;
  }

  public String wireName() {
    return wireName;
  }

  public boolean supports(FilterOperator operator) {
    return operator != null && operators.contains(operator);
  }

  public static Optional<TagFieldType> fromWire(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (TagFieldType type : values()) {
      if (type.wireName.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
