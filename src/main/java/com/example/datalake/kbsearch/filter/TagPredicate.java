package com.example.datalake.kbsearch.filter;

import com.example.datalake.kbsearch.model.FilterOperator;
import com.example.datalake.kbsearch.model.TagSlot;
import java.util.Objects;

/**
 * Backend-neutral predicate on one tag slot. {@code value} is a {@code String}, {@code Double},
 * {@code LocalDate} or {@code Boolean} matching the slot's field type. {@code valueTo} is set only
 * for {@link FilterOperator#BETWEEN}.
 */
public record TagPredicate(TagSlot slot, FilterOperator operator, Object value, Object valueTo) {

  public TagPredicate {
    Objects.requireNonNull(slot, "slot");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
    if (operator == FilterOperator.BETWEEN && valueTo == null) {
      throw new IllegalArgumentException("between requires an upper bound");
    }
    if (!slot.fieldType().supports(operator)) {
      throw new IllegalArgumentException(
          "Operator " + operator.wireName() + " is not valid for " + slot.fieldType().wireName());
    }
  }

  public static TagPredicate of(TagSlot slot, FilterOperator operator, Object value) {
    return new TagPredicate(slot, operator, value, null);
  }
}
