package com.example.datalake.kbsearch.validation;

import org.springframework.stereotype.Component;

/** A search needs a query, tag filters, or both. Blank queries count as absent. */
@Component
public class QueryOrFiltersValidator implements Validator {

  static final String MESSAGE =
      "Please provide either a search query or tag filters to search your knowledge base";

  @Override
  public ValidationStage stage() {
    return ValidationStage.SEMANTIC;
  }

  @Override
  public void validate(ValidationContext context) {
    String query = context.getQuery();
    context.setQuery(query == null || query.isBlank() ? null : query.trim());

    if (!context.hasQuery() && !context.hasTagFilters()) {
      context.addError("query", MESSAGE);
    }
  }
}
