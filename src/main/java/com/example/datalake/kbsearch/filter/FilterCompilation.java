package com.example.datalake.kbsearch.filter;

import com.example.datalake.kbsearch.validation.ValidationError;
import java.util.List;

/**
 * Outcome of compiling a filter list. Hard errors (unknown tag, type mismatch) fail the request;
 * dropped predicates are soft and only reported for logging.
 */
public record FilterCompilation(
    CompiledTagFilter filter, List<ValidationError> errors, List<String> dropped) {

  public FilterCompilation {
    filter = filter == null ? CompiledTagFilter.empty() : filter;
    errors = errors == null ? List.of() : List.copyOf(errors);
    dropped = dropped == null ? List.of() : List.copyOf(dropped);
  }

  static FilterCompilation failed(List<ValidationError> errors) {
    return new FilterCompilation(CompiledTagFilter.empty(), errors, List.of());
  }

  public boolean isValid() {
    return errors.isEmpty();
  }
}
