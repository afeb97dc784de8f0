package com.example.datalake.kbsearch.validation;

import com.example.datalake.kbsearch.request.SearchRequest;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Coordinates all registered {@link Validator} beans and executes them in stage order for an
 * incoming request. A stage with errors stops later stages from running.
 */
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  /**
   * Validates and normalizes the request.
   *
   * @throws ValidationException with every collected error if the request is malformed
   */
  public ValidationContext validate(SearchRequest request) {
    if (request == null) {
      throw new ValidationException("body", "Request body is required");
    }
    ValidationContext context = new ValidationContext(
        request.getKnowledgeBaseIds(), request.getQuery(), request.getTopK(), request.getTagFilters());

    ValidationStage currentStage = null;
    for (Validator validator : orderedValidators) {
      if (currentStage != null && validator.stage() != currentStage && context.hasErrors()) {
        break;
      }
      currentStage = validator.stage();
      validator.validate(context);
    }
    if (context.hasErrors()) {
      throw new ValidationException(context.getErrors());
    }
    return context;
  }
}
