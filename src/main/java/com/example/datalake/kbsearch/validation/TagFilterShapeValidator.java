package com.example.datalake.kbsearch.validation;

import com.example.datalake.kbsearch.request.TagFilterRequest;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Checks that every tag filter names a tag and carries a value. Type checks against the tag
 * catalog happen later, in the filter compiler.
 */
@Component
public class TagFilterShapeValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.SHAPE;
  }

  @Override
  public void validate(ValidationContext context) {
    List<TagFilterRequest> filters = context.getTagFilters();
    if (filters == null || filters.isEmpty()) {
      context.setTagFilters(List.of());
      return;
    }

    for (int i = 0; i < filters.size(); i++) {
      TagFilterRequest filter = filters.get(i);
      String prefix = "tagFilters[" + i + "]";
      if (filter == null) {
        context.addError(prefix, "Tag filter must not be null");
        continue;
      }
      if (filter.getTagName() == null || filter.getTagName().isBlank()) {
        context.addError(prefix + ".tagName", "Tag name is required");
      }
      Object value = filter.getValue();
      if (value == null || (value instanceof String text && text.isBlank())) {
        context.addError(prefix + ".value", "Tag value is required");
      }
    }
  }
}
