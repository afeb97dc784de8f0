package com.example.datalake.kbsearch.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Requires at least one non-blank knowledge base id; trims and de-duplicates the list. */
@Component
public class KnowledgeBaseIdsValidator implements Validator {

  static final String FIELD = "knowledgeBaseIds";

  @Override
  public ValidationStage stage() {
    return ValidationStage.SHAPE;
  }

  @Override
  public void validate(ValidationContext context) {
    List<String> ids = context.getKnowledgeBaseIds();
    if (ids == null || ids.isEmpty()) {
      context.addError(FIELD, "At least one knowledge base ID is required");
      return;
    }

    Set<String> normalized = new LinkedHashSet<>();
    for (int i = 0; i < ids.size(); i++) {
      String id = ids.get(i);
      if (id == null || id.isBlank()) {
        context.addError(FIELD + "[" + i + "]", "Knowledge base ID must not be blank");
        continue;
      }
      normalized.add(id.trim());
    }
    context.setKnowledgeBaseIds(new ArrayList<>(normalized));
  }
}
