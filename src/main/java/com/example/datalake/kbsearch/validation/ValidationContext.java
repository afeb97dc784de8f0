package com.example.datalake.kbsearch.validation;

import com.example.datalake.kbsearch.request.TagFilterRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries the request fields through the validation stages. Validators normalize values in place
 * and collect errors; nothing is thrown until all validators have run.
 */
public class ValidationContext {

  private List<String> knowledgeBaseIds;
  private String query;
  private Integer topK;
  private List<TagFilterRequest> tagFilters;
  private final List<ValidationError> errors = new ArrayList<>();

  public ValidationContext(
      List<String> knowledgeBaseIds, String query, Integer topK, List<TagFilterRequest> tagFilters) {
    this.knowledgeBaseIds = knowledgeBaseIds;
    this.query = query;
    this.topK = topK;
    this.tagFilters = tagFilters;
  }

  public List<String> getKnowledgeBaseIds() {
    return knowledgeBaseIds;
  }

  public void setKnowledgeBaseIds(List<String> knowledgeBaseIds) {
    this.knowledgeBaseIds = knowledgeBaseIds;
  }

  public String getQuery() {
    return query;
  }

  public void setQuery(String query) {
    this.query = query;
  }

  public Integer getTopK() {
    return topK;
  }

  public void setTopK(Integer topK) {
    this.topK = topK;
  }

  public List<TagFilterRequest> getTagFilters() {
    return tagFilters;
  }

  public void setTagFilters(List<TagFilterRequest> tagFilters) {
    this.tagFilters = tagFilters;
  }

  public void addError(String field, String message) {
    errors.add(new ValidationError(field, Objects.requireNonNull(message, "message")));
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public List<ValidationError> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  public boolean hasQuery() {
    return query != null && !query.isBlank();
  }

  public boolean hasTagFilters() {
    return tagFilters != null && !tagFilters.isEmpty();
  }
}
