package com.example.datalake.kbsearch.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

import com.example.datalake.kbsearch.config.KbSearchProperties;
import com.example.datalake.kbsearch.request.SearchRequest;
import com.example.datalake.kbsearch.request.TagFilterRequest;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationServiceTest {

  private final ValidationService service = new ValidationService(List.of(
      new QueryOrFiltersValidator(),
      new KnowledgeBaseIdsValidator(),
      new TopKValidator(new KbSearchProperties()),
      new TagFilterShapeValidator()));

  @Test
  void normalizesValidRequest() {
    ValidationContext context = service.validate(new SearchRequest()
        .setKnowledgeBaseIds(List.of(" kb-1 ", "kb-2", "kb-1"))
        .setQuery("  pricing  "));

    assertThat(context.getKnowledgeBaseIds()).containsExactly("kb-1", "kb-2");
    assertThat(context.getQuery()).isEqualTo("pricing");
    assertThat(context.getTopK()).isEqualTo(10);
    assertThat(context.getTagFilters()).isEmpty();
  }

  @Test
  void rejectsMissingQueryAndFilters() {
    ValidationException ex = rejection(
        new SearchRequest().setKnowledgeBaseIds(List.of("kb-1")).setQuery("   "));

    assertThat(ex.getErrors()).containsExactly(new ValidationError("query",
        "Please provide either a search query or tag filters to search your knowledge base"));
  }

  @Test
  void collectsEveryShapeErrorBeforeSemanticChecks() {
    ValidationException ex = rejection(new SearchRequest()
        .setKnowledgeBaseIds(List.of())
        .setTopK(101)
        .setTagFilters(Arrays.asList(new TagFilterRequest().setTagName(" "), null)));

    assertThat(ex.getErrors()).extracting(ValidationError::field).containsExactlyInAnyOrder(
        "knowledgeBaseIds",
        "topK",
        "tagFilters[0].tagName",
        "tagFilters[0].value",
        "tagFilters[1]");
  }

  @Test
  void rejectsTopKOutOfRange() {
    assertThatThrownBy(() -> service.validate(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1")).setQuery("q").setTopK(0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("topK must be between 1 and 100");
  }

  @Test
  void tagFiltersAloneAreEnough() {
    ValidationContext context = service.validate(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setTagFilters(List.of(new TagFilterRequest().setTagName("Category").setValue(false))));

    assertThat(context.hasQuery()).isFalse();
    assertThat(context.hasTagFilters()).isTrue();
  }

  @Test
  void rejectsMissingBody() {
    assertThatThrownBy(() -> service.validate(null)).isInstanceOf(ValidationException.class);
  }

  private ValidationException rejection(SearchRequest request) {
    try {
      service.validate(request);
    } catch (ValidationException e) {
      return e;
    }
    return fail("expected the request to be rejected");
  }
}
