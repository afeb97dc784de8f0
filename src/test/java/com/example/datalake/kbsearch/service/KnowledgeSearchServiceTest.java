package com.example.datalake.kbsearch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.datalake.kbsearch.config.KbSearchProperties;
import com.example.datalake.kbsearch.dao.ChunkSearchDao;
import com.example.datalake.kbsearch.exception.EmbeddingUnavailableException;
import com.example.datalake.kbsearch.exception.SearchAccessException;
import com.example.datalake.kbsearch.filter.CompiledTagFilter;
import com.example.datalake.kbsearch.filter.FilterCompiler;
import com.example.datalake.kbsearch.filter.ScopedTagFilter;
import com.example.datalake.kbsearch.filter.TagPredicate;
import com.example.datalake.kbsearch.model.ChunkRow;
import com.example.datalake.kbsearch.model.FilterOperator;
import com.example.datalake.kbsearch.model.KnowledgeBaseAccess;
import com.example.datalake.kbsearch.model.TagDefinition;
import com.example.datalake.kbsearch.model.TagSlot;
import com.example.datalake.kbsearch.request.SearchRequest;
import com.example.datalake.kbsearch.request.TagFilterRequest;
import com.example.datalake.kbsearch.response.SearchCost;
import com.example.datalake.kbsearch.response.SearchResponse;
import com.example.datalake.kbsearch.response.SearchResultItem;
import com.example.datalake.kbsearch.validation.KnowledgeBaseIdsValidator;
import com.example.datalake.kbsearch.validation.QueryOrFiltersValidator;
import com.example.datalake.kbsearch.validation.TagFilterShapeValidator;
import com.example.datalake.kbsearch.validation.TopKValidator;
import com.example.datalake.kbsearch.validation.ValidationException;
import com.example.datalake.kbsearch.validation.ValidationService;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.core.scheduler.Schedulers;

class KnowledgeSearchServiceTest {

  private static final String USER = "user-1";
  private static final float[] VECTOR = {0.5f, 0.5f};

  private WorkflowAccessGate workflowGate;
  private KnowledgeBaseAccessGate accessGate;
  private TagCatalog tagCatalog;
  private EmbeddingClient embeddingClient;
  private ChunkSearchDao dao;
  private DocumentNameResolver names;
  private QueryCostEstimator costEstimator;
  private KnowledgeSearchService service;

  @BeforeEach
  void setUp() {
    workflowGate = mock(WorkflowAccessGate.class);
    accessGate = mock(KnowledgeBaseAccessGate.class);
    tagCatalog = mock(TagCatalog.class);
    embeddingClient = mock(EmbeddingClient.class);
    dao = mock(ChunkSearchDao.class);
    names = mock(DocumentNameResolver.class);
    costEstimator = mock(QueryCostEstimator.class);

    KbSearchProperties properties = new KbSearchProperties();
    properties.getEmbedding().setInitialBackoff(Duration.ofMillis(1));

    ValidationService validationService = new ValidationService(List.of(
        new KnowledgeBaseIdsValidator(),
        new TopKValidator(properties),
        new TagFilterShapeValidator(),
        new QueryOrFiltersValidator()));
    SearchExecutor executor = new SearchExecutor(dao, Schedulers.immediate());
    SearchResultAssembler assembler =
        new SearchResultAssembler(names, tagCatalog, costEstimator, Schedulers.immediate());

    service = new KnowledgeSearchService(validationService, workflowGate, accessGate, tagCatalog,
        new FilterCompiler(), embeddingClient, new QueryPlanner(), executor, assembler, properties,
        Schedulers.immediate());

    when(names.getNames(anyCollection())).thenReturn(Map.of());
    when(tagCatalog.getTagDefinitions(anyString())).thenReturn(List.of());
    when(costEstimator.estimate(anyString())).thenReturn(Optional.empty());
  }

  @Test
  void vectorSearchReturnsRankedResultsWithCost() {
    grant("kb-1");
    when(embeddingClient.embed("refund policy")).thenReturn(VECTOR);
    when(dao.findNearest(List.of("kb-1"), VECTOR, 1.0, 10, null)).thenReturn(List.of(
        new ChunkRow("c1", "kb-1", "doc-1", 0, "Refunds within 30 days", Map.of(), 0.2),
        new ChunkRow("c2", "kb-1", "doc-1", 1, "Contact support", Map.of(), 0.3)));
    when(names.getNames(anyCollection())).thenReturn(Map.of("doc-1", "policy.pdf"));
    SearchCost cost = SearchCost.builder().input(0.00000004).total(0.00000004).build();
    when(costEstimator.estimate("refund policy")).thenReturn(Optional.of(cost));

    SearchResponse response = service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setQuery(" refund policy "), USER, "req00001").block();

    assertThat(response.getResults()).extracting(SearchResultItem::getSimilarity).containsExactly(0.8, 0.7);
    assertThat(response.getResults()).extracting(SearchResultItem::getDocumentName)
        .containsOnly("policy.pdf");
    assertThat(response.getQuery()).isEqualTo("refund policy");
    assertThat(response.getKnowledgeBaseIds()).containsExactly("kb-1");
    assertThat(response.getTopK()).isEqualTo(10);
    assertThat(response.getCost()).isSameAs(cost);
  }

  @Test
  void partialAccessFailsNamingOnlyInaccessibleIds() {
    grant("kb-1");
    when(accessGate.checkAccess("kb-2", USER)).thenReturn(KnowledgeBaseAccess.denied("kb-2"));

    assertThatThrownBy(() -> service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1", "kb-2"))
        .setQuery("anything"), USER, "req00002").block())
        .isInstanceOfSatisfying(SearchAccessException.class, ex -> {
          assertThat(ex.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
          assertThat(ex.getMessage()).isEqualTo("Knowledge bases not found or access denied: kb-2");
          assertThat(ex.getInaccessibleIds()).containsExactly("kb-2");
        });
    verifyNoInteractions(dao);
  }

  @Test
  void noAccessibleKnowledgeBaseIsNotFound() {
    when(accessGate.checkAccess("kb-9", USER)).thenReturn(KnowledgeBaseAccess.missing("kb-9"));

    assertThatThrownBy(() -> service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-9"))
        .setQuery("anything"), USER, "req00003").block())
        .isInstanceOf(SearchAccessException.class)
        .hasMessage("Knowledge base not found or access denied");
  }

  @Test
  void invalidRequestTouchesNoBackend() {
    assertThatThrownBy(() -> service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setQuery("  "), USER, "req00004").block())
        .isInstanceOf(ValidationException.class);

    verifyNoInteractions(accessGate, workflowGate, embeddingClient, dao);
  }

  @Test
  void missingUserIsUnauthorized() {
    assertThatThrownBy(() -> service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setQuery("q"), null, "req00005").block())
        .isInstanceOfSatisfying(SearchAccessException.class,
            ex -> assertThat(ex.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED));
    verifyNoInteractions(accessGate);
  }

  @Test
  void workflowIsAuthorizedBeforeKnowledgeBases() {
    doThrow(SearchAccessException.workflowNotFound()).when(workflowGate).authorizeRead("wf-1", USER);

    assertThatThrownBy(() -> service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setQuery("q")
        .setWorkflowId("wf-1"), USER, "req00006").block())
        .isInstanceOf(SearchAccessException.class)
        .hasMessage("Workflow not found");
    verifyNoInteractions(accessGate, embeddingClient);
  }

  @Test
  void unknownTagIsRejected() {
    grant("kb-1");

    assertThatThrownBy(() -> service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setTagFilters(List.of(new TagFilterRequest().setTagName("Colour").setValue("red"))), USER, "req00007")
        .block())
        .isInstanceOf(ValidationException.class)
        .hasMessage("Tag \"Colour\" is not defined for the selected knowledge bases");
    verifyNoInteractions(dao);
  }

  @Test
  void accessDenialWinsOverFilterErrors() {
    when(accessGate.checkAccess("kb-1", USER)).thenReturn(KnowledgeBaseAccess.denied("kb-1"));

    assertThatThrownBy(() -> service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setTagFilters(List.of(new TagFilterRequest().setTagName("Colour").setValue("red"))), USER, "req00008")
        .block())
        .isInstanceOf(SearchAccessException.class);
  }

  @Test
  void sameTagNameFiltersEachKnowledgeBaseOnItsOwnSlot() {
    grant("kb-1");
    grant("kb-2");
    when(tagCatalog.getTagDefinitions("kb-1")).thenReturn(List.of(new TagDefinition(TagSlot.TAG2, "Category", null)));
    when(tagCatalog.getTagDefinitions("kb-2")).thenReturn(List.of(new TagDefinition(TagSlot.TAG5, "Category", null)));
    Map<String, CompiledTagFilter> expected = new LinkedHashMap<>();
    expected.put("kb-1", CompiledTagFilter.of(List.of(TagPredicate.of(TagSlot.TAG2, FilterOperator.EQ, "docs"))));
    expected.put("kb-2", CompiledTagFilter.of(List.of(TagPredicate.of(TagSlot.TAG5, FilterOperator.EQ, "docs"))));
    when(dao.findByTags(any(ScopedTagFilter.class), anyInt())).thenReturn(List.of());

    SearchResponse response = service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1", "kb-2"))
        .setTagFilters(List.of(new TagFilterRequest().setTagName("Category").setValue("docs"))), USER, "req00009")
        .block();

    assertThat(response.getResults()).isEmpty();
    assertThat(response.getQuery()).isEmpty();
    verify(dao).findByTags(ScopedTagFilter.of(expected), 10);
    verifyNoInteractions(embeddingClient);
  }

  @Test
  void tagKnownToOneKnowledgeBaseNeverMatchesAnotherThroughTheSameSlot() {
    grant("kb-1");
    grant("kb-2");
    when(tagCatalog.getTagDefinitions("kb-1")).thenReturn(List.of(new TagDefinition(TagSlot.TAG3, "Region", null)));
    when(tagCatalog.getTagDefinitions("kb-2")).thenReturn(List.of(new TagDefinition(TagSlot.TAG3, "Author", null)));
    when(dao.findByTags(any(ScopedTagFilter.class), anyInt())).thenReturn(List.of(
        new ChunkRow("c7", "kb-2", "doc-7", 0, "By Smith", Map.of(TagSlot.TAG3, "smith"), 0)));

    SearchResponse response = service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1", "kb-2"))
        .setTagFilters(List.of(new TagFilterRequest().setTagName("Author").setValue("smith"))), USER, "req00012")
        .block();

    verify(dao).findByTags(ScopedTagFilter.uniform(List.of("kb-2"),
        CompiledTagFilter.of(List.of(TagPredicate.of(TagSlot.TAG3, FilterOperator.EQ, "smith")))), 10);
    assertThat(response.getResults()).extracting(SearchResultItem::getSimilarity).containsExactly(1.0);
    assertThat(response.getKnowledgeBaseIds()).containsExactly("kb-1", "kb-2");
  }

  @Test
  void tagsSplitAcrossKnowledgeBasesMatchNothing() {
    grant("kb-1");
    grant("kb-2");
    when(tagCatalog.getTagDefinitions("kb-1")).thenReturn(List.of(new TagDefinition(TagSlot.TAG3, "Region", null)));
    when(tagCatalog.getTagDefinitions("kb-2")).thenReturn(List.of(new TagDefinition(TagSlot.TAG1, "Author", null)));

    SearchResponse response = service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1", "kb-2"))
        .setTagFilters(List.of(
            new TagFilterRequest().setTagName("Region").setValue("emea"),
            new TagFilterRequest().setTagName("Author").setValue("smith"))), USER, "req00013")
        .block();

    assertThat(response.getResults()).isEmpty();
    assertThat(response.getTotalResults()).isZero();
    verifyNoInteractions(dao);
  }

  @Test
  void tagAndVectorWithoutTagMatchesSkipsRanking() {
    grant("kb-1");
    when(tagCatalog.getTagDefinitions("kb-1")).thenReturn(List.of(new TagDefinition(TagSlot.TAG1, "Category", null)));
    when(embeddingClient.embed("pricing")).thenReturn(VECTOR);
    when(dao.findIdsByTags(any(ScopedTagFilter.class))).thenReturn(List.of());

    SearchResponse response = service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setQuery("pricing")
        .setTagFilters(List.of(new TagFilterRequest().setTagName("Category").setValue("docs"))), USER, "req00010")
        .block();

    assertThat(response.getResults()).isEmpty();
    assertThat(response.getTotalResults()).isZero();
    verify(dao, never()).findNearest(anyList(), any(), anyDouble(), anyInt(), any());
  }

  @Test
  void embeddingFailureIsRetriedThenFatal() {
    grant("kb-1");
    when(embeddingClient.embed("q")).thenThrow(new EmbeddingUnavailableException("model down"));

    assertThatThrownBy(() -> service.search(new SearchRequest()
        .setKnowledgeBaseIds(List.of("kb-1"))
        .setQuery("q"), USER, "req00011").block())
        .isInstanceOf(EmbeddingUnavailableException.class);
    verify(embeddingClient, times(3)).embed("q");
    verifyNoInteractions(dao);
  }

  private void grant(String kbId) {
    when(accessGate.checkAccess(kbId, USER)).thenReturn(KnowledgeBaseAccess.granted(kbId));
  }
}
