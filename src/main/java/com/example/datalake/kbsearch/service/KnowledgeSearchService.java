package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.config.KbSearchProperties;
import com.example.datalake.kbsearch.exception.EmbeddingUnavailableException;
import com.example.datalake.kbsearch.exception.SearchAccessException;
import com.example.datalake.kbsearch.filter.FilterCompiler;
import com.example.datalake.kbsearch.filter.ScopedTagFilter;
import com.example.datalake.kbsearch.model.KnowledgeBaseAccess;
import com.example.datalake.kbsearch.model.QueryStrategy;
import com.example.datalake.kbsearch.model.SearchMode;
import com.example.datalake.kbsearch.model.TagDefinition;
import com.example.datalake.kbsearch.request.SearchRequest;
import com.example.datalake.kbsearch.request.TagFilterRequest;
import com.example.datalake.kbsearch.response.SearchResponse;
import com.example.datalake.kbsearch.validation.ValidationContext;
import com.example.datalake.kbsearch.validation.ValidationService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

/**
 * Entry point of a knowledge base search:
 *
 * <ol>
 *   <li>validate and normalize the request
 *   <li>authorize the workflow, when one is given
 *   <li>start the query embedding, then check knowledge base access and compile tag filters
 *       against each knowledge base's catalog concurrently
 *   <li>plan, execute and assemble
 * </ol>
 *
 * <p>Access failures win over filter errors so that a caller cannot discover the tag catalog of a
 * knowledge base it cannot read.
 */
@Slf4j
@Service
public class KnowledgeSearchService {

    private final ValidationService validationService;
    private final WorkflowAccessGate workflowAccessGate;
    private final KnowledgeBaseAccessGate accessGate;
    private final TagCatalog tagCatalog;
    private final FilterCompiler filterCompiler;
    private final EmbeddingClient embeddingClient;
    private final QueryPlanner queryPlanner;
    private final SearchExecutor searchExecutor;
    private final SearchResultAssembler resultAssembler;
    private final KbSearchProperties properties;
    private final Scheduler scheduler;

    public KnowledgeSearchService(ValidationService validationService,
                                  WorkflowAccessGate workflowAccessGate,
                                  KnowledgeBaseAccessGate accessGate,
                                  TagCatalog tagCatalog,
                                  FilterCompiler filterCompiler,
                                  EmbeddingClient embeddingClient,
                                  QueryPlanner queryPlanner,
                                  SearchExecutor searchExecutor,
                                  SearchResultAssembler resultAssembler,
                                  KbSearchProperties properties,
                                  @Qualifier("searchScheduler") Scheduler scheduler) {
        this.validationService = validationService;
        this.workflowAccessGate = workflowAccessGate;
        this.accessGate = accessGate;
        this.tagCatalog = tagCatalog;
        this.filterCompiler = filterCompiler;
        this.embeddingClient = embeddingClient;
        this.queryPlanner = queryPlanner;
        this.searchExecutor = searchExecutor;
        this.resultAssembler = resultAssembler;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    public Mono<SearchResponse> search(SearchRequest request, String userId, String requestId) {
        return Mono.<SearchResponse>defer(() -> {
            if (userId == null || userId.isBlank()) {
                return Mono.error(SearchAccessException.unauthorized());
            }
            ValidationContext ctx = validationService.validate(request);
            String workflowId = request.getWorkflowId();

            return authorizeWorkflow(workflowId, userId)
                    .then(Mono.defer(() -> run(ctx, userId, requestId)));
        }).doOnError(e -> log.debug("[{}] Search failed: {}", requestId, e.toString()));
    }

    private Mono<SearchResponse> run(ValidationContext ctx, String userId, String requestId) {
        List<String> kbIds = ctx.getKnowledgeBaseIds();
        String query = ctx.getQuery();
        int topK = ctx.getTopK();
        SearchMode mode = SearchMode.of(ctx.hasQuery(), ctx.hasTagFilters());

        log.info("[{}] {} search over {} knowledge base(s), topK {}, {} tag filter(s)",
                requestId, mode, kbIds.size(), topK, ctx.getTagFilters().size());

        Mono<float[]> queryVector = ctx.hasQuery()
                ? startEmbedding(query, requestId)
                : Mono.empty();

        Mono<List<String>> accessible = checkAccess(kbIds, userId, requestId);
        Mono<Signal<ScopedTagFilter>> compilation = compileFilters(kbIds, ctx.getTagFilters())
                .materialize();

        return Mono.zip(accessible, compilation).flatMap(tuple -> {
            List<String> accessibleIds = tuple.getT1();
            Signal<ScopedTagFilter> compiled = tuple.getT2();
            if (compiled.isOnError()) {
                return Mono.<SearchResponse>error(compiled.getThrowable());
            }
            ScopedTagFilter filter = compiled.hasValue() ? compiled.get() : ScopedTagFilter.none();

            QueryStrategy strategy = queryPlanner.plan(accessibleIds.size(), topK);
            log.debug("[{}] Strategy {} with filter {}", requestId, strategy, filter);

            return searchExecutor.execute(mode, accessibleIds, filter, queryVector, topK, strategy)
                    .flatMap(rows -> resultAssembler.assemble(rows, query, kbIds, topK))
                    .doOnNext(response -> log.info("[{}] Search returned {} result(s)",
                            requestId, response.getTotalResults()));
        });
    }

    private Mono<Void> authorizeWorkflow(String workflowId, String userId) {
        if (workflowId == null || workflowId.isBlank()) {
            return Mono.empty();
        }
        return Mono.<Void>fromRunnable(() -> workflowAccessGate.authorizeRead(workflowId.trim(), userId))
                .subscribeOn(scheduler);
    }

    /**
     * Embedding starts now and is shared by whichever step awaits it. If the request fails
     * before the vector is needed the result is discarded.
     */
    private Mono<float[]> startEmbedding(String query, String requestId) {
        KbSearchProperties.Embedding settings = properties.getEmbedding();
        CompletableFuture<float[]> future = Mono.fromCallable(() -> embeddingClient.embed(query))
                .subscribeOn(scheduler)
                .retryWhen(Retry.backoff(Math.max(0, settings.getMaxAttempts() - 1), settings.getInitialBackoff())
                        .doBeforeRetry(signal -> log.warn("[{}] Embedding attempt {} failed: {}",
                                requestId, signal.totalRetries() + 1, signal.failure().getMessage())))
                .onErrorMap(e -> {
                    Throwable cause = Exceptions.isRetryExhausted(e) ? e.getCause() : e;
                    return cause instanceof EmbeddingUnavailableException
                            ? cause
                            : new EmbeddingUnavailableException("Failed to generate query embedding", cause);
                })
                .toFuture();
        return Mono.fromFuture(future);
    }

    private Mono<List<String>> checkAccess(List<String> kbIds, String userId, String requestId) {
        return Flux.fromIterable(kbIds)
                .flatMapSequential(kbId -> Mono.fromCallable(() -> accessGate.checkAccess(kbId, userId))
                        .subscribeOn(scheduler))
                .collectList()
                .map(decisions -> {
                    List<String> inaccessible = decisions.stream()
                            .filter(decision -> !decision.hasAccess())
                            .map(KnowledgeBaseAccess::knowledgeBaseId)
                            .toList();
                    if (inaccessible.isEmpty()) {
                        return kbIds;
                    }
                    log.info("[{}] Denied {} of {} knowledge base(s): {}",
                            requestId, inaccessible.size(), kbIds.size(), inaccessible);
                    if (inaccessible.size() == kbIds.size()) {
                        throw SearchAccessException.knowledgeBaseNotFound(inaccessible);
                    }
                    throw SearchAccessException.knowledgeBasesNotFound(inaccessible);
                });
    }

    private Mono<ScopedTagFilter> compileFilters(List<String> kbIds, List<TagFilterRequest> filters) {
        if (filters == null || filters.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(kbIds)
                .flatMapSequential(kbId -> Mono.fromCallable(() -> tagCatalog.getTagDefinitions(kbId))
                        .subscribeOn(scheduler)
                        .map(definitions -> Map.entry(kbId, definitions)))
                .collect(() -> new LinkedHashMap<String, List<TagDefinition>>(),
                        (catalogs, entry) -> catalogs.put(entry.getKey(), entry.getValue()))
                .map(catalogs -> filterCompiler.compileForKnowledgeBases(filters, catalogs));
    }
}
