package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.model.ChunkRow;
import com.example.datalake.kbsearch.model.TagDefinition;
import com.example.datalake.kbsearch.model.TagSlot;
import com.example.datalake.kbsearch.response.SearchCost;
import com.example.datalake.kbsearch.response.SearchResponse;
import com.example.datalake.kbsearch.response.SearchResultItem;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Turns ranked chunk rows into the response payload. Document names and tag display names are
 * enrichment only: when a lookup fails the affected items keep going without it.
 */
@Slf4j
@Component
public class SearchResultAssembler {

    private final DocumentNameResolver documentNameResolver;
    private final TagCatalog tagCatalog;
    private final QueryCostEstimator costEstimator;
    private final Scheduler scheduler;

    public SearchResultAssembler(DocumentNameResolver documentNameResolver,
                                 TagCatalog tagCatalog,
                                 QueryCostEstimator costEstimator,
                                 @Qualifier("searchScheduler") Scheduler scheduler) {
        this.documentNameResolver = documentNameResolver;
        this.tagCatalog = tagCatalog;
        this.costEstimator = costEstimator;
        this.scheduler = scheduler;
    }

    /**
     * @param query trimmed query, or {@code null} for a tag-only search
     */
    public Mono<SearchResponse> assemble(List<ChunkRow> rows,
                                         String query,
                                         List<String> knowledgeBaseIds,
                                         int topK) {
        List<ChunkRow> safeRows = rows == null ? List.of() : rows;
        boolean hasQuery = query != null && !query.isBlank();

        Mono<Map<String, String>> names = loadDocumentNames(safeRows);
        Mono<Map<String, Map<TagSlot, String>>> displayNames = loadDisplayNames(safeRows);
        Mono<Optional<SearchCost>> cost = hasQuery
                ? Mono.fromCallable(() -> costEstimator.estimate(query))
                : Mono.just(Optional.<SearchCost>empty());

        return Mono.zip(names, displayNames, cost).map(tuple -> {
            List<SearchResultItem> items = new ArrayList<>(safeRows.size());
            for (ChunkRow row : safeRows) {
                items.add(SearchResultItem.builder()
                        .documentId(row.documentId())
                        .documentName(tuple.getT1().get(row.documentId()))
                        .content(row.content())
                        .chunkIndex(row.chunkIndex())
                        .metadata(metadata(row, tuple.getT2().getOrDefault(row.knowledgeBaseId(), Map.of())))
                        .similarity(hasQuery ? 1d - row.distance() : 1d)
                        .build());
            }
            return SearchResponse.builder()
                    .results(items)
                    .query(hasQuery ? query : "")
                    .knowledgeBaseIds(knowledgeBaseIds)
                    .topK(topK)
                    .totalResults(items.size())
                    .cost(tuple.getT3().orElse(null))
                    .build();
        });
    }

    private Mono<Map<String, String>> loadDocumentNames(List<ChunkRow> rows) {
        if (rows.isEmpty()) {
            return Mono.just(Map.of());
        }
        Set<String> documentIds = new LinkedHashSet<>();
        rows.forEach(row -> documentIds.add(row.documentId()));
        return Mono.fromCallable(() -> documentNameResolver.getNames(documentIds))
                .subscribeOn(scheduler)
                .onErrorResume(e -> {
                    log.warn("Document name lookup failed for {} document(s): {}", documentIds.size(), e.getMessage());
                    return Mono.just(Map.<String, String>of());
                });
    }

    private Mono<Map<String, Map<TagSlot, String>>> loadDisplayNames(List<ChunkRow> rows) {
        Set<String> knowledgeBaseIds = new LinkedHashSet<>();
        rows.forEach(row -> knowledgeBaseIds.add(row.knowledgeBaseId()));
        return Flux.fromIterable(knowledgeBaseIds)
                .flatMap(kbId -> Mono.fromCallable(() -> bySlot(tagCatalog.getTagDefinitions(kbId)))
                        .subscribeOn(scheduler)
                        .onErrorResume(e -> {
                            log.warn("Tag catalog lookup failed for knowledge base {}, using slot keys: {}",
                                    kbId, e.getMessage());
                            return Mono.just(Map.<TagSlot, String>of());
                        })
                        .map(slots -> Map.entry(kbId, slots)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private static Map<TagSlot, String> bySlot(List<TagDefinition> definitions) {
        Map<TagSlot, String> names = new EnumMap<>(TagSlot.class);
        for (TagDefinition definition : definitions) {
            names.putIfAbsent(definition.tagSlot(), definition.displayName());
        }
        return names;
    }

    static Map<String, Object> metadata(ChunkRow row, Map<TagSlot, String> displayNames) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        for (Map.Entry<TagSlot, Object> tag : row.tags().entrySet()) {
            if (tag.getValue() == null) {
                continue;
            }
            String key = displayNames.getOrDefault(tag.getKey(), tag.getKey().key());
            Object value = tag.getValue() instanceof LocalDate date ? date.toString() : tag.getValue();
            metadata.put(key, value);
        }
        return metadata;
    }
}
