package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.dao.ChunkSearchDao;
import com.example.datalake.kbsearch.exception.SearchExecutionException;
import com.example.datalake.kbsearch.filter.ScopedTagFilter;
import com.example.datalake.kbsearch.model.ChunkRow;
import com.example.datalake.kbsearch.model.QueryStrategy;
import com.example.datalake.kbsearch.model.SearchMode;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Runs one of the three query shapes against {@link ChunkSearchDao}. In parallel mode every
 * knowledge base gets its own sub-query; sub-queries already dispatched always run to completion.
 */
@Slf4j
@Service
public class SearchExecutor {

    private final ChunkSearchDao chunkSearchDao;
    private final Scheduler scheduler;

    public SearchExecutor(ChunkSearchDao chunkSearchDao,
                          @Qualifier("searchScheduler") Scheduler scheduler) {
        this.chunkSearchDao = chunkSearchDao;
        this.scheduler = scheduler;
    }

    /**
     * @param knowledgeBaseIds searched by a vector-only query; tag queries search only the
     *     knowledge bases in the scope of {@code filter}
     * @param queryVector resolved only when the mode needs it; a tag plus vector search with no
     *     tag matches never waits on it
     */
    public Mono<List<ChunkRow>> execute(SearchMode mode,
                                        List<String> knowledgeBaseIds,
                                        ScopedTagFilter filter,
                                        Mono<float[]> queryVector,
                                        int topK,
                                        QueryStrategy strategy) {
        switch (mode) {
            case TAG_ONLY:
                return tagOnly(filter, topK, strategy);
            case VECTOR_ONLY:
                return requireVector(queryVector)
                        .flatMap(vector -> nearest(knowledgeBaseIds, vector, topK, strategy, null));
            case TAG_AND_VECTOR:
                return tagAndVector(filter, queryVector, topK, strategy);
            default:
                return Mono.error(new IllegalStateException("Unhandled search mode " + mode));
        }
    }

    Mono<List<ChunkRow>> tagOnly(ScopedTagFilter filter, int topK, QueryStrategy strategy) {
        if (filter.isEmpty()) {
            log.debug("No knowledge base defines every filtered tag");
            return Mono.just(List.of());
        }
        if (!strategy.useParallel()) {
            return blocking(() -> chunkSearchDao.findByTags(filter, topK));
        }
        // arrival order, no ranking
        return Flux.fromIterable(filter.knowledgeBaseIds())
                .flatMap(kbId -> blocking(() ->
                        chunkSearchDao.findByTags(filter.restrictTo(kbId), strategy.parallelLimit())))
                .flatMapIterable(rows -> rows)
                .collectList()
                .map(rows -> truncate(rows, topK));
    }

    Mono<List<ChunkRow>> tagAndVector(ScopedTagFilter filter,
                                      Mono<float[]> queryVector,
                                      int topK,
                                      QueryStrategy strategy) {
        if (filter.isEmpty()) {
            log.debug("No knowledge base defines every filtered tag, skipping vector phase");
            return Mono.just(List.of());
        }
        List<String> knowledgeBaseIds = filter.knowledgeBaseIds();
        return blocking(() -> chunkSearchDao.findIdsByTags(filter))
                .flatMap(candidateIds -> {
                    if (candidateIds.isEmpty()) {
                        log.debug("No chunk matched the tag filter, skipping vector phase");
                        return Mono.just(List.<ChunkRow>of());
                    }
                    log.debug("Tag phase produced {} candidate(s)", candidateIds.size());
                    return requireVector(queryVector)
                            .flatMap(vector -> nearest(knowledgeBaseIds, vector, topK, strategy, candidateIds));
                });
    }

    private Mono<List<ChunkRow>> nearest(List<String> knowledgeBaseIds,
                                         float[] vector,
                                         int topK,
                                         QueryStrategy strategy,
                                         Collection<String> candidateIds) {
        if (strategy == null) {
            return Mono.error(new IllegalStateException("Distance threshold is required for vector search"));
        }
        double threshold = strategy.distanceThreshold();
        if (!strategy.useParallel()) {
            return blocking(() -> chunkSearchDao.findNearest(knowledgeBaseIds, vector, threshold, topK, candidateIds));
        }
        return Flux.fromIterable(knowledgeBaseIds)
                .flatMap(kbId -> blocking(() -> chunkSearchDao.findNearest(
                        List.of(kbId), vector, threshold, strategy.parallelLimit(), candidateIds)))
                .flatMapIterable(rows -> rows)
                .collectList()
                .map(rows -> rows.stream()
                        .sorted(Comparator.comparingDouble(ChunkRow::distance))
                        .limit(topK)
                        .toList());
    }

    private static Mono<float[]> requireVector(Mono<float[]> queryVector) {
        if (queryVector == null) {
            return Mono.error(new IllegalStateException("Query vector is required for vector search"));
        }
        return queryVector.switchIfEmpty(
                Mono.error(new IllegalStateException("Query vector is required for vector search")));
    }

    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call)
                .subscribeOn(scheduler)
                .onErrorMap(DataAccessException.class,
                        e -> new SearchExecutionException("Chunk query failed", e));
    }

    private static List<ChunkRow> truncate(List<ChunkRow> rows, int topK) {
        return rows.size() <= topK ? rows : List.copyOf(rows.subList(0, topK));
    }
}
