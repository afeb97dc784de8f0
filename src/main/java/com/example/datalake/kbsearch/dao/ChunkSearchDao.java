package com.example.datalake.kbsearch.dao;

import com.example.datalake.kbsearch.filter.ScopedTagFilter;
import com.example.datalake.kbsearch.model.ChunkRow;
import java.util.Collection;
import java.util.List;

/**
 * Read-only queries over searchable chunks. Every query applies the eligibility rule: the
 * document is completed, enabled and not soft-deleted, and the chunk itself is enabled.
 */
public interface ChunkSearchDao {

    /**
     * Chunks matching the tag filter, unranked, with distance 0. Only knowledge bases in the
     * filter's scope are searched, each with its own predicates.
     */
    List<ChunkRow> findByTags(ScopedTagFilter filter, int limit);

    /**
     * Ids of every chunk matching the tag filter. Phase one of a tag plus vector search.
     */
    List<String> findIdsByTags(ScopedTagFilter filter);

    /**
     * Chunks ordered by ascending cosine distance, closer than {@code distanceThreshold}.
     *
     * @param candidateIds restricts the search to these chunk ids, or {@code null} for no restriction
     */
    List<ChunkRow> findNearest(List<String> knowledgeBaseIds,
                               float[] queryVector,
                               double distanceThreshold,
                               int limit,
                               Collection<String> candidateIds);
}
