package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.model.QueryStrategy;
import org.springframework.stereotype.Component;

/**
 * Picks single versus fan-out execution from the number of knowledge bases and the requested
 * result count. Many knowledge bases tighten the distance threshold.
 */
@Component
public class QueryPlanner {

    static final double DEFAULT_THRESHOLD = 1.0;
    static final double MULTI_KB_THRESHOLD = 0.8;
    static final int PARALLEL_LIMIT_SLACK = 5;
    static final int MAX_TOP_K = 100;

    public QueryStrategy plan(int knowledgeBaseCount, int topK) {
        if (knowledgeBaseCount < 1) {
            throw new IllegalArgumentException("knowledgeBaseCount must be >= 1, got " + knowledgeBaseCount);
        }
        if (topK < 1 || topK > MAX_TOP_K) {
            throw new IllegalArgumentException("topK must be between 1 and " + MAX_TOP_K + ", got " + topK);
        }

        boolean useParallel = knowledgeBaseCount > 4 || (knowledgeBaseCount > 2 && topK > 50);
        double threshold = knowledgeBaseCount > 3 ? MULTI_KB_THRESHOLD : DEFAULT_THRESHOLD;
        int parallelLimit = (int) Math.ceil((double) topK / knowledgeBaseCount) + PARALLEL_LIMIT_SLACK;

        return new QueryStrategy(useParallel, threshold, parallelLimit, knowledgeBaseCount <= 2);
    }
}
