package com.example.datalake.kbsearch.model;

/**
 * Execution shape chosen by the planner for one request.
 *
 * @param useParallel fan out one sub-query per knowledge base and merge
 * @param distanceThreshold rows at or beyond this cosine distance are excluded
 * @param parallelLimit per knowledge base row cap in parallel mode
 * @param singleQueryOptimized at most two knowledge bases requested
 */
public record QueryStrategy(
    boolean useParallel,
    double distanceThreshold,
    int parallelLimit,
    boolean singleQueryOptimized) {
}
