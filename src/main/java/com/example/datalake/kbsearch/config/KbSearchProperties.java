package com.example.datalake.kbsearch.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds properties:
 *
 * kb-search.default-top-k=10
 * kb-search.max-top-k=100
 * kb-search.cost.model=text-embedding-3-small
 * kb-search.embedding.max-attempts=3
 * kb-search.execution.max-threads=16
 */
@Data
@ConfigurationProperties(prefix = "kb-search")
public class KbSearchProperties {

    /**
     * Result count used when the request omits topK
     */
    private int defaultTopK = 10;

    /**
     * Upper bound accepted for topK, at most 100
     */
    private int maxTopK = 100;

    private Cost cost = new Cost();

    private Embedding embedding = new Embedding();

    private Execution execution = new Execution();

    @Data
    public static class Cost {

        /**
         * Embedding model the query cost is priced against
         */
        private String model = "text-embedding-3-small";

        /**
         * USD per one million input tokens
         */
        private double inputPricePerMillion = 0.02;

        /**
         * USD per one million output tokens
         */
        private double outputPricePerMillion = 0.0;

        /**
         * Date the pricing above was last checked, echoed in the response
         */
        private String pricingUpdatedAt = "2025-07-10";
    }

    @Data
    public static class Embedding {

        /**
         * Total attempts for one embedding call, first try included
         */
        private int maxAttempts = 3;

        /**
         * Initial backoff between attempts, doubled each retry
         */
        private Duration initialBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class Execution {

        /**
         * Threads available to blocking storage and embedding calls
         */
        private int maxThreads = 16;

        /**
         * Tasks allowed to wait for a thread before submissions are rejected
         */
        private int maxQueuedTasks = 1000;
    }
}
