package com.example.datalake.kbsearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Bounded pool for blocking JDBC and embedding calls issued from reactive pipelines.
 */
@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler searchScheduler(KbSearchProperties properties) {
        KbSearchProperties.Execution execution = properties.getExecution();
        return Schedulers.newBoundedElastic(
                Math.max(2, execution.getMaxThreads()),
                execution.getMaxQueuedTasks(),
                "kb-search");
    }
}
