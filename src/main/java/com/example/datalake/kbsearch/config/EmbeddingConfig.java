package com.example.datalake.kbsearch.config;

import dev.langchain4j.model.TokenCountEstimator;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Query embedding model and the matching token estimator used for cost reporting. Retries are
 * handled by the search service, so the client itself does not retry.
 */
@Configuration
@Profile("!test")
public class EmbeddingConfig {

    @Bean
    public EmbeddingModel embeddingModel(Langchain4jOpenAiProperties props) {
        return OpenAiEmbeddingModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getEmbeddingModel())
                .dimensions(props.getEmbeddingDimensions())
                .timeout(props.getTimeout())
                .maxRetries(0)
                .build();
    }

    @Bean
    public TokenCountEstimator tokenCountEstimator(Langchain4jOpenAiProperties props) {
        return new OpenAiTokenCountEstimator(props.getEmbeddingModel());
    }
}
