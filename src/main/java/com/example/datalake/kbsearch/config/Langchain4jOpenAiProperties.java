package com.example.datalake.kbsearch.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds properties:
 *
 * langchain4j.openai.api-key=...
 * langchain4j.openai.embedding-model=text-embedding-3-small
 * langchain4j.openai.embedding-dimensions=1536
 */
@Data
@ConfigurationProperties(prefix = "langchain4j.openai")
public class Langchain4jOpenAiProperties {

    /**
     * OpenAI API key
     */
    private String apiKey;

    /**
     * Embedding model name, must match the model the stored chunks were embedded with
     */
    private String embeddingModel = "text-embedding-3-small";

    /**
     * Vector length of the stored embeddings
     */
    private Integer embeddingDimensions = 1536;

    private Duration timeout = Duration.ofSeconds(30);
}
