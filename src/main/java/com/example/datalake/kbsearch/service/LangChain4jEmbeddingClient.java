package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LangChain4jEmbeddingClient implements EmbeddingClient {

    private final EmbeddingModel embeddingModel;

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("Cannot embed empty text");
        }

        Response<Embedding> response;
        try {
            response = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Embedding model call failed", e);
        }

        if (response == null || response.content() == null) {
            throw new EmbeddingUnavailableException("Embedding model returned no content");
        }
        float[] vector = response.content().vector();
        if (vector == null || vector.length == 0) {
            throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
        }
        return vector;
    }
}
