package com.example.datalake.kbsearch.service;

/** Turns query text into a fixed-length vector. Blocking. */
public interface EmbeddingClient {

    /**
     * @throws com.example.datalake.kbsearch.exception.EmbeddingUnavailableException on any failure
     */
    float[] embed(String text);
}
