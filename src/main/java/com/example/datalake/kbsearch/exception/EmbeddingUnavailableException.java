package com.example.datalake.kbsearch.exception;

/** The query embedding could not be produced. Fatal to the request. */
public class EmbeddingUnavailableException extends RuntimeException {

  public EmbeddingUnavailableException(String message) {
    super(message);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
