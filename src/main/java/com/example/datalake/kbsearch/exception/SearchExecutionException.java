package com.example.datalake.kbsearch.exception;

/** A storage query failed while executing a search. */
public class SearchExecutionException extends RuntimeException {

  public SearchExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
