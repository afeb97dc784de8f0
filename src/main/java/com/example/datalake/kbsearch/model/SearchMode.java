package com.example.datalake.kbsearch.model;

/** Query shape, picked from whether a query string and/or tag filters are present. */
public enum SearchMode {
  TAG_ONLY,
  VECTOR_ONLY,
  TAG_AND_VECTOR;

  public static SearchMode of(boolean hasQuery, boolean hasFilters) {
    if (hasQuery && hasFilters) {
      return TAG_AND_VECTOR;
    }
    if (hasQuery) {
      return VECTOR_ONLY;
    }
    if (hasFilters) {
      return TAG_ONLY;
    }
    throw new IllegalArgumentException("Either a query or tag filters are required");
  }
}
