package com.example.datalake.kbsearch.validation;

/** Identifies when a validator runs against the incoming request. */
public enum ValidationStage {
  /** Normalizes the raw payload: trims, applies defaults, checks field bounds. */
  SHAPE,
  /** Checks cross-field rules on the normalized payload. */
  SEMANTIC
}
