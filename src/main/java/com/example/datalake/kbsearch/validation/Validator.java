package com.example.datalake.kbsearch.validation;

/** Contract for validation steps applied to a search request. */
public interface Validator {

  /** The stage in which the validator should be executed. */
  ValidationStage stage();

  /** Checks the request held by the context, normalizing it or recording errors. */
  void validate(ValidationContext context);
}
