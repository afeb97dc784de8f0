package com.example.datalake.kbsearch.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estimated USD cost of embedding the query. Amounts are rounded to eight decimal places.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchCost {

  private double input;
  private double output;
  private double total;
  private Tokens tokens;
  private String model;
  private Pricing pricing;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Tokens {
    private int prompt;
    private int completion;
    private int total;
  }

  /** USD per one million tokens. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Pricing {
    private double input;
    private double output;
    private String updatedAt;
  }
}
