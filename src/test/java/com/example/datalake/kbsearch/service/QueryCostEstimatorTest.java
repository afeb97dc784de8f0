package com.example.datalake.kbsearch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.datalake.kbsearch.config.KbSearchProperties;
import com.example.datalake.kbsearch.response.SearchCost;
import dev.langchain4j.model.TokenCountEstimator;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class QueryCostEstimatorTest {

  private final TokenCountEstimator tokens = mock(TokenCountEstimator.class);
  private final QueryCostEstimator estimator = new QueryCostEstimator(tokens, new KbSearchProperties());

  @Test
  void pricesPromptTokensOnly() {
    when(tokens.estimateTokenCountInText("refund policy")).thenReturn(2);

    SearchCost cost = estimator.estimate("refund policy").orElseThrow();

    assertThat(cost.getInput()).isEqualTo(0.00000004);
    assertThat(cost.getOutput()).isZero();
    assertThat(cost.getTotal()).isEqualTo(0.00000004);
    assertThat(cost.getTokens().getPrompt()).isEqualTo(2);
    assertThat(cost.getTokens().getCompletion()).isZero();
    assertThat(cost.getTokens().getTotal()).isEqualTo(2);
    assertThat(cost.getModel()).isEqualTo("text-embedding-3-small");
    assertThat(cost.getPricing().getInput()).isEqualTo(0.02);
    assertThat(cost.getPricing().getUpdatedAt()).isEqualTo("2025-07-10");
  }

  @Test
  void amountsAreRoundedToEightDecimals() {
    when(tokens.estimateTokenCountInText("q")).thenReturn(1);

    // 1 token at 0.02 per million is 2e-8
    assertThat(estimator.estimate("q").orElseThrow().getInput()).isEqualTo(0.00000002);
    assertThat(QueryCostEstimator.round(0.123456789)).isEqualTo(0.12345679);
  }

  @Test
  void estimatorFailureYieldsNoCost() {
    when(tokens.estimateTokenCountInText("q")).thenThrow(new IllegalStateException("no encoding"));

    assertThat(estimator.estimate("q")).isEmpty();
  }

  @Test
  void blankQueryHasNoCost() {
    assertThat(estimator.estimate("  ")).isEqualTo(Optional.empty());
  }
}
