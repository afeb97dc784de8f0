package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.config.KbSearchProperties;
import com.example.datalake.kbsearch.response.SearchCost;
import dev.langchain4j.model.TokenCountEstimator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Prices the embedding call for a query. Estimation never fails a search: any problem yields an
 * empty result and a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryCostEstimator {

    private static final int SCALE = 8;
    private static final double TOKENS_PER_PRICE_UNIT = 1_000_000d;

    private final TokenCountEstimator tokenCountEstimator;
    private final KbSearchProperties properties;

    public Optional<SearchCost> estimate(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        try {
            int promptTokens = tokenCountEstimator.estimateTokenCountInText(query);
            KbSearchProperties.Cost pricing = properties.getCost();

            double input = round(promptTokens / TOKENS_PER_PRICE_UNIT * pricing.getInputPricePerMillion());
            double output = 0d;

            return Optional.of(SearchCost.builder()
                    .input(input)
                    .output(output)
                    .total(round(input + output))
                    .tokens(SearchCost.Tokens.builder()
                            .prompt(promptTokens)
                            .completion(0)
                            .total(promptTokens)
                            .build())
                    .model(pricing.getModel())
                    .pricing(SearchCost.Pricing.builder()
                            .input(pricing.getInputPricePerMillion())
                            .output(pricing.getOutputPricePerMillion())
                            .updatedAt(pricing.getPricingUpdatedAt())
                            .build())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Cost estimation failed, omitting cost: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
