package com.example.datalake.kbsearch.validation;

import com.example.datalake.kbsearch.config.KbSearchProperties;
import org.springframework.stereotype.Component;

/** Applies the default topK and rejects values outside {@code [1, maxTopK]}. */
@Component
public class TopKValidator implements Validator {

  private final int defaultTopK;
  private final int maxTopK;

  public TopKValidator(KbSearchProperties properties) {
    this.defaultTopK = properties.getDefaultTopK();
    this.maxTopK = properties.getMaxTopK();
    if (maxTopK < 1 || maxTopK > 100) {
      throw new IllegalArgumentException("maxTopK must be between 1 and 100");
    }
    if (defaultTopK < 1 || defaultTopK > maxTopK) {
      throw new IllegalArgumentException("defaultTopK must be between 1 and maxTopK");
    }
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.SHAPE;
  }

  @Override
  public void validate(ValidationContext context) {
    Integer topK = context.getTopK();
    if (topK == null) {
      context.setTopK(defaultTopK);
      return;
    }
    if (topK < 1 || topK > maxTopK) {
      context.addError("topK", String.format("topK must be between 1 and %d", maxTopK));
    }
  }
}
