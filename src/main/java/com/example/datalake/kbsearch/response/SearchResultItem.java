package com.example.datalake.kbsearch.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResultItem {
  private String documentId;
  private String documentName;
  private String content;
  private int chunkIndex;
  /** Tag display name to value, only for populated slots. */
  private Map<String, Object> metadata;
  private double similarity;
}
