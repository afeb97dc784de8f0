package com.example.datalake.kbsearch.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
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
public class SearchResponse {
  private List<SearchResultItem> results;
  /** Echo of the trimmed query, empty string for tag-only searches. */
  private String query;
  private List<String> knowledgeBaseIds;
  private int topK;
  private int totalResults;
  private SearchCost cost;
}
