package com.example.datalake.kbsearch.request;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Inbound search payload. {@code knowledgeBaseIds} accepts a single id or an array and is
 * always a list once deserialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class SearchRequest {

  @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
  private List<String> knowledgeBaseIds;

  private String query;
  private Integer topK;
  private List<TagFilterRequest> tagFilters;
  private String workflowId;
}
