package com.example.datalake.kbsearch.response;

import com.example.datalake.kbsearch.validation.ValidationError;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of every search endpoint response. Successful calls carry {@code success} and
 * {@code data}; failures carry {@code error}, optional field {@code details} and the
 * {@code requestId} that appears in the server logs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchEnvelope {

  private Boolean success;
  private SearchResponse data;

  private String error;
  private List<ValidationError> details;
  private String requestId;

  public static SearchEnvelope ok(SearchResponse response) {
    return SearchEnvelope.builder().success(Boolean.TRUE).data(response).build();
  }

  public static SearchEnvelope error(String message, String requestId) {
    return SearchEnvelope.builder().error(message).requestId(requestId).build();
  }

  public static SearchEnvelope invalid(List<ValidationError> details, String requestId) {
    return SearchEnvelope.builder()
        .error("Invalid request data")
        .details(details)
        .requestId(requestId)
        .build();
  }
}
