package com.example.datalake.kbsearch.exception;

import java.util.List;
import org.springframework.http.HttpStatus;

/**
 * Identity or access failure. Missing identity is 401; unknown and forbidden knowledge bases both
 * collapse into 404 so that existence is never revealed to an unauthorized caller.
 */
public class SearchAccessException extends RuntimeException {

  private final HttpStatus status;
  private final List<String> inaccessibleIds;

  public SearchAccessException(HttpStatus status, String message, List<String> inaccessibleIds) {
    super(message);
    this.status = status;
    this.inaccessibleIds = inaccessibleIds == null ? List.of() : List.copyOf(inaccessibleIds);
  }

  public static SearchAccessException unauthorized() {
    return new SearchAccessException(HttpStatus.UNAUTHORIZED, "Unauthorized", List.of());
  }

  public static SearchAccessException knowledgeBaseNotFound(List<String> ids) {
    return new SearchAccessException(HttpStatus.NOT_FOUND, "Knowledge base not found or access denied", ids);
  }

  public static SearchAccessException knowledgeBasesNotFound(List<String> ids) {
    return new SearchAccessException(
        HttpStatus.NOT_FOUND,
        "Knowledge bases not found or access denied: " + String.join(", ", ids),
        ids);
  }

  public static SearchAccessException workflowNotFound() {
    return new SearchAccessException(HttpStatus.NOT_FOUND, "Workflow not found", List.of());
  }

  public static SearchAccessException workflowForbidden() {
    return new SearchAccessException(HttpStatus.FORBIDDEN, "Access denied", List.of());
  }

  public HttpStatus getStatus() {
    return status;
  }

  public List<String> getInaccessibleIds() {
    return inaccessibleIds;
  }
}
