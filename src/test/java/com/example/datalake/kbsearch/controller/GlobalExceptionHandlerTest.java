package com.example.datalake.kbsearch.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.kbsearch.response.SearchEnvelope;
import com.example.datalake.kbsearch.validation.ValidationError;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
  private final ServerWebInputException unreadable = new ServerWebInputException("Failed to read HTTP message");

  @Test
  void unreadableBodyWithoutUserIsUnauthorized() {
    MockServerWebExchange exchange = MockServerWebExchange.from(
        MockServerHttpRequest.post("/api/v1/knowledge/search").body("{not json"));

    ResponseEntity<SearchEnvelope> response = handler.handleUnreadableBody(unreadable, exchange);

    assertThat(response.getStatusCode().value()).isEqualTo(401);
    assertThat(response.getBody().getError()).isEqualTo("Unauthorized");
    assertThat(response.getBody().getDetails()).isNull();
  }

  @Test
  void unreadableBodyWithBlankUserIsUnauthorized() {
    MockServerWebExchange exchange = MockServerWebExchange.from(
        MockServerHttpRequest.post("/api/v1/knowledge/search").header("X-User-Id", " ").body("{not json"));

    assertThat(handler.handleUnreadableBody(unreadable, exchange).getStatusCode().value()).isEqualTo(401);
  }

  @Test
  void unreadableBodyFromKnownUserIsBadRequest() {
    MockServerWebExchange exchange = MockServerWebExchange.from(
        MockServerHttpRequest.post("/api/v1/knowledge/search").header("X-User-Id", "user-1").body("{not json"));

    ResponseEntity<SearchEnvelope> response = handler.handleUnreadableBody(unreadable, exchange);

    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody().getError()).isEqualTo("Invalid request data");
    assertThat(response.getBody().getDetails()).extracting(ValidationError::field).containsExactly("body");
    assertThat(response.getBody().getRequestId()).hasSize(8);
  }
}
