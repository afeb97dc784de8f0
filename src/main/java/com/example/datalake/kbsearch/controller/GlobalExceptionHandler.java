package com.example.datalake.kbsearch.controller;

import com.example.datalake.kbsearch.exception.SearchAccessException;
import com.example.datalake.kbsearch.response.SearchEnvelope;
import com.example.datalake.kbsearch.util.RequestIds;
import com.example.datalake.kbsearch.validation.ValidationError;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;

/**
 * Failures raised before a controller method runs, such as an unreadable JSON body. A caller
 * without an identity gets 401 even when the body cannot be read.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<SearchEnvelope> handleUnreadableBody(ServerWebInputException ex,
                                                               ServerWebExchange exchange) {
        String requestId = RequestIds.newRequestId();
        String userId = exchange.getRequest().getHeaders().getFirst(KnowledgeSearchController.USER_HEADER);
        if (userId == null || userId.isBlank()) {
            SearchAccessException unauthorized = SearchAccessException.unauthorized();
            log.info("[{}] {} {}", requestId, unauthorized.getStatus().value(), unauthorized.getMessage());
            return ResponseEntity.status(unauthorized.getStatus())
                    .body(SearchEnvelope.error(unauthorized.getMessage(), requestId));
        }
        log.info("[{}] Unreadable request: {}", requestId, ex.getReason());
        return ResponseEntity.badRequest().body(SearchEnvelope.invalid(
                List.of(new ValidationError("body", "Request body is missing or is not valid JSON")),
                requestId));
    }

    @ExceptionHandler(UnsupportedMediaTypeStatusException.class)
    public ResponseEntity<SearchEnvelope> handleMediaType(UnsupportedMediaTypeStatusException ex) {
        String requestId = RequestIds.newRequestId();
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(SearchEnvelope.error("Content type must be application/json", requestId));
    }
}
