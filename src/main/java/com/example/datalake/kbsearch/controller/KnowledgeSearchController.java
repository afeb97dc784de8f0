package com.example.datalake.kbsearch.controller;

import com.example.datalake.kbsearch.exception.EmbeddingUnavailableException;
import com.example.datalake.kbsearch.exception.SearchAccessException;
import com.example.datalake.kbsearch.request.SearchRequest;
import com.example.datalake.kbsearch.response.SearchEnvelope;
import com.example.datalake.kbsearch.service.KnowledgeSearchService;
import com.example.datalake.kbsearch.util.RequestIds;
import com.example.datalake.kbsearch.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/knowledge")
@Tag(name = "Knowledge Search", description = "Tag filter and vector search over knowledge bases")
@RequiredArgsConstructor
public class KnowledgeSearchController {

    static final String USER_HEADER = "X-User-Id";
    static final String SEARCH_FAILED = "Failed to perform vector search";

    private final KnowledgeSearchService searchService;

    @PostMapping("/search")
    @Operation(
            summary = "Search knowledge base chunks",
            description = "Filters chunks by tags, ranks them by similarity to the query, or both."
    )
    public Mono<ResponseEntity<SearchEnvelope>> search(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestBody SearchRequest request) {
        String requestId = RequestIds.newRequestId();
        return searchService.search(request, userId, requestId)
                .map(response -> ResponseEntity.ok(SearchEnvelope.ok(response)))
                .onErrorResume(ValidationException.class, ex -> {
                    log.info("[{}] Rejected search request: {}", requestId, ex.getMessage());
                    return Mono.just(ResponseEntity.badRequest()
                            .body(SearchEnvelope.invalid(ex.getErrors(), requestId)));
                })
                .onErrorResume(SearchAccessException.class, ex -> {
                    log.info("[{}] {} {}", requestId, ex.getStatus().value(), ex.getMessage());
                    return Mono.just(ResponseEntity.status(ex.getStatus())
                            .body(SearchEnvelope.error(ex.getMessage(), requestId)));
                })
                .onErrorResume(EmbeddingUnavailableException.class, ex -> {
                    log.error("[{}] Query embedding unavailable", requestId, ex);
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(SearchEnvelope.error(SEARCH_FAILED, requestId)));
                })
                .onErrorResume(ex -> {
                    log.error("[{}] Unexpected failure while searching", requestId, ex);
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(SearchEnvelope.error(SEARCH_FAILED, requestId)));
                });
    }
}
