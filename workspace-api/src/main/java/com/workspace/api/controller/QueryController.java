package com.workspace.api.controller;

import com.workspace.api.dto.request.WorkspaceQueryRequest;
import com.workspace.core.query.QueryOrchestrator;
import com.workspace.core.query.model.QueryRequest;
import com.workspace.core.query.model.QueryResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Transport shell over {@link QueryOrchestrator}: the JSON API and the form
 * submission return the same envelope.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final QueryOrchestrator queryOrchestrator;

    @PostMapping(path = "/api/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<QueryResult> query(@Valid @RequestBody WorkspaceQueryRequest request) {
        log.debug("JSON query request - mode: {}, topK: {}", request.getMode(), request.getTopK());
        return ResponseEntity.ok(queryOrchestrator.processQuery(QueryRequest.builder()
            .question(request.getQuestion())
            .topK(request.getTopK())
            .mode(request.getMode())
            .build()));
    }

    @PostMapping(path = "/workspace/query", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<QueryResult> formQuery(
            @RequestParam(name = "question", defaultValue = "") String question,
            @RequestParam(name = "top_k", defaultValue = "8") Integer topK,
            @RequestParam(name = "mode", defaultValue = "assisted") String mode
    ) {
        log.debug("Form query request - mode: {}, topK: {}", mode, topK);
        return ResponseEntity.ok(queryOrchestrator.processQuery(QueryRequest.builder()
            .question(question)
            .topK(topK)
            .mode(mode)
            .build()));
    }
}
