package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.api.dto.request.ContextRequestDto;
import com.flamingo.ai.knowledge.api.dto.request.SearchKnowledgeRequest;
import com.flamingo.ai.knowledge.api.dto.response.ContextResponse;
import com.flamingo.ai.knowledge.api.dto.response.DocumentResponse;
import com.flamingo.ai.knowledge.api.dto.response.SearchResultResponse;
import com.flamingo.ai.knowledge.service.lifecycle.DocumentLifecycleService;
import com.flamingo.ai.knowledge.service.retrieval.KnowledgeRetrievalService;
import com.flamingo.ai.knowledge.store.KnowledgeStats;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for retrieval and knowledge base statistics. */
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeSearchController {

  private final KnowledgeRetrievalService retrievalService;
  private final DocumentLifecycleService lifecycleService;

  /** Ranked similarity search. */
  @PostMapping("/search")
  public ResponseEntity<List<SearchResultResponse>> search(
      @Valid @RequestBody SearchKnowledgeRequest request) {
    return ResponseEntity.ok(
        retrievalService.search(request.toSearchRequest()).stream()
            .map(SearchResultResponse::from)
            .toList());
  }

  /** Context text for a generation prompt, bounded by a token budget. */
  @PostMapping("/context")
  public ResponseEntity<ContextResponse> context(@Valid @RequestBody ContextRequestDto request) {
    return ResponseEntity.ok(
        ContextResponse.from(retrievalService.getContextForPrompt(request.toContextRequest())));
  }

  @GetMapping("/stats")
  public ResponseEntity<KnowledgeStats> stats() {
    return ResponseEntity.ok(lifecycleService.getStats());
  }

  /** Documents embedded by a model other than the active one. */
  @GetMapping("/stale")
  public ResponseEntity<List<DocumentResponse>> staleDocuments() {
    return ResponseEntity.ok(
        lifecycleService.findStaleDocuments().stream().map(DocumentResponse::fromEntity).toList());
  }
}
