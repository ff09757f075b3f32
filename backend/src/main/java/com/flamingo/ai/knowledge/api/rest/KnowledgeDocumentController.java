package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.api.dto.request.AddDocumentRequest;
import com.flamingo.ai.knowledge.api.dto.request.UpdateDocumentRequest;
import com.flamingo.ai.knowledge.api.dto.response.DocumentResponse;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.service.ingestion.IngestionService;
import com.flamingo.ai.knowledge.service.lifecycle.DocumentFilter;
import com.flamingo.ai.knowledge.service.lifecycle.DocumentLifecycleService;
import com.flamingo.ai.knowledge.service.lifecycle.PendingSubmission;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for knowledge document management. */
@RestController
@RequestMapping("/api/knowledge/documents")
@RequiredArgsConstructor
public class KnowledgeDocumentController {

  private final IngestionService ingestionService;
  private final DocumentLifecycleService lifecycleService;

  /** Adds a document in PENDING; processing is triggered separately. */
  @PostMapping
  public ResponseEntity<DocumentResponse> addDocument(
      @Valid @RequestBody AddDocumentRequest request) {
    KnowledgeDocument document = ingestionService.addDocument(request.toIngestionRequest());
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Lists documents, or the caller's own uploads when {@code owner} is given. */
  @GetMapping
  public ResponseEntity<List<DocumentResponse>> listDocuments(
      @RequestParam(required = false) KnowledgeDocumentType docType,
      @RequestParam(required = false) DocumentStatus status,
      @RequestParam(required = false) Boolean active,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String owner) {
    List<KnowledgeDocument> documents =
        owner != null
            ? lifecycleService.listOwnedDocuments(owner)
            : lifecycleService.listDocuments(new DocumentFilter(docType, status, active, limit));
    return ResponseEntity.ok(documents.stream().map(DocumentResponse::fromEntity).toList());
  }

  /** Gets a document by ID. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    return ResponseEntity.ok(DocumentResponse.fromEntity(lifecycleService.getDocument(documentId)));
  }

  /** Updates document metadata. */
  @PatchMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> updateDocument(
      @PathVariable UUID documentId, @Valid @RequestBody UpdateDocumentRequest request) {
    KnowledgeDocument document =
        lifecycleService.updateDocument(documentId, request.toDocumentUpdate());
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }

  /** Deletes a document with its chunks. */
  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable UUID documentId) {
    lifecycleService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }

  /** Processes a PENDING or FAILED document, synchronously unless {@code async} is set. */
  @PostMapping("/{documentId}/process")
  public ResponseEntity<DocumentResponse> processDocument(
      @PathVariable UUID documentId, @RequestParam(defaultValue = "false") boolean async) {
    if (async) {
      KnowledgeDocument document = lifecycleService.submitForProcessing(documentId);
      return ResponseEntity.accepted().body(DocumentResponse.fromEntity(document));
    }
    return ResponseEntity.ok(DocumentResponse.fromEntity(lifecycleService.process(documentId)));
  }

  /** Reprocesses a READY or FAILED document. */
  @PostMapping("/{documentId}/reprocess")
  public ResponseEntity<DocumentResponse> reprocessDocument(@PathVariable UUID documentId) {
    return ResponseEntity.ok(DocumentResponse.fromEntity(lifecycleService.reprocess(documentId)));
  }

  /** Requests cancellation of an in-flight processing pass. */
  @PostMapping("/{documentId}/cancel")
  public ResponseEntity<Map<String, Object>> cancelProcessing(@PathVariable UUID documentId) {
    boolean cancelled = lifecycleService.cancel(documentId);
    return ResponseEntity.ok(Map.of("documentId", documentId, "cancelled", cancelled));
  }

  /** Submits every PENDING document for background processing. */
  @PostMapping("/process-pending")
  public ResponseEntity<Map<String, Object>> processPending() {
    PendingSubmission submission = lifecycleService.processPending();
    return ResponseEntity.accepted()
        .body(Map.of("submitted", submission.submitted(), "deferred", submission.deferred()));
  }
}
