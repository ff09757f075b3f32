package com.flamingo.ai.knowledge.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.knowledge.api.dto.request.AddDocumentRequest;
import com.flamingo.ai.knowledge.api.dto.request.UpdateDocumentRequest;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.exception.DocumentProcessingException;
import com.flamingo.ai.knowledge.exception.DocumentStateConflictException;
import com.flamingo.ai.knowledge.exception.DuplicateDocumentException;
import com.flamingo.ai.knowledge.exception.ExtractionFailureException;
import com.flamingo.ai.knowledge.exception.GlobalExceptionHandler;
import com.flamingo.ai.knowledge.service.ingestion.IngestionRequest;
import com.flamingo.ai.knowledge.service.ingestion.IngestionService;
import com.flamingo.ai.knowledge.service.lifecycle.DocumentFilter;
import com.flamingo.ai.knowledge.service.lifecycle.DocumentLifecycleService;
import com.flamingo.ai.knowledge.service.lifecycle.DocumentUpdate;
import com.flamingo.ai.knowledge.service.lifecycle.PendingSubmission;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("KnowledgeDocumentController Tests")
class KnowledgeDocumentControllerTest {

  @Mock private IngestionService ingestionService;
  @Mock private DocumentLifecycleService lifecycleService;

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new KnowledgeDocumentController(ingestionService, lifecycleService))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static KnowledgeDocument document(UUID id, DocumentStatus status) {
    return KnowledgeDocument.builder()
        .id(id)
        .title("Sigma basics")
        .docType(KnowledgeDocumentType.QUERY_SYNTAX)
        .sourceType(SourceType.FILE)
        .status(status)
        .priority(3)
        .uploadedBy("alice")
        .build();
  }

  private static AddDocumentRequest addRequest() {
    return AddDocumentRequest.builder()
        .title("Sigma basics")
        .sourceType(SourceType.FILE)
        .extractedText("Sigma rules describe log events.")
        .priority(5)
        .owner("alice")
        .build();
  }

  @Test
  @DisplayName("Should create a PENDING document")
  void shouldAddDocument() throws Exception {
    UUID id = UUID.randomUUID();
    when(ingestionService.addDocument(any(IngestionRequest.class)))
        .thenReturn(document(id, DocumentStatus.PENDING));

    mockMvc
        .perform(
            post("/api/knowledge/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(addRequest())))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(id.toString()))
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.docType").value("QUERY_SYNTAX"));

    ArgumentCaptor<IngestionRequest> captor = ArgumentCaptor.forClass(IngestionRequest.class);
    verify(ingestionService).addDocument(captor.capture());
    assertThat(captor.getValue().owner()).isEqualTo("alice");
  }

  @Test
  @DisplayName("Should return 409 with the existing id for a duplicate")
  void shouldRejectDuplicate() throws Exception {
    UUID existing = UUID.randomUUID();
    when(ingestionService.addDocument(any(IngestionRequest.class)))
        .thenThrow(
            new DuplicateDocumentException(
                existing, "You have already uploaded this document: 'Sigma basics'"));

    mockMvc
        .perform(
            post("/api/knowledge/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(addRequest())))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DOCUMENT_004"))
        .andExpect(jsonPath("$.resourceId").value(existing.toString()))
        .andExpect(
            jsonPath("$.message").value("You have already uploaded this document: 'Sigma basics'"));
  }

  @Test
  @DisplayName("Should return 422 when no text was extracted")
  void shouldRejectEmptyExtraction() throws Exception {
    when(ingestionService.addDocument(any(IngestionRequest.class)))
        .thenThrow(new ExtractionFailureException("No text could be extracted"));

    mockMvc
        .perform(
            post("/api/knowledge/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(addRequest())))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("DOCUMENT_002"));
  }

  @Test
  @DisplayName("Should return 400 for an invalid request body")
  void shouldValidateRequest() throws Exception {
    AddDocumentRequest invalid = addRequest();
    invalid.setTitle("");
    invalid.setPriority(11);

    mockMvc
        .perform(
            post("/api/knowledge/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(invalid)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(ingestionService, never()).addDocument(any());
  }

  @Test
  @DisplayName("Should return 404 for an unknown document")
  void shouldReturnNotFound() throws Exception {
    UUID id = UUID.randomUUID();
    when(lifecycleService.getDocument(id)).thenThrow(new DocumentNotFoundException(id));

    mockMvc
        .perform(get("/api/knowledge/documents/{id}", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("DOCUMENT_001"))
        .andExpect(jsonPath("$.path").value("/api/knowledge/documents/" + id));
  }

  @Test
  @DisplayName("Should list with filters or by owner")
  void shouldListDocuments() throws Exception {
    UUID id = UUID.randomUUID();
    when(lifecycleService.listDocuments(
            new DocumentFilter(KnowledgeDocumentType.PLAYBOOK, DocumentStatus.READY, true, 10)))
        .thenReturn(List.of(document(id, DocumentStatus.READY)));
    when(lifecycleService.listOwnedDocuments("alice")).thenReturn(List.of());

    mockMvc
        .perform(
            get("/api/knowledge/documents")
                .param("docType", "PLAYBOOK")
                .param("status", "READY")
                .param("active", "true")
                .param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(id.toString()));

    mockMvc
        .perform(get("/api/knowledge/documents").param("owner", "alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  @Test
  @DisplayName("Should process synchronously and report failures as 422")
  void shouldProcessDocument() throws Exception {
    UUID ok = UUID.randomUUID();
    UUID broken = UUID.randomUUID();
    when(lifecycleService.process(ok)).thenReturn(document(ok, DocumentStatus.READY));
    when(lifecycleService.process(broken))
        .thenThrow(new DocumentProcessingException(broken, "Processing failed: disk full"));

    mockMvc
        .perform(post("/api/knowledge/documents/{id}/process", ok))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("READY"));
    mockMvc
        .perform(post("/api/knowledge/documents/{id}/process", broken))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("DOCUMENT_003"));
  }

  @Test
  @DisplayName("Should submit async processing and answer 202")
  void shouldProcessAsync() throws Exception {
    UUID id = UUID.randomUUID();
    when(lifecycleService.submitForProcessing(id)).thenReturn(document(id, DocumentStatus.PENDING));

    mockMvc
        .perform(post("/api/knowledge/documents/{id}/process", id).param("async", "true"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("PENDING"));

    verify(lifecycleService, never()).process(id);
  }

  @Test
  @DisplayName("Should answer 409 for async processing of a READY document")
  void shouldRejectAsyncProcessingOfReadyDocument() throws Exception {
    UUID id = UUID.randomUUID();
    when(lifecycleService.submitForProcessing(id))
        .thenThrow(new DocumentStateConflictException(id, DocumentStatus.READY, "process"));

    mockMvc
        .perform(post("/api/knowledge/documents/{id}/process", id).param("async", "true"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DOCUMENT_005"))
        .andExpect(jsonPath("$.resourceId").value(id.toString()));
  }

  @Test
  @DisplayName("Should answer 503 when the processing executor is saturated")
  void shouldReportSaturatedExecutor() throws Exception {
    UUID id = UUID.randomUUID();
    when(lifecycleService.submitForProcessing(id))
        .thenThrow(new TaskRejectedException("queue full"));

    mockMvc
        .perform(post("/api/knowledge/documents/{id}/process", id).param("async", "true"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("DOCUMENT_006"));
  }

  @Test
  @DisplayName("Should return 409 when reprocessing a document that is being processed")
  void shouldRejectConcurrentReprocess() throws Exception {
    UUID id = UUID.randomUUID();
    when(lifecycleService.reprocess(id))
        .thenThrow(new DocumentStateConflictException(id, DocumentStatus.PROCESSING, "reprocess"));

    mockMvc
        .perform(post("/api/knowledge/documents/{id}/reprocess", id))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DOCUMENT_005"));
  }

  @Test
  @DisplayName("Should update metadata, cancel, and delete")
  void shouldUpdateCancelAndDelete() throws Exception {
    UUID id = UUID.randomUUID();
    KnowledgeDocument updated = document(id, DocumentStatus.READY);
    updated.setPriority(9);
    when(lifecycleService.updateDocument(eq(id), any(DocumentUpdate.class))).thenReturn(updated);
    when(lifecycleService.cancel(id)).thenReturn(true);

    mockMvc
        .perform(
            patch("/api/knowledge/documents/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        UpdateDocumentRequest.builder().priority(9).build())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.priority").value(9));
    mockMvc
        .perform(post("/api/knowledge/documents/{id}/cancel", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelled").value(true));
    mockMvc
        .perform(delete("/api/knowledge/documents/{id}", id))
        .andExpect(status().isNoContent());

    verify(lifecycleService).deleteDocument(id);
  }

  @Test
  @DisplayName("Should submit pending documents")
  void shouldProcessPending() throws Exception {
    UUID deferred = UUID.randomUUID();
    when(lifecycleService.processPending()).thenReturn(new PendingSubmission(4, List.of(deferred)));

    mockMvc
        .perform(post("/api/knowledge/documents/process-pending"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.submitted").value(4))
        .andExpect(jsonPath("$.deferred[0]").value(deferred.toString()));
  }
}
