package com.flamingo.ai.knowledge.service.processing;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.exception.DocumentProcessingException;
import com.flamingo.ai.knowledge.exception.DocumentStateConflictException;
import com.flamingo.ai.knowledge.exception.ExtractionFailureException;
import com.flamingo.ai.knowledge.exception.ProcessingCancelledException;
import com.flamingo.ai.knowledge.service.rag.chunking.TextChunk;
import com.flamingo.ai.knowledge.service.rag.chunking.TextChunker;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingResult;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledge.store.KnowledgeStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs a processing pass: extract, chunk, embed, and replace the document's chunk set.
 *
 * <p>A pass only starts after moving the document from {@code PENDING} or {@code FAILED} to
 * {@code PROCESSING} in a single conditional update, so at most one pass per document is in
 * flight. The chunk set is only written by {@link KnowledgeStore#replaceChunks}; a pass that fails
 * or is cancelled before that point leaves the previous chunks untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

  static final String CANCELLED_MESSAGE = "Processing cancelled";

  private final KnowledgeStore knowledgeStore;
  private final ContentExtractor contentExtractor;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final CancellationRegistry cancellationRegistry;
  private final MeterRegistry meterRegistry;

  /**
   * Processes a document synchronously.
   *
   * @param documentId the document to process
   * @return the document in {@code READY}
   * @throws DocumentNotFoundException if the document does not exist
   * @throws DocumentStateConflictException if the document is not in a processable state
   * @throws DocumentProcessingException if the pass failed; the document is then {@code FAILED}
   */
  @Timed(value = "knowledge.document.process", description = "Time to process a document")
  public KnowledgeDocument process(UUID documentId) {
    acquire(documentId);
    cancellationRegistry.begin(documentId);
    try {
      KnowledgeDocument document =
          knowledgeStore
              .getDocument(documentId)
              .orElseThrow(() -> new DocumentNotFoundException(documentId));

      String text = contentExtractor.extractText(document);
      List<TextChunk> textChunks = textChunker.chunk(text);
      if (textChunks.isEmpty()) {
        throw new ExtractionFailureException(documentId, "Document text produced no chunks");
      }
      log.info("Document {} split into {} chunks", documentId, textChunks.size());

      List<KnowledgeChunk> chunks = new ArrayList<>(textChunks.size());
      for (TextChunk textChunk : textChunks) {
        cancellationRegistry.throwIfCancelled(documentId);
        EmbeddingResult embedding = embeddingService.embed(textChunk.content());
        log.debug(
            "Embedded chunk {} of document {} with {}",
            textChunk.index(),
            documentId,
            embedding.modelId());
        chunks.add(
            KnowledgeChunk.builder()
                .documentId(documentId)
                .chunkIndex(textChunk.index())
                .content(textChunk.content())
                .tokenCount(textChunk.tokenCount())
                .embedding(embedding.vector())
                .embeddingModel(embedding.modelId())
                .startChar(textChunk.startChar())
                .endChar(textChunk.endChar())
                .build());
      }
      cancellationRegistry.throwIfCancelled(documentId);

      int stored = knowledgeStore.replaceChunks(documentId, chunks);
      KnowledgeDocument ready = knowledgeStore.markReady(documentId, stored);

      meterRegistry.counter("knowledge.processing.success").increment();
      log.info("Document {} processed successfully: {} chunks", documentId, stored);
      return ready;

    } catch (ProcessingCancelledException e) {
      meterRegistry.counter("knowledge.processing.cancelled").increment();
      log.info("Processing of document {} cancelled", documentId);
      recordFailure(documentId, CANCELLED_MESSAGE);
      throw e;
    } catch (DocumentNotFoundException e) {
      throw e;
    } catch (ExtractionFailureException e) {
      meterRegistry.counter("knowledge.processing.failure").increment();
      log.error("Extraction failed for document {}: {}", documentId, e.getMessage());
      recordFailure(documentId, e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("knowledge.processing.failure").increment();
      log.error("Failed to process document {}: {}", documentId, e.getMessage(), e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      recordFailure(documentId, message);
      throw new DocumentProcessingException(documentId, "Processing failed: " + message, e);
    } finally {
      cancellationRegistry.end(documentId);
    }
  }

  /**
   * Processes a document on the {@code documentProcessingExecutor}. Failures are recorded on the
   * document and complete the future exceptionally.
   */
  @Async("documentProcessingExecutor")
  public CompletableFuture<KnowledgeDocument> processAsync(UUID documentId) {
    try {
      return CompletableFuture.completedFuture(process(documentId));
    } catch (RuntimeException e) {
      log.warn("Async processing of document {} ended with {}", documentId, e.toString());
      return CompletableFuture.failedFuture(e);
    }
  }

  private void acquire(UUID documentId) {
    if (knowledgeStore.compareAndSetStatus(
        documentId, DocumentStatus.PROCESSABLE, DocumentStatus.PROCESSING)) {
      return;
    }
    KnowledgeDocument current =
        knowledgeStore
            .getDocument(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    throw new DocumentStateConflictException(documentId, current.getStatus(), "process");
  }

  private void recordFailure(UUID documentId, String message) {
    try {
      knowledgeStore.updateDocumentStatus(documentId, DocumentStatus.FAILED, message);
    } catch (DocumentNotFoundException e) {
      log.warn("Document {} was deleted while processing", documentId);
    }
  }
}
