package com.flamingo.ai.knowledge.service.processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledge.config.RagConfig;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.exception.DocumentProcessingException;
import com.flamingo.ai.knowledge.exception.DocumentStateConflictException;
import com.flamingo.ai.knowledge.exception.ExtractionFailureException;
import com.flamingo.ai.knowledge.exception.ProcessingCancelledException;
import com.flamingo.ai.knowledge.service.rag.chunking.TextChunker;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingStrategy;
import com.flamingo.ai.knowledge.service.rag.embedding.HashEmbeddingProvider;
import com.flamingo.ai.knowledge.service.rag.embedding.LangChain4jEmbeddingProvider;
import com.flamingo.ai.knowledge.store.InMemoryKnowledgeStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

@DisplayName("DocumentProcessingService Tests")
class DocumentProcessingServiceTest {

  private static final String TEXT =
      "Credential dumping from LSASS is a common post-exploitation step. ".repeat(40);

  private InMemoryKnowledgeStore store;
  private CancellationRegistry cancellationRegistry;
  private SimpleMeterRegistry meterRegistry;
  private RagConfig ragConfig;
  private HashEmbeddingProvider fallback;

  @BeforeEach
  void setUp() {
    store = new InMemoryKnowledgeStore();
    cancellationRegistry = new CancellationRegistry();
    meterRegistry = new SimpleMeterRegistry();
    ragConfig = new RagConfig();
    fallback = new HashEmbeddingProvider(16);
  }

  private DocumentProcessingService service(EmbeddingProvider primary) {
    EmbeddingService embeddingService =
        new EmbeddingService(new EmbeddingStrategy(primary, fallback), ragConfig, meterRegistry);
    return new DocumentProcessingService(
        store,
        new StoredContentExtractor(),
        new TextChunker(ragConfig),
        embeddingService,
        cancellationRegistry,
        meterRegistry);
  }

  private DocumentProcessingService localService() {
    return service(new LangChain4jEmbeddingProvider(null, "none"));
  }

  private KnowledgeDocument pendingDocument(String text) {
    return store.createDocument(
        KnowledgeDocument.builder()
            .title("LSASS")
            .sourceType(SourceType.FILE)
            .rawContent(text)
            .uploadedBy("admin")
            .adminManaged(true)
            .build());
  }

  private void resetToPending(UUID id) {
    assertThat(store.compareAndSetStatus(id, DocumentStatus.REPROCESSABLE, DocumentStatus.PENDING))
        .isTrue();
  }

  @Test
  @DisplayName("Should chunk, embed and mark the document READY")
  void shouldProcessPendingDocument() {
    KnowledgeDocument doc = pendingDocument(TEXT);

    KnowledgeDocument result = localService().process(doc.getId());

    List<KnowledgeChunk> chunks = store.chunksOf(doc.getId());
    assertThat(result.getStatus()).isEqualTo(DocumentStatus.READY);
    assertThat(result.getChunkCount()).isEqualTo(chunks.size()).isGreaterThan(1);
    assertThat(result.getProcessingError()).isNull();
    assertThat(result.getProcessedAt()).isNotNull();
    assertThat(chunks).extracting(KnowledgeChunk::getChunkIndex).startsWith(0, 1);
    assertThat(chunks)
        .allSatisfy(
            c -> {
              assertThat(c.getEmbeddingModel()).isEqualTo(fallback.modelId());
              assertThat(c.getEmbedding()).hasSize(16);
            });
    assertThat(meterRegistry.counter("knowledge.processing.success").count()).isEqualTo(1.0);
    assertThat(cancellationRegistry.isRunning(doc.getId())).isFalse();
  }

  @Test
  @DisplayName("Should reject processing a READY document")
  void shouldRejectReadyDocument() {
    KnowledgeDocument doc = pendingDocument(TEXT);
    DocumentProcessingService service = localService();
    service.process(doc.getId());

    assertThatThrownBy(() -> service.process(doc.getId()))
        .isInstanceOf(DocumentStateConflictException.class)
        .extracting(e -> ((DocumentStateConflictException) e).getCurrentStatus())
        .isEqualTo(DocumentStatus.READY);
  }

  @Test
  @DisplayName("Should reject a second pass while one is in flight")
  void shouldRejectConcurrentPass() {
    KnowledgeDocument doc = pendingDocument(TEXT);
    store.updateDocumentStatus(doc.getId(), DocumentStatus.PROCESSING, null);

    assertThatThrownBy(() -> localService().process(doc.getId()))
        .isInstanceOf(DocumentStateConflictException.class);
    assertThat(store.getDocument(doc.getId())).get()
        .extracting(KnowledgeDocument::getStatus)
        .isEqualTo(DocumentStatus.PROCESSING);
  }

  @Test
  @DisplayName("Should report a missing document")
  void shouldRejectMissingDocument() {
    assertThatThrownBy(() -> localService().process(UUID.randomUUID()))
        .isInstanceOf(DocumentNotFoundException.class);
  }

  @Test
  @DisplayName("Should keep the previous chunks and mark FAILED when storing fails")
  void shouldPreserveChunksOnFailure() {
    KnowledgeDocument doc = pendingDocument(TEXT);
    DocumentProcessingService service = localService();
    service.process(doc.getId());
    List<UUID> previousIds = store.chunksOf(doc.getId()).stream().map(KnowledgeChunk::getId).toList();

    resetToPending(doc.getId());
    store.failNextReplace(new DataIntegrityViolationException("disk full"));

    assertThatThrownBy(() -> service.process(doc.getId()))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("disk full");

    KnowledgeDocument failed = store.getDocument(doc.getId()).orElseThrow();
    assertThat(failed.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(failed.getProcessingError()).contains("disk full");
    assertThat(store.chunksOf(doc.getId()))
        .extracting(KnowledgeChunk::getId)
        .containsExactlyElementsOf(previousIds);
    assertThat(meterRegistry.counter("knowledge.processing.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should retry a FAILED document successfully")
  void shouldProcessFailedDocument() {
    KnowledgeDocument doc = pendingDocument(TEXT);
    store.updateDocumentStatus(doc.getId(), DocumentStatus.FAILED, "earlier failure");

    KnowledgeDocument result = localService().process(doc.getId());

    assertThat(result.getStatus()).isEqualTo(DocumentStatus.READY);
    assertThat(result.getProcessingError()).isNull();
  }

  @Test
  @DisplayName("Should mark FAILED when a URL document has no fetched content")
  void shouldFailOnMissingContent() {
    KnowledgeDocument doc =
        store.createDocument(
            KnowledgeDocument.builder()
                .title("Remote page")
                .sourceType(SourceType.URL)
                .uploadedBy("alice")
                .build());

    assertThatThrownBy(() -> localService().process(doc.getId()))
        .isInstanceOf(ExtractionFailureException.class);
    assertThat(store.getDocument(doc.getId()).orElseThrow().getStatus())
        .isEqualTo(DocumentStatus.FAILED);
    assertThat(store.chunksOf(doc.getId())).isEmpty();
  }

  @Test
  @DisplayName("Should stop between chunks when cancelled and never store partial chunks")
  void shouldStopWhenCancelled() {
    KnowledgeDocument doc = pendingDocument(TEXT);
    EmbeddingProvider cancellingProvider =
        new EmbeddingProvider() {
          @Override
          public String modelId() {
            return "test:cancelling";
          }

          @Override
          public boolean isAvailable() {
            return true;
          }

          @Override
          public float[] embed(String text) {
            cancellationRegistry.requestCancel(doc.getId());
            return new float[] {1f, 0f};
          }
        };

    assertThatThrownBy(() -> service(cancellingProvider).process(doc.getId()))
        .isInstanceOf(ProcessingCancelledException.class);

    KnowledgeDocument cancelled = store.getDocument(doc.getId()).orElseThrow();
    assertThat(cancelled.getStatus()).isEqualTo(DocumentStatus.FAILED);
    assertThat(cancelled.getProcessingError()).isEqualTo("Processing cancelled");
    assertThat(store.chunksOf(doc.getId())).isEmpty();
    assertThat(cancellationRegistry.isRunning(doc.getId())).isFalse();
  }

  @Test
  @DisplayName("Reprocessing unchanged text should reproduce chunk count and boundaries")
  void shouldReprocessIdempotently() {
    KnowledgeDocument doc = pendingDocument(TEXT);
    DocumentProcessingService service = localService();
    int firstCount = service.process(doc.getId()).getChunkCount();
    List<String> firstBounds = bounds(store.chunksOf(doc.getId()));

    resetToPending(doc.getId());
    int secondCount = service.process(doc.getId()).getChunkCount();

    assertThat(secondCount).isEqualTo(firstCount);
    assertThat(bounds(store.chunksOf(doc.getId()))).containsExactlyElementsOf(firstBounds);
  }

  @Test
  @DisplayName("Async variant should complete with the processed document")
  void shouldCompleteAsyncFuture() {
    KnowledgeDocument doc = pendingDocument(TEXT);

    CompletableFuture<KnowledgeDocument> future = localService().processAsync(doc.getId());

    assertThat(future).isCompleted();
    assertThat(future.join().getStatus()).isEqualTo(DocumentStatus.READY);
  }

  @Test
  @DisplayName("Async variant should complete exceptionally on failure")
  void shouldFailAsyncFuture() {
    CompletableFuture<KnowledgeDocument> future = localService().processAsync(UUID.randomUUID());

    assertThat(future).isCompletedExceptionally();
  }

  @Test
  @DisplayName("Processable states should be PENDING and FAILED")
  void processableStates() {
    assertThat(DocumentStatus.PROCESSABLE)
        .isEqualTo(Set.of(DocumentStatus.PENDING, DocumentStatus.FAILED));
  }

  private static List<String> bounds(List<KnowledgeChunk> chunks) {
    return chunks.stream().map(c -> c.getStartChar() + "-" + c.getEndChar()).toList();
  }
}
