package com.flamingo.ai.knowledge.service.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.service.ingestion.IngestionRequest;
import com.flamingo.ai.knowledge.service.ingestion.IngestionService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Submits a backlog larger than the processing executor's pool plus queue through the real async
 * executor.
 */
@SpringBootTest
class ProcessPendingIntegrationTest {

  private static final int BACKLOG = 150;

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private IngestionService ingestionService;
  @Autowired private DocumentLifecycleService lifecycleService;

  @BeforeEach
  void setUp() {
    when(embeddingModel.embed(anyString()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(20);
              return Response.from(Embedding.from(new float[] {0.6f, 0.8f}));
            });
  }

  @Test
  @DisplayName("processPending should hand over the whole backlog without failing")
  void shouldSubmitBacklogLargerThanExecutor() throws InterruptedException {
    String batch = UUID.randomUUID().toString();
    List<UUID> ids = new ArrayList<>();
    for (int i = 0; i < BACKLOG; i++) {
      KnowledgeDocument document =
          ingestionService.addDocument(
              IngestionRequest.builder()
                  .title("Runbook " + i)
                  .sourceType(SourceType.FILE)
                  .extractedText("Runbook " + i + " of batch " + batch + ". Isolate the host.")
                  .docType(KnowledgeDocumentType.PLAYBOOK)
                  .scope(DocumentScope.GLOBAL)
                  .adminManaged(true)
                  .owner("admin")
                  .build());
      ids.add(document.getId());
    }

    PendingSubmission first = lifecycleService.processPending();

    assertThat(first.submitted() + first.deferred().size()).isGreaterThanOrEqualTo(BACKLOG);
    for (UUID deferred : first.deferred()) {
      assertThat(lifecycleService.getDocument(deferred).getStatus())
          .isEqualTo(DocumentStatus.PENDING);
    }

    awaitNoPending(ids, first.deferred());
    PendingSubmission second = lifecycleService.processPending();
    assertThat(second.deferred()).isEmpty();
    awaitNoPending(ids, List.of());

    assertThat(ids)
        .allSatisfy(
            id ->
                assertThat(lifecycleService.getDocument(id).getStatus())
                    .isEqualTo(DocumentStatus.READY));
  }

  /** Waits until every document outside {@code stillPending} has left PENDING and PROCESSING. */
  private void awaitNoPending(List<UUID> ids, Collection<UUID> stillPending)
      throws InterruptedException {
    long deadline = System.currentTimeMillis() + 60_000;
    while (System.currentTimeMillis() < deadline) {
      boolean busy =
          ids.stream()
              .filter(id -> !stillPending.contains(id))
              .map(id -> lifecycleService.getDocument(id).getStatus())
              .anyMatch(
                  status -> status == DocumentStatus.PENDING || status == DocumentStatus.PROCESSING);
      if (!busy) {
        return;
      }
      Thread.sleep(50);
    }
    throw new AssertionError("Processing did not finish in time");
  }
}
