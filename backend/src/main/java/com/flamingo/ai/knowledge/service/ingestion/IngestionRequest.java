package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import java.util.Set;
import lombok.Builder;

/**
 * Input handed over by the extraction collaborator.
 *
 * @param extractedText text of the document; required for files, optional for URLs that have not
 *     been fetched yet
 * @param sourceUrl page address, required for URL documents
 * @param filePath stored artifact of an uploaded file, removed on delete
 * @param priority requested ranking weight 1-10, null for the default
 * @param owner identifier of the uploader
 */
@Builder
public record IngestionRequest(
    String title,
    String description,
    KnowledgeDocumentType docType,
    SourceType sourceType,
    String extractedText,
    String sourceUrl,
    String fileName,
    String filePath,
    Long fileSize,
    String mimeType,
    Integer crawlDepth,
    DocumentScope scope,
    boolean adminManaged,
    Set<String> targetFunctions,
    Set<String> targetPlatforms,
    Set<String> tags,
    Integer priority,
    String owner) {}
