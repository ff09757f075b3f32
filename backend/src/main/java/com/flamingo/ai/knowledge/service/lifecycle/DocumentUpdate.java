package com.flamingo.ai.knowledge.service.lifecycle;

import java.util.Set;
import lombok.Builder;

/** Metadata changes to a document. Null fields are left unchanged. */
@Builder
public record DocumentUpdate(
    String title,
    String description,
    Set<String> targetFunctions,
    Set<String> targetPlatforms,
    Set<String> tags,
    Integer priority,
    Boolean active) {}
