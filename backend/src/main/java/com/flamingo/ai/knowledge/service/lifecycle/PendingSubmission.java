package com.flamingo.ai.knowledge.service.lifecycle;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a batch submission of {@code PENDING} documents.
 *
 * @param submitted number of documents handed to the processing executor
 * @param deferred documents the executor refused; they stay {@code PENDING} for a later batch
 */
public record PendingSubmission(int submitted, List<UUID> deferred) {}
