package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final EmbeddingService embeddingService;

  /** Returns a simple health check response with the embedding mode. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "knowledge-retrieval");
    health.put("embeddingModel", embeddingService.activeModelId());
    health.put("embeddingMode", embeddingService.isRemoteAvailable() ? "remote" : "fallback");
    health.put("fallbackModel", embeddingService.fallbackModelId());
    return ResponseEntity.ok(health);
  }
}
