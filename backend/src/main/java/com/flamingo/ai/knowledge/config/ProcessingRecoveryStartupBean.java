package com.flamingo.ai.knowledge.config;

import com.flamingo.ai.knowledge.service.lifecycle.DocumentLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Startup bean that fails documents left in {@code PROCESSING} by a previous run. No pass can be
 * in flight before the application has started, so every such document was interrupted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessingRecoveryStartupBean implements CommandLineRunner {

  private final DocumentLifecycleService lifecycleService;

  @Override
  public void run(String... args) {
    try {
      int recovered = lifecycleService.recoverInterrupted();
      log.info("Processing recovery complete: {} interrupted documents", recovered);
    } catch (DataAccessException e) {
      // Startup continues; the documents stay PROCESSING until the next start
      log.error("Processing recovery failed: {}", e.getMessage(), e);
    }
  }
}
