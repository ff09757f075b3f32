package com.flamingo.ai.knowledge.service.lifecycle;

import com.flamingo.ai.knowledge.config.RagConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/** Removes the stored source files of deleted documents. */
@Component
@Slf4j
public class SourceFileStorage {

  private final Path basePath;

  public SourceFileStorage(RagConfig ragConfig) {
    this.basePath = Paths.get(ragConfig.getStorage().getBasePath()).toAbsolutePath().normalize();
  }

  /**
   * Deletes the file once the surrounding transaction commits, or right away when no transaction
   * is active. Paths outside the storage directory are ignored.
   */
  public void deleteAfterCommit(String filePath) {
    if (filePath == null || filePath.isBlank()) {
      return;
    }
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              delete(filePath);
            }
          });
    } else {
      delete(filePath);
    }
  }

  /**
   * Deletes a stored file.
   *
   * @return true if a file was removed
   */
  public boolean delete(String filePath) {
    Path path = basePath.resolve(filePath).normalize();
    if (!path.startsWith(basePath)) {
      log.warn("Refusing to delete {} outside of {}", path, basePath);
      return false;
    }
    try {
      boolean deleted = Files.deleteIfExists(path);
      log.debug("Source file {} {}", path, deleted ? "deleted" : "already absent");
      return deleted;
    } catch (IOException e) {
      log.warn("Failed to delete source file {}: {}", path, e.getMessage());
      return false;
    }
  }
}
