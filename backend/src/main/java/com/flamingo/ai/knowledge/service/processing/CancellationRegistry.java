package com.flamingo.ai.knowledge.service.processing;

import com.flamingo.ai.knowledge.exception.ProcessingCancelledException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/** Cancellation flags of in-flight processing passes, keyed by document id. */
@Component
public class CancellationRegistry {

  private final Map<UUID, AtomicBoolean> flags = new ConcurrentHashMap<>();

  /** Registers a pass that is about to start, clearing any earlier request. */
  public void begin(UUID documentId) {
    flags.put(documentId, new AtomicBoolean(false));
  }

  /** Removes the flag once the pass has finished, whatever its outcome. */
  public void end(UUID documentId) {
    flags.remove(documentId);
  }

  /**
   * Flags the running pass of a document.
   *
   * @return false if no pass is running for it
   */
  public boolean requestCancel(UUID documentId) {
    AtomicBoolean flag = flags.get(documentId);
    if (flag == null) {
      return false;
    }
    flag.set(true);
    return true;
  }

  public boolean isRunning(UUID documentId) {
    return flags.containsKey(documentId);
  }

  public void throwIfCancelled(UUID documentId) {
    AtomicBoolean flag = flags.get(documentId);
    if (flag != null && flag.get()) {
      throw new ProcessingCancelledException(documentId);
    }
  }
}
