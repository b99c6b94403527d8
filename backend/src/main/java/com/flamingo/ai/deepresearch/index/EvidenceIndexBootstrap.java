package com.flamingo.ai.deepresearch.index;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Restores the in-memory vector store from the durable backend once the application is up. */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvidenceIndexBootstrap {

  private final EvidenceIndex evidenceIndex;
  private final ResearchConfig researchConfig;

  @EventListener(ApplicationReadyEvent.class)
  public void rebuildOnStartup() {
    if (!researchConfig.getIndex().isRebuildOnStartup() || !evidenceIndex.isDurableWritten()) {
      log.info("[Index] Startup rebuild skipped");
      return;
    }
    try {
      int loaded = evidenceIndex.rebuildFromDurable();
      log.info("[Index] Startup rebuild loaded {} chunks", loaded);
    } catch (RuntimeException e) {
      // Service stays up with an empty in-memory store; POST /api/evidence/rebuild retries.
      log.warn("[Index] Startup rebuild failed: {}", e.getMessage());
    }
  }
}
