package com.flamingo.ai.deepresearch.api.sse;

import com.flamingo.ai.deepresearch.service.research.ResearchEngine;
import com.flamingo.ai.deepresearch.service.research.ResearchEvent;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Streams research events over Server-Sent Events. */
@RestController
@RequestMapping("/api/research/{sessionId}")
@RequiredArgsConstructor
@Slf4j
public class ResearchEventController {

  private final ResearchEngine researchEngine;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams the session's events from its start. The stream completes when the session finishes.
   *
   * @param sessionId the session ID
   * @return a Flux of SSE events
   */
  @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ResearchEvent> events(@PathVariable UUID sessionId) {
    Flux<ResearchEvent> events = researchEngine.events(sessionId);
    log.info("Opening event stream for session {}", sessionId);
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return events
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Event stream completed for session {}", sessionId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Event stream error for session {}: {}", sessionId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Event stream cancelled for session {}", sessionId);
            });
  }
}
