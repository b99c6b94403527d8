package com.flamingo.ai.deepresearch.api.rest;

import com.flamingo.ai.deepresearch.api.dto.request.PlanningCommandRequest;
import com.flamingo.ai.deepresearch.api.dto.request.StartResearchRequest;
import com.flamingo.ai.deepresearch.api.dto.response.PlanningCommandResponse;
import com.flamingo.ai.deepresearch.api.dto.response.StartResearchResponse;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.service.planning.RoutingDecision;
import com.flamingo.ai.deepresearch.service.research.ResearchEngine;
import com.flamingo.ai.deepresearch.service.research.ResearchOptions;
import com.flamingo.ai.deepresearch.service.research.SessionStatus;
import com.flamingo.ai.deepresearch.service.research.StageDescriptor;
import com.flamingo.ai.deepresearch.service.research.StageRegistry;
import jakarta.validation.Valid;
import java.util.Collection;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for research sessions. */
@RestController
@RequestMapping("/api/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

  private final ResearchEngine researchEngine;
  private final StageRegistry stageRegistry;
  private final ResearchConfig researchConfig;

  /** Starts a research session. */
  @PostMapping
  public ResponseEntity<StartResearchResponse> start(
      @Valid @RequestBody StartResearchRequest request) {
    ResearchOptions options =
        ResearchOptions.from(researchConfig)
            .withOverrides(
                request.getMaxResearchLoops(),
                request.getInitialQueryCount(),
                request.getRequirePlanningConfirmation());
    UUID sessionId = researchEngine.start(request.getQuestion(), options);
    SessionStatus status = researchEngine.status(sessionId);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new StartResearchResponse(sessionId, status.state()));
  }

  /** Sends a planning command to a waiting session. */
  @PostMapping("/{sessionId}/commands")
  public ResponseEntity<PlanningCommandResponse> command(
      @PathVariable UUID sessionId, @Valid @RequestBody PlanningCommandRequest request) {
    RoutingDecision decision = researchEngine.resume(sessionId, request.getCommand());
    return ResponseEntity.ok(PlanningCommandResponse.from(sessionId, decision));
  }

  /** Cancels a session. */
  @PostMapping("/{sessionId}/cancel")
  public ResponseEntity<SessionStatus> cancel(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(researchEngine.cancel(sessionId));
  }

  /** Gets the status of a session. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionStatus> status(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(researchEngine.status(sessionId));
  }

  /** Lists the stages of the research state machine. */
  @GetMapping("/stages")
  public ResponseEntity<Collection<StageDescriptor>> stages() {
    return ResponseEntity.ok(stageRegistry.all());
  }
}
