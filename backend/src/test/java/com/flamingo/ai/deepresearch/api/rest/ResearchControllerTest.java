package com.flamingo.ai.deepresearch.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.api.dto.request.PlanningCommandRequest;
import com.flamingo.ai.deepresearch.api.dto.request.StartResearchRequest;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.ApiError;
import com.flamingo.ai.deepresearch.exception.GlobalExceptionHandler;
import com.flamingo.ai.deepresearch.exception.InvalidSessionStateException;
import com.flamingo.ai.deepresearch.exception.ResearchSessionNotFoundException;
import com.flamingo.ai.deepresearch.service.planning.RoutingDecision;
import com.flamingo.ai.deepresearch.service.research.PlanningStatus;
import com.flamingo.ai.deepresearch.service.research.ResearchEngine;
import com.flamingo.ai.deepresearch.service.research.ResearchOptions;
import com.flamingo.ai.deepresearch.service.research.ResearchOutcome;
import com.flamingo.ai.deepresearch.service.research.ResearchState;
import com.flamingo.ai.deepresearch.service.research.SessionStatus;
import com.flamingo.ai.deepresearch.service.research.StageRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResearchController Tests")
class ResearchControllerTest {

  private static final String QUESTION = "What is quantum computing?";

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private ResearchEngine researchEngine;

  @BeforeEach
  void setUp() {
    ResearchConfig researchConfig = new ResearchConfig();
    ResearchController controller =
        new ResearchController(researchEngine, new StageRegistry(), researchConfig);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should accept a research request with overrides")
  void shouldStartResearch() throws Exception {
    // Given
    UUID sessionId = UUID.randomUUID();
    StartResearchRequest request =
        StartResearchRequest.builder()
            .question(QUESTION)
            .maxResearchLoops(1)
            .requirePlanningConfirmation(false)
            .build();
    when(researchEngine.start(eq(QUESTION), any(ResearchOptions.class))).thenReturn(sessionId);
    when(researchEngine.status(sessionId))
        .thenReturn(sessionStatus(sessionId, ResearchState.GENERATE_QUERIES));

    // When / Then
    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.sessionId").value(sessionId.toString()))
        .andExpect(jsonPath("$.state").value("GENERATE_QUERIES"));

    // Loop and confirmation overrides win; the query count keeps the configured default.
    verify(researchEngine).start(QUESTION, new ResearchOptions(1, 3, false, 50_000));
  }

  @Test
  @DisplayName("Should reject a blank question")
  void shouldRejectBlankQuestion() throws Exception {
    StartResearchRequest request = StartResearchRequest.builder().question("   ").build();

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

    verify(researchEngine, never()).start(any(), any());
  }

  @Test
  @DisplayName("Should reject an out-of-range loop override")
  void shouldRejectLoopOverride() throws Exception {
    StartResearchRequest request =
        StartResearchRequest.builder().question(QUESTION).maxResearchLoops(0).build();

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should route a planning command")
  void shouldRouteCommand() throws Exception {
    UUID sessionId = UUID.randomUUID();
    when(researchEngine.resume(sessionId, "confirm-plan"))
        .thenReturn(
            new RoutingDecision(
                PlanningStatus.CONFIRMED,
                ResearchState.RESEARCH_FAN_OUT,
                "Plan confirmed. Proceeding to research.",
                true));

    mockMvc
        .perform(
            post("/api/research/{sessionId}/commands", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(new PlanningCommandRequest("confirm-plan"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("RESEARCH_FAN_OUT"))
        .andExpect(jsonPath("$.planningStatus").value("CONFIRMED"))
        .andExpect(jsonPath("$.recognized").value(true));
  }

  @Test
  @DisplayName("Should answer 409 for a command outside the planning wait")
  void shouldConflictOutsideWait() throws Exception {
    UUID sessionId = UUID.randomUUID();
    when(researchEngine.resume(sessionId, "confirm-plan"))
        .thenThrow(
            new InvalidSessionStateException(
                sessionId, ResearchState.REFLECT, "Not waiting for confirmation"));

    mockMvc
        .perform(
            post("/api/research/{sessionId}/commands", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(new PlanningCommandRequest("confirm-plan"))))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value(ApiError.SESSION_STATE_CONFLICT));
  }

  @Test
  @DisplayName("Should answer 404 for an unknown session")
  void shouldReturnNotFound() throws Exception {
    UUID sessionId = UUID.randomUUID();
    when(researchEngine.status(sessionId))
        .thenThrow(new ResearchSessionNotFoundException(sessionId));

    mockMvc
        .perform(get("/api/research/{sessionId}", sessionId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.SESSION_NOT_FOUND))
        .andExpect(jsonPath("$.path").value("/api/research/" + sessionId));
  }

  @Test
  @DisplayName("Should return the session status")
  void shouldReturnStatus() throws Exception {
    UUID sessionId = UUID.randomUUID();
    when(researchEngine.status(sessionId)).thenReturn(sessionStatus(sessionId, ResearchState.DONE));

    mockMvc
        .perform(get("/api/research/{sessionId}", sessionId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("DONE"))
        .andExpect(jsonPath("$.outcome").value("ANSWERED"))
        .andExpect(jsonPath("$.sources['https://example.com/qubits']").value(1));
  }

  @Test
  @DisplayName("Should cancel a session")
  void shouldCancel() throws Exception {
    UUID sessionId = UUID.randomUUID();
    when(researchEngine.cancel(sessionId))
        .thenReturn(sessionStatus(sessionId, ResearchState.CANCELLED));

    mockMvc
        .perform(post("/api/research/{sessionId}/cancel", sessionId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("CANCELLED"));
  }

  @Test
  @DisplayName("Should list every stage")
  void shouldListStages() throws Exception {
    mockMvc
        .perform(get("/api/research/stages"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(ResearchState.values().length))
        .andExpect(jsonPath("$[0].stage").value("INIT"));
  }

  private static SessionStatus sessionStatus(UUID sessionId, ResearchState state) {
    return new SessionStatus(
        sessionId,
        QUESTION,
        state,
        PlanningStatus.AUTO_APPROVED,
        List.of(),
        1,
        1,
        Map.of("https://example.com/qubits", 1),
        List.of(),
        state == ResearchState.DONE ? ResearchOutcome.ANSWERED : null,
        null,
        null);
  }
}
