package com.flamingo.ai.deepresearch.service.research;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.IndexWriteException;
import com.flamingo.ai.deepresearch.exception.InvalidSessionStateException;
import com.flamingo.ai.deepresearch.exception.LlmServiceException;
import com.flamingo.ai.deepresearch.exception.ResearchSessionNotFoundException;
import com.flamingo.ai.deepresearch.exception.StageFatalException;
import com.flamingo.ai.deepresearch.index.BackendType;
import com.flamingo.ai.deepresearch.index.IngestResult;
import com.flamingo.ai.deepresearch.index.PartialWrite;
import com.flamingo.ai.deepresearch.search.CancellationToken;
import com.flamingo.ai.deepresearch.search.FanOutResult;
import com.flamingo.ai.deepresearch.search.ProviderFailure;
import com.flamingo.ai.deepresearch.search.QuerySearchOutcome;
import com.flamingo.ai.deepresearch.search.SearchCoordinator;
import com.flamingo.ai.deepresearch.search.SearchHit;
import com.flamingo.ai.deepresearch.service.evidence.AnswerSynthesizer;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceCompressor;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceRecorder;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceUnit;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceValidator;
import com.flamingo.ai.deepresearch.service.evidence.FinalAnswer;
import com.flamingo.ai.deepresearch.service.evidence.ValidationReport;
import com.flamingo.ai.deepresearch.service.persistence.PlanStore;
import com.flamingo.ai.deepresearch.service.persistence.PlanStoreException;
import com.flamingo.ai.deepresearch.service.planning.PlanningRouter;
import com.flamingo.ai.deepresearch.service.planning.QueryPlanner;
import com.flamingo.ai.deepresearch.service.planning.ReflectionDecision;
import com.flamingo.ai.deepresearch.service.planning.ReflectionService;
import com.flamingo.ai.deepresearch.service.planning.RoutingDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResearchEngine Tests")
class ResearchEngineTest {

  private static final String QUESTION = "What is quantum computing?";

  @Mock private QueryPlanner queryPlanner;
  @Mock private ReflectionService reflectionService;
  @Mock private SearchCoordinator searchCoordinator;
  @Mock private EvidenceValidator evidenceValidator;
  @Mock private EvidenceCompressor evidenceCompressor;
  @Mock private EvidenceRecorder evidenceRecorder;
  @Mock private AnswerSynthesizer answerSynthesizer;
  @Mock private PlanStore planStore;

  private SimpleMeterRegistry meterRegistry;
  private ResearchEngine engine;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    engine = newEngine(new ResearchConfig());
    stubPipeline();
  }

  // Sessions run on the calling thread, so every call returns once the session settles.
  private ResearchEngine newEngine(ResearchConfig config) {
    return new ResearchEngine(
        queryPlanner,
        reflectionService,
        new PlanningRouter(),
        searchCoordinator,
        evidenceValidator,
        evidenceCompressor,
        evidenceRecorder,
        answerSynthesizer,
        planStore,
        config,
        Runnable::run,
        meterRegistry);
  }

  private void stubPipeline() {
    lenient()
        .when(queryPlanner.generateQueries(anyString(), anyInt()))
        .thenReturn(List.of("quantum computing"));
    lenient()
        .when(searchCoordinator.fanOut(anyList(), any(CancellationToken.class)))
        .thenAnswer(invocation -> answerAll(invocation.getArgument(0)));
    lenient()
        .when(evidenceValidator.validate(anyString(), anyList()))
        .thenAnswer(invocation -> new ValidationReport(invocation.getArgument(1), List.of()));
    lenient()
        .when(evidenceRecorder.record(anyString(), anyList()))
        .thenReturn(new IngestResult(List.of("c1"), List.of("c1"), List.of()));
    lenient()
        .when(evidenceCompressor.compress(anyString(), anyList(), anyList(), anyInt()))
        .thenAnswer(
            invocation -> {
              List<EvidenceUnit> existing = invocation.getArgument(1);
              List<EvidenceUnit> merged = new ArrayList<>(existing);
              merged.addAll(invocation.getArgument(2));
              return merged;
            });
    lenient()
        .when(reflectionService.reflect(anyString(), anyList(), anyInt(), anyList(), anyInt()))
        .thenReturn(new ReflectionDecision(true, null, List.of(), false));
    lenient()
        .when(answerSynthesizer.synthesize(anyString(), anyList()))
        .thenAnswer(
            invocation -> {
              List<EvidenceUnit> evidence = invocation.getArgument(1);
              return new FinalAnswer("Quantum computers use qubits [1].", evidence.size(),
                  evidence.isEmpty());
            });
  }

  @Nested
  @DisplayName("End to end")
  class EndToEnd {

    @Test
    @DisplayName("Should answer in one round without confirmation")
    void shouldAnswerInOneRound() {
      // When
      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      // Then
      SessionStatus status = engine.status(id);
      assertThat(status.state()).isEqualTo(ResearchState.DONE);
      assertThat(status.planningStatus()).isEqualTo(PlanningStatus.AUTO_APPROVED);
      assertThat(status.plan())
          .singleElement()
          .satisfies(
              step -> {
                assertThat(step.id()).isEqualTo("plan-1");
                assertThat(step.query()).isEqualTo("quantum computing");
                assertThat(step.status()).isEqualTo(PlanStepStatus.DONE);
              });
      assertThat(status.researchLoopCount()).isEqualTo(1);
      assertThat(status.outcome()).isEqualTo(ResearchOutcome.ANSWERED);
      assertThat(status.sources()).containsEntry("https://example.com/quantum-computing", 1);
      assertThat(status.answer()).contains("[1]");
      verify(evidenceRecorder).record(eq("plan-1"), anyList());
      verify(planStore, atLeastOnce()).save(any(ResearchSession.class));
    }

    @Test
    @DisplayName("Should publish stage events and complete the stream")
    void shouldPublishEvents() {
      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      StepVerifier.create(engine.events(id))
          .assertNext(
              event -> {
                assertThat(event.getEventType()).isEqualTo(ResearchEvent.PLANNING_UPDATED);
                assertThat(((ResearchEvent.PlanningData) event.getData()).feedback())
                    .isEqualTo("Plan auto-approved.");
              })
          .assertNext(
              event -> {
                assertThat(event.getEventType()).isEqualTo(ResearchEvent.SEARCH_BATCH_COMPLETED);
                ResearchEvent.SearchBatchData data =
                    (ResearchEvent.SearchBatchData) event.getData();
                assertThat(data.round()).isEqualTo(1);
                assertThat(data.succeededQueries()).isEqualTo(1);
              })
          .assertNext(
              event ->
                  assertThat(event.getEventType()).isEqualTo(ResearchEvent.REFLECTION_COMPLETED))
          .assertNext(
              event -> {
                assertThat(event.getEventType()).isEqualTo(ResearchEvent.FINALIZED);
                assertThat(event.getState()).isEqualTo(ResearchState.DONE);
              })
          .verifyComplete();
    }

    @Test
    @DisplayName("Should number citations in evidence order without gaps")
    void shouldAssignCitationsInOrder() {
      // Given
      when(queryPlanner.generateQueries(anyString(), anyInt()))
          .thenReturn(List.of("qubits", "entanglement"));
      when(searchCoordinator.fanOut(anyList(), any(CancellationToken.class)))
          .thenReturn(
              new FanOutResult(
                  List.of(
                      new QuerySearchOutcome(
                          "qubits", "tavily", List.of(hit("a"), hit("b")), List.of()),
                      new QuerySearchOutcome(
                          "entanglement", "brave", List.of(hit("a")), List.of())),
                  false));

      // When
      UUID id = engine.start(QUESTION, new ResearchOptions(1, 2, false, 50_000));

      // Then
      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<EvidenceUnit>> evidence = ArgumentCaptor.forClass(List.class);
      verify(answerSynthesizer).synthesize(eq(QUESTION), evidence.capture());
      assertThat(evidence.getValue())
          .extracting(EvidenceUnit::citationIndex)
          .containsExactly(1, 2, 1);
      assertThat(engine.status(id).sources())
          .containsEntry("https://example.com/a", 1)
          .containsEntry("https://example.com/b", 2)
          .hasSize(2);
    }
  }

  @Nested
  @DisplayName("Planning confirmation")
  class Planning {

    @Test
    @DisplayName("Should suspend until the plan is confirmed")
    void shouldSuspendForConfirmation() {
      // When
      UUID id = engine.start(QUESTION, new ResearchOptions(2, 1, true, 50_000));

      // Then
      SessionStatus waiting = engine.status(id);
      assertThat(waiting.state()).isEqualTo(ResearchState.PLANNING_WAIT);
      assertThat(waiting.planningStatus()).isEqualTo(PlanningStatus.AWAITING_CONFIRMATION);
      assertThat(waiting.plan())
          .extracting(PlanStep::status)
          .containsExactly(PlanStepStatus.PENDING);
      verify(searchCoordinator, never()).fanOut(anyList(), any(CancellationToken.class));
      verify(planStore).save(any(ResearchSession.class));

      // When
      RoutingDecision decision = engine.resume(id, "confirm-plan");

      // Then
      assertThat(decision.nextState()).isEqualTo(ResearchState.RESEARCH_FAN_OUT);
      SessionStatus done = engine.status(id);
      assertThat(done.state()).isEqualTo(ResearchState.DONE);
      assertThat(done.planningStatus()).isEqualTo(PlanningStatus.CONFIRMED);
    }

    @Test
    @DisplayName("Should stay waiting on an unknown command")
    void shouldStayWaitingOnUnknownCommand() {
      UUID id = engine.start(QUESTION, new ResearchOptions(2, 1, true, 50_000));

      RoutingDecision decision = engine.resume(id, "hurry up");

      assertThat(decision.recognized()).isFalse();
      assertThat(engine.status(id).state()).isEqualTo(ResearchState.PLANNING_WAIT);
      verify(searchCoordinator, never()).fanOut(anyList(), any(CancellationToken.class));
    }

    @Test
    @DisplayName("Should auto-approve when planning is skipped")
    void shouldSkipPlanning() {
      UUID id = engine.start(QUESTION, new ResearchOptions(2, 1, true, 50_000));

      engine.resume(id, "/end_plan");

      SessionStatus status = engine.status(id);
      assertThat(status.state()).isEqualTo(ResearchState.DONE);
      assertThat(status.planningStatus()).isEqualTo(PlanningStatus.AUTO_APPROVED);
    }

    @Test
    @DisplayName("Should reject commands once the session is running or finished")
    void shouldRejectCommandOutsideWait() {
      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      assertThatThrownBy(() -> engine.resume(id, "confirm-plan"))
          .isInstanceOf(InvalidSessionStateException.class);
    }
  }

  @Nested
  @DisplayName("Termination")
  class Termination {

    @Test
    @DisplayName("Should stop at the loop ceiling even if evidence stays insufficient")
    void shouldStopAtCeiling() {
      // Given
      when(reflectionService.reflect(anyString(), anyList(), anyInt(), anyList(), anyInt()))
          .thenReturn(
              new ReflectionDecision(false, "hardware", List.of("superconducting qubits"), false),
              new ReflectionDecision(false, "costs", List.of("qubit costs"), false));

      // When
      UUID id = engine.start(QUESTION, new ResearchOptions(2, 1, false, 50_000));

      // Then
      SessionStatus status = engine.status(id);
      assertThat(status.state()).isEqualTo(ResearchState.DONE);
      assertThat(status.researchLoopCount()).isEqualTo(2);
      assertThat(status.plan())
          .extracting(PlanStep::query)
          .containsExactly("quantum computing", "superconducting qubits");
      verify(searchCoordinator, times(2)).fanOut(anyList(), any(CancellationToken.class));
      verify(reflectionService).reflect(anyString(), anyList(), eq(2), anyList(), anyInt());
    }

    @Test
    @DisplayName("Should finish when reflection proposes no follow-ups")
    void shouldFinishWithoutFollowUps() {
      when(reflectionService.reflect(anyString(), anyList(), anyInt(), anyList(), anyInt()))
          .thenReturn(new ReflectionDecision(false, "unknown", List.of(), false));

      UUID id = engine.start(QUESTION, new ResearchOptions(3, 1, false, 50_000));

      assertThat(engine.status(id).researchLoopCount()).isEqualTo(1);
      verify(searchCoordinator, times(1)).fanOut(anyList(), any(CancellationToken.class));
    }

    @Test
    @DisplayName("Should answer with a caveat when every query failed")
    void shouldCaveatWhenNothingFound() {
      when(searchCoordinator.fanOut(anyList(), any(CancellationToken.class)))
          .thenReturn(
              new FanOutResult(
                  List.of(
                      QuerySearchOutcome.failed(
                          "quantum computing",
                          List.of(new ProviderFailure("tavily", "missing api key")))),
                  false));

      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      SessionStatus status = engine.status(id);
      assertThat(status.outcome()).isEqualTo(ResearchOutcome.NO_EVIDENCE);
      assertThat(status.plan())
          .extracting(PlanStep::status)
          .containsExactly(PlanStepStatus.BLOCKED);
      verify(evidenceRecorder, never()).record(anyString(), anyList());
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should abort with the failing stage in the reason")
    void shouldAbortOnStageFailure() {
      when(queryPlanner.generateQueries(anyString(), anyInt()))
          .thenThrow(new LlmServiceException("LLM call 'generate_queries' failed: 503"));

      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      SessionStatus status = engine.status(id);
      assertThat(status.state()).isEqualTo(ResearchState.FAILED);
      assertThat(status.outcome()).isEqualTo(ResearchOutcome.ABORTED);
      assertThat(status.failureReason())
          .isEqualTo("Stage GENERATE_QUERIES failed: LLM call 'generate_queries' failed: 503");
      StepVerifier.create(engine.events(id).map(ResearchEvent::getEventType))
          .expectNext(ResearchEvent.FAILED)
          .verifyComplete();
    }

    @Test
    @DisplayName("Should keep a stage-fatal message verbatim")
    void shouldKeepFatalMessage() {
      when(answerSynthesizer.synthesize(anyString(), anyList()))
          .thenThrow(
              new StageFatalException("FINALIZE", "Answer synthesis returned an empty answer"));

      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      assertThat(engine.status(id).failureReason())
          .isEqualTo("Answer synthesis returned an empty answer");
    }

    @Test
    @DisplayName("Should degrade, not fail, when evidence cannot be indexed")
    void shouldDegradeOnIndexFailures() {
      when(evidenceRecorder.record(anyString(), anyList()))
          .thenReturn(
              new IngestResult(
                  List.of("c1"),
                  List.of(),
                  List.of(new PartialWrite("c1", BackendType.ELASTICSEARCH, "timeout"))));

      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      assertThat(engine.status(id).state()).isEqualTo(ResearchState.DONE);
      StepVerifier.create(engine.events(id).map(ResearchEvent::getEventType))
          .expectNext(
              ResearchEvent.PLANNING_UPDATED,
              ResearchEvent.SEARCH_BATCH_COMPLETED,
              ResearchEvent.INDEX_WRITE_DEGRADED,
              ResearchEvent.REFLECTION_COMPLETED,
              ResearchEvent.FINALIZED)
          .verifyComplete();
    }

    @Test
    @DisplayName("Should degrade when embedding the evidence fails")
    void shouldDegradeOnEmbeddingFailure() {
      when(evidenceRecorder.record(anyString(), anyList()))
          .thenThrow(new IndexWriteException("embedding", "Embedded 0 of 1 chunks for plan-1"));

      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      assertThat(engine.status(id).outcome()).isEqualTo(ResearchOutcome.ANSWERED);
      assertThat(meterRegistry.counter("research.index.degraded").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not re-index evidence reused from the index")
    void shouldNotRecordReusedEvidence() {
      when(searchCoordinator.fanOut(anyList(), any(CancellationToken.class)))
          .thenReturn(
              new FanOutResult(
                  List.of(
                      new QuerySearchOutcome(
                          "quantum computing",
                          SearchCoordinator.INDEX_PROVIDER,
                          List.of(hit("stored")),
                          List.of())),
                  false));

      engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      verify(evidenceRecorder, never()).record(anyString(), anyList());
    }

    @Test
    @DisplayName("Should finish the session when snapshots cannot be saved")
    void shouldSurvivePersistenceFailure() {
      doThrow(new PlanStoreException("disk full", null)).when(planStore).save(any());

      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      assertThat(engine.status(id).state()).isEqualTo(ResearchState.DONE);
      assertThat(meterRegistry.counter("research.persistence.errors").count()).isPositive();
    }
  }

  @Nested
  @DisplayName("Cancellation")
  class Cancellation {

    @Test
    @DisplayName("Should cancel a waiting session at once")
    void shouldCancelWaitingSession() {
      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, true, 50_000));

      SessionStatus status = engine.cancel(id);

      assertThat(status.state()).isEqualTo(ResearchState.CANCELLED);
      assertThat(status.outcome()).isEqualTo(ResearchOutcome.CANCELLED);
      assertThatThrownBy(() -> engine.cancel(id))
          .isInstanceOf(InvalidSessionStateException.class);
      StepVerifier.create(engine.events(id).map(ResearchEvent::getEventType))
          .expectNext(ResearchEvent.PLANNING_UPDATED, ResearchEvent.CANCELLED)
          .verifyComplete();
    }

    @Test
    @DisplayName("Should discard in-flight results of a cancelled round")
    void shouldCancelRunningSession() {
      // Given
      AtomicReference<UUID> sessionId = new AtomicReference<>();
      when(searchCoordinator.fanOut(anyList(), any(CancellationToken.class)))
          .thenAnswer(
              invocation -> {
                engine.cancel(sessionId.get());
                return answerAll(invocation.getArgument(0));
              });
      sessionId.set(engine.start(QUESTION, new ResearchOptions(1, 1, true, 50_000)));

      // When
      engine.resume(sessionId.get(), "confirm-plan");

      // Then
      SessionStatus status = engine.status(sessionId.get());
      assertThat(status.state()).isEqualTo(ResearchState.CANCELLED);
      assertThat(status.evidenceCount()).isZero();
      verify(evidenceValidator, never()).validate(anyString(), anyList());
    }
  }

  @Nested
  @DisplayName("Recovery")
  class Recovery {

    @Test
    @DisplayName("Should restore an interrupted session into the planning wait")
    void shouldRestoreInterruptedSession() {
      // Given
      ResearchSession saved =
          ResearchSession.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));
      saved.setPendingQueries(new ArrayList<>(List.of("quantum computing")));
      saved.addPlanSteps(saved.getPendingQueries());
      saved.setState(ResearchState.RESEARCH_FAN_OUT);
      when(planStore.load(saved.getId())).thenReturn(Optional.of(saved));

      // When
      SessionStatus restored = engine.status(saved.getId());

      // Then
      assertThat(restored.state()).isEqualTo(ResearchState.PLANNING_WAIT);
      assertThat(restored.planningStatus()).isEqualTo(PlanningStatus.AWAITING_CONFIRMATION);

      // When
      engine.resume(saved.getId(), "confirm-plan");

      // Then
      assertThat(engine.status(saved.getId()).state()).isEqualTo(ResearchState.DONE);
      verify(searchCoordinator).fanOut(eq(List.of("quantum computing")), any());
    }

    @Test
    @DisplayName("Should replay nothing for a finished session")
    void shouldCompleteStreamOfFinishedSession() {
      ResearchSession saved =
          ResearchSession.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));
      saved.setState(ResearchState.DONE);
      when(planStore.load(saved.getId())).thenReturn(Optional.of(saved));

      StepVerifier.create(engine.events(saved.getId())).verifyComplete();
      assertThat(engine.status(saved.getId()).state()).isEqualTo(ResearchState.DONE);
    }

    @Test
    @DisplayName("Should report unknown sessions")
    void shouldRejectUnknownSession() {
      UUID unknown = UUID.randomUUID();
      when(planStore.load(unknown)).thenReturn(Optional.empty());

      assertThatThrownBy(() -> engine.status(unknown))
          .isInstanceOf(ResearchSessionNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("Retention")
  class Retention {

    private final Map<UUID, ResearchSession> saved = new ConcurrentHashMap<>();

    private ResearchEngine releasingEngine() {
      lenient()
          .doAnswer(
              invocation -> {
                ResearchSession session = invocation.getArgument(0);
                saved.put(session.getId(), session);
                return null;
              })
          .when(planStore)
          .save(any(ResearchSession.class));
      lenient()
          .when(planStore.load(any(UUID.class)))
          .thenAnswer(invocation -> Optional.ofNullable(saved.get(invocation.getArgument(0))));
      ResearchConfig config = new ResearchConfig();
      config.setSessionRetentionSeconds(0);
      return newEngine(config);
    }

    @Test
    @DisplayName("Should release finished sessions and answer status from the store")
    void shouldReleaseFinishedSessions() {
      // Given
      ResearchEngine releasing = releasingEngine();
      List<UUID> ids = new ArrayList<>();

      // When
      for (int i = 0; i < 50; i++) {
        ids.add(releasing.start(QUESTION, new ResearchOptions(1, 1, false, 50_000)));
      }

      // Then
      assertThat(releasing.activeSessionCount()).isZero();
      assertThat(meterRegistry.counter("research.sessions.evicted").count()).isEqualTo(50.0);
      SessionStatus status = releasing.status(ids.get(0));
      assertThat(status.state()).isEqualTo(ResearchState.DONE);
      assertThat(status.outcome()).isEqualTo(ResearchOutcome.ANSWERED);
      StepVerifier.create(releasing.events(ids.get(0))).verifyComplete();
      assertThat(releasing.activeSessionCount()).isZero();
    }

    @Test
    @DisplayName("Should release cancelled sessions")
    void shouldReleaseCancelledSessions() {
      // Given
      ResearchEngine releasing = releasingEngine();
      UUID id = releasing.start(QUESTION, new ResearchOptions(1, 1, true, 50_000));
      assertThat(releasing.activeSessionCount()).isEqualTo(1);

      // When
      releasing.cancel(id);

      // Then
      assertThat(releasing.activeSessionCount()).isZero();
      assertThat(releasing.status(id).state()).isEqualTo(ResearchState.CANCELLED);
    }

    @Test
    @DisplayName("Should keep a finished session whose snapshot could not be written")
    void shouldKeepUnpersistedSession() {
      // Given
      ResearchConfig config = new ResearchConfig();
      config.setSessionRetentionSeconds(0);
      ResearchEngine releasing = newEngine(config);
      doThrow(new PlanStoreException("disk full", null)).when(planStore).save(any());

      // When
      UUID id = releasing.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      // Then
      assertThat(releasing.activeSessionCount()).isEqualTo(1);
      assertThat(releasing.status(id).state()).isEqualTo(ResearchState.DONE);
    }

    @Test
    @DisplayName("Should hold finished sessions during the retention period")
    void shouldHoldDuringRetention() {
      UUID id = engine.start(QUESTION, new ResearchOptions(1, 1, false, 50_000));

      assertThat(engine.activeSessionCount()).isEqualTo(1);
      StepVerifier.create(engine.events(id))
          .thenConsumeWhile(event -> true)
          .verifyComplete();
    }
  }

  @Test
  @DisplayName("Should reject a blank question")
  void shouldRejectBlankQuestion() {
    assertThatThrownBy(() -> engine.start("  ", new ResearchOptions(1, 1, false, 50_000)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static FanOutResult answerAll(List<String> queries) {
    List<QuerySearchOutcome> outcomes = new ArrayList<>();
    for (String query : queries) {
      SearchHit hit = hit(query.replace(' ', '-'));
      outcomes.add(new QuerySearchOutcome(query, "tavily", List.of(hit), List.of()));
    }
    return new FanOutResult(outcomes, false);
  }

  private static SearchHit hit(String key) {
    return new SearchHit("https://example.com/" + key, "About " + key, "Facts about " + key);
  }
}
