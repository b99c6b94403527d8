package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.IndexWriteException;
import com.flamingo.ai.deepresearch.exception.InvalidSessionStateException;
import com.flamingo.ai.deepresearch.exception.ResearchSessionNotFoundException;
import com.flamingo.ai.deepresearch.exception.StageFatalException;
import com.flamingo.ai.deepresearch.index.IngestResult;
import com.flamingo.ai.deepresearch.search.CancellationToken;
import com.flamingo.ai.deepresearch.search.FanOutResult;
import com.flamingo.ai.deepresearch.search.QuerySearchOutcome;
import com.flamingo.ai.deepresearch.search.SearchCoordinator;
import com.flamingo.ai.deepresearch.service.evidence.AnswerSynthesizer;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceCompressor;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceRecorder;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceUnit;
import com.flamingo.ai.deepresearch.service.evidence.EvidenceValidator;
import com.flamingo.ai.deepresearch.service.evidence.FinalAnswer;
import com.flamingo.ai.deepresearch.service.evidence.ValidationReport;
import com.flamingo.ai.deepresearch.service.persistence.PlanStore;
import com.flamingo.ai.deepresearch.service.planning.PlanningRouter;
import com.flamingo.ai.deepresearch.service.planning.QueryPlanner;
import com.flamingo.ai.deepresearch.service.planning.ReflectionDecision;
import com.flamingo.ai.deepresearch.service.planning.ReflectionService;
import com.flamingo.ai.deepresearch.service.planning.RoutingDecision;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Research state machine.
 *
 * <pre>
 * INIT -> GENERATE_QUERIES -> PLANNING -> [PLANNING_WAIT]* -> RESEARCH_FAN_OUT -> VALIDATE
 *      -> COMPRESS -> REFLECT -> {RESEARCH_FAN_OUT | FINALIZE} -> DONE
 * </pre>
 *
 * <p>Each session runs on one task of the session executor; rounds never overlap. Stages do their
 * slow work outside the session lock and apply results under it, so status reads and commands
 * never wait on a provider. {@code PLANNING_WAIT} ends the task: nothing happens until {@link
 * #resume} routes a command that leaves the wait.
 */
@Service
@Slf4j
public class ResearchEngine {

  private final QueryPlanner queryPlanner;
  private final ReflectionService reflectionService;
  private final PlanningRouter planningRouter;
  private final SearchCoordinator searchCoordinator;
  private final EvidenceValidator evidenceValidator;
  private final EvidenceCompressor evidenceCompressor;
  private final EvidenceRecorder evidenceRecorder;
  private final AnswerSynthesizer answerSynthesizer;
  private final PlanStore planStore;
  private final ResearchConfig researchConfig;
  private final Executor sessionExecutor;
  private final MeterRegistry meterRegistry;

  private final Map<UUID, SessionRuntime> sessions = new ConcurrentHashMap<>();

  public ResearchEngine(
      QueryPlanner queryPlanner,
      ReflectionService reflectionService,
      PlanningRouter planningRouter,
      SearchCoordinator searchCoordinator,
      EvidenceValidator evidenceValidator,
      EvidenceCompressor evidenceCompressor,
      EvidenceRecorder evidenceRecorder,
      AnswerSynthesizer answerSynthesizer,
      PlanStore planStore,
      ResearchConfig researchConfig,
      @Qualifier("researchSessionExecutor") Executor sessionExecutor,
      MeterRegistry meterRegistry) {
    this.queryPlanner = queryPlanner;
    this.reflectionService = reflectionService;
    this.planningRouter = planningRouter;
    this.searchCoordinator = searchCoordinator;
    this.evidenceValidator = evidenceValidator;
    this.evidenceCompressor = evidenceCompressor;
    this.evidenceRecorder = evidenceRecorder;
    this.answerSynthesizer = answerSynthesizer;
    this.planStore = planStore;
    this.researchConfig = researchConfig;
    this.sessionExecutor = sessionExecutor;
    this.meterRegistry = meterRegistry;
  }

  /** Starts a session with the configured defaults. */
  public UUID start(String question) {
    return start(question, ResearchOptions.from(researchConfig));
  }

  /**
   * Creates a session and schedules it.
   *
   * @param question the research question
   * @param options per-session settings
   * @return the session id
   */
  public UUID start(String question, ResearchOptions options) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("question must not be blank");
    }
    ResearchSession session = ResearchSession.start(question.strip(), options);
    SessionRuntime runtime = new SessionRuntime(session);
    sessions.put(session.getId(), runtime);
    meterRegistry.counter("research.sessions.started").increment();
    log.info(
        "[Engine] Session {} started: loops={}, queries={}, confirm={}",
        session.getId(),
        options.maxResearchLoops(),
        options.initialQueryCount(),
        options.requirePlanningConfirmation());

    synchronized (runtime) {
      runtime.running = true;
    }
    schedule(runtime);
    return session.getId();
  }

  /**
   * Routes a planning command to a session waiting in {@link ResearchState#PLANNING_WAIT}.
   *
   * @param sessionId the session
   * @param command {@code enter-planning}, {@code skip-planning} or {@code confirm-plan}, or
   *     their slash aliases; anything else leaves the session waiting
   * @return the routing decision
   * @throws InvalidSessionStateException if the session is not waiting
   */
  public RoutingDecision resume(UUID sessionId, String command) {
    SessionRuntime runtime = runtime(sessionId);
    ResearchSession session = runtime.session;
    RoutingDecision decision;
    boolean launch = false;
    synchronized (runtime) {
      if (session.getState() != ResearchState.PLANNING_WAIT) {
        throw new InvalidSessionStateException(
            sessionId,
            session.getState(),
            "Planning commands are only accepted while waiting for plan confirmation");
      }
      decision = planningRouter.route(session.getPlanningStatus(), command);
      session.setPlanningStatus(decision.nextStatus());
      session.setState(decision.nextState());
      session.touch();
      runtime.emit(ResearchEvent.planningUpdated(session, decision.feedback(), session.getPlan()));
      if (decision.nextState() != ResearchState.PLANNING_WAIT && !runtime.running) {
        runtime.running = true;
        launch = true;
      }
    }
    log.info(
        "[Engine] Session {} command '{}' -> {} ({})",
        sessionId,
        command,
        decision.nextState(),
        decision.nextStatus());

    if (launch) {
      schedule(runtime);
    } else {
      persist(runtime);
    }
    return decision;
  }

  /**
   * Cancels a session. A waiting session is cancelled at once; a running one stops at the next
   * stage boundary and its in-flight provider calls are abandoned.
   *
   * @throws InvalidSessionStateException if the session already finished
   */
  public SessionStatus cancel(UUID sessionId) {
    SessionRuntime runtime = runtime(sessionId);
    boolean cancelNow;
    synchronized (runtime) {
      ResearchState state = runtime.session.getState();
      if (state.isTerminal()) {
        throw new InvalidSessionStateException(
            sessionId, state, "Session already finished in state " + state);
      }
      runtime.token.cancel();
      cancelNow = !runtime.running;
      if (cancelNow) {
        markCancelled(runtime);
      }
    }
    log.info("[Engine] Session {} cancellation requested", sessionId);
    if (cancelNow) {
      persistAndRelease(runtime);
    }
    return status(sessionId);
  }

  public SessionStatus status(UUID sessionId) {
    SessionRuntime runtime = runtime(sessionId);
    synchronized (runtime) {
      return SessionStatus.of(runtime.session);
    }
  }

  /** Event stream of the session, replayed from its start, completing when the session ends. */
  public Flux<ResearchEvent> events(UUID sessionId) {
    return runtime(sessionId).sink.asFlux();
  }

  private void schedule(SessionRuntime runtime) {
    try {
      sessionExecutor.execute(() -> drive(runtime));
    } catch (RejectedExecutionException e) {
      log.error("[Engine] Session {} rejected by executor", runtime.session.getId());
      fail(runtime, new StageFatalException("INIT", "Research executor is saturated", e));
    }
  }

  private void drive(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    try {
      while (true) {
        ResearchState state;
        synchronized (runtime) {
          if (runtime.token.isCancelled() && !session.getState().isTerminal()) {
            markCancelled(runtime);
          }
          state = session.getState();
          if (state.isTerminal() || state == ResearchState.PLANNING_WAIT) {
            runtime.running = false;
            break;
          }
        }
        runStage(runtime, state);
      }
      persistAndRelease(runtime);
    } catch (RuntimeException e) {
      fail(runtime, e);
    }
  }

  private void runStage(SessionRuntime runtime, ResearchState state) {
    log.debug("[Engine] Session {} entering {}", runtime.session.getId(), state);
    switch (state) {
      case INIT -> apply(runtime, s -> s.setState(ResearchState.GENERATE_QUERIES));
      case GENERATE_QUERIES -> generateQueries(runtime);
      case PLANNING -> plan(runtime);
      case RESEARCH_FAN_OUT -> fanOut(runtime);
      case VALIDATE -> validate(runtime);
      case COMPRESS -> compress(runtime);
      case REFLECT -> reflect(runtime);
      case FINALIZE -> finalizeAnswer(runtime);
      default -> throw new StageFatalException(state.name(), "No handler for state " + state);
    }
  }

  private void generateQueries(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    List<String> queries =
        queryPlanner.generateQueries(
            session.getQuestion(), session.getOptions().initialQueryCount());
    apply(
        runtime,
        s -> {
          s.setPendingQueries(new ArrayList<>(queries));
          s.setState(ResearchState.PLANNING);
        });
  }

  private void plan(SessionRuntime runtime) {
    boolean applied =
        apply(
            runtime,
            s -> {
              s.addPlanSteps(s.getPendingQueries());
              if (s.getOptions().requirePlanningConfirmation()) {
                s.setPlanningStatus(PlanningStatus.AWAITING_CONFIRMATION);
                s.setState(ResearchState.PLANNING_WAIT);
                runtime.emit(
                    ResearchEvent.planningUpdated(s, "Awaiting plan confirmation.", s.getPlan()));
              } else {
                s.setPlanningStatus(PlanningStatus.AUTO_APPROVED);
                s.setState(ResearchState.RESEARCH_FAN_OUT);
                runtime.emit(ResearchEvent.planningUpdated(s, "Plan auto-approved.", s.getPlan()));
              }
            });
    // The task ends here when suspended; drive() persists the waiting session.
    if (applied && runtime.session.getState() == ResearchState.PLANNING_WAIT) {
      log.info("[Engine] Session {} waiting for plan confirmation", runtime.session.getId());
    }
  }

  private void fanOut(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    List<String> queries;
    synchronized (runtime) {
      int maxLoops = session.getOptions().maxResearchLoops();
      if (session.getResearchLoopCount() >= maxLoops || session.getPendingQueries().isEmpty()) {
        log.info(
            "[FanOut] Session {} skips fan-out: round {} of {}, {} pending queries",
            session.getId(),
            session.getResearchLoopCount(),
            maxLoops,
            session.getPendingQueries().size());
        session.setState(ResearchState.FINALIZE);
        return;
      }
      queries = List.copyOf(session.getPendingQueries());
      for (String query : queries) {
        session.stepFor(query)
            .ifPresent(step -> session.updateStep(step.id(), PlanStepStatus.IN_PROGRESS));
      }
    }

    FanOutResult batch = searchCoordinator.fanOut(queries, runtime.token);

    apply(
        runtime,
        s -> {
          List<EvidenceUnit> raw = new ArrayList<>();
          runtime.reusedQueries.clear();
          for (QuerySearchOutcome outcome : batch.outcomes()) {
            for (int rank = 0; rank < outcome.hits().size(); rank++) {
              raw.add(EvidenceUnit.fromHit(outcome.hits().get(rank), outcome.query(), rank));
            }
            if (SearchCoordinator.INDEX_PROVIDER.equals(outcome.provider())) {
              runtime.reusedQueries.add(outcome.query());
            }
            PlanStepStatus status =
                outcome.isEmpty() ? PlanStepStatus.BLOCKED : PlanStepStatus.DONE;
            s.stepFor(outcome.query()).ifPresent(step -> s.updateStep(step.id(), status));
          }
          s.setRawResults(raw);
          s.getExecutedQueries().addAll(queries);
          s.getPendingQueries().clear();
          s.setState(ResearchState.VALIDATE);
          runtime.emit(
              ResearchEvent.searchBatchCompleted(
                  s,
                  s.getResearchLoopCount() + 1,
                  batch.succeededCount(),
                  batch.failedCount(),
                  raw.size()));
        });
  }

  private void validate(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    ValidationReport report =
        evidenceValidator.validate(session.getQuestion(), List.copyOf(session.getRawResults()));
    recordEvidence(runtime, report.accepted());
    apply(
        runtime,
        s -> {
          s.setValidatedResults(new ArrayList<>(report.accepted()));
          s.getValidationNotes().addAll(report.notes());
          s.setState(ResearchState.COMPRESS);
        });
  }

  /** Ingests validated units per plan step. Index failures degrade the session, never fail it. */
  private void recordEvidence(SessionRuntime runtime, List<EvidenceUnit> units) {
    ResearchSession session = runtime.session;
    Map<String, List<EvidenceUnit>> byStep = new LinkedHashMap<>();
    synchronized (runtime) {
      for (EvidenceUnit unit : units) {
        if (runtime.reusedQueries.contains(unit.query())) {
          continue;
        }
        Optional<PlanStep> step = session.stepFor(unit.query());
        step.ifPresent(
            s -> byStep.computeIfAbsent(s.id(), id -> new ArrayList<>()).add(unit));
      }
    }

    for (Map.Entry<String, List<EvidenceUnit>> entry : byStep.entrySet()) {
      String stepId = entry.getKey();
      try {
        IngestResult result = evidenceRecorder.record(stepId, entry.getValue());
        if (!result.isComplete()) {
          degraded(
              runtime,
              stepId,
              result.partialWrites().size() + " partial writes, first: "
                  + result.partialWrites().get(0).failedBackend()
                  + " "
                  + result.partialWrites().get(0).reason());
        }
      } catch (IndexWriteException e) {
        degraded(runtime, stepId, e.getBackend() + ": " + e.getMessage());
      }
    }
  }

  private void degraded(SessionRuntime runtime, String stepId, String reason) {
    log.warn("[Index] Session {} step {} degraded: {}", runtime.session.getId(), stepId, reason);
    meterRegistry.counter("research.index.degraded").increment();
    synchronized (runtime) {
      runtime.emit(ResearchEvent.indexWriteDegraded(runtime.session, stepId, reason));
    }
  }

  private void compress(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    List<EvidenceUnit> compressed =
        evidenceCompressor.compress(
            session.getQuestion(),
            List.copyOf(session.getCompressedResults()),
            List.copyOf(session.getValidatedResults()),
            session.getOptions().tokenBudget());
    apply(
        runtime,
        s -> {
          // Ids follow evidence order (query order, then rank), not provider arrival order.
          List<EvidenceUnit> cited = new ArrayList<>(compressed.size());
          for (EvidenceUnit unit : compressed) {
            cited.add(
                unit.citationIndex() != null
                    ? unit
                    : unit.withCitationIndex(s.getCitations().assign(unit.sourceUrl())));
          }
          s.setCompressedResults(cited);
          s.setState(ResearchState.REFLECT);
        });
  }

  private void reflect(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    int round;
    List<String> executed;
    List<EvidenceUnit> evidence;
    synchronized (runtime) {
      round = session.getResearchLoopCount() + 1;
      executed = List.copyOf(session.getExecutedQueries());
      evidence = List.copyOf(session.getCompressedResults());
    }

    ReflectionDecision decision =
        reflectionService.reflect(
            session.getQuestion(),
            evidence,
            round,
            executed,
            session.getOptions().initialQueryCount());

    apply(
        runtime,
        s -> {
          s.setResearchLoopCount(round);
          s.setSufficient(decision.sufficient());
          s.setKnowledgeGap(decision.knowledgeGap());
          boolean ceiling = round >= s.getOptions().maxResearchLoops();
          boolean finish = decision.sufficient() || ceiling || decision.followUpQueries().isEmpty();
          runtime.emit(
              ResearchEvent.reflectionCompleted(
                  s, decision.sufficient(), decision.knowledgeGap(), decision.followUpQueries()));
          if (finish) {
            s.setState(ResearchState.FINALIZE);
          } else {
            s.setPendingQueries(new ArrayList<>(decision.followUpQueries()));
            s.addPlanSteps(decision.followUpQueries());
            s.setState(ResearchState.RESEARCH_FAN_OUT);
            runtime.emit(
                ResearchEvent.planningUpdated(
                    s,
                    "Plan extended with " + decision.followUpQueries().size() + " follow-up steps.",
                    s.getPlan()));
          }
          log.info(
              "[Reflect] Session {} round {}: sufficient={}, ceiling={}, next={}",
              s.getId(),
              round,
              decision.sufficient(),
              ceiling,
              s.getState());
        });
    persist(runtime);
  }

  private void finalizeAnswer(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    FinalAnswer answer =
        answerSynthesizer.synthesize(
            session.getQuestion(), List.copyOf(session.getCompressedResults()));
    apply(
        runtime,
        s -> {
          ResearchOutcome outcome =
              answer.caveated() ? ResearchOutcome.NO_EVIDENCE : ResearchOutcome.ANSWERED;
          s.setAnswer(answer.text());
          s.setOutcome(outcome);
          s.getMessages().add(SessionMessage.assistant(answer.text()));
          s.setState(ResearchState.DONE);
          runtime.emit(ResearchEvent.finalized(s));
          runtime.sink.tryEmitComplete();
          meterRegistry
              .counter("research.sessions.completed", "outcome", outcome.name())
              .increment();
          log.info(
              "[Engine] Session {} done: outcome={}, rounds={}, evidence={}",
              s.getId(),
              outcome,
              s.getResearchLoopCount(),
              s.getEvidenceCount());
        });
  }

  /**
   * Applies a mutation under the session lock unless the session was cancelled meanwhile.
   *
   * @return whether the mutation ran
   */
  private boolean apply(SessionRuntime runtime, Consumer<ResearchSession> step) {
    synchronized (runtime) {
      if (runtime.token.isCancelled()) {
        return false;
      }
      step.accept(runtime.session);
      runtime.session.touch();
      return true;
    }
  }

  private void markCancelled(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    session.setState(ResearchState.CANCELLED);
    session.setOutcome(ResearchOutcome.CANCELLED);
    session.getPendingQueries().clear();
    session.touch();
    runtime.running = false;
    runtime.emit(ResearchEvent.cancelled(session));
    runtime.sink.tryEmitComplete();
    meterRegistry.counter("research.sessions.cancelled").increment();
    log.info("[Engine] Session {} cancelled", session.getId());
  }

  private void fail(SessionRuntime runtime, RuntimeException e) {
    ResearchSession session = runtime.session;
    synchronized (runtime) {
      runtime.running = false;
      if (session.getState().isTerminal()) {
        log.warn(
            "[Engine] Session {} error after termination: {}", session.getId(), e.getMessage());
        return;
      }
      if (runtime.token.isCancelled()) {
        markCancelled(runtime);
      } else {
        ResearchState stage = session.getState();
        String reason =
            e instanceof StageFatalException
                ? e.getMessage()
                : "Stage " + stage + " failed: " + e.getMessage();
        log.error("[Engine] Session {} failed in {}: {}", session.getId(), stage, reason, e);
        session.setState(ResearchState.FAILED);
        session.setOutcome(ResearchOutcome.ABORTED);
        session.setFailureReason(reason);
        session.touch();
        runtime.emit(ResearchEvent.failed(session, reason));
        runtime.sink.tryEmitComplete();
        meterRegistry.counter("research.sessions.failed", "stage", stage.name()).increment();
      }
    }
    persistAndRelease(runtime);
  }

  /** @return whether the snapshot was written */
  private boolean persist(SessionRuntime runtime) {
    try {
      synchronized (runtime) {
        planStore.save(runtime.session);
      }
      return true;
    } catch (RuntimeException e) {
      // The run continues; only crash recovery of this session is affected.
      log.error(
          "[Engine] Could not persist session {}: {}", runtime.session.getId(), e.getMessage());
      meterRegistry.counter("research.persistence.errors").increment();
      return false;
    }
  }

  /**
   * Persists the session and, once it is finished, drops it from memory after the retention
   * period. Later reads reload the terminal snapshot from the plan store. A session whose final
   * snapshot could not be written stays in memory, since nothing else can answer for it.
   */
  private void persistAndRelease(SessionRuntime runtime) {
    if (persist(runtime)) {
      release(runtime);
    }
  }

  private void release(SessionRuntime runtime) {
    UUID sessionId = runtime.session.getId();
    synchronized (runtime) {
      if (!runtime.session.getState().isTerminal() || runtime.releaseScheduled) {
        return;
      }
      runtime.releaseScheduled = true;
    }
    long retention = Math.max(0, researchConfig.getSessionRetentionSeconds());
    if (retention == 0) {
      evict(sessionId, runtime);
      return;
    }
    CompletableFuture.delayedExecutor(retention, TimeUnit.SECONDS)
        .execute(() -> evict(sessionId, runtime));
  }

  private void evict(UUID sessionId, SessionRuntime runtime) {
    if (sessions.remove(sessionId, runtime)) {
      meterRegistry.counter("research.sessions.evicted").increment();
      log.debug("[Engine] Session {} released from memory", sessionId);
    }
  }

  /** Number of sessions currently held in memory. */
  @VisibleForTesting
  int activeSessionCount() {
    return sessions.size();
  }

  private SessionRuntime runtime(UUID sessionId) {
    SessionRuntime existing = sessions.get(sessionId);
    if (existing != null) {
      return existing;
    }
    ResearchSession restored =
        planStore
            .load(sessionId)
            .orElseThrow(() -> new ResearchSessionNotFoundException(sessionId));
    SessionRuntime runtime = new SessionRuntime(restored);
    SessionRuntime winner = sessions.putIfAbsent(sessionId, runtime);
    if (winner != null) {
      return winner;
    }
    recover(runtime);
    return runtime;
  }

  /**
   * Re-enters the wait for an interrupted run. Finished runs only get a completed stream and are
   * released again after the retention period.
   */
  private void recover(SessionRuntime runtime) {
    ResearchSession session = runtime.session;
    if (session.getState().isTerminal()) {
      runtime.sink.tryEmitComplete();
      release(runtime);
      return;
    }
    synchronized (runtime) {
      log.info(
          "[Engine] Session {} restored from state {}, waiting for confirmation",
          session.getId(),
          session.getState());
      session.setState(ResearchState.PLANNING_WAIT);
      session.setPlanningStatus(PlanningStatus.AWAITING_CONFIRMATION);
      session.touch();
      runtime.emit(
          ResearchEvent.planningUpdated(
              session, "Session restored. Awaiting plan confirmation.", session.getPlan()));
    }
    persist(runtime);
  }

  /** Engine-side state of one session that is never persisted. */
  private static final class SessionRuntime {

    private final ResearchSession session;
    private final CancellationToken token = new CancellationToken();
    private final Sinks.Many<ResearchEvent> sink = Sinks.many().replay().all();
    private final Set<String> reusedQueries = new HashSet<>();

    /** Whether a task is driving the session; guarded by this. */
    private boolean running;

    /** Whether removal from memory is already scheduled; guarded by this. */
    private boolean releaseScheduled;

    private SessionRuntime(ResearchSession session) {
      this.session = session;
    }

    private synchronized void emit(ResearchEvent event) {
      Sinks.EmitResult result = sink.tryEmitNext(event);
      if (result.isFailure()) {
        log.warn(
            "[Engine] Event {} dropped for session {}: {}",
            event.getEventType(),
            session.getId(),
            result);
      }
    }
  }
}
