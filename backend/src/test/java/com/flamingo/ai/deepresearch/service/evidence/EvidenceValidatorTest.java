package com.flamingo.ai.deepresearch.service.evidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.deepresearch.agent.EvidenceValidationAgent;
import com.flamingo.ai.deepresearch.agent.dto.RelevanceVerdict;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.support.TestLlm;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EvidenceValidator Tests")
class EvidenceValidatorTest {

  private static final String QUESTION = "What is quantum computing?";

  @Mock private EvidenceValidationAgent agent;

  private ResearchConfig researchConfig;
  private SimpleMeterRegistry meterRegistry;
  private EvidenceValidator validator;

  @BeforeEach
  void setUp() {
    researchConfig = new ResearchConfig();
    meterRegistry = new SimpleMeterRegistry();
    validator =
        new EvidenceValidator(
            agent, TestLlm.executor(meterRegistry), researchConfig, meterRegistry);
  }

  @Test
  @DisplayName("Should hard-fail units without a citation")
  void shouldRejectMissingCitation() {
    // Given
    researchConfig.getValidation().setMode(ValidationMode.HEURISTIC);
    EvidenceUnit cited = unit("Quantum computing uses qubits [IBM](https://ibm.com/qc)");
    EvidenceUnit uncited = unit("Quantum computing uses qubits");

    // When
    ValidationReport report = validator.validate(QUESTION, List.of(cited, uncited));

    // Then
    assertThat(report.accepted()).containsExactly(cited);
    assertThat(report.notes()).containsExactly("Result 2 rejected: Missing citations (Hard Fail).");
  }

  @Test
  @DisplayName("Should reject units sharing no keyword with the question")
  void shouldRejectWithoutKeywordOverlap() {
    researchConfig.getValidation().setMode(ValidationMode.HEURISTIC);
    EvidenceUnit offTopic = unit("Banana bread recipe [Food](https://food.example)");

    ValidationReport report = validator.validate(QUESTION, List.of(offTopic));

    assertThat(report.accepted()).isEmpty();
    assertThat(report.notes())
        .containsExactly(
            "Result 1 rejected: No keyword overlap with the question.",
            "All summaries failed validation.");
  }

  @Test
  @DisplayName("Should accept fuzzy keyword matches")
  void shouldAcceptFuzzyMatch() {
    researchConfig.getValidation().setMode(ValidationMode.HEURISTIC);
    EvidenceUnit fuzzy = unit("Advances in quantam computers [News](https://news.example)");

    ValidationReport report = validator.validate(QUESTION, List.of(fuzzy));

    assertThat(report.accepted()).containsExactly(fuzzy);
    verifyNoInteractions(agent);
  }

  @Test
  @DisplayName("Should reject units the model judges irrelevant in hybrid mode")
  void shouldRejectIrrelevantInHybridMode() {
    // Given
    EvidenceUnit relevant = unit("Quantum computing explained [IBM](https://ibm.com/qc)");
    EvidenceUnit misleading = unit("Quantum computing stocks soar [Biz](https://biz.example)");
    when(agent.judge(eq(QUESTION), contains("explained")))
        .thenReturn(new RelevanceVerdict(true, "defines the topic"));
    when(agent.judge(eq(QUESTION), contains("stocks")))
        .thenReturn(new RelevanceVerdict(false, "about markets"));

    // When
    ValidationReport report = validator.validate(QUESTION, List.of(relevant, misleading));

    // Then
    assertThat(report.accepted()).containsExactly(relevant);
    assertThat(report.notes())
        .containsExactly("Result 2 rejected: Judged irrelevant (about markets).");
  }

  @Test
  @DisplayName("Should accept units when the relevance call fails")
  void shouldFailOpenOnLlmError() {
    researchConfig.getValidation().setMode(ValidationMode.LLM);
    EvidenceUnit unit = unit("Anything at all [Src](https://src.example)");
    when(agent.judge(eq(QUESTION), anyString())).thenThrow(new IllegalStateException("timeout"));

    ValidationReport report = validator.validate(QUESTION, List.of(unit));

    assertThat(report.accepted()).containsExactly(unit);
    assertThat(meterRegistry.counter("validation.llm.fail_open").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should skip the citation check when citations are optional")
  void shouldAllowUncitedWhenNotRequired() {
    researchConfig.getValidation().setMode(ValidationMode.HEURISTIC);
    researchConfig.getValidation().setRequireCitations(false);
    EvidenceUnit uncited = unit("Quantum computing uses qubits");

    assertThat(validator.validate(QUESTION, List.of(uncited)).accepted()).hasSize(1);
  }

  @Test
  @DisplayName("Should compute the LCS similarity ratio")
  void shouldComputeSimilarity() {
    assertThat(EvidenceValidator.similarity("quantum", "quantum")).isEqualTo(1.0);
    assertThat(EvidenceValidator.similarity("quantam", "quantum")).isGreaterThan(0.8);
    assertThat(EvidenceValidator.similarity("banana", "quantum")).isLessThan(0.5);
  }

  @Test
  @DisplayName("Should extract keywords without stopwords or short tokens")
  void shouldExtractKeywords() {
    assertThat(EvidenceValidator.keywords("What is quantum computing?", 4))
        .containsExactly("quantum", "computing");
  }

  private static EvidenceUnit unit(String snippet) {
    return new EvidenceUnit("https://src.example", "Source", snippet, 1.0, null, "q");
  }
}
