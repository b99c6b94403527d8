package com.flamingo.ai.deepresearch.service.evidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.IndexWriteException;
import com.flamingo.ai.deepresearch.index.ChunkFilter;
import com.flamingo.ai.deepresearch.index.ChunkIdGenerator;
import com.flamingo.ai.deepresearch.index.EvidenceBackend;
import com.flamingo.ai.deepresearch.index.EvidenceChunk;
import com.flamingo.ai.deepresearch.index.EvidenceIndex;
import com.flamingo.ai.deepresearch.index.InMemoryVectorBackend;
import com.flamingo.ai.deepresearch.index.IngestResult;
import com.flamingo.ai.deepresearch.index.RetrievedChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EvidenceRecorder Tests")
class EvidenceRecorderTest {

  @Mock private EmbeddingService embeddingService;
  @Mock private EvidenceBackend durableBackend;

  private EvidenceIndex evidenceIndex;
  private EvidenceRecorder recorder;

  @BeforeEach
  void setUp() {
    ResearchConfig config = new ResearchConfig();
    evidenceIndex =
        new EvidenceIndex(
            new InMemoryVectorBackend(),
            durableBackend,
            new ChunkIdGenerator("rec"),
            config,
            new SimpleMeterRegistry());
    recorder = new EvidenceRecorder(embeddingService, evidenceIndex, config);
  }

  @Test
  @DisplayName("Should ingest one chunk per short unit with its source metadata")
  void shouldRecordUnits() {
    // Given
    EvidenceUnit unit =
        new EvidenceUnit(
            "https://ibm.com/qc", "IBM", "Qubits [IBM](https://ibm.com/qc)", 1.0, null, "q");
    when(embeddingService.embedAll(anyList())).thenReturn(List.of(List.of(1f, 0f)));

    // When
    IngestResult result = recorder.record("plan-1", List.of(unit));

    // Then
    assertThat(result.chunkIds()).containsExactly("plan-1_rec_1");
    List<RetrievedChunk> stored = evidenceIndex.query(List.of(1f, 0f), 1, ChunkFilter.none());
    assertThat(stored).hasSize(1);
    EvidenceChunk chunk = stored.get(0).chunk();
    assertThat(chunk.subgoalId()).isEqualTo("plan-1");
    assertThat(chunk.sourceUrl()).isEqualTo("https://ibm.com/qc");
    assertThat(chunk.sourceMetadata()).containsEntry(EvidenceChunk.TITLE, "IBM");
  }

  @Test
  @DisplayName("Should fail when the embedding provider returned nothing")
  void shouldFailWithoutEmbeddings() {
    EvidenceUnit unit =
        new EvidenceUnit("https://a.example", "A", "text [A](https://a.example)", 1.0, null, "q");
    when(embeddingService.embedAll(anyList())).thenReturn(List.of());

    assertThatThrownBy(() -> recorder.record("plan-1", List.of(unit)))
        .isInstanceOfSatisfying(
            IndexWriteException.class, e -> assertThat(e.getBackend()).isEqualTo("embedding"));
    assertThat(evidenceIndex.stats().activeCount()).isZero();
  }

  @Test
  @DisplayName("Should do nothing for units without text")
  void shouldSkipEmptyUnits() {
    EvidenceUnit blank = new EvidenceUnit("https://a.example", "A", " ", 1.0, null, "q");

    assertThat(recorder.record("plan-1", List.of(blank)).chunkIds()).isEmpty();
  }
}
