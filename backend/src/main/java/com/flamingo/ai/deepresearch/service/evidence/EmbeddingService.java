package com.flamingo.ai.deepresearch.service.evidence;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds queries and evidence text. An empty result means the embedding provider is unavailable;
 * callers treat that as "no reuse" or a degraded index write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below at one char per token
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  @Retry(name = "openai")
  public List<Float> embed(String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text));
      meterRegistry.counter("embedding.requests.success").increment();
      return toList(response.content().vector());
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  @CircuitBreaker(name = "openai", fallbackMethod = "embedAllFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments =
          texts.stream().map(this::truncate).map(TextSegment::from).toList();
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<List<Float>> results = new ArrayList<>(texts.size());
      for (Embedding embedding : response.content()) {
        results.add(toList(embedding.vector()));
      }
      meterRegistry.counter("embedding.requests.success").increment();
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker fallback: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedAllFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
