package com.avaolo.ai.knowledge.service.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings with the configured OpenAI embedding model.
 *
 * <p>An empty vector means the model is unavailable (circuit breaker open or retries exhausted);
 * callers decide whether to degrade or fail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // ada-002 accepts 8191 tokens; Croatian and Slovenian text runs near 3 chars per token
  static final int MAX_CHARS_PER_EMBEDDING = 20000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector, empty when the model is unavailable
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(truncate(query, "Query"));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds a knowledge passage before indexing.
   *
   * @param passage the passage text
   * @return embedding vector, empty when the model is unavailable
   */
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextFallback")
  @Retry(name = "openai")
  public List<Float> embedPassage(String passage) {
    Response<Embedding> response = embeddingModel.embed(truncate(passage, "Passage"));
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds several passages in one model call, preserving order.
   *
   * @param passages the passages to embed
   * @return one vector per passage, or an empty list when the model is unavailable
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextsFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedPassages(List<String> passages) {
    if (passages.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(passages.size());
    for (String passage : passages) {
      segments.add(TextSegment.from(truncate(passage, "Passage")));
    }
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<List<Float>> results = new ArrayList<>(passages.size());
    for (Embedding embedding : response.content()) {
      results.add(toFloatList(embedding.vector()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    return results;
  }

  private String truncate(String text, String kind) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "{} too long for embedding, truncating from {} chars to {} chars",
        kind,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedTextFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker open or retries exhausted: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedTextsFallback(List<String> passages, Throwable t) {
    log.error("Batch embedding of {} passages failed: {}", passages.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
