package com.avaolo.ai.knowledge.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("Should embed query text unchanged")
  void shouldEmbedQueryTextUnchanged() {
    when(embeddingModel.embed(anyString())).thenReturn(Response.from(embedding(0.1f, 0.2f, 0.3f)));

    List<Float> result = embeddingService.embedQuery("Koliko je karenca za Prosaro u pšenici?");

    assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
    verify(embeddingModel).embed("Koliko je karenca za Prosaro u pšenici?");
    verify(meterRegistry).counter("embedding.requests.success", "type", "query");
  }

  @Test
  @DisplayName("Should embed passage and count it")
  void shouldEmbedPassage() {
    when(embeddingModel.embed(anyString())).thenReturn(Response.from(embedding(0.4f, 0.5f)));

    List<Float> result = embeddingService.embedPassage("Prosaro: karenca 35 dana.");

    assertThat(result).containsExactly(0.4f, 0.5f);
    verify(meterRegistry).counter("embedding.requests.success", "type", "passage");
    verify(counter).increment();
  }

  @Test
  @DisplayName("Should truncate text longer than the embedding budget")
  void shouldTruncateVeryLongText() {
    String veryLong = "a".repeat(EmbeddingService.MAX_CHARS_PER_EMBEDDING + 500);
    when(embeddingModel.embed(anyString())).thenReturn(Response.from(embedding(0.1f)));

    embeddingService.embedPassage(veryLong);

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(EmbeddingService.MAX_CHARS_PER_EMBEDDING);
  }

  @Test
  @DisplayName("Should embed a batch in one call preserving order")
  @SuppressWarnings("unchecked")
  void shouldEmbedBatchInOneCall() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(embedding(0.1f, 0.2f), embedding(0.3f, 0.4f))));

    List<List<Float>> results = embeddingService.embedPassages(List.of("first", "second"));

    assertThat(results).hasSize(2);
    assertThat(results.get(0)).containsExactly(0.1f, 0.2f);
    assertThat(results.get(1)).containsExactly(0.3f, 0.4f);

    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(captor.capture());
    assertThat(captor.getValue()).extracting(TextSegment::text).containsExactly("first", "second");
  }

  @Test
  @DisplayName("Should not call the model for an empty batch")
  void shouldNotCallModelForEmptyBatch() {
    assertThat(embeddingService.embedPassages(List.of())).isEmpty();
    verify(embeddingModel, never()).embedAll(anyList());
  }

  private static Embedding embedding(float... vector) {
    return new Embedding(vector);
  }
}
