package com.avaolo.ai.knowledge.service.hierarchy.provider;

import com.avaolo.ai.knowledge.config.KnowledgeConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the Perplexity chat-completions endpoint used as global web search. Only the
 * bare question is sent; no farmer or location data leaves the service.
 */
@Component
@ConditionalOnProperty(name = "knowledge.external-search.enabled", havingValue = "true")
@Slf4j
public class ExternalSearchClient {

  private static final String SYSTEM_PROMPT =
      "You are an agricultural expert. Answer concisely with practical, globally valid guidance.";

  private final WebClient webClient;
  private final String model;
  private final int maxTokens;
  private final int readTimeoutMs;

  public ExternalSearchClient(KnowledgeConfig knowledgeConfig) {
    KnowledgeConfig.ExternalSearch config = knowledgeConfig.getExternalSearch();
    if (config.getApiKey() == null || config.getApiKey().isBlank()) {
      throw new IllegalStateException(
          "External search is enabled but no API key is set. Set PERPLEXITY_API_KEY.");
    }
    this.model = config.getModel();
    this.maxTokens = config.getMaxTokens();
    this.readTimeoutMs = config.getReadTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(config.getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
            .build();
    log.info(
        "External search client initialized: baseUrl={}, model={}", config.getBaseUrl(), model);
  }

  /**
   * Asks the web search model a question.
   *
   * @param question the question text
   * @return the answer, or an empty string when the model returned none
   */
  public String search(String question) {
    var request =
        new ChatCompletionRequest(
            model,
            List.of(new Message("system", SYSTEM_PROMPT), new Message("user", question)),
            maxTokens);
    ChatCompletionResponse response =
        webClient
            .post()
            .uri("/chat/completions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(ChatCompletionResponse.class)
            .timeout(Duration.ofMillis(readTimeoutMs))
            .block();
    if (response == null || response.choices() == null || response.choices().isEmpty()) {
      return "";
    }
    Message message = response.choices().get(0).message();
    return message != null && message.content() != null ? message.content() : "";
  }

  record ChatCompletionRequest(
      String model, List<Message> messages, @JsonProperty("max_tokens") int maxTokens) {}

  record Message(String role, String content) {}

  record Choice(Message message) {}

  record ChatCompletionResponse(List<Choice> choices) {}
}
