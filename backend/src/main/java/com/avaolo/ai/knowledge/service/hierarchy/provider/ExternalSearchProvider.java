package com.avaolo.ai.knowledge.service.hierarchy.provider;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.domain.enums.SourceType;
import com.avaolo.ai.knowledge.service.hierarchy.InformationHierarchyManagerImpl;
import com.avaolo.ai.knowledge.service.hierarchy.InformationProvider;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Global-tier answers from web search. */
@Component
@ConditionalOnProperty(name = "knowledge.external-search.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ExternalSearchProvider implements InformationProvider {

  private final ExternalSearchClient externalSearchClient;

  @Override
  public String sourceId() {
    return InformationHierarchyManagerImpl.EXTERNAL_SEARCH;
  }

  @Override
  public Set<InformationRelevance> supportedLevels() {
    return Set.of(InformationRelevance.GLOBAL);
  }

  @Override
  @CircuitBreaker(name = "externalSearch", fallbackMethod = "fetchFallback")
  public List<InformationItem> fetch(InformationQuery query, InformationRelevance level) {
    String answer = externalSearchClient.search(query.getQueryText());
    if (answer.isBlank()) {
      return List.of();
    }
    return List.of(
        InformationItem.builder()
            .content(answer)
            .relevance(InformationRelevance.GLOBAL)
            .sourceType(SourceType.EXTERNAL.getValue())
            .sourceId(sourceId())
            .build());
  }

  @SuppressWarnings("unused")
  private List<InformationItem> fetchFallback(
      InformationQuery query, InformationRelevance level, Throwable t) {
    log.warn("External search unavailable: {}", t.getMessage());
    return List.of();
  }
}
