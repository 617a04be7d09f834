package com.avaolo.ai.knowledge.service.hierarchy.provider;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.domain.enums.SourceType;
import com.avaolo.ai.knowledge.service.hierarchy.InformationHierarchyManagerImpl;
import com.avaolo.ai.knowledge.service.hierarchy.InformationProvider;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import com.avaolo.ai.knowledge.service.hierarchy.model.LocalizationContext;
import com.avaolo.ai.knowledge.service.knowledge.KnowledgeSearchService;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeDocument;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeFilter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Answers country and global tiers from the knowledge base. The country tier only sees documents
 * tagged with the caller's country; the global tier only sees documents without a country.
 */
@Component
@RequiredArgsConstructor
public class KnowledgeBaseProvider implements InformationProvider {

  private final KnowledgeSearchService knowledgeSearchService;

  @Override
  public String sourceId() {
    return InformationHierarchyManagerImpl.RAG_KNOWLEDGE;
  }

  @Override
  public Set<InformationRelevance> supportedLevels() {
    return Set.of(InformationRelevance.COUNTRY_SPECIFIC, InformationRelevance.GLOBAL);
  }

  @Override
  public List<InformationItem> fetch(InformationQuery query, InformationRelevance level) {
    LocalizationContext context =
        query.getContext() != null ? query.getContext() : new LocalizationContext();
    KnowledgeFilter filter =
        level == InformationRelevance.COUNTRY_SPECIFIC
            ? KnowledgeFilter.builder().countryCode(context.getCountryCode()).build()
            : KnowledgeFilter.builder().globalOnly(true).build();
    if (level == InformationRelevance.COUNTRY_SPECIFIC && filter.countryCode() == null) {
      return List.of();
    }

    List<KnowledgeDocument> documents =
        knowledgeSearchService.search(query.getQueryText(), filter, query.getMaxItemsPerLevel());
    return documents.stream().map(document -> toItem(document, level)).toList();
  }

  private InformationItem toItem(KnowledgeDocument document, InformationRelevance level) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("documentId", document.getId());
    metadata.put("score", document.getScore());
    metadata.put("source", document.getSource());
    metadata.put("documentType", document.getDocumentType());
    Object countryCode =
        document.getMetadata() != null ? document.getMetadata().get("countryCode") : null;
    return InformationItem.builder()
        .content(document.getText())
        .relevance(level)
        .countryCode(countryCode != null ? countryCode.toString() : null)
        .language(document.getLanguage())
        .sourceType(SourceType.RAG.getValue())
        .sourceId(sourceId())
        .metadata(metadata)
        .build();
  }
}
