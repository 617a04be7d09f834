package com.avaolo.ai.knowledge.service.knowledge;

import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeDocument;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeFilter;
import com.avaolo.ai.knowledge.service.knowledge.model.PesticideLookupResult;
import com.avaolo.ai.knowledge.service.knowledge.model.ProtectionRecommendation;
import java.util.List;
import java.util.Map;

/** Semantic search over the agricultural knowledge base. */
public interface KnowledgeSearchService {

  /**
   * Finds the documents most similar to the query that match the filter.
   *
   * @param query free-text question
   * @param filter metadata restrictions, may be null
   * @param topK maximum number of documents, null for the configured default
   * @return documents ordered by score, best first
   */
  List<KnowledgeDocument> search(String query, KnowledgeFilter filter, Integer topK);

  /**
   * Looks up the pre-harvest interval of a chemical, optionally on a specific crop.
   *
   * @param chemicalName product or active substance
   * @param crop crop name, may be null
   * @return the interval when a matching document states one, plus the documents searched
   */
  PesticideLookupResult searchPesticideInfo(String chemicalName, String crop);

  /**
   * Collects protection recommendations for a crop, grouped into fungicides, insecticides,
   * herbicides and general measures.
   *
   * @param crop crop name
   * @param problem pest, disease or symptom, may be null
   * @return recommendations keyed by group, every group present
   */
  Map<String, List<ProtectionRecommendation>> searchCropProtection(String crop, String problem);
}
