package com.avaolo.ai.knowledge.service.knowledge;

import com.avaolo.ai.knowledge.config.KnowledgeConfig;
import com.avaolo.ai.knowledge.domain.enums.DocumentType;
import com.avaolo.ai.knowledge.domain.enums.ProtectionType;
import com.avaolo.ai.knowledge.elasticsearch.KnowledgeEntry;
import com.avaolo.ai.knowledge.elasticsearch.KnowledgeIndexService;
import com.avaolo.ai.knowledge.service.embedding.EmbeddingService;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeDocument;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeFilter;
import com.avaolo.ai.knowledge.service.knowledge.model.PesticideLookupResult;
import com.avaolo.ai.knowledge.service.knowledge.model.PhiInfo;
import com.avaolo.ai.knowledge.service.knowledge.model.ProtectionRecommendation;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Vector search over the knowledge index, degrading to keyword search without embeddings. */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeSearchServiceImpl implements KnowledgeSearchService {

  private final KnowledgeIndexService knowledgeIndexService;
  private final EmbeddingService embeddingService;
  private final KnowledgeConfig knowledgeConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "knowledge.search", description = "Time to answer a knowledge search")
  public List<KnowledgeDocument> search(String query, KnowledgeFilter filter, Integer topK) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    int limit = resolveTopK(topK);
    Map<String, Object> criteria = (filter != null ? filter : KnowledgeFilter.none()).toCriteria();

    List<Float> embedding = embeddingService.embedQuery(query);
    List<KnowledgeEntry> entries;
    if (embedding.isEmpty()) {
      log.warn("Query embedding unavailable, using keyword search for: {}", query);
      meterRegistry.counter("knowledge.search.keyword_fallback").increment();
      entries = knowledgeIndexService.keywordSearch(criteria, query, limit);
    } else {
      entries = knowledgeIndexService.vectorSearch(criteria, embedding, limit);
    }

    List<KnowledgeDocument> documents =
        entries.stream()
            .sorted(
                Comparator.comparingDouble(
                        (KnowledgeEntry e) ->
                            e.getRelevanceScore() != null ? e.getRelevanceScore() : 0.0)
                    .reversed())
            .limit(limit)
            .map(this::toDocument)
            .toList();

    meterRegistry.counter("knowledge.search.requests").increment();
    log.info("Found {} documents for query: {}", documents.size(), query);
    return documents;
  }

  @Override
  public PesticideLookupResult searchPesticideInfo(String chemicalName, String crop) {
    if (chemicalName == null || chemicalName.isBlank()) {
      throw new IllegalArgumentException("Chemical name must not be blank");
    }
    boolean hasCrop = crop != null && !crop.isBlank();
    String query = hasCrop ? chemicalName + " " + crop : chemicalName;
    KnowledgeFilter filter =
        KnowledgeFilter.builder()
            .documentType(DocumentType.PESTICIDE.getValue())
            .chemical(chemicalName)
            .crop(hasCrop ? crop : null)
            .build();

    List<KnowledgeDocument> documents =
        search(query, filter, knowledgeConfig.getSearch().getPesticideTopK());

    for (KnowledgeDocument document : documents) {
      if (document.getPhiDays() != null) {
        String phiCrop = hasCrop ? crop : (document.getCrop() != null ? document.getCrop() : "");
        PhiInfo info =
            new PhiInfo(
                chemicalName,
                phiCrop,
                document.getPhiDays(),
                document.getSource(),
                document.getText());
        log.info(
            "PHI for {} on '{}': {} days (source {})",
            chemicalName,
            phiCrop,
            info.phiDays(),
            info.source());
        return PesticideLookupResult.builder()
            .found(true)
            .pesticideInfo(info)
            .documents(documents)
            .build();
      }
    }

    log.info("No PHI information found for {} (crop '{}')", chemicalName, crop);
    return PesticideLookupResult.builder()
        .found(false)
        .message("No PHI information found for " + chemicalName)
        .documents(documents)
        .build();
  }

  @Override
  public Map<String, List<ProtectionRecommendation>> searchCropProtection(
      String crop, String problem) {
    if (crop == null || crop.isBlank()) {
      throw new IllegalArgumentException("Crop must not be blank");
    }
    String query = crop + " protection";
    if (problem != null && !problem.isBlank()) {
      query += " " + problem;
    }
    KnowledgeFilter filter =
        KnowledgeFilter.builder()
            .documentType(DocumentType.CROP_PROTECTION.getValue())
            .crop(crop)
            .build();

    List<KnowledgeDocument> documents =
        search(query, filter, knowledgeConfig.getSearch().getCropProtectionTopK());

    Map<String, List<ProtectionRecommendation>> grouped = new LinkedHashMap<>();
    for (ProtectionType type : ProtectionType.values()) {
      grouped.put(type.getValue(), new ArrayList<>());
    }
    for (KnowledgeDocument document : documents) {
      Map<String, Object> metadata = document.getMetadata();
      ProtectionType type =
          ProtectionType.fromValue(
              (String) metadata.get(KnowledgeIndexService.FIELD_PROTECTION_TYPE));
      grouped
          .get(type.getValue())
          .add(
              new ProtectionRecommendation(
                  stringOrEmpty(metadata.get(KnowledgeIndexService.FIELD_CHEMICAL)),
                  stringOrEmpty(metadata.get(KnowledgeIndexService.FIELD_TARGET_PEST)),
                  stringOrEmpty(metadata.get(KnowledgeIndexService.FIELD_DOSAGE)),
                  stringOrEmpty(metadata.get(KnowledgeIndexService.FIELD_APPLICATION_TIMING)),
                  document.getText()));
    }
    return grouped;
  }

  private int resolveTopK(Integer topK) {
    KnowledgeConfig.Search search = knowledgeConfig.getSearch();
    if (topK == null) {
      return search.getDefaultTopK();
    }
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1");
    }
    return Math.min(topK, search.getMaxTopK());
  }

  private KnowledgeDocument toDocument(KnowledgeEntry entry) {
    KnowledgeConfig.Defaults defaults = knowledgeConfig.getDefaults();
    String source = entry.getSource() != null ? entry.getSource() : defaults.getUnknownSource();
    String documentType =
        entry.getDocumentType() != null
            ? entry.getDocumentType()
            : DocumentType.GENERAL.getValue();
    String language = entry.getLanguage() != null ? entry.getLanguage() : defaults.getLanguage();

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(KnowledgeIndexService.FIELD_SOURCE, source);
    metadata.put(KnowledgeIndexService.FIELD_DOCUMENT_TYPE, documentType);
    metadata.put(KnowledgeIndexService.FIELD_LANGUAGE, language);
    putIfPresent(metadata, KnowledgeIndexService.FIELD_COUNTRY_CODE, entry.getCountryCode());
    putIfPresent(metadata, KnowledgeIndexService.FIELD_CROP, entry.getCrop());
    putIfPresent(metadata, KnowledgeIndexService.FIELD_CHEMICAL, entry.getChemical());
    putIfPresent(metadata, KnowledgeIndexService.FIELD_PHI_DAYS, entry.getPhiDays());
    putIfPresent(metadata, KnowledgeIndexService.FIELD_PROTECTION_TYPE, entry.getProtectionType());
    putIfPresent(metadata, KnowledgeIndexService.FIELD_TARGET_PEST, entry.getTargetPest());
    putIfPresent(metadata, KnowledgeIndexService.FIELD_DOSAGE, entry.getDosage());
    putIfPresent(
        metadata, KnowledgeIndexService.FIELD_APPLICATION_TIMING, entry.getApplicationTiming());
    putIfPresent(metadata, KnowledgeIndexService.FIELD_CHUNK_INDEX, entry.getChunkIndex());
    putIfPresent(metadata, KnowledgeIndexService.FIELD_INDEXED_AT, entry.getIndexedAt());

    return KnowledgeDocument.builder()
        .id(entry.getId())
        .score(entry.getRelevanceScore() != null ? entry.getRelevanceScore() : 0.0)
        .text(entry.getText())
        .source(source)
        .documentType(documentType)
        .language(language)
        .crop(entry.getCrop())
        .chemical(entry.getChemical())
        .phiDays(entry.getPhiDays())
        .metadata(metadata)
        .build();
  }

  private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
    if (value != null) {
      metadata.put(key, value);
    }
  }

  private static String stringOrEmpty(Object value) {
    return value != null ? value.toString() : "";
  }
}
