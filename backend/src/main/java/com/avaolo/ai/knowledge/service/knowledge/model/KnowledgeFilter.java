package com.avaolo.ai.knowledge.service.knowledge.model;

import com.avaolo.ai.knowledge.elasticsearch.KnowledgeIndexService;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;

/**
 * Metadata restrictions applied to a knowledge search. Null fields do not restrict; document type,
 * crop and chemical are matched lower-cased, country codes upper-cased.
 *
 * @param documentType document type, e.g. {@code pesticide}
 * @param crop crop name
 * @param chemical active substance or product name
 * @param language ISO language code of the text
 * @param countryCode ISO country code
 * @param globalOnly only match entries that are not tied to a country
 */
@Builder
public record KnowledgeFilter(
    String documentType,
    String crop,
    String chemical,
    String language,
    String countryCode,
    boolean globalOnly) {

  public KnowledgeFilter {
    documentType = lower(documentType);
    crop = lower(crop);
    chemical = lower(chemical);
    language = blankToNull(language);
    countryCode = upper(countryCode);
  }

  public static KnowledgeFilter none() {
    return KnowledgeFilter.builder().build();
  }

  /**
   * Reads a loosely typed filter map. Both {@code document_type} and {@code documentType} styles
   * are accepted; other keys are ignored.
   *
   * @param filters the filter map, may be null
   * @return the filter
   */
  public static KnowledgeFilter fromMap(Map<String, ?> filters) {
    if (filters == null || filters.isEmpty()) {
      return none();
    }
    return KnowledgeFilter.builder()
        .documentType(value(filters, "document_type", "documentType"))
        .crop(value(filters, "crop", "crop"))
        .chemical(value(filters, "chemical", "chemical"))
        .language(value(filters, "language", "language"))
        .countryCode(value(filters, "country_code", "countryCode"))
        .globalOnly(Boolean.parseBoolean(value(filters, "global_only", "globalOnly")))
        .build();
  }

  /** Criteria map understood by {@link KnowledgeIndexService}. */
  public Map<String, Object> toCriteria() {
    Map<String, Object> criteria = new LinkedHashMap<>();
    putIfPresent(criteria, KnowledgeIndexService.FIELD_DOCUMENT_TYPE, documentType);
    putIfPresent(criteria, KnowledgeIndexService.FIELD_CROP, crop);
    putIfPresent(criteria, KnowledgeIndexService.FIELD_CHEMICAL, chemical);
    putIfPresent(criteria, KnowledgeIndexService.FIELD_LANGUAGE, language);
    putIfPresent(criteria, KnowledgeIndexService.FIELD_COUNTRY_CODE, countryCode);
    if (globalOnly) {
      criteria.put(KnowledgeIndexService.GLOBAL_ONLY, Boolean.TRUE);
    }
    return criteria;
  }

  private static void putIfPresent(Map<String, Object> criteria, String key, String value) {
    if (value != null) {
      criteria.put(key, value);
    }
  }

  private static String value(Map<String, ?> filters, String snakeKey, String camelKey) {
    Object value = filters.get(snakeKey);
    if (value == null) {
      value = filters.get(camelKey);
    }
    return value != null ? value.toString() : null;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static String lower(String value) {
    String trimmed = blankToNull(value);
    return trimmed != null ? trimmed.toLowerCase(Locale.ROOT) : null;
  }

  private static String upper(String value) {
    String trimmed = blankToNull(value);
    return trimmed != null ? trimmed.toUpperCase(Locale.ROOT) : null;
  }
}
