package com.avaolo.ai.knowledge.api.dto.response;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationResult;
import com.avaolo.ai.knowledge.service.hierarchy.model.LocalizationContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized information hierarchy result.
 *
 * @param query the query text
 * @param farmerId the asking farmer, may be null
 * @param countryCode the farmer's country, may be null
 * @param items item lists keyed by {@code farmer_specific}, {@code country_specific}, {@code
 *     global}
 * @param metadata query metadata
 */
public record InformationResultResponse(
    String query,
    @JsonProperty("farmer_id") Long farmerId,
    @JsonProperty("country_code") String countryCode,
    Map<String, List<Item>> items,
    Map<String, Object> metadata) {

  /**
   * One item.
   *
   * @param content the information
   * @param source the kind of source it came from
   */
  public record Item(String content, String source) {}

  public static InformationResultResponse fromResult(InformationResult result) {
    LocalizationContext context = result.getQuery().getContext();
    Map<String, List<Item>> items = new LinkedHashMap<>();
    for (InformationRelevance relevance : InformationRelevance.values()) {
      items.put(
          relevance.getLevelName(),
          result.getItems(relevance).stream().map(InformationResultResponse::toItem).toList());
    }
    return new InformationResultResponse(
        result.getQuery().getQueryText(),
        context != null ? context.getFarmerId() : null,
        context != null ? context.getCountryCode() : null,
        items,
        result.getMetadata());
  }

  private static Item toItem(InformationItem item) {
    return new Item(item.getContent(), item.getSourceType());
  }
}
