package com.avaolo.ai.knowledge.service.hierarchy.model;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Items found for a query, one list per relevance tier. */
@Getter
@Builder
public class InformationResult {

  private final InformationQuery query;
  @Builder.Default private final List<InformationItem> farmerItems = List.of();
  @Builder.Default private final List<InformationItem> countryItems = List.of();
  @Builder.Default private final List<InformationItem> globalItems = List.of();
  @Builder.Default private final Map<String, Object> metadata = Map.of();

  /** All items, farmer-specific first and global last. */
  public List<InformationItem> getAllItemsByPriority() {
    List<InformationItem> all = new ArrayList<>(farmerItems);
    all.addAll(countryItems);
    all.addAll(globalItems);
    return all;
  }

  public List<InformationItem> getItems(InformationRelevance relevance) {
    return switch (relevance) {
      case FARMER_SPECIFIC -> farmerItems;
      case COUNTRY_SPECIFIC -> countryItems;
      case GLOBAL -> globalItems;
    };
  }
}
