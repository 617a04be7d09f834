package com.avaolo.ai.knowledge.service.hierarchy.model;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** A question asked on behalf of a farmer, and which tiers should answer it. */
@Getter
@Builder
public class InformationQuery {

  private final String queryText;
  private final LocalizationContext context;

  @Builder.Default
  private final List<InformationRelevance> requiredRelevanceLevels =
      List.of(
          InformationRelevance.FARMER_SPECIFIC,
          InformationRelevance.COUNTRY_SPECIFIC,
          InformationRelevance.GLOBAL);

  @Builder.Default private final int maxItemsPerLevel = 5;
  @Builder.Default private final boolean includeMetadata = true;
}
