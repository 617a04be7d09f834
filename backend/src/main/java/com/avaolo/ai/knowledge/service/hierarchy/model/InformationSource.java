package com.avaolo.ai.knowledge.service.hierarchy.model;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.domain.enums.SourceType;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** A registered information source and the relevance tiers it is allowed to supply. */
@Getter
@Builder
public class InformationSource {

  private final String sourceId;
  private final SourceType sourceType;
  private final String sourceName;
  @Builder.Default private final boolean canAccessFarmerData = false;
  @Builder.Default private final boolean canAccessCountryData = true;
  @Builder.Default private final boolean canAccessGlobalData = true;
  @Builder.Default private final Map<String, Object> metadata = Map.of();

  /** Whether this source may supply items of the given tier. */
  public boolean mayProvide(InformationRelevance relevance) {
    return switch (relevance) {
      case FARMER_SPECIFIC -> canAccessFarmerData;
      case COUNTRY_SPECIFIC -> canAccessCountryData;
      case GLOBAL -> canAccessGlobalData;
    };
  }
}
