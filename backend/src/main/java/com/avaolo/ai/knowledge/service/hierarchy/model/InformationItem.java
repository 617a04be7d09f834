package com.avaolo.ai.knowledge.service.hierarchy.model;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** A single piece of information returned by a source, tagged with its relevance tier. */
@Getter
@Builder
public class InformationItem {

  private final String content;
  private final InformationRelevance relevance;
  private final Long farmerId;
  private final String countryCode;
  private final String language;
  @Builder.Default private final String sourceType = "unknown";
  private final String sourceId;
  @Builder.Default private final Map<String, Object> metadata = Map.of();
}
