package com.avaolo.ai.knowledge.service.knowledge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** A knowledge search hit with its metadata. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KnowledgeDocument {

  private final String id;
  private final double score;
  private final String text;
  private final String source;
  private final String documentType;
  private final String language;
  private final String crop;
  private final String chemical;
  private final Integer phiDays;

  /** Every stored metadata field of the hit. */
  private final Map<String, Object> metadata;
}
