package com.avaolo.ai.knowledge.service.knowledge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Metadata supplied with a document to index. Missing values receive configured defaults. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeMetadata {

  private String source;
  private String documentType;
  private String language;
  private String countryCode;
  private String crop;
  private String chemical;
  private Integer phiDays;
  private String protectionType;
  private String targetPest;
  private String dosage;
  private String applicationTiming;
}
