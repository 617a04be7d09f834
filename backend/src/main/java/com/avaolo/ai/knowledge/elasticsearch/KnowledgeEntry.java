package com.avaolo.ai.knowledge.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A piece of agricultural knowledge stored in the vector index together with its metadata.
 *
 * <p>{@code crop} and {@code chemical} are stored lower-cased. A missing {@code countryCode} marks
 * the entry as globally applicable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeEntry implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String text;
  private String source;
  private String documentType;
  private String language;
  private String countryCode;
  private String crop;
  private String chemical;

  /** Pre-harvest interval (karenca) in days. */
  private Integer phiDays;

  private String protectionType;
  private String targetPest;
  private String dosage;
  private String applicationTiming;

  /** Position of the chunk within an uploaded file; null for single documents. */
  private Integer chunkIndex;

  /** ISO-8601 instant of indexing. */
  private String indexedAt;

  private List<Float> embedding;

  @Builder.Default private Double relevanceScore = 0.0;
}
