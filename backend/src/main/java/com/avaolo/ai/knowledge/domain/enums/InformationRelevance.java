package com.avaolo.ai.knowledge.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/** Relevance tiers of the information hierarchy. Lower priority number wins. */
public enum InformationRelevance {
  /** Data about one farmer: fields, crops, history. */
  FARMER_SPECIFIC("FARMER", 1, "farmer_specific"),

  /** Regulations, varieties and practices of one country. */
  COUNTRY_SPECIFIC("COUNTRY", 2, "country_specific"),

  /** Knowledge valid everywhere. */
  GLOBAL("GLOBAL", 3, "global");

  private final String value;
  private final int priority;
  private final String levelName;

  InformationRelevance(String value, int priority, String levelName) {
    this.value = value;
    this.priority = priority;
    this.levelName = levelName;
  }

  public String getValue() {
    return value;
  }

  public int getPriority() {
    return priority;
  }

  /** Name of the level in serialized results and the {@code sources_used} metadata. */
  public String getLevelName() {
    return levelName;
  }

  /**
   * Resolves a tier from its constant name, its short value or its level name, ignoring case.
   *
   * @param value e.g. {@code FARMER_SPECIFIC}, {@code FARMER} or {@code farmer_specific}
   * @return the tier
   * @throws IllegalArgumentException if no tier matches
   */
  @JsonCreator
  public static InformationRelevance fromValue(String value) {
    if (value != null) {
      String trimmed = value.trim();
      for (InformationRelevance relevance : values()) {
        if (relevance.name().equalsIgnoreCase(trimmed)
            || relevance.value.equalsIgnoreCase(trimmed)
            || relevance.levelName.equalsIgnoreCase(trimmed)) {
          return relevance;
        }
      }
    }
    throw new IllegalArgumentException("Unknown information relevance: " + value);
  }
}
