package com.avaolo.ai.knowledge.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of information sources known to the hierarchy. */
public enum SourceType {
  DATABASE("database"),
  RAG("rag"),
  EXTERNAL("external"),
  CACHE("cache");

  private final String value;

  SourceType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
