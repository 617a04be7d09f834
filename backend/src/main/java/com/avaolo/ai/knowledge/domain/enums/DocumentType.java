package com.avaolo.ai.knowledge.domain.enums;

/**
 * Well-known knowledge document types.
 *
 * <p>The index stores the type as a free-form keyword, so documents may carry types not listed
 * here; these are the ones the service itself filters on or defaults to.
 */
public enum DocumentType {
  PESTICIDE("pesticide"),
  CROP_PROTECTION("crop_protection"),
  SEED("seed"),
  FERTILIZER("fertilizer"),
  MACHINERY("machinery"),
  BEST_PRACTICE("best_practice"),
  GENERAL("general");

  private final String value;

  DocumentType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
