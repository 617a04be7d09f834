package com.avaolo.ai.knowledge.domain.enums;

import java.util.Locale;

/** Groups used when presenting crop protection recommendations, in display order. */
public enum ProtectionType {
  FUNGICIDES("fungicides"),
  INSECTICIDES("insecticides"),
  HERBICIDES("herbicides"),
  GENERAL("general");

  private final String value;

  ProtectionType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Resolves a stored protection type. Singular forms ("fungicide") are accepted; missing or
   * unrecognised values map to {@link #GENERAL}.
   *
   * @param raw the stored value, may be null
   * @return the matching group
   */
  public static ProtectionType fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      return GENERAL;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (ProtectionType type : values()) {
      if (type.value.equals(normalized) || type.value.equals(normalized + "s")) {
        return type;
      }
    }
    return GENERAL;
  }
}
