package com.avaolo.ai.knowledge.service.hierarchy.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Who is asking and from where: derived from the farmer's WhatsApp number and profile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocalizationContext {

  private String whatsappNumber;
  private String countryCode;
  private String countryName;
  @Builder.Default private List<String> languages = List.of();
  private Long farmerId;
  private String preferredLanguage;
  private String timezone;
  @Builder.Default private List<String> agriculturalZones = List.of();
}
