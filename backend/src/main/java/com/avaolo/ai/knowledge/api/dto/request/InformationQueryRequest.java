package com.avaolo.ai.knowledge.api.dto.request;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for an information hierarchy query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InformationQueryRequest {

  @NotBlank(message = "Query text is required")
  @Size(max = 2000, message = "Query text must not exceed 2000 characters")
  private String queryText;

  @NotNull(message = "Context is required")
  @Valid
  private Context context;

  /** Tiers to query; all three when omitted. */
  private List<InformationRelevance> requiredRelevanceLevels;

  @Min(value = 1, message = "maxItemsPerLevel must be at least 1")
  @Max(value = 20, message = "maxItemsPerLevel must be at most 20")
  private Integer maxItemsPerLevel;

  private Boolean includeMetadata;

  /** Localization of the asking farmer. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Context {

    @NotBlank(message = "WhatsApp number is required")
    private String whatsappNumber;

    private String countryCode;
    private String countryName;
    private List<String> languages;
    private Long farmerId;
    private String preferredLanguage;
    private String timezone;
    private List<String> agriculturalZones;
  }
}
