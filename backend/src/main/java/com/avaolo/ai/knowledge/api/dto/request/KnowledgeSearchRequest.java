package com.avaolo.ai.knowledge.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a knowledge search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeSearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  /** Optional metadata filters: document_type, crop, chemical, language, country_code. */
  private Map<String, Object> filters;

  /** Requested hit count; values above the configured maximum are clamped. */
  @Min(value = 1, message = "topK must be at least 1")
  private Integer topK;
}
