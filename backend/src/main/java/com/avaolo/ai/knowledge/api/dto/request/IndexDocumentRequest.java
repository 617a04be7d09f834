package com.avaolo.ai.knowledge.api.dto.request;

import com.avaolo.ai.knowledge.service.knowledge.model.IndexableDocument;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeMetadata;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for adding one document to the knowledge base. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexDocumentRequest {

  @NotBlank(message = "Text is required")
  @Size(max = 100000, message = "Text must not exceed 100000 characters")
  private String text;

  private String source;
  private String documentType;
  private String language;

  @Size(min = 2, max = 2, message = "Country code must have 2 letters")
  private String countryCode;

  private String crop;
  private String chemical;

  @Min(value = 0, message = "phiDays must not be negative")
  private Integer phiDays;

  private String protectionType;
  private String targetPest;
  private String dosage;
  private String applicationTiming;

  public IndexableDocument toIndexableDocument() {
    return new IndexableDocument(
        text,
        KnowledgeMetadata.builder()
            .source(source)
            .documentType(documentType)
            .language(language)
            .countryCode(countryCode)
            .crop(crop)
            .chemical(chemical)
            .phiDays(phiDays)
            .protectionType(protectionType)
            .targetPest(targetPest)
            .dosage(dosage)
            .applicationTiming(applicationTiming)
            .build());
  }
}
