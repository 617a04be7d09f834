package com.avaolo.ai.knowledge.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for indexing a batch of FIS documents. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkIndexRequest {

  @NotEmpty(message = "At least one document is required")
  @Size(max = 500, message = "At most 500 documents per batch")
  @Valid
  private List<IndexDocumentRequest> documents;
}
