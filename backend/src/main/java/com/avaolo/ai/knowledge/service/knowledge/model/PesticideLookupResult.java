package com.avaolo.ai.knowledge.service.knowledge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Answer to a pre-harvest interval question, with the documents it was derived from. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PesticideLookupResult {

  private final boolean found;
  private final PhiInfo pesticideInfo;
  private final String message;
  private final List<KnowledgeDocument> documents;
}
