package com.avaolo.ai.knowledge.api.rest;

import com.avaolo.ai.knowledge.api.dto.request.InformationQueryRequest;
import com.avaolo.ai.knowledge.api.dto.response.InformationResultResponse;
import com.avaolo.ai.knowledge.config.KnowledgeConfig;
import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.service.hierarchy.InformationHierarchyManager;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationResult;
import com.avaolo.ai.knowledge.service.hierarchy.model.LocalizationContext;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the information hierarchy. */
@RestController
@RequestMapping("/api/information")
@RequiredArgsConstructor
public class InformationController {

  private final InformationHierarchyManager informationHierarchyManager;
  private final KnowledgeConfig knowledgeConfig;

  /** Queries farmer, country and global tiers for a question. */
  @PostMapping("/query")
  public ResponseEntity<InformationResultResponse> query(
      @Valid @RequestBody InformationQueryRequest request) {
    InformationResult result = informationHierarchyManager.queryInformation(toQuery(request));
    return ResponseEntity.ok(InformationResultResponse.fromResult(result));
  }

  /** Lists registered sources and which tiers each may supply. */
  @GetMapping("/sources")
  public ResponseEntity<Map<String, Map<String, Object>>> sources() {
    return ResponseEntity.ok(informationHierarchyManager.getSourceCapabilities());
  }

  private InformationQuery toQuery(InformationQueryRequest request) {
    InformationQueryRequest.Context ctx = request.getContext();
    LocalizationContext context =
        LocalizationContext.builder()
            .whatsappNumber(ctx.getWhatsappNumber())
            .countryCode(ctx.getCountryCode())
            .countryName(ctx.getCountryName())
            .languages(ctx.getLanguages() != null ? ctx.getLanguages() : List.of())
            .farmerId(ctx.getFarmerId())
            .preferredLanguage(ctx.getPreferredLanguage())
            .timezone(ctx.getTimezone())
            .agriculturalZones(
                ctx.getAgriculturalZones() != null ? ctx.getAgriculturalZones() : List.of())
            .build();

    InformationQuery.InformationQueryBuilder builder =
        InformationQuery.builder()
            .queryText(request.getQueryText())
            .context(context)
            .maxItemsPerLevel(
                request.getMaxItemsPerLevel() != null
                    ? request.getMaxItemsPerLevel()
                    : knowledgeConfig.getHierarchy().getMaxItemsPerLevel());
    List<InformationRelevance> levels =
        request.getRequiredRelevanceLevels() != null
            ? request.getRequiredRelevanceLevels().stream().filter(Objects::nonNull).toList()
            : List.of();
    if (!levels.isEmpty()) {
      builder.requiredRelevanceLevels(levels);
    }
    if (request.getIncludeMetadata() != null) {
      builder.includeMetadata(request.getIncludeMetadata());
    }
    return builder.build();
  }
}
