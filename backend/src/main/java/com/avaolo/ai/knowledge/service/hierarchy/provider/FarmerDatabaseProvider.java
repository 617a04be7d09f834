package com.avaolo.ai.knowledge.service.hierarchy.provider;

import com.avaolo.ai.knowledge.domain.entity.FarmField;
import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.domain.enums.SourceType;
import com.avaolo.ai.knowledge.domain.repository.FarmFieldRepository;
import com.avaolo.ai.knowledge.service.hierarchy.InformationHierarchyManagerImpl;
import com.avaolo.ai.knowledge.service.hierarchy.InformationProvider;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import com.avaolo.ai.knowledge.service.hierarchy.model.LocalizationContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Describes the asking farmer's fields and crops from the farmer database. */
@Component
@RequiredArgsConstructor
@Slf4j
public class FarmerDatabaseProvider implements InformationProvider {

  private final FarmFieldRepository farmFieldRepository;

  @Override
  public String sourceId() {
    return InformationHierarchyManagerImpl.FARMER_DB;
  }

  @Override
  public Set<InformationRelevance> supportedLevels() {
    return Set.of(InformationRelevance.FARMER_SPECIFIC);
  }

  @Override
  @Transactional(readOnly = true)
  public List<InformationItem> fetch(InformationQuery query, InformationRelevance level) {
    LocalizationContext context = query.getContext();
    if (context == null || context.getFarmerId() == null) {
      return List.of();
    }
    List<FarmField> fields =
        farmFieldRepository.findByFarmerIdOrderByFieldNameAsc(context.getFarmerId());
    log.debug("Found {} fields for farmer {}", fields.size(), context.getFarmerId());
    return fields.stream().map(field -> toItem(field, context)).toList();
  }

  private InformationItem toItem(FarmField field, LocalizationContext context) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("fieldId", field.getId() != null ? field.getId().toString() : null);
    metadata.put("fieldName", field.getFieldName());
    if (field.getCrop() != null) {
      metadata.put("crop", field.getCrop());
    }
    return InformationItem.builder()
        .content(describe(field))
        .relevance(InformationRelevance.FARMER_SPECIFIC)
        .farmerId(field.getFarmerId())
        .countryCode(context.getCountryCode())
        .language(context.getPreferredLanguage())
        .sourceType(SourceType.DATABASE.getValue())
        .sourceId(sourceId())
        .metadata(metadata)
        .build();
  }

  static String describe(FarmField field) {
    StringBuilder sb = new StringBuilder("Field '").append(field.getFieldName()).append("'");
    if (field.getAreaHectares() != null) {
      sb.append(" (").append(field.getAreaHectares()).append(" ha)");
    }
    sb.append(": ").append(field.getCrop() != null ? field.getCrop() : "no crop recorded");
    if (field.getVariety() != null) {
      sb.append(", variety ").append(field.getVariety());
    }
    if (field.getPlantingDate() != null) {
      sb.append(", planted ").append(field.getPlantingDate());
    }
    return sb.toString();
  }
}
