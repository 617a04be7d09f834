package com.avaolo.ai.knowledge.service.hierarchy;

import static com.google.common.base.Strings.nullToEmpty;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.domain.enums.SourceType;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationResult;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationSource;
import com.avaolo.ai.knowledge.service.hierarchy.model.LocalizationContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link InformationHierarchyManager}.
 *
 * <p>Registers the farmer database, the knowledge base and external web search as sources and
 * binds every {@link InformationProvider} bean to the source with the same id. Items that a source
 * is not allowed to supply are dropped and counted; farmer items are additionally dropped unless
 * they belong to the asking farmer.
 */
@Service
@Slf4j
public class InformationHierarchyManagerImpl implements InformationHierarchyManager {

  public static final String FARMER_DB = "farmer_db";
  public static final String RAG_KNOWLEDGE = "rag_knowledge";
  public static final String EXTERNAL_SEARCH = "external_search";

  private final Map<String, InformationSource> sources = new LinkedHashMap<>();
  private final Map<String, InformationProvider> providers = new ConcurrentHashMap<>();
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  public InformationHierarchyManagerImpl(
      List<InformationProvider> informationProviders,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    registerDefaultSources();
    for (InformationProvider provider : informationProviders) {
      providers.put(provider.sourceId(), provider);
      log.info(
          "Bound information provider {} for levels {}",
          provider.sourceId(),
          provider.supportedLevels());
    }
  }

  private void registerDefaultSources() {
    registerSource(
        InformationSource.builder()
            .sourceId(FARMER_DB)
            .sourceType(SourceType.DATABASE)
            .sourceName("Farmer Database")
            .canAccessFarmerData(true)
            .canAccessCountryData(true)
            .canAccessGlobalData(false)
            .build());
    registerSource(
        InformationSource.builder()
            .sourceId(RAG_KNOWLEDGE)
            .sourceType(SourceType.RAG)
            .sourceName("Agricultural Knowledge Base")
            .canAccessFarmerData(false)
            .canAccessCountryData(true)
            .canAccessGlobalData(true)
            .build());
    registerSource(
        InformationSource.builder()
            .sourceId(EXTERNAL_SEARCH)
            .sourceType(SourceType.EXTERNAL)
            .sourceName("Web Search (Perplexity)")
            .canAccessFarmerData(false)
            .canAccessCountryData(false)
            .canAccessGlobalData(true)
            .build());
  }

  @Override
  public void registerSource(InformationSource source) {
    synchronized (sources) {
      sources.put(source.getSourceId(), source);
    }
    log.info(
        "Registered information source: {} ({})", source.getSourceName(), source.getSourceId());
  }

  @Override
  public void registerSource(InformationSource source, InformationProvider provider) {
    if (!Objects.equals(source.getSourceId(), provider.sourceId())) {
      throw new IllegalArgumentException(
          "Provider " + provider.sourceId() + " does not back source " + source.getSourceId());
    }
    registerSource(source);
    providers.put(provider.sourceId(), provider);
  }

  @Override
  @Timed(value = "information.query", description = "Time to query the information hierarchy")
  public InformationResult queryInformation(InformationQuery query) {
    LocalizationContext context =
        query.getContext() != null ? query.getContext() : new LocalizationContext();
    List<InformationSource> snapshot;
    synchronized (sources) {
      snapshot = List.copyOf(sources.values());
    }

    Map<InformationRelevance, List<InformationItem>> byLevel =
        new EnumMap<>(InformationRelevance.class);
    List<String> sourcesUsed = new ArrayList<>();
    List<InformationRelevance> levels =
        query.getRequiredRelevanceLevels().stream()
            .distinct()
            .sorted(Comparator.comparingInt(InformationRelevance::getPriority))
            .toList();

    for (InformationRelevance level : levels) {
      if (!levelApplies(level, context)) {
        log.debug("Skipping level {}: context does not identify it", level);
        continue;
      }
      List<InformationItem> items = collect(query, context, level, snapshot);
      if (items.size() > query.getMaxItemsPerLevel()) {
        items = new ArrayList<>(items.subList(0, query.getMaxItemsPerLevel()));
      }
      byLevel.put(level, List.copyOf(items));
      if (!items.isEmpty()) {
        sourcesUsed.add(level.getLevelName());
      }
    }

    int totalItems = byLevel.values().stream().mapToInt(List::size).sum();
    Map<String, Object> metadata = new LinkedHashMap<>();
    if (query.isIncludeMetadata()) {
      metadata.put("query_timestamp", Instant.now().toString());
      metadata.put("sources_used", List.copyOf(sourcesUsed));
      metadata.put("total_items", totalItems);
      metadata.put("context_hash", hashContext(context));
    }

    InformationResult result =
        InformationResult.builder()
            .query(query)
            .farmerItems(byLevel.getOrDefault(InformationRelevance.FARMER_SPECIFIC, List.of()))
            .countryItems(byLevel.getOrDefault(InformationRelevance.COUNTRY_SPECIFIC, List.of()))
            .globalItems(byLevel.getOrDefault(InformationRelevance.GLOBAL, List.of()))
            .metadata(metadata)
            .build();
    meterRegistry.counter("information.queries").increment();
    logQuery(result, context);
    return result;
  }

  private boolean levelApplies(InformationRelevance level, LocalizationContext context) {
    return switch (level) {
      case FARMER_SPECIFIC -> context.getFarmerId() != null;
      case COUNTRY_SPECIFIC -> context.getCountryCode() != null
          && !context.getCountryCode().isBlank();
      case GLOBAL -> true;
    };
  }

  private List<InformationItem> collect(
      InformationQuery query,
      LocalizationContext context,
      InformationRelevance level,
      List<InformationSource> snapshot) {
    List<InformationItem> items = new ArrayList<>();
    for (InformationSource source : snapshot) {
      if (!source.mayProvide(level)) {
        continue;
      }
      InformationProvider provider = providers.get(source.getSourceId());
      if (provider == null || !provider.supportedLevels().contains(level)) {
        continue;
      }
      log.debug("Querying {} data from {}", level.getValue(), source.getSourceName());

      List<InformationItem> fetched;
      try {
        fetched = provider.fetch(query, level);
      } catch (RuntimeException e) {
        meterRegistry
            .counter("information.source.failures", "source", source.getSourceId())
            .increment();
        log.warn(
            "Source {} failed for level {}: {}", source.getSourceId(), level, e.getMessage(), e);
        continue;
      }

      for (InformationItem item : fetched) {
        if (!validatePrivacyCompliance(item, source) || !belongsToFarmer(item, context)) {
          meterRegistry
              .counter("information.privacy.violations", "source", source.getSourceId())
              .increment();
          continue;
        }
        items.add(item);
      }
    }
    return items;
  }

  private boolean belongsToFarmer(InformationItem item, LocalizationContext context) {
    if (item.getRelevance() != InformationRelevance.FARMER_SPECIFIC) {
      return true;
    }
    if (Objects.equals(item.getFarmerId(), context.getFarmerId())) {
      return true;
    }
    log.error(
        "Privacy violation: item for farmer {} returned to farmer {}",
        item.getFarmerId(),
        context.getFarmerId());
    return false;
  }

  @Override
  public boolean validatePrivacyCompliance(InformationItem item, InformationSource source) {
    if (item.getRelevance() == InformationRelevance.FARMER_SPECIFIC
        && !source.isCanAccessFarmerData()) {
      log.error(
          "Privacy violation: Source {} cannot access farmer data", source.getSourceId());
      return false;
    }
    if (item.getRelevance() == InformationRelevance.COUNTRY_SPECIFIC
        && !source.isCanAccessCountryData()) {
      log.error(
          "Privacy violation: Source {} cannot access country data", source.getSourceId());
      return false;
    }
    return true;
  }

  @Override
  public Map<String, Map<String, Object>> getSourceCapabilities() {
    Map<String, Map<String, Object>> capabilities = new LinkedHashMap<>();
    synchronized (sources) {
      for (InformationSource source : sources.values()) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("farmer_data", source.isCanAccessFarmerData());
        entry.put("country_data", source.isCanAccessCountryData());
        entry.put("global_data", source.isCanAccessGlobalData());
        entry.put("source_type", source.getSourceType().getValue());
        capabilities.put(source.getSourceId(), entry);
      }
    }
    return capabilities;
  }

  @Override
  public String hashContext(LocalizationContext context) {
    String contextString =
        nullToEmpty(context.getWhatsappNumber())
            + ":"
            + nullToEmpty(context.getCountryCode())
            + ":"
            + nullToEmpty(context.getPreferredLanguage());
    String hash = Hashing.sha256().hashString(contextString, StandardCharsets.UTF_8).toString();
    return hash.substring(0, 16);
  }

  private void logQuery(InformationResult result, LocalizationContext context) {
    Map<String, Object> itemsFound = new LinkedHashMap<>();
    itemsFound.put("farmer", result.getFarmerItems().size());
    itemsFound.put("country", result.getCountryItems().size());
    itemsFound.put("global", result.getGlobalItems().size());

    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("timestamp", Instant.now().toString());
    entry.put("query", result.getQuery().getQueryText());
    entry.put("farmer_id", context.getFarmerId());
    entry.put("country", context.getCountryCode());
    entry.put("items_found", itemsFound);
    try {
      log.info("Information query audit: {}", objectMapper.writeValueAsString(entry));
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize audit entry, logging raw: {}", entry);
    }
  }
}
