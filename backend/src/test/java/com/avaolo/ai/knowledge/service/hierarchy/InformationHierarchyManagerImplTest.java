package com.avaolo.ai.knowledge.service.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.domain.enums.SourceType;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationResult;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationSource;
import com.avaolo.ai.knowledge.service.hierarchy.model.LocalizationContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InformationHierarchyManagerImpl Tests")
class InformationHierarchyManagerImplTest {

  private static final LocalizationContext CROATIAN_FARMER =
      LocalizationContext.builder()
          .whatsappNumber("+385912345678")
          .countryCode("HR")
          .preferredLanguage("hr")
          .farmerId(42L)
          .build();

  private SimpleMeterRegistry meterRegistry;
  private StubProvider farmerProvider;
  private StubProvider knowledgeProvider;
  private InformationHierarchyManagerImpl manager;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    farmerProvider =
        new StubProvider(
            InformationHierarchyManagerImpl.FARMER_DB,
            Set.of(InformationRelevance.FARMER_SPECIFIC),
            (query, level) ->
                List.of(item(level, "Field 'Gornja njiva' (2.5 ha): kukuruz", 42L)));
    knowledgeProvider =
        new StubProvider(
            InformationHierarchyManagerImpl.RAG_KNOWLEDGE,
            Set.of(InformationRelevance.COUNTRY_SPECIFIC, InformationRelevance.GLOBAL),
            (query, level) -> List.of(item(level, level.getLevelName() + " advice", null)));
    manager =
        new InformationHierarchyManagerImpl(
            List.of(farmerProvider, knowledgeProvider), new ObjectMapper(), meterRegistry);
  }

  @Nested
  @DisplayName("queryInformation")
  class QueryInformation {

    @Test
    @DisplayName("should fill every tier the context identifies")
    void shouldFillEveryTier() {
      InformationResult result = manager.queryInformation(query(CROATIAN_FARMER));

      assertThat(result.getFarmerItems()).hasSize(1);
      assertThat(result.getCountryItems())
          .singleElement()
          .extracting(InformationItem::getContent)
          .isEqualTo("country_specific advice");
      assertThat(result.getGlobalItems()).hasSize(1);
      assertThat(result.getAllItemsByPriority())
          .extracting(InformationItem::getRelevance)
          .containsExactly(
              InformationRelevance.FARMER_SPECIFIC,
              InformationRelevance.COUNTRY_SPECIFIC,
              InformationRelevance.GLOBAL);
      assertThat(result.getMetadata())
          .containsEntry("total_items", 3)
          .containsEntry(
              "sources_used", List.of("farmer_specific", "country_specific", "global"))
          .containsEntry("context_hash", manager.hashContext(CROATIAN_FARMER))
          .containsKey("query_timestamp");
      assertThat(meterRegistry.counter("information.queries").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip tiers the context cannot identify")
    void shouldSkipUnidentifiedTiers() {
      LocalizationContext anonymous = LocalizationContext.builder().whatsappNumber("+1").build();

      InformationResult result = manager.queryInformation(query(anonymous));

      assertThat(result.getFarmerItems()).isEmpty();
      assertThat(result.getCountryItems()).isEmpty();
      assertThat(result.getGlobalItems()).hasSize(1);
      assertThat(farmerProvider.calls).isEmpty();
      assertThat(knowledgeProvider.calls).containsExactly(InformationRelevance.GLOBAL);
    }

    @Test
    @DisplayName("should only query requested tiers")
    void shouldOnlyQueryRequestedTiers() {
      InformationQuery query =
          InformationQuery.builder()
              .queryText("karenca")
              .context(CROATIAN_FARMER)
              .requiredRelevanceLevels(List.of(InformationRelevance.GLOBAL))
              .build();

      InformationResult result = manager.queryInformation(query);

      assertThat(result.getFarmerItems()).isEmpty();
      assertThat(result.getGlobalItems()).hasSize(1);
      assertThat(farmerProvider.calls).isEmpty();
    }

    @Test
    @DisplayName("should truncate each tier to the item limit")
    void shouldTruncateTiers() {
      knowledgeProvider.answer =
          (query, level) -> {
            List<InformationItem> items = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
              items.add(item(level, "advice " + i, null));
            }
            return items;
          };
      InformationQuery query =
          InformationQuery.builder()
              .queryText("karenca")
              .context(CROATIAN_FARMER)
              .maxItemsPerLevel(2)
              .build();

      InformationResult result = manager.queryInformation(query);

      assertThat(result.getGlobalItems())
          .extracting(InformationItem::getContent)
          .containsExactly("advice 0", "advice 1");
      assertThat(result.getCountryItems()).hasSize(2);
    }

    @Test
    @DisplayName("should drop farmer items that belong to another farmer")
    void shouldDropOtherFarmersItems() {
      farmerProvider.answer =
          (query, level) -> List.of(item(level, "someone else's field", 7L));

      InformationResult result = manager.queryInformation(query(CROATIAN_FARMER));

      assertThat(result.getFarmerItems()).isEmpty();
      assertThat(
              meterRegistry
                  .counter("information.privacy.violations", "source", "farmer_db")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should drop country items from a source without country access")
    void shouldDropCountryItemsFromGlobalOnlySource() {
      StubProvider webSearch =
          new StubProvider(
              InformationHierarchyManagerImpl.EXTERNAL_SEARCH,
              Set.of(InformationRelevance.GLOBAL),
              (query, level) ->
                  List.of(item(InformationRelevance.COUNTRY_SPECIFIC, "HR web regulation", null)));
      InformationHierarchyManagerImpl withWebSearch =
          new InformationHierarchyManagerImpl(
              List.of(farmerProvider, knowledgeProvider, webSearch),
              new ObjectMapper(),
              meterRegistry);

      InformationResult result = withWebSearch.queryInformation(query(CROATIAN_FARMER));

      assertThat(webSearch.calls).containsExactly(InformationRelevance.GLOBAL);
      assertThat(result.getAllItemsByPriority())
          .extracting(InformationItem::getContent)
          .doesNotContain("HR web regulation");
      assertThat(result.getGlobalItems())
          .extracting(InformationItem::getContent)
          .containsExactly("global advice");
      assertThat(
              meterRegistry
                  .counter("information.privacy.violations", "source", "external_search")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should continue with other sources when one fails")
    void shouldContinueWhenSourceFails() {
      farmerProvider.answer =
          (query, level) -> {
            throw new IllegalStateException("database down");
          };

      InformationResult result = manager.queryInformation(query(CROATIAN_FARMER));

      assertThat(result.getFarmerItems()).isEmpty();
      assertThat(result.getGlobalItems()).hasSize(1);
      assertThat(
              meterRegistry
                  .counter("information.source.failures", "source", "farmer_db")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should omit metadata when not requested")
    void shouldOmitMetadata() {
      InformationQuery query =
          InformationQuery.builder()
              .queryText("karenca")
              .context(CROATIAN_FARMER)
              .includeMetadata(false)
              .build();

      assertThat(manager.queryInformation(query).getMetadata()).isEmpty();
    }
  }

  @Nested
  @DisplayName("sources")
  class Sources {

    @Test
    @DisplayName("should list default capabilities")
    void shouldListDefaultCapabilities() {
      Map<String, Map<String, Object>> capabilities = manager.getSourceCapabilities();

      assertThat(capabilities.keySet())
          .containsExactly("farmer_db", "rag_knowledge", "external_search");
      assertThat(capabilities.get("farmer_db"))
          .containsEntry("farmer_data", true)
          .containsEntry("global_data", false)
          .containsEntry("source_type", "database");
      assertThat(capabilities.get("external_search"))
          .containsEntry("country_data", false)
          .containsEntry("source_type", "external");
    }

    @Test
    @DisplayName("should never take farmer items from a source without farmer access")
    void shouldRejectFarmerItemsFromRestrictedSource() {
      InformationSource cooperative =
          InformationSource.builder()
              .sourceId("cooperative")
              .sourceType(SourceType.DATABASE)
              .sourceName("Cooperative registry")
              .canAccessFarmerData(true)
              .build();
      StubProvider provider =
          new StubProvider(
              "cooperative",
              Set.of(InformationRelevance.FARMER_SPECIFIC),
              (query, level) -> List.of(item(level, "cooperative field", 42L)));
      manager.registerSource(cooperative, provider);

      InformationItem farmerItem = item(InformationRelevance.FARMER_SPECIFIC, "field", 42L);
      InformationSource external =
          InformationSource.builder().sourceId("web").sourceType(SourceType.EXTERNAL).build();

      assertThat(manager.validatePrivacyCompliance(farmerItem, external)).isFalse();
      InformationSource globalOnly =
          InformationSource.builder()
              .sourceId("encyclopedia")
              .sourceType(SourceType.EXTERNAL)
              .canAccessCountryData(false)
              .build();
      InformationItem countryItem =
          item(InformationRelevance.COUNTRY_SPECIFIC, "HR regulation", null);
      assertThat(manager.validatePrivacyCompliance(countryItem, globalOnly)).isFalse();
      assertThat(manager.validatePrivacyCompliance(countryItem, external)).isTrue();
      assertThat(manager.validatePrivacyCompliance(farmerItem, cooperative)).isTrue();
      assertThat(manager.queryInformation(query(CROATIAN_FARMER)).getFarmerItems()).hasSize(2);
    }

    @Test
    @DisplayName("should reject a provider registered for another source")
    void shouldRejectMismatchedProvider() {
      InformationSource source =
          InformationSource.builder().sourceId("a").sourceType(SourceType.CACHE).build();

      assertThatThrownBy(() -> manager.registerSource(source, farmerProvider))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  @DisplayName("hashContext should be stable and sensitive to the context")
  void hashContextShouldBeStable() {
    LocalizationContext slovenian =
        LocalizationContext.builder()
            .whatsappNumber("+385912345678")
            .countryCode("SI")
            .preferredLanguage("sl")
            .build();

    String hash = manager.hashContext(CROATIAN_FARMER);

    assertThat(hash).hasSize(16).matches("[0-9a-f]+");
    assertThat(manager.hashContext(CROATIAN_FARMER)).isEqualTo(hash);
    assertThat(manager.hashContext(slovenian)).isNotEqualTo(hash);
    assertThat(manager.hashContext(new LocalizationContext())).hasSize(16);
  }

  private static InformationQuery query(LocalizationContext context) {
    return InformationQuery.builder().queryText("Kada smijem brati?").context(context).build();
  }

  private static InformationItem item(InformationRelevance level, String content, Long farmerId) {
    return InformationItem.builder()
        .content(content)
        .relevance(level)
        .farmerId(farmerId)
        .sourceType("test")
        .build();
  }

  private static final class StubProvider implements InformationProvider {

    private final String sourceId;
    private final Set<InformationRelevance> levels;
    private final List<InformationRelevance> calls = new ArrayList<>();
    private BiFunction<InformationQuery, InformationRelevance, List<InformationItem>> answer;

    StubProvider(
        String sourceId,
        Set<InformationRelevance> levels,
        BiFunction<InformationQuery, InformationRelevance, List<InformationItem>> answer) {
      this.sourceId = sourceId;
      this.levels = levels;
      this.answer = answer;
    }

    @Override
    public String sourceId() {
      return sourceId;
    }

    @Override
    public Set<InformationRelevance> supportedLevels() {
      return levels;
    }

    @Override
    public List<InformationItem> fetch(InformationQuery query, InformationRelevance level) {
      calls.add(level);
      return answer.apply(query, level);
    }
  }
}
