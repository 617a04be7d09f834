package com.avaolo.ai.knowledge.service.hierarchy.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import com.avaolo.ai.knowledge.service.hierarchy.model.LocalizationContext;
import com.avaolo.ai.knowledge.service.knowledge.KnowledgeSearchService;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeDocument;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeFilter;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("KnowledgeBaseProvider Tests")
class KnowledgeBaseProviderTest {

  @Mock private KnowledgeSearchService knowledgeSearchService;

  @InjectMocks private KnowledgeBaseProvider provider;

  @Test
  @DisplayName("should restrict the country tier to the caller's country")
  void shouldRestrictCountryTier() {
    KnowledgeDocument document =
        KnowledgeDocument.builder()
            .id("fis_1")
            .score(0.87)
            .text("U Hrvatskoj je Prosaro registriran za pšenicu.")
            .source("fis_prosaro.pdf")
            .documentType("pesticide")
            .language("hr")
            .metadata(Map.of("countryCode", "HR"))
            .build();
    when(knowledgeSearchService.search(eq("Prosaro"), any(KnowledgeFilter.class), eq(3)))
        .thenReturn(List.of(document));

    List<InformationItem> items =
        provider.fetch(query("hr", 3), InformationRelevance.COUNTRY_SPECIFIC);

    ArgumentCaptor<KnowledgeFilter> filter = ArgumentCaptor.forClass(KnowledgeFilter.class);
    verify(knowledgeSearchService).search(eq("Prosaro"), filter.capture(), eq(3));
    assertThat(filter.getValue().countryCode()).isEqualTo("HR");
    assertThat(filter.getValue().globalOnly()).isFalse();
    assertThat(items)
        .singleElement()
        .satisfies(
            item -> {
              assertThat(item.getRelevance()).isEqualTo(InformationRelevance.COUNTRY_SPECIFIC);
              assertThat(item.getCountryCode()).isEqualTo("HR");
              assertThat(item.getSourceType()).isEqualTo("rag");
              assertThat(item.getMetadata())
                  .containsEntry("documentId", "fis_1")
                  .containsEntry("score", 0.87);
            });
  }

  @Test
  @DisplayName("should search only country-free documents for the global tier")
  void shouldSearchGlobalDocuments() {
    when(knowledgeSearchService.search(anyString(), any(KnowledgeFilter.class), anyInt()))
        .thenReturn(List.of());

    provider.fetch(query("hr", 5), InformationRelevance.GLOBAL);

    ArgumentCaptor<KnowledgeFilter> filter = ArgumentCaptor.forClass(KnowledgeFilter.class);
    verify(knowledgeSearchService).search(eq("Prosaro"), filter.capture(), eq(5));
    assertThat(filter.getValue().globalOnly()).isTrue();
    assertThat(filter.getValue().countryCode()).isNull();
  }

  @Test
  @DisplayName("should skip the country tier without a country")
  void shouldSkipCountryTierWithoutCountry() {
    List<InformationItem> items =
        provider.fetch(query(null, 5), InformationRelevance.COUNTRY_SPECIFIC);

    assertThat(items).isEmpty();
    verify(knowledgeSearchService, never()).search(any(), any(), any());
  }

  private static InformationQuery query(String countryCode, int maxItems) {
    return InformationQuery.builder()
        .queryText("Prosaro")
        .context(LocalizationContext.builder().countryCode(countryCode).build())
        .maxItemsPerLevel(maxItems)
        .build();
  }
}
