package com.avaolo.ai.knowledge.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the knowledge index against a real Elasticsearch node: country and global entries must stay
 * apart, metadata filters must restrict kNN hits, and deleting a source must remove its chunks.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Knowledge Index Integration Test")
class KnowledgeIndexIntegrationTest {

  private static final String INDEX = "knowledge-it";

  @Container
  private static final ElasticsearchContainer ELASTICSEARCH_CONTAINER =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.0.0")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("xpack.security.http.ssl.enabled", "false")
          .withStartupTimeout(Duration.ofMinutes(2));

  private Rest5Client restClient;
  private ElasticsearchClient elasticsearchClient;
  private KnowledgeIndexService indexService;

  @BeforeEach
  void setUp() {
    restClient =
        Rest5Client.builder(
                new HttpHost(
                    "http",
                    ELASTICSEARCH_CONTAINER.getHost(),
                    ELASTICSEARCH_CONTAINER.getMappedPort(9200)))
            .build();
    elasticsearchClient =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));
    indexService =
        new KnowledgeIndexService(elasticsearchClient, new SimpleMeterRegistry(), INDEX, 3);
    indexService.initIndex();

    indexService.indexDocuments(
        List.of(
            pesticide("hr_prosaro", "fis_hr.pdf", "HR", List.of(1.0f, 0.0f, 0.0f)),
            pesticide("si_prosaro", "fis_si.pdf", "SI", List.of(0.9f, 0.1f, 0.0f)),
            pesticide("global_prosaro", "manual", null, List.of(0.8f, 0.2f, 0.0f)),
            KnowledgeEntry.builder()
                .id("global_soil")
                .text("Analiza tla prije sjetve.")
                .source("manual")
                .documentType("general")
                .language("hr")
                .indexedAt(Instant.now().toString())
                .embedding(List.of(0.0f, 0.0f, 1.0f))
                .build()));
    indexService.refresh();
  }

  @AfterEach
  void tearDown() throws Exception {
    elasticsearchClient.indices().delete(d -> d.index(INDEX));
    restClient.close();
  }

  @Test
  @DisplayName("country filter should only return that country's entries")
  void countryFilterShouldIsolateCountries() {
    List<KnowledgeEntry> hits =
        indexService.vectorSearch(Map.of("countryCode", "HR"), List.of(1.0f, 0.0f, 0.0f), 5);

    assertThat(hits).extracting(KnowledgeEntry::getId).containsExactly("hr_prosaro");
    assertThat(hits.get(0).getRelevanceScore()).isPositive();
  }

  @Test
  @DisplayName("global filter should exclude every country entry")
  void globalFilterShouldExcludeCountryEntries() {
    List<KnowledgeEntry> hits =
        indexService.vectorSearch(
            Map.of(KnowledgeIndexService.GLOBAL_ONLY, true), List.of(1.0f, 0.0f, 0.0f), 5);

    assertThat(hits)
        .extracting(KnowledgeEntry::getId)
        .containsExactly("global_prosaro", "global_soil");
  }

  @Test
  @DisplayName("keyword search should honour metadata filters")
  void keywordSearchShouldHonourFilters() {
    List<KnowledgeEntry> hits =
        indexService.keywordSearch(Map.of("documentType", "general"), "analiza tla", 5);

    assertThat(hits).extracting(KnowledgeEntry::getId).containsExactly("global_soil");
  }

  @Test
  @DisplayName("deleting a source should remove only its entries")
  void deleteBySourceShouldRemoveOnlyThatSource() {
    indexService.deleteBySource("fis_hr.pdf");
    indexService.refresh();

    assertThat(indexService.count()).isEqualTo(3);
    assertThat(indexService.vectorSearch(new HashMap<>(), List.of(1.0f, 0.0f, 0.0f), 5))
        .extracting(KnowledgeEntry::getId)
        .doesNotContain("hr_prosaro");
  }

  @Test
  @DisplayName("pruning a source should keep the listed ids")
  void deleteStaleEntriesShouldKeepListedIds() {
    indexService.deleteStaleEntries("manual", List.of("global_soil"));
    indexService.refresh();

    assertThat(indexService.count()).isEqualTo(3);
    assertThat(indexService.vectorSearch(new HashMap<>(), List.of(1.0f, 0.0f, 0.0f), 5))
        .extracting(KnowledgeEntry::getId)
        .containsExactlyInAnyOrder("hr_prosaro", "si_prosaro", "global_soil");
  }

  private static KnowledgeEntry pesticide(
      String id, String source, String countryCode, List<Float> vector) {
    return KnowledgeEntry.builder()
        .id(id)
        .text("Prosaro, karenca 35 dana.")
        .source(source)
        .documentType("pesticide")
        .language("hr")
        .countryCode(countryCode)
        .chemical("prosaro")
        .phiDays(35)
        .indexedAt(Instant.now().toString())
        .embedding(vector)
        .build();
  }
}
