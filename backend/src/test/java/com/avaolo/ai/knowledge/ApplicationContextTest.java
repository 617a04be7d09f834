package com.avaolo.ai.knowledge;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.avaolo.ai.knowledge.service.hierarchy.InformationHierarchyManager;
import com.avaolo.ai.knowledge.service.hierarchy.provider.ExternalSearchProvider;
import com.avaolo.ai.knowledge.service.knowledge.KnowledgeIndexingService;
import com.avaolo.ai.knowledge.service.knowledge.KnowledgeSearchService;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies that the application context loads. The embedding model and Elasticsearch client are
 * mocked so the test runs without external services; the farmer database is in-memory H2.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(KnowledgeSearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(KnowledgeIndexingService.class)).isNotNull();
    assertThat(applicationContext.getBean(InformationHierarchyManager.class)).isNotNull();
  }

  @Test
  @DisplayName("External search should stay off unless enabled")
  void externalSearchShouldBeDisabledByDefault() {
    assertThat(applicationContext.getBeanNamesForType(ExternalSearchProvider.class)).isEmpty();
  }
}
