package com.avaolo.ai.knowledge.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.avaolo.ai.knowledge.domain.repository.FarmFieldRepository;
import com.avaolo.ai.knowledge.elasticsearch.KnowledgeIndexService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {

  private MockMvc mockMvc;

  @Mock private KnowledgeIndexService knowledgeIndexService;
  @Mock private FarmFieldRepository farmFieldRepository;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new HealthController(knowledgeIndexService, farmFieldRepository))
            .build();
  }

  @Test
  @DisplayName("GET /health should report UP")
  void shouldReportUp() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.service").value("ava-olo-knowledge"));
  }

  @Test
  @DisplayName("GET /health/stats should report index and database sizes")
  void shouldReportStats() throws Exception {
    when(knowledgeIndexService.getIndexName()).thenReturn("ava-olo-knowledge");
    when(knowledgeIndexService.count()).thenReturn(128L);
    when(farmFieldRepository.count()).thenReturn(12L);
    when(farmFieldRepository.countFarmers()).thenReturn(4L);

    mockMvc
        .perform(get("/health/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.indexName").value("ava-olo-knowledge"))
        .andExpect(jsonPath("$.knowledgeEntries").value(128))
        .andExpect(jsonPath("$.farmFields").value(12))
        .andExpect(jsonPath("$.farmers").value(4));
  }
}
