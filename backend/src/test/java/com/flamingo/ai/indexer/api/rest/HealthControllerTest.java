package com.flamingo.ai.indexer.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.indexer.elasticsearch.ElasticsearchIndexOperations;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
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

  @Mock private ElasticsearchIndexOperations<Passage> indexOperations;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(indexOperations)).build();
  }

  @Test
  @DisplayName("Should report UP when Elasticsearch answers")
  void shouldReportUp() throws Exception {
    when(indexOperations.ping()).thenReturn(true);

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.elasticsearch").value("UP"))
        .andExpect(jsonPath("$.service").value("file-indexer"));
  }

  @Test
  @DisplayName("Should report DEGRADED when Elasticsearch is down")
  void shouldReportDegraded() throws Exception {
    when(indexOperations.ping()).thenReturn(false);

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DEGRADED"))
        .andExpect(jsonPath("$.elasticsearch").value("DOWN"));
  }
}
