package com.flamingo.ai.legalrag;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.legalrag.config.IngestionStartupRunner;
import com.flamingo.ai.legalrag.service.ingestion.IngestionService;
import com.flamingo.ai.legalrag.service.locator.ParagraphLocatorService;
import com.flamingo.ai.legalrag.service.rag.HybridRetriever;
import com.flamingo.ai.legalrag.service.rag.KeywordIndex;
import com.flamingo.ai.legalrag.service.rag.VectorIndex;
import com.flamingo.ai.legalrag.service.store.ParagraphStore;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Integration test that verifies the Spring application context loads correctly. Uses @MockitoBean
 * to mock external dependencies (LLM, Elasticsearch) so the test can run without external services.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
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
    assertThat(applicationContext.getBean(ParagraphStore.class)).isNotNull();
    assertThat(applicationContext.getBean(KeywordIndex.class)).isNotNull();
    assertThat(applicationContext.getBean(VectorIndex.class)).isNotNull();
    assertThat(applicationContext.getBean(HybridRetriever.class)).isNotNull();
    assertThat(applicationContext.getBean(ParagraphLocatorService.class)).isNotNull();
    assertThat(applicationContext.getBean(IngestionService.class)).isNotNull();
  }

  @Test
  @DisplayName("Ingestion should not run on startup unless enabled")
  void ingestionRunnerShouldBeDisabledByDefault() {
    assertThat(applicationContext.getBeansOfType(IngestionStartupRunner.class)).isEmpty();
  }
}
