package com.flamingo.ai.legalrag.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.legalrag.api.dto.request.LocateParagraphRequest;
import com.flamingo.ai.legalrag.api.rest.HealthController;
import com.flamingo.ai.legalrag.api.rest.ParagraphLocatorController;
import com.flamingo.ai.legalrag.api.rest.SearchController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify the public endpoints keep their paths:
 *
 * <ul>
 *   <li>POST /find_paragraph - Locate the justifying paragraph
 *   <li>GET /api/search - Hybrid retrieval for debugging
 *   <li>GET /health, GET /health/stats - Liveness and corpus size
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("ParagraphLocatorController API contract")
  class ParagraphLocatorControllerContract {

    @Test
    @DisplayName("should expose POST /find_paragraph at the root")
    void shouldExposeFindParagraph() throws NoSuchMethodException {
      RequestMapping mapping = ParagraphLocatorController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).isEmpty();

      PostMapping post =
          ParagraphLocatorController.class
              .getMethod("findParagraph", LocateParagraphRequest.class)
              .getAnnotation(PostMapping.class);
      assertThat(post.value()).containsExactly("/find_paragraph");
    }
  }

  @Nested
  @DisplayName("SearchController API contract")
  class SearchControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = SearchController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
