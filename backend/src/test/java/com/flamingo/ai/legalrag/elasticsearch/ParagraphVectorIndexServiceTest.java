package com.flamingo.ai.legalrag.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;
import com.flamingo.ai.legalrag.exception.DimensionMismatchException;
import com.flamingo.ai.legalrag.service.rag.VectorIndex;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ParagraphVectorIndexService Tests")
class ParagraphVectorIndexServiceTest {

  private static final String INDEX = "test-paragraphs-vectors";

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private ParagraphVectorIndexService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service = new ParagraphVectorIndexService(elasticsearchClient, meterRegistry, INDEX, 3);
  }

  @Test
  @DisplayName("should reject a query vector of the wrong size before calling Elasticsearch")
  void shouldRejectWrongQueryDimensions() {
    assertThatThrownBy(() -> service.search(List.of(0.1f, 0.2f), 5))
        .isInstanceOf(DimensionMismatchException.class)
        .hasMessageContaining("expected 3 but got 2");
    verifyNoInteractions(elasticsearchClient);
    assertThat(meterRegistry.counter("vector_index.dimension_mismatch").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should reject an upsert of the wrong size before calling Elasticsearch")
  void shouldRejectWrongUpsertDimensions() {
    VectorIndex.VectorPoint point =
        new VectorIndex.VectorPoint(1L, List.of(1f, 2f, 3f, 4f), new ParagraphLocation(1, 2, 3));

    assertThatThrownBy(() -> service.upsert(point)).isInstanceOf(DimensionMismatchException.class);
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("should run a kNN search and map hits in similarity order")
  @SuppressWarnings("unchecked")
  void shouldRunKnnSearch() throws IOException {
    SearchResponse<Void> response = mock(SearchResponse.class);
    List<Hit<Void>> hits =
        List.of(
            Hit.of(h -> h.index(INDEX).id("7").score(0.95)),
            Hit.of(h -> h.index(INDEX).id("2").score(0.81)));
    when(response.hits()).thenReturn(HitsMetadata.of(m -> m.hits(hits)));
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Void.class)))
        .thenReturn(response);

    List<SearchHit> result = service.search(List.of(0.1f, 0.2f, 0.3f), 5);

    assertThat(result).containsExactly(new SearchHit(7, 0, 0.95), new SearchHit(2, 1, 0.81));
    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(elasticsearchClient).search(captor.capture(), eq(Void.class));
    assertThat(captor.getValue().knn()).hasSize(1);
    assertThat(captor.getValue().knn().get(0).field()).isEqualTo("embedding");
    assertThat(captor.getValue().size()).isEqualTo(5);
  }

  @Test
  @DisplayName("should report the configured dimensionality")
  void shouldReportDimensions() {
    assertThat(service.dimensions()).isEqualTo(3);
    assertThat(service.getIndexName()).isEqualTo(INDEX);
  }

  @Test
  @DisplayName("should refuse an existing index created with other dimensions")
  void shouldRefuseExistingIndexWithOtherDimensions() {
    Map<String, Property> existing =
        Map.of("embedding", Property.of(p -> p.denseVector(d -> d.dims(768))));

    assertThatThrownBy(() -> service.verifyExistingMapping(existing))
        .isInstanceOf(DimensionMismatchException.class)
        .hasMessageContaining("expected 768 but got 3");
  }

  @Test
  @DisplayName("should accept an existing index with matching dimensions")
  void shouldAcceptExistingIndexWithMatchingDimensions() {
    Map<String, Property> existing =
        Map.of("embedding", Property.of(p -> p.denseVector(d -> d.dims(3))));

    service.verifyExistingMapping(existing);
  }
}
