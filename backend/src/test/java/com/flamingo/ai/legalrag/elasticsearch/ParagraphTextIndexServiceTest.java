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
import co.elastic.clients.elasticsearch._types.ErrorCause;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.exception.IndexingException;
import com.flamingo.ai.legalrag.exception.SourceUnavailableException;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ParagraphTextIndexService Tests")
class ParagraphTextIndexServiceTest {

  private static final String INDEX = "test-paragraphs-text";

  @Mock private ElasticsearchClient elasticsearchClient;

  private ParagraphTextIndexService service;

  @BeforeEach
  void setUp() {
    service = new ParagraphTextIndexService(elasticsearchClient, new SimpleMeterRegistry(), INDEX);
  }

  @SuppressWarnings("unchecked")
  private static SearchResponse<Void> responseWith(List<Hit<Void>> hits) {
    SearchResponse<Void> response = mock(SearchResponse.class);
    when(response.hits()).thenReturn(HitsMetadata.of(h -> h.hits(hits)));
    return response;
  }

  private static Hit<Void> hit(String id, double score) {
    return Hit.of(h -> h.index(INDEX).id(id).score(score));
  }

  @Nested
  @DisplayName("search")
  class SearchTests {

    @Test
    @DisplayName("should return an empty list for a punctuation-only query without a request")
    void shouldSkipPunctuationOnlyQuery() {
      assertThat(service.search("?!\"*()", 5)).isEmpty();
      verifyNoInteractions(elasticsearchClient);
    }

    @Test
    @DisplayName("should send the sanitized query and map hits in rank order")
    void shouldMapHits() throws IOException {
      SearchResponse<Void> response = responseWith(List.of(hit("12", 7.5), hit("3", 4.0)));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Void.class)))
          .thenReturn(response);

      List<SearchHit> hits = service.search("group \"III\"?", 5);

      assertThat(hits).containsExactly(new SearchHit(12, 0, 7.5), new SearchHit(3, 1, 4.0));
      ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
      verify(elasticsearchClient).search(captor.capture(), eq(Void.class));
      SearchRequest request = captor.getValue();
      assertThat(request.index()).containsExactly(INDEX);
      assertThat(request.size()).isEqualTo(5);
      assertThat(request.query().match().field()).isEqualTo("text");
      assertThat(request.query().match().query().stringValue()).isEqualTo("group III");
    }

    @Test
    @DisplayName("should report an unreachable backend as source unavailable")
    void shouldWrapIoException() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Void.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(() -> service.search("rules", 5))
          .isInstanceOf(SourceUnavailableException.class)
          .hasCauseInstanceOf(IOException.class);
    }
  }

  @Nested
  @DisplayName("indexing")
  class IndexingTests {

    @Test
    @DisplayName("should key documents by record id")
    void shouldKeyDocumentsByRecordId() throws IOException {
      BulkResponse bulkResponse = mock(BulkResponse.class);
      when(bulkResponse.errors()).thenReturn(false);
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(bulkResponse);

      service.indexAll(
          List.of(
              Paragraph.builder()
                  .id(42L)
                  .docId(1)
                  .chapterId(1)
                  .paragraphId(1)
                  .text("paragraph text")
                  .build()));

      ArgumentCaptor<BulkRequest> captor = ArgumentCaptor.forClass(BulkRequest.class);
      verify(elasticsearchClient).bulk(captor.capture());
      assertThat(captor.getValue().operations()).hasSize(1);
      assertThat(captor.getValue().operations().get(0).index().id()).isEqualTo("42");
      assertThat(captor.getValue().operations().get(0).index().index()).isEqualTo(INDEX);
    }

    @Test
    @DisplayName("should fail when any document is rejected")
    void shouldFailOnBulkErrors() throws IOException {
      BulkResponse bulkResponse = mock(BulkResponse.class);
      BulkResponseItem failed = mock(BulkResponseItem.class);
      when(failed.error()).thenReturn(mock(ErrorCause.class));
      when(failed.id()).thenReturn("42");
      when(bulkResponse.errors()).thenReturn(true);
      when(bulkResponse.items()).thenReturn(List.of(failed));
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(bulkResponse);

      assertThatThrownBy(() -> service.index(42L, "paragraph text"))
          .isInstanceOf(IndexingException.class)
          .hasMessageContaining("[42]");
    }

    @Test
    @DisplayName("should not send a request for an empty batch")
    void shouldSkipEmptyBatch() {
      service.indexAll(List.of());
      verifyNoInteractions(elasticsearchClient);
    }
  }
}
