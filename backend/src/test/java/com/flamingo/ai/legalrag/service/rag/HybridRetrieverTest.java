package com.flamingo.ai.legalrag.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.legalrag.config.RagConfig;
import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.exception.DimensionMismatchException;
import com.flamingo.ai.legalrag.exception.SourceUnavailableException;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import com.flamingo.ai.legalrag.service.store.ParagraphStore;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

@ExtendWith(MockitoExtension.class)
@DisplayName("HybridRetriever Tests")
class HybridRetrieverTest {

  private static final List<Float> EMBEDDING = List.of(0.1f, 0.2f, 0.3f);

  @Mock private KeywordIndex keywordIndex;
  @Mock private VectorIndex vectorIndex;
  @Mock private EmbeddingService embeddingService;
  @Mock private ParagraphStore paragraphStore;

  private SimpleMeterRegistry meterRegistry;
  private RagConfig ragConfig;
  private HybridRetriever hybridRetriever;
  private final Map<Long, Paragraph> records = new HashMap<>();

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ragConfig = new RagConfig();
    hybridRetriever =
        new HybridRetriever(
            keywordIndex,
            vectorIndex,
            embeddingService,
            paragraphStore,
            ragConfig,
            meterRegistry,
            Runnable::run);

    lenient()
        .when(paragraphStore.getMany(anyCollection()))
        .thenAnswer(
            invocation -> {
              Collection<Long> ids = invocation.getArgument(0);
              Map<Long, Paragraph> found = new HashMap<>();
              ids.stream()
                  .filter(records::containsKey)
                  .forEach(id -> found.put(id, records.get(id)));
              return found;
            });
    lenient().when(embeddingService.embedQuery(anyString())).thenReturn(EMBEDDING);
  }

  private Paragraph record(long id, int doc, int chapter, int paragraph, String text) {
    Paragraph p =
        Paragraph.builder()
            .id(id)
            .docId(doc)
            .chapterId(chapter)
            .paragraphId(paragraph)
            .text(text)
            .build();
    records.put(id, p);
    return p;
  }

  @Nested
  @DisplayName("fusion")
  class FusionTests {

    @Test
    @DisplayName("should return the record both sources rank first")
    void shouldReturnRecordFoundByBothSources() {
      Paragraph p1 =
          record(1, 1, 1, 10, "Inspection alone may be performed by staff with group III");
      when(keywordIndex.search("group III", 5)).thenReturn(List.of(new SearchHit(1, 0, 7.2)));
      when(vectorIndex.search(EMBEDDING, 5)).thenReturn(List.of(new SearchHit(1, 0, 0.93)));

      List<Paragraph> results = hybridRetriever.retrieve("group III", 5);

      assertThat(results).containsExactly(p1);
    }

    @Test
    @DisplayName("should order records by fused score")
    void shouldOrderByFusedScore() {
      Paragraph p1 = record(1, 1, 1, 1, "first paragraph text");
      Paragraph p2 = record(2, 1, 1, 2, "second paragraph text");
      Paragraph p3 = record(3, 1, 1, 3, "third paragraph text");
      when(keywordIndex.search(anyString(), anyInt()))
          .thenReturn(List.of(new SearchHit(1, 0, 3.0), new SearchHit(2, 1, 2.0)));
      when(vectorIndex.search(anyList(), anyInt()))
          .thenReturn(List.of(new SearchHit(3, 0, 0.9), new SearchHit(2, 1, 0.8)));

      List<Paragraph> results = hybridRetriever.retrieve("query", 5);

      // 2 appears in both lists; 1 and 3 tie and fall back to id order
      assertThat(results).containsExactly(p2, p1, p3);
    }

    @Test
    @DisplayName("should truncate to k")
    void shouldTruncateToK() {
      record(1, 1, 1, 1, "first paragraph text");
      record(2, 1, 1, 2, "second paragraph text");
      when(keywordIndex.search(anyString(), eq(1)))
          .thenReturn(List.of(new SearchHit(1, 0, 3.0)));
      when(vectorIndex.search(anyList(), eq(1))).thenReturn(List.of(new SearchHit(2, 0, 0.9)));

      assertThat(hybridRetriever.retrieve("query", 1))
          .extracting(Paragraph::getId)
          .containsExactly(1L);
    }

    @Test
    @DisplayName("should return empty when both sources return nothing")
    void shouldReturnEmptyWhenBothSourcesEmpty() {
      when(keywordIndex.search(anyString(), anyInt())).thenReturn(List.of());
      when(vectorIndex.search(anyList(), anyInt())).thenReturn(List.of());

      assertThat(hybridRetriever.retrieve("nothing", 5)).isEmpty();
      verify(paragraphStore, never()).getMany(anyCollection());
    }

    @Test
    @DisplayName("should drop ids missing from the record store")
    void shouldDropMissingRecords() {
      Paragraph p4 = record(4, 2, 1, 1, "stored paragraph text");
      when(keywordIndex.search(anyString(), anyInt()))
          .thenReturn(List.of(new SearchHit(99, 0, 5.0), new SearchHit(4, 1, 4.0)));
      when(vectorIndex.search(anyList(), anyInt())).thenReturn(List.of());

      assertThat(hybridRetriever.retrieve("query", 5)).containsExactly(p4);
      assertThat(meterRegistry.counter("rag.retrieve.missing_records").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("source failures")
  class SourceFailureTests {

    @Test
    @DisplayName("should continue with vector results when keyword search fails")
    void shouldFailOpenOnKeywordError() {
      Paragraph p7 = record(7, 3, 2, 5, "vector only paragraph text");
      when(keywordIndex.search(anyString(), anyInt()))
          .thenThrow(new SourceUnavailableException("keyword", "connection refused", null));
      when(vectorIndex.search(anyList(), anyInt())).thenReturn(List.of(new SearchHit(7, 0, 0.8)));

      assertThat(hybridRetriever.retrieve("query", 5)).containsExactly(p7);
      assertThat(
              meterRegistry.counter("rag.retrieve.source.fallback", "source", "keyword").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip vector search when the query embedding is empty")
    void shouldSkipVectorSearchWithoutEmbedding() {
      Paragraph p1 = record(1, 1, 1, 1, "keyword only paragraph text");
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of());
      when(keywordIndex.search(anyString(), anyInt()))
          .thenReturn(List.of(new SearchHit(1, 0, 1.0)));

      assertThat(hybridRetriever.retrieve("query", 5)).containsExactly(p1);
      verify(vectorIndex, never()).search(anyList(), anyInt());
    }

    @Test
    @DisplayName("should propagate a vector dimension mismatch")
    void shouldPropagateDimensionMismatch() {
      when(keywordIndex.search(anyString(), anyInt()))
          .thenReturn(List.of(new SearchHit(1, 0, 1.0)));
      when(vectorIndex.search(anyList(), anyInt()))
          .thenThrow(new DimensionMismatchException("legal-paragraphs-vectors", 1536, 3));

      assertThatThrownBy(() -> hybridRetriever.retrieve("query", 5))
          .isInstanceOf(DimensionMismatchException.class)
          .hasMessageContaining("expected 1536 but got 3");
    }

    @Test
    @DisplayName("should continue with keyword results when the executor rejects the vector source")
    void shouldContinueWhenExecutorRejectsSource() {
      AtomicInteger submissions = new AtomicInteger();
      Executor saturated =
          task -> {
            if (submissions.incrementAndGet() > 1) {
              throw new RejectedExecutionException("pool full");
            }
            task.run();
          };
      HybridRetriever retriever =
          new HybridRetriever(
              keywordIndex,
              vectorIndex,
              embeddingService,
              paragraphStore,
              ragConfig,
              meterRegistry,
              saturated);
      Paragraph p1 = record(1, 1, 1, 10, "keyword only paragraph text");
      when(keywordIndex.search("query", 5)).thenReturn(List.of(new SearchHit(1, 0, 2.5)));

      List<Paragraph> results = retriever.retrieve("query", 5);

      assertThat(results).containsExactly(p1);
      verify(vectorIndex, never()).search(anyList(), anyInt());
      assertThat(
              meterRegistry
                  .counter("rag.retrieve.source.fallback", "source", HybridRetriever.VECTOR)
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat a slow source as empty after the timeout")
    void shouldTreatSlowSourceAsEmpty() throws Exception {
      ExecutorService executor = Executors.newFixedThreadPool(2);
      CountDownLatch release = new CountDownLatch(1);
      try {
        HybridRetriever retriever =
            new HybridRetriever(
                keywordIndex,
                vectorIndex,
                embeddingService,
                paragraphStore,
                ragConfig,
                meterRegistry,
                executor);
        Paragraph p7 = record(7, 3, 2, 5, "vector only paragraph text");
        when(keywordIndex.search(anyString(), anyInt()))
            .thenAnswer(
                invocation -> {
                  release.await(5, TimeUnit.SECONDS);
                  return List.of(new SearchHit(1, 0, 1.0));
                });
        when(vectorIndex.search(anyList(), anyInt()))
            .thenReturn(List.of(new SearchHit(7, 0, 0.8)));

        List<Paragraph> results = retriever.retrieve("query", 5, Duration.ofMillis(200));

        assertThat(results).containsExactly(p7);
      } finally {
        release.countDown();
        executor.shutdown();
      }
    }
  }

  @Test
  @DisplayName("should return empty for non-positive k without searching")
  void shouldReturnEmptyForNonPositiveK() {
    assertThat(hybridRetriever.retrieve("query", 0)).isEmpty();
    verify(keywordIndex, never()).search(anyString(), anyInt());
  }

  @Test
  @DisplayName("should record one timing per call for either overload")
  void shouldTimeEachEntryPointOnce() {
    when(keywordIndex.search(anyString(), anyInt())).thenReturn(List.of());
    when(vectorIndex.search(anyList(), anyInt())).thenReturn(List.of());
    AspectJProxyFactory factory = new AspectJProxyFactory(hybridRetriever);
    factory.setProxyTargetClass(true);
    factory.addAspect(new TimedAspect(meterRegistry));
    HybridRetriever proxied = factory.getProxy();

    proxied.retrieve("rules", 5);
    proxied.retrieve("rules", 5, Duration.ofSeconds(1));

    assertThat(meterRegistry.get("rag.retrieve").timer().count()).isEqualTo(2);
  }
}
