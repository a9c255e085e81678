package com.flamingo.ai.legalrag.service.rag;

import com.flamingo.ai.legalrag.config.RagConfig;
import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.exception.DimensionMismatchException;
import com.flamingo.ai.legalrag.service.rag.model.FusedHit;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import com.flamingo.ai.legalrag.service.store.ParagraphStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval combining BM25 keyword search and kNN vector search with Reciprocal Rank
 * Fusion, followed by hydration from the record store.
 *
 * <p>Both sources run in parallel on the retrieval executor. A source that fails or times out
 * contributes an empty list; a vector dimension mismatch fails the whole request.
 */
@Service
@Slf4j
public class HybridRetriever {

  static final String KEYWORD = "keyword";
  static final String VECTOR = "vector";

  private final KeywordIndex keywordIndex;
  private final VectorIndex vectorIndex;
  private final EmbeddingService embeddingService;
  private final ParagraphStore paragraphStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor retrievalExecutor;

  public HybridRetriever(
      KeywordIndex keywordIndex,
      VectorIndex vectorIndex,
      EmbeddingService embeddingService,
      ParagraphStore paragraphStore,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
    this.keywordIndex = keywordIndex;
    this.vectorIndex = vectorIndex;
    this.embeddingService = embeddingService;
    this.paragraphStore = paragraphStore;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.retrievalExecutor = retrievalExecutor;
  }

  /**
   * Retrieves the best {@code k} paragraphs using the configured per-source timeout.
   *
   * @param query free-text query
   * @param k maximum number of records
   * @return records in fused order, possibly empty
   */
  @Timed(value = "rag.retrieve", description = "Time for hybrid retrieval")
  public List<Paragraph> retrieve(String query, int k) {
    return doRetrieve(
        query, k, Duration.ofMillis(ragConfig.getRetrieval().getSourceTimeoutMs()));
  }

  /**
   * Retrieves the best {@code k} paragraphs.
   *
   * @param query free-text query
   * @param k maximum number of records
   * @param sourceTimeout upper bound for each source call
   * @return records in fused order, possibly empty
   * @throws DimensionMismatchException if the query embedding does not fit the vector index
   */
  @Timed(value = "rag.retrieve", description = "Time for hybrid retrieval")
  public List<Paragraph> retrieve(String query, int k, Duration sourceTimeout) {
    return doRetrieve(query, k, sourceTimeout);
  }

  private List<Paragraph> doRetrieve(String query, int k, Duration sourceTimeout) {
    if (k <= 0) {
      return List.of();
    }
    log.debug("Starting hybrid retrieval, k={}, query='{}'", k, query);

    CompletableFuture<List<SearchHit>> keywordFuture =
        submit(KEYWORD, () -> keywordIndex.search(query, k));
    CompletableFuture<List<SearchHit>> vectorFuture = submit(VECTOR, () -> vectorSearch(query, k));

    long deadline = System.nanoTime() + sourceTimeout.toNanos();
    List<SearchHit> keywordHits = await(KEYWORD, keywordFuture, deadline);
    List<SearchHit> vectorHits = await(VECTOR, vectorFuture, deadline);

    List<FusedHit> fused =
        ReciprocalRankFusion.fuse(
            List.of(keywordHits, vectorHits), ragConfig.getRetrieval().getRrfK(), k);
    log.info(
        "[Retrieve] keyword={} vector={} fused={} k={}",
        keywordHits.size(),
        vectorHits.size(),
        fused.size(),
        k);

    List<Paragraph> results = hydrate(fused);
    meterRegistry.counter("rag.retrieve.success").increment();
    return results;
  }

  /** A source the executor cannot accept fails on its own, like any other source error. */
  private CompletableFuture<List<SearchHit>> submit(
      String source, Supplier<List<SearchHit>> search) {
    try {
      return CompletableFuture.supplyAsync(search, retrievalExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("[Retrieve] retrieval executor rejected the {} source: {}", source, e.getMessage());
      return CompletableFuture.failedFuture(e);
    }
  }

  private List<SearchHit> vectorSearch(String query, int k) {
    List<Float> embedding = embeddingService.embedQuery(query);
    if (embedding.isEmpty()) {
      log.warn("Failed to generate query embedding, continuing with keyword results only");
      meterRegistry.counter("rag.retrieve.source.fallback", "source", VECTOR).increment();
      return List.of();
    }
    return vectorIndex.search(embedding, k);
  }

  private List<SearchHit> await(
      String source, CompletableFuture<List<SearchHit>> future, long deadlineNanos) {
    try {
      long remaining = Math.max(deadlineNanos - System.nanoTime(), 0);
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof DimensionMismatchException mismatch) {
        log.error("[Retrieve] {} source rejected the query vector: {}", source, cause.getMessage());
        throw mismatch;
      }
      log.warn(
          "[Retrieve] {} source unavailable, continuing without it: {}",
          source,
          cause.getMessage());
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("[Retrieve] {} source timed out, continuing without it", source);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      log.warn("[Retrieve] interrupted while waiting for {} source", source);
    }
    meterRegistry.counter("rag.retrieve.source.fallback", "source", source).increment();
    return List.of();
  }

  private List<Paragraph> hydrate(List<FusedHit> fused) {
    if (fused.isEmpty()) {
      return List.of();
    }
    Map<Long, Paragraph> records =
        paragraphStore.getMany(fused.stream().map(FusedHit::id).toList());
    List<Paragraph> results = new ArrayList<>(fused.size());
    for (FusedHit hit : fused) {
      Paragraph paragraph = records.get(hit.id());
      if (paragraph == null) {
        log.warn("[Retrieve] id {} is indexed but missing from the record store", hit.id());
        meterRegistry.counter("rag.retrieve.missing_records").increment();
        continue;
      }
      log.debug(
          "  [{}] id={} score={} doc={} chapter={} paragraph={}",
          results.size(),
          hit.id(),
          String.format("%.5f", hit.fusedScore()),
          paragraph.getDocId(),
          paragraph.getChapterId(),
          paragraph.getParagraphId());
      results.add(paragraph);
    }
    return results;
  }
}
