package com.flamingo.ai.legalrag.service.rag;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for generating text embeddings using OpenAI's embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; keep a wide margin for dense legal text
  static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a search query. Returns an empty list when the provider fails, so the caller can skip
   * vector search.
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String query) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(query, 0));
      meterRegistry.counter("embedding.requests.success").increment();
      List<Float> result = toList(response.content().vector());
      log.debug("Query embedding generated, vector dimension: {}", result.size());
      return result;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /**
   * Embeds paragraph texts in one provider call, preserving input order. Failures propagate so
   * that ingestion can roll the batch back.
   */
  @Retry(name = "openai")
  public List<List<Float>> embedTexts(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = new ArrayList<>(texts.size());
      for (int i = 0; i < texts.size(); i++) {
        segments.add(TextSegment.from(truncate(texts.get(i), i)));
      }
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<Embedding> embeddings = response.content();
      if (embeddings.size() != texts.size()) {
        throw new IllegalStateException(
            String.format(
                "Embedding provider returned %d vectors for %d texts",
                embeddings.size(), texts.size()));
      }
      List<List<Float>> results = new ArrayList<>(embeddings.size());
      for (Embedding embedding : embeddings) {
        results.add(toList(embedding.vector()));
      }
      meterRegistry.counter("embedding.batch.success").increment();
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.warn("Query embedding failed, vector search will be skipped: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  private static String truncate(String text, int position) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        position,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
