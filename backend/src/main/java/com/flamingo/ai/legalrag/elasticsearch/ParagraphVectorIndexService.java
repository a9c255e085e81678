package com.flamingo.ai.legalrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.legalrag.exception.DimensionMismatchException;
import com.flamingo.ai.legalrag.service.rag.VectorIndex;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Cosine-similarity kNN index over paragraph embeddings.
 *
 * <p>Vector length is checked against the configured dimensionality before any request is sent,
 * on writes and on searches.
 */
@Service
@Slf4j
public class ParagraphVectorIndexService
    extends AbstractElasticsearchIndexService<ParagraphVectorDocument> implements VectorIndex {

  @Value("${app.elasticsearch.vector-index-name:legal-paragraphs-vectors}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public ParagraphVectorIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ParagraphVectorIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  public int dimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("docId", Property.of(p -> p.integer(i -> i)));
    properties.put("chapterId", Property.of(p -> p.integer(i -> i)));
    properties.put("paragraphId", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  /** An existing index keeps the dimensionality it was created with. */
  @Override
  protected void verifyExistingMapping(Map<String, Property> actualProperties) {
    Property embedding = actualProperties.get("embedding");
    if (embedding == null || !embedding.isDenseVector()) {
      return;
    }
    Integer existing = embedding.denseVector().dims();
    if (existing != null && existing != vectorDimensions) {
      throw new DimensionMismatchException(getIndexName(), existing, vectorDimensions);
    }
  }

  @Override
  protected Map<String, Object> convertToDocument(ParagraphVectorDocument document) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("docId", document.getDocId());
    doc.put("chapterId", document.getChapterId());
    doc.put("paragraphId", document.getParagraphId());
    doc.put("embedding", document.getEmbedding());
    return doc;
  }

  @Override
  protected long getRecordId(ParagraphVectorDocument document) {
    return document.getId();
  }

  @Override
  protected String getMetricPrefix() {
    return "vector_index";
  }

  @Override
  protected String getSourceName() {
    return "vector";
  }

  @Override
  public void upsert(VectorPoint point) {
    upsertAll(List.of(point));
  }

  @Override
  public void upsertAll(Collection<VectorPoint> points) {
    points.forEach(point -> checkDimensions(point.vector()));
    indexDocuments(points.stream().map(this::toDocument).toList());
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public List<SearchHit> search(List<Float> vector, int k) {
    checkDimensions(vector);
    if (k <= 0) {
      return List.of();
    }
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        kn ->
                            kn.field("embedding")
                                .queryVector(vector)
                                .k(k)
                                .numCandidates(Math.max(k * 10, 50)))
                    .size(k)
                    .source(src -> src.fetch(false)));
    return executeSearch(request, "knn k=" + k);
  }

  @Override
  public void deleteAll(Collection<Long> ids) {
    deleteByIds(ids);
  }

  @Override
  public void recreate() {
    recreateIndex();
  }

  private void checkDimensions(List<Float> vector) {
    int actual = vector == null ? 0 : vector.size();
    if (actual != vectorDimensions) {
      meterRegistry.counter("vector_index.dimension_mismatch").increment();
      throw new DimensionMismatchException(indexName, vectorDimensions, actual);
    }
  }

  private ParagraphVectorDocument toDocument(VectorPoint point) {
    return ParagraphVectorDocument.builder()
        .id(point.id())
        .embedding(point.vector())
        .docId(point.location().docId())
        .chapterId(point.location().chapterId())
        .paragraphId(point.location().paragraphId())
        .build();
  }
}
