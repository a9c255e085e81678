package com.flamingo.ai.legalrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import co.elastic.clients.elasticsearch.indices.get_mapping.IndexMappingRecord;
import com.flamingo.ai.legalrag.exception.IndexingException;
import com.flamingo.ai.legalrag.exception.SourceUnavailableException;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for the paragraph indexes stored in Elasticsearch.
 *
 * <p>Provides index bootstrap and mapping validation, bulk writes, deletion by record id and
 * execution of ranked searches. Subclasses define the schema, the document conversion and the
 * search request. Every document's {@code _id} is the record store id.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Returns the Elasticsearch index name.
   *
   * @return the index name
   */
  @Override
  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  /**
   * Converts a document to the map sent to Elasticsearch.
   *
   * @param document the document to convert
   * @return the Elasticsearch document map
   */
  protected abstract Map<String, Object> convertToDocument(T document);

  /**
   * Extracts the record id that becomes the Elasticsearch {@code _id}.
   *
   * @param document the document
   * @return the record id
   */
  protected abstract long getRecordId(T document);

  /**
   * Returns the metric prefix for this index (e.g., "keyword_index", "vector_index").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  /** Name of the retrieval source served by this index, used in errors and logs. */
  protected abstract String getSourceName();

  /**
   * Creates the index on first start, or checks an existing index against the declared schema.
   * Fields missing from an existing index are added; a field whose type changed cannot be fixed in
   * place and stops startup until ingestion recreates the index.
   */
  @PostConstruct
  @Override
  public void initIndex() {
    ElasticsearchIndicesClient indices = elasticsearchClient.indices();
    if (indices == null) {
      log.warn("No Elasticsearch indices client, index {} left unchecked", getIndexName());
      return;
    }
    try {
      if (indices.exists(e -> e.index(getIndexName())).value()) {
        reconcileMappings(indices);
      } else {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      }
    } catch (IOException e) {
      throw new IllegalStateException(
          "Elasticsearch unreachable while preparing " + getIndexName(), e);
    }
  }

  /**
   * Checks the mapping of an index that already exists, after field types have been verified.
   * Subclasses override this to reject settings that cannot change once documents are stored.
   *
   * @param actualProperties the properties currently mapped in Elasticsearch
   */
  protected void verifyExistingMapping(Map<String, Property> actualProperties) {}

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  private void reconcileMappings(ElasticsearchIndicesClient indices) throws IOException {
    IndexMappingRecord mapping =
        indices.getMapping(g -> g.index(getIndexName())).get(getIndexName());
    if (mapping == null) {
      return;
    }
    Map<String, Property> actual = mapping.mappings().properties();
    Map<String, Property> declared = defineIndexProperties();

    List<String> conflicts =
        declared.entrySet().stream()
            .filter(e -> actual.containsKey(e.getKey()))
            .filter(e -> actual.get(e.getKey())._kind() != e.getValue()._kind())
            .map(
                e ->
                    String.format(
                        "%s is %s, expected %s",
                        e.getKey(), actual.get(e.getKey())._kind(), e.getValue()._kind()))
            .toList();
    if (!conflicts.isEmpty()) {
      log.error("Index {} has incompatible fields: {}", getIndexName(), conflicts);
      throw new IllegalStateException(
          String.format(
              "Index '%s' has incompatible fields (%s). Re-run ingestion with"
                  + " rag.ingestion.recreate=true to rebuild it.",
              getIndexName(), String.join("; ", conflicts)));
    }
    verifyExistingMapping(actual);

    Map<String, Property> added = new HashMap<>(declared);
    added.keySet().removeAll(actual.keySet());
    if (added.isEmpty()) {
      log.debug("Index {} mapping is up to date", getIndexName());
      return;
    }
    indices.putMapping(PutMappingRequest.of(p -> p.index(getIndexName()).properties(added)));
    log.info("Added field(s) {} to index {}", added.keySet(), getIndexName());
  }

  @Override
  public void recreateIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
      if (exists) {
        elasticsearchClient.indices().delete(d -> d.index(getIndexName()));
        log.info("Deleted Elasticsearch index: {}", getIndexName());
      }
      createIndex();
      log.info("Recreated Elasticsearch index: {}", getIndexName());
    } catch (IOException e) {
      throw new IndexingException("Failed to recreate index '" + getIndexName() + "'", e);
    }
  }

  /**
   * Writes the documents in one bulk request. Partial failures are reported as an exception so
   * that ingestion can roll the batch back.
   */
  @Override
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = String.valueOf(getRecordId(document));
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        List<String> failedIds =
            response.items().stream()
                .filter(item -> item.error() != null)
                .map(BulkResponseItem::id)
                .toList();
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new IndexingException(
            String.format(
                "%d of %d documents failed to index in %s: %s",
                failedIds.size(), documents.size(), getIndexName(), failedIds));
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexingException("Failed to index documents to " + getIndexName(), e);
    }
  }

  @Override
  public void deleteByIds(Collection<Long> ids) {
    if (ids.isEmpty()) {
      return;
    }
    List<String> idValues = ids.stream().map(String::valueOf).toList();
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d -> d.index(getIndexName()).query(q -> q.ids(i -> i.values(idValues))));
      elasticsearchClient.deleteByQuery(request);
      log.info("Deleted {} documents from {}", ids.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(ids.size());
    } catch (IOException e) {
      log.error("Failed to delete documents from {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexingException("Failed to delete documents from " + getIndexName(), e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  /**
   * Executes a ranked search and maps the hits to {@link SearchHit}s in response order.
   *
   * @param request the search request built by the subclass
   * @param searchParam a short description of the query for logging
   * @return hits with their 0-based rank and raw score
   * @throws SourceUnavailableException if Elasticsearch cannot be reached
   */
  protected List<SearchHit> executeSearch(SearchRequest request, String searchParam) {
    try {
      SearchResponse<Void> response = elasticsearchClient.search(request, Void.class);
      List<Hit<Void>> hits = response.hits().hits();
      List<SearchHit> results = new ArrayList<>(hits.size());
      for (Hit<Void> hit : hits) {
        if (hit.id() == null) {
          continue;
        }
        double score = hit.score() != null ? hit.score() : 0.0;
        results.add(new SearchHit(Long.parseLong(hit.id()), results.size(), score));
      }
      log.info(
          "[{}] index={} param='{}' returned={}",
          getSourceName(),
          getIndexName(),
          searchParam,
          results.size());
      if (log.isDebugEnabled()) {
        results.forEach(
            h -> log.debug("  [{}] rank={} id={} score={}", getSourceName(), h.rank(), h.id(),
                h.rawScore()));
      }
      meterRegistry.counter(getMetricPrefix() + ".search").increment();
      return results;
    } catch (IOException e) {
      log.error("{} search failed for {}: {}", getSourceName(), getIndexName(), e.getMessage(), e);
      throw new SourceUnavailableException(
          getSourceName(), getSourceName() + " search failed on " + getIndexName(), e);
    }
  }
}
