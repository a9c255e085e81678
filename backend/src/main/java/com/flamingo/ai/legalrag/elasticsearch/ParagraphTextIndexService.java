package com.flamingo.ai.legalrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.service.rag.KeywordIndex;
import com.flamingo.ai.legalrag.service.rag.QuerySanitizer;
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

/** BM25 keyword index over paragraph text. */
@Service
@Slf4j
public class ParagraphTextIndexService
    extends AbstractElasticsearchIndexService<ParagraphTextDocument>
    implements KeywordIndex {

  @Value("${app.elasticsearch.text-index-name:legal-paragraphs-text}")
  private String indexName;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Autowired
  public ParagraphTextIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting the index name. */
  @VisibleForTesting
  public ParagraphTextIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, String indexName) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.textAnalyzer = "standard";
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    if (!"standard".equals(textAnalyzer)) {
      log.warn("Using custom analyzer '{}'. Ensure it's installed in Elasticsearch.", textAnalyzer);
    }
    Map<String, Property> properties = new HashMap<>();
    properties.put(
        "text", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(ParagraphTextDocument document) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("text", document.getText());
    return doc;
  }

  @Override
  protected long getRecordId(ParagraphTextDocument document) {
    return document.getId();
  }

  @Override
  protected String getMetricPrefix() {
    return "keyword_index";
  }

  @Override
  protected String getSourceName() {
    return "keyword";
  }

  @Override
  public void index(long id, String text) {
    indexDocuments(List.of(ParagraphTextDocument.builder().id(id).text(text).build()));
  }

  @Override
  public void indexAll(Collection<Paragraph> paragraphs) {
    indexDocuments(
        paragraphs.stream()
            .map(p -> ParagraphTextDocument.builder().id(p.getId()).text(p.getText()).build())
            .toList());
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public List<SearchHit> search(String query, int k) {
    String sanitized = QuerySanitizer.sanitize(query);
    if (sanitized.isEmpty() || k <= 0) {
      log.debug("Keyword query '{}' has nothing left to match after sanitizing", query);
      return List.of();
    }
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(q -> q.match(m -> m.field("text").query(sanitized)))
                    .size(k)
                    .source(src -> src.fetch(false)));
    return executeSearch(request, sanitized);
  }

  @Override
  public void deleteAll(Collection<Long> ids) {
    deleteByIds(ids);
  }

  @Override
  public void recreate() {
    recreateIndex();
  }
}
