package com.flamingo.ai.legalrag.service.ingestion;

import com.flamingo.ai.legalrag.config.RagConfig;
import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;
import com.flamingo.ai.legalrag.exception.IndexingException;
import com.flamingo.ai.legalrag.service.ingestion.model.IngestionReport;
import com.flamingo.ai.legalrag.service.ingestion.model.PreparedParagraph;
import com.flamingo.ai.legalrag.service.ingestion.model.RawDocument;
import com.flamingo.ai.legalrag.service.rag.EmbeddingService;
import com.flamingo.ai.legalrag.service.rag.KeywordIndex;
import com.flamingo.ai.legalrag.service.rag.VectorIndex;
import com.flamingo.ai.legalrag.service.store.ParagraphStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of IngestionService writing to SQLite and both Elasticsearch indexes. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionServiceImpl implements IngestionService {

  private final RawDocumentLoader rawDocumentLoader;
  private final HtmlCleaner htmlCleaner;
  private final ParagraphStore paragraphStore;
  private final KeywordIndex keywordIndex;
  private final VectorIndex vectorIndex;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public IngestionReport ingestDirectory() {
    return ingestDirectory(Path.of(ragConfig.getIngestion().getSourceDir()));
  }

  @Override
  @Timed(value = "ingestion.run", description = "Time to ingest a source directory")
  public IngestionReport ingestDirectory(Path sourceDir) {
    log.info("Loading and preparing data from directory: {}", sourceDir.toAbsolutePath());
    List<RawDocument> documents = rawDocumentLoader.load(sourceDir);

    List<PreparedParagraph> prepared = new ArrayList<>();
    int total = 0;
    for (RawDocument document : documents) {
      total += document.chapters().stream().mapToInt(c -> c.paragraphs().size()).sum();
      prepared.addAll(prepare(document));
    }
    int skipped = total - prepared.size();
    log.info(
        "Prepared {} paragraphs from {} files ({} skipped)",
        prepared.size(),
        documents.size(),
        skipped);

    if (ragConfig.getIngestion().isRecreate()) {
      resetStores();
    }

    int stored = ingest(prepared);
    IngestionReport report =
        IngestionReport.builder()
            .files(documents.size())
            .prepared(prepared.size())
            .skipped(skipped)
            .stored(stored)
            .build();
    log.info("Ingestion complete: {}", report);
    return report;
  }

  @Override
  public List<PreparedParagraph> prepare(RawDocument document) {
    int minLength = ragConfig.getIngestion().getMinParagraphLength();
    List<PreparedParagraph> prepared = new ArrayList<>();
    for (RawDocument.RawChapter chapter : document.chapters()) {
      for (RawDocument.RawParagraph paragraph : chapter.paragraphs()) {
        if (paragraph.content() == null || paragraph.content().isEmpty()) {
          continue;
        }
        if (document.id() == null || chapter.id() == null || paragraph.id() == null) {
          log.warn(
              "Skipping paragraph without a full location (doc={}, chapter={}, paragraph={})",
              document.id(),
              chapter.id(),
              paragraph.id());
          continue;
        }
        String text = htmlCleaner.clean(paragraph.content());
        // very short fragments are headings or numbering
        if (text.length() < minLength) {
          continue;
        }
        prepared.add(
            new PreparedParagraph(
                text, new ParagraphLocation(document.id(), chapter.id(), paragraph.id())));
      }
    }
    return prepared;
  }

  @Override
  public int ingest(List<PreparedParagraph> paragraphs) {
    int batchSize = Math.max(ragConfig.getIngestion().getBatchSize(), 1);
    int stored = 0;
    for (int start = 0; start < paragraphs.size(); start += batchSize) {
      List<PreparedParagraph> batch =
          paragraphs.subList(start, Math.min(start + batchSize, paragraphs.size()));
      stored += ingestBatch(batch);
      log.info("Ingested {}/{} paragraphs", stored, paragraphs.size());
    }
    keywordIndex.refresh();
    vectorIndex.refresh();
    meterRegistry.counter("ingestion.paragraphs.stored").increment(stored);
    return stored;
  }

  private int ingestBatch(List<PreparedParagraph> batch) {
    List<Paragraph> records =
        paragraphStore.putAll(
            batch.stream()
                .map(
                    p ->
                        Paragraph.builder()
                            .docId(p.location().docId())
                            .chapterId(p.location().chapterId())
                            .paragraphId(p.location().paragraphId())
                            .text(p.text())
                            .build())
                .toList());
    List<Long> ids = records.stream().map(Paragraph::getId).toList();

    try {
      List<List<Float>> embeddings =
          embeddingService.embedTexts(records.stream().map(Paragraph::getText).toList());
      List<VectorIndex.VectorPoint> points = new ArrayList<>(records.size());
      for (int i = 0; i < records.size(); i++) {
        Paragraph record = records.get(i);
        points.add(
            new VectorIndex.VectorPoint(
                record.getId(), embeddings.get(i), ParagraphLocation.of(record)));
      }
      keywordIndex.indexAll(records);
      vectorIndex.upsertAll(points);
      return records.size();
    } catch (RuntimeException e) {
      log.error(
          "Failed to index batch of {} paragraphs, rolling back ids {}..{}: {}",
          records.size(),
          ids.get(0),
          ids.get(ids.size() - 1),
          e.getMessage(),
          e);
      meterRegistry.counter("ingestion.batches.failed").increment();
      try {
        rollback(ids);
      } catch (RuntimeException rollbackFailure) {
        log.error(
            "Rollback of ids {}..{} failed: {}",
            ids.get(0),
            ids.get(ids.size() - 1),
            rollbackFailure.getMessage());
        e.addSuppressed(rollbackFailure);
      }
      if (e instanceof IndexingException indexingException) {
        throw indexingException;
      }
      throw new IndexingException("Failed to index batch starting at id " + ids.get(0), e);
    }
  }

  private void rollback(List<Long> ids) {
    try {
      keywordIndex.deleteAll(ids);
      vectorIndex.deleteAll(ids);
    } finally {
      paragraphStore.deleteAll(ids);
    }
  }

  private void resetStores() {
    log.info("Recreating record store and indexes");
    paragraphStore.clear();
    keywordIndex.recreate();
    vectorIndex.recreate();
  }
}
