package com.flamingo.ai.legalrag.service.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.legalrag.service.ingestion.model.RawDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads raw legal documents ({@code *.json}) from a directory in file-name order. */
@Component
@RequiredArgsConstructor
@Slf4j
public class RawDocumentLoader {

  private final ObjectMapper objectMapper;

  /**
   * Loads every readable document. Files that cannot be read or parsed are logged and skipped; a
   * missing directory yields an empty list.
   */
  public List<RawDocument> load(Path directory) {
    if (!Files.isDirectory(directory)) {
      log.error("Source directory not found: {}", directory.toAbsolutePath());
      return List.of();
    }

    List<Path> files;
    try (Stream<Path> entries = Files.list(directory)) {
      files =
          entries
              .filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().endsWith(".json"))
              .sorted()
              .toList();
    } catch (IOException e) {
      log.error("Failed to list source directory {}: {}", directory, e.getMessage(), e);
      return List.of();
    }

    List<RawDocument> documents = new ArrayList<>(files.size());
    for (Path file : files) {
      try {
        RawDocument document = objectMapper.readValue(file.toFile(), RawDocument.class);
        documents.add(document);
        log.info(
            "Loaded {} (doc_id={}, chapters={})",
            file.getFileName(),
            document.id(),
            document.chapters().size());
      } catch (IOException e) {
        log.warn("Skipping {}: {}", file.getFileName(), e.getMessage());
      }
    }
    return documents;
  }
}
