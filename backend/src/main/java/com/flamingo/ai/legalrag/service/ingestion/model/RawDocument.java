package com.flamingo.ai.legalrag.service.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Source document as stored in the raw data directory. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawDocument(Integer id, List<RawChapter> chapters) {

  public List<RawChapter> chapters() {
    return chapters == null ? List.of() : chapters;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RawChapter(Integer id, List<RawParagraph> paragraphs) {

    public List<RawParagraph> paragraphs() {
      return paragraphs == null ? List.of() : paragraphs;
    }
  }

  /** A paragraph whose content may contain HTML markup. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RawParagraph(Integer id, String content) {}
}
