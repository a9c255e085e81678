package com.flamingo.ai.legalrag.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;

/** Location of the justifying paragraph, serialized with snake_case keys. */
public record ParagraphLocationResponse(
    @JsonProperty("doc_id") int docId,
    @JsonProperty("chapter_id") int chapterId,
    @JsonProperty("paragraph_id") int paragraphId) {

  public static ParagraphLocationResponse from(ParagraphLocation location) {
    return new ParagraphLocationResponse(
        location.docId(), location.chapterId(), location.paragraphId());
  }
}
