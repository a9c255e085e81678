package com.flamingo.ai.legalrag.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for a retrieved paragraph record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParagraphResponse {

  private long id;

  @JsonProperty("doc_id")
  private int docId;

  @JsonProperty("chapter_id")
  private int chapterId;

  @JsonProperty("paragraph_id")
  private int paragraphId;

  private String text;

  public static ParagraphResponse fromEntity(Paragraph paragraph) {
    return ParagraphResponse.builder()
        .id(paragraph.getId())
        .docId(paragraph.getDocId())
        .chapterId(paragraph.getChapterId())
        .paragraphId(paragraph.getParagraphId())
        .text(paragraph.getText())
        .build();
  }
}
