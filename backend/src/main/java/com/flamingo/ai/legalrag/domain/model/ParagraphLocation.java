package com.flamingo.ai.legalrag.domain.model;

import com.flamingo.ai.legalrag.domain.entity.Paragraph;

/** Addressable coordinate of a paragraph inside the legal corpus. Carries no text. */
public record ParagraphLocation(int docId, int chapterId, int paragraphId) {

  public static ParagraphLocation of(Paragraph paragraph) {
    return new ParagraphLocation(
        paragraph.getDocId(), paragraph.getChapterId(), paragraph.getParagraphId());
  }
}
