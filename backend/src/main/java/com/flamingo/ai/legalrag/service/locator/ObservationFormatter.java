package com.flamingo.ai.legalrag.service.locator;

import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Renders retrieved paragraphs as the tool observation shown to the reasoning engine. */
@Component
public class ObservationFormatter {

  static final String NO_RESULTS = "No relevant documents found for this query.";
  static final String SEPARATOR = "\n---\n";

  public String format(List<Paragraph> paragraphs) {
    if (paragraphs.isEmpty()) {
      return NO_RESULTS;
    }
    return paragraphs.stream()
        .map(ObservationFormatter::formatOne)
        .collect(Collectors.joining(SEPARATOR));
  }

  private static String formatOne(Paragraph p) {
    return String.format(
        "Source (doc_id: %d, chapter_id: %d, paragraph_id: %d):\nContent: %s\n",
        p.getDocId(), p.getChapterId(), p.getParagraphId(), p.getText());
  }
}
