package com.flamingo.ai.legalrag.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Document stored in the vector index. Besides the embedding it carries the paragraph location as
 * payload so a vector hit can be traced without the record store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParagraphVectorDocument {

  private long id;
  private List<Float> embedding;
  private int docId;
  private int chapterId;
  private int paragraphId;
}
