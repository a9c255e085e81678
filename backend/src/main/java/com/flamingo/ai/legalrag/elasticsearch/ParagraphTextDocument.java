package com.flamingo.ai.legalrag.elasticsearch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Document stored in the keyword index. Its {@code _id} is the record store id. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParagraphTextDocument {

  private long id;
  private String text;
}
