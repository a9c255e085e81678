package com.flamingo.ai.legalrag.service.rag;

import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import java.util.Collection;
import java.util.List;

/** Full-text index over paragraph text, keyed by the record store id. */
public interface KeywordIndex {

  /**
   * Indexes the text under the given id, replacing whatever was indexed for that id before.
   *
   * @param id record id
   * @param text paragraph text
   */
  void index(long id, String text);

  /** Bulk variant of {@link #index(long, String)} using each paragraph's id and text. */
  void indexAll(Collection<Paragraph> paragraphs);

  /**
   * Ranked full-text match. The query is sanitized first; a query with nothing left to match
   * returns an empty list.
   *
   * @param query free-text query
   * @param k maximum number of hits
   * @return at most {@code k} hits in source rank order
   */
  List<SearchHit> search(String query, int k);

  void deleteAll(Collection<Long> ids);

  /** Drops and recreates the underlying index. */
  void recreate();

  /** Makes recent writes visible to search. */
  void refresh();
}
