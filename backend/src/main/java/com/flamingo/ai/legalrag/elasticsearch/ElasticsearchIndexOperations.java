package com.flamingo.ai.legalrag.elasticsearch;

import java.util.Collection;
import java.util.List;

/**
 * Lifecycle and write operations shared by the paragraph indexes. Documents are addressed by the
 * record store id of the paragraph they describe.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /** Creates the index if absent, otherwise brings its mapping up to date. */
  void initIndex();

  /**
   * Writes documents in one bulk request, replacing any document with the same record id.
   *
   * @param documents the documents to write
   * @throws com.flamingo.ai.legalrag.exception.IndexingException if any document is rejected
   */
  void indexDocuments(List<T> documents);

  /**
   * Removes the documents of the given records. Unknown ids are ignored.
   *
   * @param ids record ids
   */
  void deleteByIds(Collection<Long> ids);

  /** Drops every document by deleting and re-creating the index. */
  void recreateIndex();

  /** Makes writes so far visible to search. */
  void refresh();

  String getIndexName();
}
