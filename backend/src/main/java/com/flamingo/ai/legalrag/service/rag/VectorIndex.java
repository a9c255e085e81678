package com.flamingo.ai.legalrag.service.rag;

import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import java.util.Collection;
import java.util.List;

/**
 * Nearest-neighbour index over paragraph embeddings, keyed by the record store id. The
 * dimensionality is fixed when the index is created; vectors of any other length are rejected
 * with {@link com.flamingo.ai.legalrag.exception.DimensionMismatchException}.
 */
public interface VectorIndex {

  /** A point to upsert: its id, embedding and the location carried as payload. */
  record VectorPoint(long id, List<Float> vector, ParagraphLocation location) {}

  void upsert(VectorPoint point);

  void upsertAll(Collection<VectorPoint> points);

  /**
   * Similarity search.
   *
   * @param vector query embedding
   * @param k maximum number of hits
   * @return at most {@code k} hits ordered by similarity descending
   */
  List<SearchHit> search(List<Float> vector, int k);

  int dimensions();

  void deleteAll(Collection<Long> ids);

  void recreate();

  void refresh();
}
