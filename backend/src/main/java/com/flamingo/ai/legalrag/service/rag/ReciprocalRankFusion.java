package com.flamingo.ai.legalrag.service.rag;

import com.flamingo.ai.legalrag.service.rag.model.FusedHit;
import com.flamingo.ai.legalrag.service.rag.model.SearchHit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Reciprocal Rank Fusion over ranked hit lists.
 *
 * <p>RRF score = Σ 1/(k + rank + 1) over every list an id appears in, with 0-based ranks taken
 * from list position. Ties on the fused score are broken by ascending id, so the output order is
 * deterministic.
 */
@Slf4j
public final class ReciprocalRankFusion {

  private static final Comparator<FusedHit> FUSED_ORDER =
      Comparator.comparingDouble(FusedHit::fusedScore)
          .reversed()
          .thenComparingLong(FusedHit::id);

  private ReciprocalRankFusion() {}

  /**
   * Fuses the lists into one ranking.
   *
   * @param rankedLists hit lists, each in source rank order
   * @param rrfK smoothing constant
   * @return every distinct id with its fused score, best first
   */
  public static List<FusedHit> fuse(List<List<SearchHit>> rankedLists, int rrfK) {
    Map<Long, Double> rrfScores = new LinkedHashMap<>();
    for (List<SearchHit> hits : rankedLists) {
      for (int rank = 0; rank < hits.size(); rank++) {
        rrfScores.merge(hits.get(rank).id(), 1.0 / (rrfK + rank + 1), Double::sum);
      }
    }
    List<FusedHit> fused =
        rrfScores.entrySet().stream()
            .map(e -> new FusedHit(e.getKey(), e.getValue()))
            .sorted(FUSED_ORDER)
            .toList();
    log.debug("[RRF] lists={} unique ids={} rrfK={}", rankedLists.size(), fused.size(), rrfK);
    return fused;
  }

  /** Fuses and keeps the best {@code limit} ids. */
  public static List<FusedHit> fuse(List<List<SearchHit>> rankedLists, int rrfK, int limit) {
    List<FusedHit> fused = fuse(rankedLists, rrfK);
    return fused.size() <= limit ? fused : fused.subList(0, Math.max(limit, 0));
  }
}
