package com.flamingo.ai.legalrag.api.rest;

import com.flamingo.ai.legalrag.api.dto.response.ParagraphResponse;
import com.flamingo.ai.legalrag.config.RagConfig;
import com.flamingo.ai.legalrag.service.rag.HybridRetriever;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing the hybrid retriever for retrieval debugging. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchController {

  private static final int MAX_K = 50;

  private final HybridRetriever hybridRetriever;
  private final RagConfig ragConfig;

  /** Runs hybrid retrieval and returns the fused records in rank order. */
  @GetMapping("/search")
  public ResponseEntity<List<ParagraphResponse>> search(
      @RequestParam("query") String query, @RequestParam(value = "k", required = false) Integer k) {
    int limit = k == null ? ragConfig.getRetrieval().getTopK() : Math.min(Math.max(k, 1), MAX_K);
    List<ParagraphResponse> results =
        hybridRetriever.retrieve(query, limit).stream().map(ParagraphResponse::fromEntity).toList();
    return ResponseEntity.ok(results);
  }
}
