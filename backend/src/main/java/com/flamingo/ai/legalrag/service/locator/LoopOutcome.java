package com.flamingo.ai.legalrag.service.locator;

import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;

/** Terminal state of one query refinement run. */
public interface LoopOutcome {

  /** Number of reasoning turns that consumed budget before the loop ended. */
  int iterations();

  record Located(ParagraphLocation location, int iterations) implements LoopOutcome {}

  /** The engine reported that no justifying paragraph exists. */
  record NotFound(String reason, int iterations) implements LoopOutcome {}

  record IterationLimitExceeded(int iterations) implements LoopOutcome {

    public static final String REASON = "iteration limit exceeded";
  }

  /** The engine finished but its answer could not be interpreted. */
  record MalformedPayload(String problem, String rawPayload, int iterations)
      implements LoopOutcome {}
}
