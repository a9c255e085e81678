package com.flamingo.ai.legalrag.agent;

import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;

/** Interpretation of the agent's final answer. */
public interface TerminalPayload {

  record Success(ParagraphLocation location) implements TerminalPayload {}

  record Failure(String reason) implements TerminalPayload {}

  /** The payload could not be read as either a location or a failure report. */
  record Malformed(String problem, String rawPayload) implements TerminalPayload {}
}
