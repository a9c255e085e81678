package com.flamingo.ai.legalrag.agent;

/** One parsed reasoning turn of the paragraph search agent. */
public interface Turn {

  /** The engine asked for a search with the given query. */
  record ToolCall(String query) implements Turn {}

  /** The engine finished; the payload still has to be interpreted. */
  record FinalAnswer(String payload) implements Turn {}

  /** The turn followed neither format. */
  record Unparseable(String problem, String rawText) implements Turn {}
}
