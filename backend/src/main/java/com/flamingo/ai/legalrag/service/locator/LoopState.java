package com.flamingo.ai.legalrag.service.locator;

import com.flamingo.ai.legalrag.agent.ParagraphSearchPrompt;
import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Conversation and budget bookkeeping for one refinement run. Not thread-safe. */
class LoopState {

  private final List<ChatMessage> messages = new ArrayList<>();
  private final Set<ParagraphLocation> observedLocations = new HashSet<>();
  private int iterations;

  LoopState(String taskInput) {
    messages.add(SystemMessage.from(ParagraphSearchPrompt.SYSTEM_PROMPT));
    messages.add(UserMessage.from(taskInput));
  }

  List<ChatMessage> messages() {
    return Collections.unmodifiableList(messages);
  }

  int iterations() {
    return iterations;
  }

  /** Appends a tool round trip and consumes one unit of budget. */
  void recordToolCall(String turnText, String observation, List<Paragraph> paragraphs) {
    appendObservation(turnText, observation);
    paragraphs.forEach(p -> observedLocations.add(ParagraphLocation.of(p)));
  }

  /** Appends a corrective observation for an unparseable turn and consumes one unit of budget. */
  void recordCorrection(String turnText, String correction) {
    appendObservation(turnText, correction);
  }

  boolean wasObserved(ParagraphLocation location) {
    return observedLocations.contains(location);
  }

  private void appendObservation(String turnText, String observation) {
    messages.add(AiMessage.from(turnText == null ? "" : turnText));
    messages.add(UserMessage.from("Observation: " + observation));
    iterations++;
  }
}
