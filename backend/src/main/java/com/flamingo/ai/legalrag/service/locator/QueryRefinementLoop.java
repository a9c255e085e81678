package com.flamingo.ai.legalrag.service.locator;

import com.flamingo.ai.legalrag.agent.ParagraphSearchPrompt;
import com.flamingo.ai.legalrag.agent.TerminalPayload;
import com.flamingo.ai.legalrag.agent.TerminalPayloadParser;
import com.flamingo.ai.legalrag.agent.Turn;
import com.flamingo.ai.legalrag.agent.TurnParser;
import com.flamingo.ai.legalrag.config.RagConfig;
import com.flamingo.ai.legalrag.domain.entity.Paragraph;
import com.flamingo.ai.legalrag.exception.LlmServiceException;
import com.flamingo.ai.legalrag.exception.LocatorTimeoutException;
import com.flamingo.ai.legalrag.service.rag.HybridRetriever;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Bounded ReAct loop: the reasoning engine alternates between {@code hybrid_search} calls and a
 * final answer until it answers or the iteration budget runs out.
 *
 * <p>Every tool call and every unparseable turn consumes one unit of budget. The budget, the
 * caller's deadline and the thread's interrupt flag are checked at the top of each iteration, so
 * the loop never stops in the middle of an engine or retriever call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryRefinementLoop {

  private final ChatModel chatModel;
  private final HybridRetriever hybridRetriever;
  private final TurnParser turnParser;
  private final TerminalPayloadParser terminalPayloadParser;
  private final ObservationFormatter observationFormatter;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the loop for one task.
   *
   * @param taskInput the question and its correct answers, as sent to the engine
   * @param deadline point in time after which no further iteration starts
   * @return the terminal outcome
   * @throws LocatorTimeoutException if the deadline passes or the thread is interrupted
   * @throws LlmServiceException if the reasoning engine cannot be reached
   */
  @Timed(value = "locator.loop", description = "Time for one query refinement run")
  public LoopOutcome run(String taskInput, Instant deadline) {
    int maxIterations = ragConfig.getAgent().getMaxIterations();
    LoopState state = new LoopState(taskInput);

    while (true) {
      checkDeadline(deadline, state);
      if (state.iterations() >= maxIterations) {
        log.warn("[Loop] iteration limit {} reached without a final answer", maxIterations);
        meterRegistry.counter("locator.loop.outcome", "outcome", "iteration_limit").increment();
        return new LoopOutcome.IterationLimitExceeded(state.iterations());
      }

      String text = think(state);
      Turn turn = turnParser.parse(text);

      if (turn instanceof Turn.ToolCall call) {
        String query = truncateQuery(call.query());
        log.info(
            "[Loop] iteration {}: {}('{}')",
            state.iterations() + 1,
            ParagraphSearchPrompt.TOOL_NAME,
            query);
        List<Paragraph> paragraphs =
            hybridRetriever.retrieve(query, ragConfig.getRetrieval().getTopK());
        state.recordToolCall(text, observationFormatter.format(paragraphs), paragraphs);
        meterRegistry.counter("locator.loop.tool_calls").increment();
      } else if (turn instanceof Turn.FinalAnswer answer) {
        return finish(answer.payload(), state);
      } else if (turn instanceof Turn.Unparseable unparseable) {
        log.warn(
            "[Loop] iteration {}: unparseable turn ({}): {}",
            state.iterations() + 1,
            unparseable.problem(),
            abbreviate(unparseable.rawText()));
        state.recordCorrection(text, ParagraphSearchPrompt.correction(unparseable.problem()));
        meterRegistry.counter("locator.loop.unparseable_turns").increment();
      } else {
        throw new IllegalStateException("Unknown turn type: " + turn.getClass().getName());
      }
    }
  }

  private LoopOutcome finish(String payload, LoopState state) {
    TerminalPayload parsed = terminalPayloadParser.parse(payload);
    if (parsed instanceof TerminalPayload.Success success) {
      if (!state.wasObserved(success.location())) {
        log.warn(
            "[Loop] located paragraph {} was not among the observed search results",
            success.location());
      }
      log.info("[Loop] located {} after {} iteration(s)", success.location(), state.iterations());
      meterRegistry.counter("locator.loop.outcome", "outcome", "located").increment();
      return new LoopOutcome.Located(success.location(), state.iterations());
    }
    if (parsed instanceof TerminalPayload.Failure failure) {
      log.info("[Loop] engine reported failure: {}", failure.reason());
      meterRegistry.counter("locator.loop.outcome", "outcome", "not_found").increment();
      return new LoopOutcome.NotFound(failure.reason(), state.iterations());
    }
    TerminalPayload.Malformed malformed = (TerminalPayload.Malformed) parsed;
    log.warn(
        "[Loop] malformed final answer ({}): {}",
        malformed.problem(),
        abbreviate(malformed.rawPayload()));
    meterRegistry.counter("locator.loop.outcome", "outcome", "malformed").increment();
    return new LoopOutcome.MalformedPayload(
        malformed.problem(), malformed.rawPayload(), state.iterations());
  }

  private String think(LoopState state) {
    try {
      ChatResponse response =
          chatModel.chat(ChatRequest.builder().messages(state.messages()).build());
      String text = response.aiMessage().text();
      log.debug("[Loop] engine turn: {}", text);
      return text;
    } catch (RuntimeException e) {
      log.error("Reasoning engine call failed: {}", e.getMessage(), e);
      meterRegistry.counter("locator.loop.llm_errors").increment();
      throw new LlmServiceException("Failed to get a response from the reasoning engine", e);
    }
  }

  private static void checkDeadline(Instant deadline, LoopState state) {
    if (Thread.currentThread().isInterrupted()) {
      throw new LocatorTimeoutException("Request was cancelled", state.iterations());
    }
    if (Instant.now().isAfter(deadline)) {
      throw new LocatorTimeoutException(
          "Request deadline exceeded after " + state.iterations() + " iteration(s)",
          state.iterations());
    }
  }

  private String truncateQuery(String query) {
    int max = ragConfig.getAgent().getMaxQueryLength();
    if (query.length() <= max) {
      return query;
    }
    log.debug("Truncating tool query from {} to {} chars", query.length(), max);
    return query.substring(0, max);
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }
}
