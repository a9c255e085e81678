package com.flamingo.ai.legalrag.service.locator;

import com.flamingo.ai.legalrag.agent.ParagraphSearchPrompt;
import com.flamingo.ai.legalrag.config.RagConfig;
import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;
import com.flamingo.ai.legalrag.exception.JustificationNotFoundException;
import com.flamingo.ai.legalrag.exception.MalformedAgentOutputException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Locates the paragraph that justifies a correct answer to a question. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParagraphLocatorService {

  private final QueryRefinementLoop queryRefinementLoop;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the refinement loop and returns the located paragraph.
   *
   * @param question question text
   * @param correctAnswers answers known to be correct
   * @return location of the justifying paragraph
   * @throws JustificationNotFoundException if the engine gave up or ran out of iterations
   * @throws MalformedAgentOutputException if the final answer could not be interpreted
   * @throws com.flamingo.ai.legalrag.exception.LocatorTimeoutException if the request deadline
   *     passed
   */
  public ParagraphLocation locate(String question, List<String> correctAnswers) {
    String taskInput = ParagraphSearchPrompt.taskInput(question, correctAnswers);
    Instant deadline =
        Instant.now().plus(Duration.ofSeconds(ragConfig.getAgent().getRequestTimeoutSeconds()));
    log.info("Locating justification for question ({} chars)", question.length());

    LoopOutcome outcome = queryRefinementLoop.run(taskInput, deadline);
    meterRegistry.counter("locator.requests").increment();

    if (outcome instanceof LoopOutcome.Located located) {
      return located.location();
    }
    if (outcome instanceof LoopOutcome.NotFound notFound) {
      throw new JustificationNotFoundException(notFound.reason(), false);
    }
    if (outcome instanceof LoopOutcome.IterationLimitExceeded) {
      throw new JustificationNotFoundException(
          LoopOutcome.IterationLimitExceeded.REASON, true);
    }
    if (outcome instanceof LoopOutcome.MalformedPayload malformed) {
      throw new MalformedAgentOutputException(
          "Agent returned an unreadable final answer: " + malformed.problem(),
          malformed.rawPayload());
    }
    throw new IllegalStateException("Unknown loop outcome: " + outcome);
  }
}
