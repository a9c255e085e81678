package com.flamingo.ai.legalrag.agent;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses ReAct-formatted engine output into a {@link Turn}.
 *
 * <ul>
 *   <li>{@code Final Answer: ...} is a final answer, unless the turn also requests an action
 *   <li>{@code Action: hybrid_search} with a non-blank {@code Action Input} is a tool call
 *   <li>text without markers that opens with a JSON object or a code fence is a bare final answer
 * </ul>
 *
 * Everything else is unparseable.
 */
@Component
public class TurnParser {

  private static final String FINAL_ANSWER = "Final Answer:";

  private static final Pattern ACTION =
      Pattern.compile(
          "Action\\s*\\d*\\s*:[ \\t]*(.*?)[ \\t]*\\r?\\n"
              + "\\s*Action\\s*\\d*\\s*Input\\s*\\d*\\s*:[ \\t]*(.*)",
          Pattern.DOTALL);

  private static final Pattern ACTION_MARKER = Pattern.compile("Action\\s*\\d*\\s*:");

  public Turn parse(String text) {
    if (text == null || text.isBlank()) {
      return new Turn.Unparseable("empty response", text == null ? "" : text);
    }
    boolean hasFinal = text.contains(FINAL_ANSWER);
    Matcher action = ACTION.matcher(text);
    boolean hasAction = action.find();

    if (hasFinal && hasAction) {
      return new Turn.Unparseable("response contains both an action and a final answer", text);
    }
    if (hasFinal) {
      String payload = text.substring(text.indexOf(FINAL_ANSWER) + FINAL_ANSWER.length()).trim();
      return new Turn.FinalAnswer(payload);
    }
    if (hasAction) {
      String tool = action.group(1).trim();
      if (!ParagraphSearchPrompt.TOOL_NAME.equals(tool)) {
        return new Turn.Unparseable("unknown tool '" + tool + "'", text);
      }
      String query = stripQuotes(cutAtObservation(action.group(2)).trim());
      if (query.isBlank()) {
        return new Turn.Unparseable("blank action input", text);
      }
      return new Turn.ToolCall(query);
    }
    if (ACTION_MARKER.matcher(text).find()) {
      return new Turn.Unparseable("action without 'Action Input'", text);
    }
    String trimmed = text.trim();
    if (trimmed.startsWith("{") || trimmed.startsWith("```")) {
      return new Turn.FinalAnswer(trimmed);
    }
    return new Turn.Unparseable("no action or final answer", text);
  }

  private static String cutAtObservation(String input) {
    int idx = input.indexOf("\nObservation");
    return idx >= 0 ? input.substring(0, idx) : input;
  }

  private static String stripQuotes(String input) {
    if (input.length() >= 2 && input.startsWith("\"") && input.endsWith("\"")) {
      return input.substring(1, input.length() - 1).trim();
    }
    return input;
  }
}
