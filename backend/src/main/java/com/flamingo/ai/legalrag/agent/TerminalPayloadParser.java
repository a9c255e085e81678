package com.flamingo.ai.legalrag.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the final answer of the agent.
 *
 * <p>Exactly one balanced top-level JSON object is extracted, ignoring code fences and any text
 * around it. Braces inside JSON strings do not count.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TerminalPayloadParser {

  private final ObjectMapper objectMapper;

  public TerminalPayload parse(String payload) {
    if (payload == null) {
      return new TerminalPayload.Malformed("no JSON object found", "");
    }
    List<String> objects = extractObjects(payload);
    if (objects.isEmpty()) {
      return new TerminalPayload.Malformed("no JSON object found", payload);
    }
    if (objects.size() > 1) {
      return new TerminalPayload.Malformed(
          "expected one JSON object but found " + objects.size(), payload);
    }

    JsonNode node;
    try {
      node = objectMapper.readTree(objects.get(0));
    } catch (JsonProcessingException e) {
      log.debug("Final answer is not valid JSON: {}", e.getOriginalMessage());
      return new TerminalPayload.Malformed("invalid JSON: " + e.getOriginalMessage(), payload);
    }

    if (node.hasNonNull("error")) {
      return new TerminalPayload.Failure(node.get("error").asText());
    }
    JsonNode docId = node.get("doc_id");
    JsonNode chapterId = node.get("chapter_id");
    JsonNode paragraphId = node.get("paragraph_id");
    if (!isInt(docId) || !isInt(chapterId) || !isInt(paragraphId)) {
      return new TerminalPayload.Malformed(
          "expected integer doc_id, chapter_id and paragraph_id", payload);
    }
    return new TerminalPayload.Success(
        new ParagraphLocation(docId.intValue(), chapterId.intValue(), paragraphId.intValue()));
  }

  private static boolean isInt(JsonNode node) {
    return node != null && node.isIntegralNumber() && node.canConvertToInt();
  }

  /** Returns the top-level {@code {...}} spans of the text in order of appearance. */
  static List<String> extractObjects(String text) {
    List<String> objects = new ArrayList<>();
    int depth = 0;
    int start = -1;
    boolean inString = false;
    boolean escaped = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"' && depth > 0) {
        inString = true;
      } else if (c == '{') {
        if (depth == 0) {
          start = i;
        }
        depth++;
      } else if (c == '}' && depth > 0) {
        depth--;
        if (depth == 0) {
          objects.add(text.substring(start, i + 1));
        }
      }
    }
    return objects;
  }
}
