package com.flamingo.ai.legalrag.service.rag;

import java.util.regex.Pattern;

/**
 * Cleans free-text queries before they reach the keyword index. Every character that is not a
 * letter, digit or whitespace in any script becomes a space, so query-syntax operators never
 * reach the engine.
 */
public final class QuerySanitizer {

  private static final Pattern NON_WORD =
      Pattern.compile("[^\\p{L}\\p{N}\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private QuerySanitizer() {}

  /**
   * Returns the sanitized query, collapsed and trimmed. An empty result means nothing is left to
   * match.
   */
  public static String sanitize(String query) {
    if (query == null) {
      return "";
    }
    String replaced = NON_WORD.matcher(query).replaceAll(" ");
    return WHITESPACE.matcher(replaced).replaceAll(" ").trim();
  }
}
