package com.flamingo.ai.legalrag.service.ingestion;

import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/** Strips HTML markup from paragraph content and collapses whitespace. */
@Component
public class HtmlCleaner {

  public String clean(String rawHtml) {
    if (rawHtml == null || rawHtml.isBlank()) {
      return "";
    }
    // text() decodes entities and normalizes whitespace
    String text = Jsoup.parseBodyFragment(rawHtml).body().text();
    return text.replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
  }
}
