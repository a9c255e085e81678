package com.flamingo.ai.legalrag.api.rest;

import com.flamingo.ai.legalrag.api.dto.request.LocateParagraphRequest;
import com.flamingo.ai.legalrag.api.dto.response.ParagraphLocationResponse;
import com.flamingo.ai.legalrag.domain.model.ParagraphLocation;
import com.flamingo.ai.legalrag.service.locator.ParagraphLocatorService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for locating justification paragraphs. */
@RestController
@RequestMapping
@RequiredArgsConstructor
@Slf4j
public class ParagraphLocatorController {

  private final ParagraphLocatorService paragraphLocatorService;

  /** Finds the paragraph that justifies the correct answer to the question. */
  @PostMapping("/find_paragraph")
  public ResponseEntity<ParagraphLocationResponse> findParagraph(
      @Valid @RequestBody LocateParagraphRequest request) {
    log.info("Received find_paragraph request");
    ParagraphLocation location =
        paragraphLocatorService.locate(
            request.getQuestion().getText(), request.getCorrectAnswers());
    log.info("Located paragraph {}", location);
    return ResponseEntity.ok(ParagraphLocationResponse.from(location));
  }

  @GetMapping("/")
  public ResponseEntity<Map<String, String>> root() {
    return ResponseEntity.ok(
        Map.of("message", "Legal paragraph locator. POST a question to /find_paragraph."));
  }
}
