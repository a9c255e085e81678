package com.flamingo.ai.legalrag.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for locating the paragraph that justifies an answer. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocateParagraphRequest {

  @Valid
  @NotNull(message = "Question is required")
  private QuestionDetail question;

  /** All answer options. Not used for the search. */
  private List<String> answers = new ArrayList<>();

  @NotEmpty(message = "At least one correct answer is required")
  private List<String> correctAnswers;
}
