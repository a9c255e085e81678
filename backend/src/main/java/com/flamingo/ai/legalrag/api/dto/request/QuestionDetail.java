package com.flamingo.ai.legalrag.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The exam question. An attached image is accepted but not used for search. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuestionDetail {

  @NotBlank(message = "Question text is required")
  private String text;

  private String imageBase64;
}
