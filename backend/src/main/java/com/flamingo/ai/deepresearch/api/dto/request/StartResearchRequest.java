package com.flamingo.ai.deepresearch.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a research session. Null overrides keep the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartResearchRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 2000, message = "Question must be at most 2000 characters")
  private String question;

  @Min(value = 1, message = "maxResearchLoops must be at least 1")
  @Max(value = 10, message = "maxResearchLoops must be at most 10")
  private Integer maxResearchLoops;

  @Min(value = 1, message = "initialQueryCount must be at least 1")
  @Max(value = 10, message = "initialQueryCount must be at most 10")
  private Integer initialQueryCount;

  private Boolean requirePlanningConfirmation;
}
