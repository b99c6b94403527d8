package com.flamingo.ai.deepresearch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying a planning command. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanningCommandRequest {

  @NotBlank(message = "Command is required")
  private String command;
}
