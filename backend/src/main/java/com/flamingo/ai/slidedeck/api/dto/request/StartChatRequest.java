package com.flamingo.ai.slidedeck.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a guided conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartChatRequest {

  @NotBlank(message = "Template is required")
  @Size(max = 100, message = "Template must not exceed 100 characters")
  private String template;
}
