package com.flamingo.ai.slidedeck.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating a presentation straight from a topic. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuickGenerateRequest {

  @NotBlank(message = "Topic is required")
  @Size(max = 500, message = "Topic must not exceed 500 characters")
  private String topic;

  @Size(max = 10, message = "Language must not exceed 10 characters")
  private String language;

  /** Larger values are clamped to the configured maximum. */
  @Min(value = 1, message = "At least one slide is required")
  private Integer slides;

  @DecimalMin(value = "0.0", message = "Temperature must be between 0 and 2")
  @DecimalMax(value = "2.0", message = "Temperature must be between 0 and 2")
  private Double temperature;
}
