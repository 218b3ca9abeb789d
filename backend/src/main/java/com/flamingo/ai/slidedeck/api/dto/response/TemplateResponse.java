package com.flamingo.ai.slidedeck.api.dto.response;

import com.flamingo.ai.slidedeck.config.PresentationConfig.Template;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a presentation template. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateResponse {

  private String key;
  private String name;
  private String description;
  private boolean guidedModeEnabled;

  public static TemplateResponse from(String key, Template template) {
    return TemplateResponse.builder()
        .key(key)
        .name(template.getName() != null ? template.getName() : key)
        .description(template.getDescription())
        .guidedModeEnabled(template.getGuidedMode().isEnabled())
        .build();
  }
}
