package com.flamingo.ai.slidedeck.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.slidedeck.domain.enums.SlideType;
import java.util.List;

/**
 * A single slide of an outline.
 *
 * @param type slide layout
 * @param heading slide heading, never blank in a valid outline
 * @param subheading optional subtitle
 * @param bullets optional bullet points, in display order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlideSpec(SlideType type, String heading, String subheading, List<String> bullets) {

  public SlideSpec {
    bullets = bullets == null ? null : List.copyOf(bullets);
  }

  public boolean hasBullets() {
    return bullets != null && !bullets.isEmpty();
  }
}
