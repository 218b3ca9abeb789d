package com.flamingo.ai.slidedeck.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Structured intermediate form between the conversation and the rendered deck. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresentationOutline(String title, List<SlideSpec> slides) {

  public PresentationOutline {
    slides = slides == null ? List.of() : List.copyOf(slides);
  }
}
