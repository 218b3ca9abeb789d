package com.flamingo.ai.slidedeck.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Types of slides an outline may contain. */
public enum SlideType {
  TITLE,
  CONTENT,
  SUMMARY;

  @JsonValue
  public String toJson() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses the lowercase wire form, case-insensitively.
   *
   * @throws IllegalArgumentException if the value names no slide type
   */
  @JsonCreator
  public static SlideType fromJson(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Slide type is required");
    }
    return SlideType.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
