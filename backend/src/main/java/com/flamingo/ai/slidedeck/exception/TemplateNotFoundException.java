package com.flamingo.ai.slidedeck.exception;

/** Exception thrown when a presentation template key is unknown. */
public class TemplateNotFoundException extends RuntimeException {

  private final String templateKey;

  public TemplateNotFoundException(String templateKey) {
    super("Template not found: " + templateKey);
    this.templateKey = templateKey;
  }

  public String getTemplateKey() {
    return templateKey;
  }
}
