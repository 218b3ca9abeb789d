package com.flamingo.ai.slidedeck.exception;

/** Exception thrown when a guided conversation is started on a template without guided mode. */
public class GuidedModeNotSupportedException extends RuntimeException {

  private final String templateKey;

  public GuidedModeNotSupportedException(String templateKey) {
    super("Template does not support guided mode: " + templateKey);
    this.templateKey = templateKey;
  }

  public String getTemplateKey() {
    return templateKey;
  }
}
