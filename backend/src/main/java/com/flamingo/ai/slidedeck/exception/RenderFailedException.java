package com.flamingo.ai.slidedeck.exception;

/** Exception thrown when the presentation file could not be produced. */
public class RenderFailedException extends RuntimeException {

  private final String userMessage;

  public RenderFailedException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Failed to generate the presentation file";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
