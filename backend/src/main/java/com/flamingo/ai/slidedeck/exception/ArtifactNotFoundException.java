package com.flamingo.ai.slidedeck.exception;

/** Exception thrown when a rendered presentation file does not exist. */
public class ArtifactNotFoundException extends RuntimeException {

  private final String artifactId;

  public ArtifactNotFoundException(String artifactId) {
    super("Presentation file not found: " + artifactId);
    this.artifactId = artifactId;
  }

  public String getArtifactId() {
    return artifactId;
  }
}
