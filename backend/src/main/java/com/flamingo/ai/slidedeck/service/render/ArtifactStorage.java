package com.flamingo.ai.slidedeck.service.render;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.exception.ArtifactNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Maps artifact ids to {@code {id}.pptx} files under the configured output directory. */
@Component
@Slf4j
public class ArtifactStorage {

  static final String EXTENSION = ".pptx";

  private final Path outputDir;
  private final String downloadPath;

  public ArtifactStorage(PresentationConfig config) {
    this.outputDir = Paths.get(config.getRender().getOutputDir()).toAbsolutePath().normalize();
    String path = config.getRender().getDownloadPath();
    this.downloadPath = path.endsWith("/") ? path : path + "/";
  }

  /** Creates the output directory if needed and returns the path to write the artifact to. */
  public Path allocate(String artifactId) throws IOException {
    Files.createDirectories(outputDir);
    return pathFor(artifactId);
  }

  public String newArtifactId() {
    return UUID.randomUUID().toString();
  }

  /**
   * Resolves an existing artifact.
   *
   * @throws ArtifactNotFoundException if the id is not a UUID or no such file exists
   */
  public Path resolve(String artifactId) {
    Path path = pathFor(artifactId);
    if (!Files.isRegularFile(path)) {
      log.debug("Artifact {} not found at {}", artifactId, path);
      throw new ArtifactNotFoundException(artifactId);
    }
    return path;
  }

  public String downloadUrl(String artifactId) {
    return downloadPath + artifactId;
  }

  public String fileName(String artifactId) {
    return artifactId + EXTENSION;
  }

  private Path pathFor(String artifactId) {
    String canonical;
    try {
      canonical = UUID.fromString(artifactId).toString();
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new ArtifactNotFoundException(artifactId);
    }
    // Only ids that round-trip as UUIDs reach the filesystem.
    if (!canonical.equalsIgnoreCase(artifactId)) {
      throw new ArtifactNotFoundException(artifactId);
    }
    return outputDir.resolve(canonical + EXTENSION);
  }
}
