package com.flamingo.ai.slidedeck.service.render;

import java.nio.file.Path;

/**
 * A rendered presentation file.
 *
 * @param artifactId opaque identifier used for download
 * @param path location of the file
 * @param slideCount number of slides written
 */
public record RenderedArtifact(String artifactId, Path path, int slideCount) {}
