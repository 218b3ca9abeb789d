package com.flamingo.ai.slidedeck.service.conversation;

import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;

/**
 * Result of final generation.
 *
 * @param artifactId id of the rendered file
 * @param downloadUrl relative URL the file can be fetched from
 * @param preview the outline the file was rendered from
 */
public record GeneratedArtifact(
    String artifactId, String downloadUrl, PresentationOutline preview) {}
