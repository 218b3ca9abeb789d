package com.flamingo.ai.slidedeck.service.render;

import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import java.io.IOException;

/** Turns an outline into a downloadable presentation file. */
public interface PresentationRenderer {

  /**
   * Renders the outline into a new artifact.
   *
   * @param outline validated outline
   * @return the stored artifact
   * @throws IOException if the file could not be written
   */
  RenderedArtifact render(PresentationOutline outline) throws IOException;
}
