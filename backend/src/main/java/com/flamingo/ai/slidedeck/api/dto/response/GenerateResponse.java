package com.flamingo.ai.slidedeck.api.dto.response;

import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.service.conversation.GeneratedArtifact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a generated presentation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateResponse {

  private boolean success;
  private String fileId;
  private String downloadUrl;
  private PresentationOutline preview;

  public static GenerateResponse from(GeneratedArtifact artifact) {
    return GenerateResponse.builder()
        .success(true)
        .fileId(artifact.artifactId())
        .downloadUrl(artifact.downloadUrl())
        .preview(artifact.preview())
        .build();
  }
}
