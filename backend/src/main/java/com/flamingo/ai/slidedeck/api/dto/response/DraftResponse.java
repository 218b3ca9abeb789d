package com.flamingo.ai.slidedeck.api.dto.response;

import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a created draft. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftResponse {

  private UUID sessionId;
  private PresentationOutline draft;
}
