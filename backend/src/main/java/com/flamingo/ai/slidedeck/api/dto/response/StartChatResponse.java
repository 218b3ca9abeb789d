package com.flamingo.ai.slidedeck.api.dto.response;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a started guided conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartChatResponse {

  private UUID sessionId;

  /** The assistant's greeting, already recorded as the first turn. */
  private String message;
}
