package com.flamingo.ai.slidedeck.api.dto.response;

import com.flamingo.ai.slidedeck.domain.enums.SessionState;
import com.flamingo.ai.slidedeck.domain.model.GuidedSession;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for guided session details. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionInfoResponse {

  private UUID sessionId;
  private String template;
  private int messageCount;
  private SessionState state;
  private boolean readyForDraft;
  private boolean hasDraft;
  private String fileId;
  private Instant createdAt;
  private Instant lastActivity;

  public static SessionInfoResponse fromSession(GuidedSession session) {
    return SessionInfoResponse.builder()
        .sessionId(session.getId())
        .template(session.getTemplateKey())
        .messageCount(session.getMessageCount())
        .state(session.getState())
        .readyForDraft(session.getState().isDraftUnlocked())
        .hasDraft(session.hasDraft())
        .fileId(session.getArtifactId())
        .createdAt(session.getCreatedAt())
        .lastActivity(session.getLastActivity())
        .build();
  }
}
