package com.flamingo.ai.slidedeck.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for SSE streaming chunks.
 *
 * <p>A stream is zero or more {@code token} events followed by exactly one event with {@code
 * done=true}, either {@code done} or {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamChunkResponse {

  public static final String TOKEN = "token";
  public static final String DONE = "done";
  public static final String ERROR = "error";

  /** Event type: token, done, error. */
  private String eventType;

  /** Visible text; on the done event, any text withheld until the end of the stream. */
  private String content;

  private boolean done;

  /** Set on the done event: whether a draft may now be requested. */
  private Boolean readyForDraft;

  private String errorId;

  private String message;

  /** Creates a token event. */
  public static StreamChunkResponse token(String content) {
    return StreamChunkResponse.builder().eventType(TOKEN).content(content).done(false).build();
  }

  /** Creates the final event of a successful exchange. */
  public static StreamChunkResponse done(String remainder, boolean readyForDraft) {
    return StreamChunkResponse.builder()
        .eventType(DONE)
        .content(remainder)
        .done(true)
        .readyForDraft(readyForDraft)
        .build();
  }

  /** Creates the final event of a failed exchange. */
  public static StreamChunkResponse error(String errorId, String message) {
    return StreamChunkResponse.builder()
        .eventType(ERROR)
        .done(true)
        .errorId(errorId)
        .message(message)
        .build();
  }
}
