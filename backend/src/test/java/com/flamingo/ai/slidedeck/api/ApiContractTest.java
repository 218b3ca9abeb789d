package com.flamingo.ai.slidedeck.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.slidedeck.api.rest.DownloadController;
import com.flamingo.ai.slidedeck.api.rest.QuickGenerationController;
import com.flamingo.ai.slidedeck.api.rest.TemplateController;
import com.flamingo.ai.slidedeck.api.sse.GuidedChatController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify controllers stay on the published paths:
 *
 * <ul>
 *   <li>POST /api/v1/chat/start - Start guided conversation
 *   <li>POST /api/v1/chat/{sessionId}/message - Send message (SSE)
 *   <li>POST /api/v1/chat/{sessionId}/draft - Create draft
 *   <li>POST /api/v1/chat/{sessionId}/generate - Generate presentation
 *   <li>GET /api/v1/chat/{sessionId} - Get session
 *   <li>DELETE /api/v1/chat/{sessionId} - Delete session
 *   <li>GET /api/v1/download/{fileId} - Download presentation
 *   <li>GET /api/v1/templates - List templates
 *   <li>POST /api/v1/generate - Generate presentation from a topic
 * </ul>
 */
class ApiContractTest {

  private static Method method(Class<?> type, String name) {
    return Arrays.stream(type.getDeclaredMethods())
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow();
  }

  @Nested
  @DisplayName("GuidedChatController API contract")
  class GuidedChatControllerContract {

    @Test
    @DisplayName("should be mapped to /api/v1/chat")
    void shouldBeMappedToChat() {
      RequestMapping mapping = GuidedChatController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/v1/chat");
    }

    @Test
    @DisplayName("should expose the conversation operations")
    void shouldExposeOperations() {
      assertThat(
              method(GuidedChatController.class, "start").getAnnotation(PostMapping.class).value())
          .containsExactly("/start");
      assertThat(
              method(GuidedChatController.class, "createDraft")
                  .getAnnotation(PostMapping.class)
                  .value())
          .containsExactly("/{sessionId}/draft");
      assertThat(
              method(GuidedChatController.class, "generate")
                  .getAnnotation(PostMapping.class)
                  .value())
          .containsExactly("/{sessionId}/generate");
      assertThat(
              method(GuidedChatController.class, "getSession")
                  .getAnnotation(GetMapping.class)
                  .value())
          .containsExactly("/{sessionId}");
      assertThat(
              method(GuidedChatController.class, "deleteSession")
                  .getAnnotation(DeleteMapping.class)
                  .value())
          .containsExactly("/{sessionId}");
    }

    @Test
    @DisplayName("should stream messages as server-sent events")
    void shouldStreamMessages() {
      PostMapping mapping =
          method(GuidedChatController.class, "sendMessage").getAnnotation(PostMapping.class);
      assertThat(mapping.value()).containsExactly("/{sessionId}/message");
      assertThat(mapping.produces()).containsExactly(MediaType.TEXT_EVENT_STREAM_VALUE);
    }
  }

  @Nested
  @DisplayName("DownloadController API contract")
  class DownloadControllerContract {

    @Test
    @DisplayName("should be mapped to /api/v1/download")
    void shouldBeMappedToDownload() {
      RequestMapping mapping = DownloadController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/v1/download");
      assertThat(
              method(DownloadController.class, "download").getAnnotation(GetMapping.class).value())
          .containsExactly("/{fileId}");
    }
  }

  @Nested
  @DisplayName("TemplateController API contract")
  class TemplateControllerContract {

    @Test
    @DisplayName("should be mapped to /api/v1/templates")
    void shouldBeMappedToTemplates() {
      RequestMapping mapping = TemplateController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/v1/templates");
    }
  }

  @Nested
  @DisplayName("QuickGenerationController API contract")
  class QuickGenerationControllerContract {

    @Test
    @DisplayName("should accept POST /api/v1/generate")
    void shouldBeMappedToGenerate() {
      RequestMapping mapping = QuickGenerationController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/v1/generate");
      assertThat(
              method(QuickGenerationController.class, "generate")
                  .getAnnotation(PostMapping.class))
          .isNotNull();
    }
  }
}
