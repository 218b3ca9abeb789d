package com.flamingo.ai.slidedeck.service.draft;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.domain.enums.MessageRole;
import com.flamingo.ai.slidedeck.domain.enums.SlideType;
import com.flamingo.ai.slidedeck.domain.model.ConversationTurn;
import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.domain.model.SlideSpec;
import com.flamingo.ai.slidedeck.exception.BackendUnavailableException;
import com.flamingo.ai.slidedeck.exception.MalformedDraftException;
import com.flamingo.ai.slidedeck.exception.RenderFailedException;
import com.flamingo.ai.slidedeck.service.llm.ModelBackend;
import com.flamingo.ai.slidedeck.service.render.PresentationRenderer;
import com.flamingo.ai.slidedeck.service.render.RenderedArtifact;
import com.flamingo.ai.slidedeck.service.template.TemplateCatalog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DraftOrchestratorTest {

  private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");
  private static final PresentationOutline OUTLINE =
      new PresentationOutline(
          "Apollo",
          List.of(
              new SlideSpec(SlideType.TITLE, "Apollo", "Kick-off", null),
              new SlideSpec(SlideType.SUMMARY, "Next", null, List.of("Approve"))));

  @Mock private ModelBackend modelBackend;
  @Mock private PresentationRenderer renderer;
  @Captor private ArgumentCaptor<List<ConversationTurn>> turnsCaptor;
  @Captor private ArgumentCaptor<String> promptCaptor;

  private DraftOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    PresentationConfig config = new PresentationConfig();
    PresentationConfig.Template template = new PresentationConfig.Template();
    template.setName("Project Initiation");
    template.setSystemPrompt("You are a project manager.");
    template.getGuidedMode().setEnabled(true);
    template.getGuidedMode().setRequiredInfo(List.of("Project name", "Timeline"));
    config.getTemplates().put("project_init", template);

    OutlineParser parser = new OutlineParser(new ObjectMapper(), config, new SimpleMeterRegistry());
    orchestrator =
        new DraftOrchestrator(
            modelBackend,
            parser,
            renderer,
            new TemplateCatalog(config),
            config,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Nested
  @DisplayName("buildDraft")
  class BuildDraft {

    private final List<ConversationTurn> history =
        List.of(
            ConversationTurn.assistant("Hello! Tell me about your project.", NOW),
            ConversationTurn.user("It's called Apollo and ships in Q3.", NOW));

    @Test
    @DisplayName("should send the history with a closing instruction and parse the answer")
    void shouldBuildDraft() {
      when(modelBackend.complete(anyList(), anyString()))
          .thenReturn(
              "```json\n{\"title\": \"Apollo\", \"slides\": "
                  + "[{\"type\": \"title\", \"heading\": \"Apollo\"}]}\n```");

      PresentationOutline outline = orchestrator.buildDraft(history, "project_init");

      assertThat(outline.title()).isEqualTo("Apollo");
      verify(modelBackend).complete(turnsCaptor.capture(), promptCaptor.capture());

      List<ConversationTurn> sent = turnsCaptor.getValue();
      assertThat(sent).hasSize(3);
      assertThat(sent.subList(0, 2)).isEqualTo(history);
      assertThat(sent.get(2).role()).isEqualTo(MessageRole.USER);
      assertThat(sent.get(2).text()).contains("5-7 slides").contains("valid JSON");

      assertThat(promptCaptor.getValue())
          .startsWith("You are a project manager.")
          .contains("Template: Project Initiation")
          .contains("- Project name")
          .contains("- Timeline")
          .contains("\"slides\"");
    }

    @Test
    @DisplayName("should propagate malformed answers")
    void shouldPropagateMalformedDraft() {
      when(modelBackend.complete(anyList(), anyString())).thenReturn("no JSON here");

      assertThatThrownBy(() -> orchestrator.buildDraft(history, "project_init"))
          .isInstanceOf(MalformedDraftException.class);
    }

    @Test
    @DisplayName("should propagate backend failures")
    void shouldPropagateBackendFailure() {
      when(modelBackend.complete(anyList(), anyString()))
          .thenThrow(new BackendUnavailableException("down"));

      assertThatThrownBy(() -> orchestrator.buildDraft(history, "project_init"))
          .isInstanceOf(BackendUnavailableException.class);
    }
  }

  @Nested
  @DisplayName("buildArtifact")
  class BuildArtifact {

    @Test
    @DisplayName("should return the rendered artifact")
    void shouldRender() throws IOException {
      RenderedArtifact artifact = new RenderedArtifact("id-1", Path.of("id-1.pptx"), 2);
      when(renderer.render(OUTLINE)).thenReturn(artifact);

      assertThat(orchestrator.buildArtifact(OUTLINE)).isEqualTo(artifact);
    }

    @Test
    @DisplayName("should wrap I/O failures")
    void shouldWrapIoFailure() throws IOException {
      when(renderer.render(any())).thenThrow(new IOException("disk full"));

      assertThatThrownBy(() -> orchestrator.buildArtifact(OUTLINE))
          .isInstanceOf(RenderFailedException.class)
          .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("should wrap unexpected renderer failures")
    void shouldWrapRuntimeFailure() throws IOException {
      when(renderer.render(any())).thenThrow(new IllegalStateException("bad shape"));

      assertThatThrownBy(() -> orchestrator.buildArtifact(OUTLINE))
          .isInstanceOf(RenderFailedException.class);
    }
  }
}
