package com.flamingo.ai.slidedeck.service.draft;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.domain.enums.MessageRole;
import com.flamingo.ai.slidedeck.domain.model.ConversationTurn;
import com.flamingo.ai.slidedeck.exception.MalformedDraftException;
import com.flamingo.ai.slidedeck.exception.TemplateNotFoundException;
import com.flamingo.ai.slidedeck.service.conversation.GeneratedArtifact;
import com.flamingo.ai.slidedeck.service.llm.ModelBackend;
import com.flamingo.ai.slidedeck.service.render.ArtifactStorage;
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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QuickGenerationServiceTest {

  private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");
  private static final String ANSWER =
      "{\"title\": \"Solar Power\", \"slides\": ["
          + "{\"type\": \"title\", \"heading\": \"Solar Power\", \"subheading\": \"Basics\"},"
          + "{\"type\": \"content\", \"heading\": \"Why\", \"bullets\": [\"Cheap\", \"Clean\"]},"
          + "{\"type\": \"summary\", \"heading\": \"Summary\", \"bullets\": [\"Invest\"]}]}";

  @Mock private ModelBackend modelBackend;
  @Mock private PresentationRenderer renderer;
  @Captor private ArgumentCaptor<List<ConversationTurn>> turnsCaptor;

  private PresentationConfig config;
  private SimpleMeterRegistry meterRegistry;
  private QuickGenerationService service;

  @BeforeEach
  void setUp() {
    config = new PresentationConfig();
    PresentationConfig.Template general = new PresentationConfig.Template();
    general.setName("General Presentation");
    general.setSystemPrompt("You are a professional presentation designer.");
    config.getTemplates().put("general", general);

    meterRegistry = new SimpleMeterRegistry();
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    TemplateCatalog catalog = new TemplateCatalog(config);
    OutlineParser parser = new OutlineParser(new ObjectMapper(), config, meterRegistry);
    DraftOrchestrator orchestrator =
        new DraftOrchestrator(modelBackend, parser, renderer, catalog, config, clock);
    service =
        new QuickGenerationService(
            modelBackend,
            parser,
            orchestrator,
            new ArtifactStorage(config),
            catalog,
            config,
            meterRegistry,
            clock);
  }

  @Test
  @DisplayName("should prompt for the topic, language and slide count and render the outline")
  void shouldGenerateFromTopic() throws IOException {
    when(modelBackend.complete(anyList(), anyString(), anyDouble())).thenReturn(ANSWER);
    when(renderer.render(any()))
        .thenReturn(new RenderedArtifact("a1b2", Path.of("a1b2.pptx"), 3));

    GeneratedArtifact artifact = service.generate("  Solar power  ", "de", 3, 0.4);

    assertThat(artifact.artifactId()).isEqualTo("a1b2");
    assertThat(artifact.downloadUrl()).isEqualTo("/api/v1/download/a1b2");
    assertThat(artifact.preview().title()).isEqualTo("Solar Power");
    assertThat(artifact.preview().slides()).hasSize(3);

    verify(modelBackend)
        .complete(
            turnsCaptor.capture(), eq("You are a professional presentation designer."), eq(0.4));
    List<ConversationTurn> sent = turnsCaptor.getValue();
    assertThat(sent).hasSize(1);
    assertThat(sent.get(0).role()).isEqualTo(MessageRole.USER);
    assertThat(sent.get(0).text())
        .contains("outline in de about: \"Solar power\"")
        .contains("exactly 3 slides")
        .contains("Slides 2 to 2 are content slides")
        .contains("Slide 3 must be a summary slide")
        .contains("\"slides\"");
    assertThat(meterRegistry.counter("quick.generated").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should fall back to the configured language, slide count and temperature")
  void shouldApplyDefaults() throws IOException {
    when(modelBackend.complete(anyList(), anyString(), anyDouble())).thenReturn(ANSWER);
    when(renderer.render(any())).thenReturn(new RenderedArtifact("id", Path.of("id.pptx"), 3));

    service.generate("Solar power", " ", null, null);

    verify(modelBackend).complete(turnsCaptor.capture(), anyString(), eq(0.15));
    assertThat(turnsCaptor.getValue().get(0).text())
        .contains("outline in en about")
        .contains("exactly 3 slides");
  }

  @Test
  @DisplayName("should clamp the slide count to the configured maximum")
  void shouldClampSlides() {
    assertThat(service.clampSlides(50)).isEqualTo(10);
    assertThat(service.clampSlides(0)).isEqualTo(1);
    assertThat(service.clampSlides(7)).isEqualTo(7);
  }

  @Test
  @DisplayName("should ask for a single title slide when one slide is requested")
  void shouldPromptForSingleSlide() {
    String prompt = QuickGenerationService.topicPrompt("Solar power", "en", 1);

    assertThat(prompt).contains("exactly 1 slide\n").doesNotContain("summary slide");
  }

  @Test
  @DisplayName("should propagate malformed answers without rendering")
  void shouldPropagateMalformedAnswer() throws IOException {
    when(modelBackend.complete(anyList(), anyString(), anyDouble())).thenReturn("Sorry, no.");

    assertThatThrownBy(() -> service.generate("Solar power", "en", 3, null))
        .isInstanceOf(MalformedDraftException.class);
    verify(renderer, never()).render(any());
    assertThat(meterRegistry.counter("quick.generated").count()).isZero();
  }

  @Test
  @DisplayName("should fail when the configured template is missing")
  void shouldRequireTemplate() {
    config.getQuick().setTemplate("missing");

    assertThatThrownBy(() -> service.generate("Solar power", "en", 3, null))
        .isInstanceOf(TemplateNotFoundException.class);
  }
}
