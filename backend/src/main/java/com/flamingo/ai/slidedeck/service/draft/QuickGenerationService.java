package com.flamingo.ai.slidedeck.service.draft;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.config.PresentationConfig.Template;
import com.flamingo.ai.slidedeck.domain.model.ConversationTurn;
import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.service.conversation.GeneratedArtifact;
import com.flamingo.ai.slidedeck.service.llm.ModelBackend;
import com.flamingo.ai.slidedeck.service.render.ArtifactStorage;
import com.flamingo.ai.slidedeck.service.render.RenderedArtifact;
import com.flamingo.ai.slidedeck.service.template.TemplateCatalog;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a deck from a bare topic in a single model call, without a guided conversation.
 *
 * <p>No session is created; the outline is parsed and rendered the same way a guided draft is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuickGenerationService {

  private final ModelBackend modelBackend;
  private final OutlineParser outlineParser;
  private final DraftOrchestrator draftOrchestrator;
  private final ArtifactStorage artifactStorage;
  private final TemplateCatalog templateCatalog;
  private final PresentationConfig config;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Generates and renders a presentation about a topic.
   *
   * @param topic what the presentation is about
   * @param language language to write the slides in, or {@code null} for the default
   * @param slides requested slide count, or {@code null} for the default; clamped to the maximum
   * @param temperature sampling temperature, or {@code null} for the default
   * @return the rendered artifact and the outline it was rendered from
   * @throws com.flamingo.ai.slidedeck.exception.BackendUnavailableException if the model failed
   * @throws com.flamingo.ai.slidedeck.exception.MalformedDraftException if the answer is unusable
   * @throws com.flamingo.ai.slidedeck.exception.RenderFailedException if rendering failed
   */
  @Timed(value = "quick.generate", description = "Time to generate a deck from a topic")
  public GeneratedArtifact generate(
      String topic, String language, Integer slides, Double temperature) {
    PresentationConfig.Quick quick = config.getQuick();
    String effectiveLanguage =
        language == null || language.isBlank() ? quick.getDefaultLanguage() : language.strip();
    int effectiveSlides = clampSlides(slides == null ? quick.getDefaultSlides() : slides);
    double effectiveTemperature = temperature == null ? quick.getTemperature() : temperature;

    log.info(
        "Quick generation: {} slides in '{}' about '{}'",
        effectiveSlides,
        effectiveLanguage,
        topic);
    List<ConversationTurn> turns =
        List.of(
            ConversationTurn.user(
                topicPrompt(topic.strip(), effectiveLanguage, effectiveSlides), clock.instant()));
    String raw = modelBackend.complete(turns, systemPrompt(), effectiveTemperature);
    PresentationOutline outline = outlineParser.parse(raw);

    RenderedArtifact rendered = draftOrchestrator.buildArtifact(outline);
    meterRegistry.counter("quick.generated").increment();
    log.info(
        "Quick generation rendered '{}' as {} ({} slides)",
        outline.title(),
        rendered.artifactId(),
        rendered.slideCount());
    return new GeneratedArtifact(
        rendered.artifactId(), artifactStorage.downloadUrl(rendered.artifactId()), outline);
  }

  int clampSlides(int requested) {
    int max = Math.max(1, config.getQuick().getMaxSlides());
    int clamped = Math.max(1, Math.min(requested, max));
    if (clamped != requested) {
      log.debug("Requested {} slides, using {}", requested, clamped);
    }
    return clamped;
  }

  String systemPrompt() {
    Template template = templateCatalog.get(config.getQuick().getTemplate());
    return template.getSystemPrompt();
  }

  static String topicPrompt(String topic, String language, int slides) {
    StringBuilder prompt = new StringBuilder();
    prompt
        .append("Generate a professional PowerPoint presentation outline in ")
        .append(language)
        .append(" about: \"")
        .append(topic)
        .append("\"\n\n");
    prompt.append("Return ONLY valid JSON, no other text.\n\n");
    prompt.append(DraftOrchestrator.OUTLINE_FORMAT).append("\n\n");

    prompt.append("Requirements:\n");
    prompt
        .append("- Create exactly ")
        .append(slides)
        .append(slides == 1 ? " slide\n" : " slides\n");
    prompt.append("- Slide 1 must be a title slide with a heading and a subheading\n");
    if (slides > 2) {
      prompt
          .append("- Slides 2 to ")
          .append(slides - 1)
          .append(" are content slides with 3-5 bullets each\n");
    }
    if (slides > 1) {
      prompt.append("- Slide ").append(slides).append(" must be a summary slide\n");
    }
    prompt.append("- Write all text in ").append(language).append('\n');
    prompt.append(
        "\nFocus on professional, concise content suitable for business presentations. "
            + "Use clear headings and bullet points.");
    return prompt.toString();
  }
}
