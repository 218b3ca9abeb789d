package com.flamingo.ai.slidedeck.service.draft;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.config.PresentationConfig.Template;
import com.flamingo.ai.slidedeck.domain.model.ConversationTurn;
import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.exception.RenderFailedException;
import com.flamingo.ai.slidedeck.service.llm.ModelBackend;
import com.flamingo.ai.slidedeck.service.render.PresentationRenderer;
import com.flamingo.ai.slidedeck.service.render.RenderedArtifact;
import com.flamingo.ai.slidedeck.service.template.TemplateCatalog;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a finished conversation into an outline, and an outline into a rendered deck.
 *
 * <p>Neither operation touches session state; callers persist the results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DraftOrchestrator {

  static final String OUTLINE_FORMAT =
      """
      Output JSON in this exact format:
      {
        "title": "Presentation Title",
        "slides": [
          {"type": "title", "heading": "Main Title", "subheading": "Subtitle"},
          {"type": "content", "heading": "Section", "bullets": ["Point 1", "Point 2", "Point 3"]},
          {"type": "summary", "heading": "Conclusion", "bullets": ["Takeaway 1", "Takeaway 2"]}
        ]
      }""";

  private final ModelBackend modelBackend;
  private final OutlineParser outlineParser;
  private final PresentationRenderer renderer;
  private final TemplateCatalog templateCatalog;
  private final PresentationConfig config;
  private final Clock clock;

  /**
   * Asks the model for an outline of the conversation.
   *
   * @param history conversation so far, oldest first
   * @param templateKey template the session was started with
   * @return validated outline
   * @throws com.flamingo.ai.slidedeck.exception.BackendUnavailableException if the model failed
   * @throws com.flamingo.ai.slidedeck.exception.MalformedDraftException if the answer is unusable
   */
  @Timed(value = "guided.draft.build", description = "Time to build a draft outline")
  public PresentationOutline buildDraft(List<ConversationTurn> history, String templateKey) {
    List<ConversationTurn> turns = new ArrayList<>(history);
    turns.add(ConversationTurn.user(draftInstruction(), clock.instant()));

    log.debug("Requesting draft for template '{}' from {} turns", templateKey, history.size());
    String raw = modelBackend.complete(turns, draftSystemPrompt(templateKey));
    PresentationOutline outline = outlineParser.parse(raw);
    log.info("Draft '{}' parsed with {} slides", outline.title(), outline.slides().size());
    return outline;
  }

  /**
   * Renders an outline.
   *
   * @throws RenderFailedException if the renderer fails for any reason
   */
  @Timed(value = "guided.artifact.build", description = "Time to render a presentation")
  public RenderedArtifact buildArtifact(PresentationOutline outline) {
    try {
      return renderer.render(outline);
    } catch (IOException | RuntimeException e) {
      log.error("Rendering '{}' failed: {}", outline.title(), e.getMessage(), e);
      throw new RenderFailedException("Rendering failed: " + e.getMessage(), e);
    }
  }

  String draftSystemPrompt(String templateKey) {
    Template template = templateCatalog.get(templateKey);
    StringBuilder prompt = new StringBuilder();
    if (template.getSystemPrompt() != null && !template.getSystemPrompt().isBlank()) {
      prompt.append(template.getSystemPrompt().strip()).append("\n\n");
    }
    prompt.append("You are creating a presentation draft based on a conversation.\n");
    prompt.append("Use the information gathered to create a structured presentation outline.\n\n");
    prompt.append("Template: ").append(templateCatalog.displayName(templateKey)).append('\n');

    List<String> requiredInfo = template.getGuidedMode().getRequiredInfo();
    if (!requiredInfo.isEmpty()) {
      prompt.append("Cover the following information:\n");
      requiredInfo.forEach(item -> prompt.append("- ").append(item).append('\n'));
    }
    prompt.append('\n').append(OUTLINE_FORMAT);
    return prompt.toString();
  }

  private String draftInstruction() {
    PresentationConfig.Draft draft = config.getDraft();
    return "Based on this conversation, create a presentation draft. Generate a professional "
        + "presentation structure with "
        + draft.getMinSlides()
        + "-"
        + draft.getMaxSlides()
        + " slides: start with a title slide and end with a summary slide. Output valid JSON only.";
  }
}
