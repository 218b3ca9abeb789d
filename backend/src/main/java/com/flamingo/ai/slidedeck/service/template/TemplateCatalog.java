package com.flamingo.ai.slidedeck.service.template;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.config.PresentationConfig.Template;
import com.flamingo.ai.slidedeck.exception.GuidedModeNotSupportedException;
import com.flamingo.ai.slidedeck.exception.TemplateNotFoundException;
import jakarta.annotation.PostConstruct;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Read-only view of the presentation templates configured under {@code presentation.templates}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateCatalog {

  private final PresentationConfig config;

  @PostConstruct
  void logTemplates() {
    long guided =
        config.getTemplates().values().stream().filter(t -> t.getGuidedMode().isEnabled()).count();
    log.info(
        "Loaded {} presentation templates ({} with guided mode)",
        config.getTemplates().size(),
        guided);
  }

  /** Templates in configuration order, keyed by template key. */
  public Map<String, Template> list() {
    return config.getTemplates();
  }

  public Template get(String templateKey) {
    Template template = templateKey == null ? null : config.getTemplates().get(templateKey);
    if (template == null) {
      throw new TemplateNotFoundException(templateKey);
    }
    return template;
  }

  /**
   * Returns the template if it can drive a guided conversation.
   *
   * @throws TemplateNotFoundException if the key is unknown
   * @throws GuidedModeNotSupportedException if guided mode is disabled for the template
   */
  public Template requireGuided(String templateKey) {
    Template template = get(templateKey);
    if (!template.getGuidedMode().isEnabled()) {
      throw new GuidedModeNotSupportedException(templateKey);
    }
    return template;
  }

  /** Display name of a template, falling back to its key. */
  public String displayName(String templateKey) {
    Template template = config.getTemplates().get(templateKey);
    if (template == null || template.getName() == null || template.getName().isBlank()) {
      return templateKey;
    }
    return template.getName();
  }
}
