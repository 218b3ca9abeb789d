package com.flamingo.ai.slidedeck.service.draft;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.domain.model.SlideSpec;
import com.flamingo.ai.slidedeck.exception.MalformedDraftException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts a {@link PresentationOutline} from free-form model output.
 *
 * <p>Models wrap JSON in code fences or add chatter around it. The parser tries every balanced
 * {@code {...}} block, leftmost first, and returns the first one that maps to a valid outline.
 * Oversized outlines are truncated rather than rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutlineParser {

  private final ObjectMapper objectMapper;
  private final PresentationConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Parses raw model output.
   *
   * @param raw model answer
   * @return validated, possibly truncated outline
   * @throws MalformedDraftException if no block yields a valid outline
   */
  public PresentationOutline parse(String raw) {
    String firstProblem = null;
    if (raw != null) {
      for (int start = raw.indexOf('{'); start >= 0; start = raw.indexOf('{', start + 1)) {
        int end = findClosingBrace(raw, start);
        if (end < 0) {
          continue;
        }
        String block = raw.substring(start, end + 1);
        try {
          PresentationOutline candidate = objectMapper.readValue(block, PresentationOutline.class);
          String problem = validate(candidate);
          if (problem == null) {
            return truncate(candidate);
          }
          if (firstProblem == null) {
            firstProblem = problem;
          }
        } catch (JsonProcessingException e) {
          if (firstProblem == null) {
            firstProblem = "not a valid outline object: " + e.getOriginalMessage();
          }
        } catch (IllegalArgumentException | NullPointerException e) {
          if (firstProblem == null) {
            firstProblem = "not a valid outline object: " + e.getMessage();
          }
        }
      }
    }

    String reason = firstProblem != null ? firstProblem : "no JSON object found";
    String errorId = UUID.randomUUID().toString().substring(0, 8);
    meterRegistry.counter("guided.draft.malformed").increment();
    log.warn("Malformed draft [{}]: {}. Raw model output: {}", errorId, reason, raw);
    throw new MalformedDraftException(errorId, "Malformed draft: " + reason);
  }

  /** Index of the brace closing the block opened at {@code start}, or -1 if unbalanced. */
  static int findClosingBrace(String text, int start) {
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private String validate(PresentationOutline outline) {
    if (outline.title() == null || outline.title().isBlank()) {
      return "missing title";
    }
    if (outline.slides().isEmpty()) {
      return "no slides";
    }
    for (int i = 0; i < outline.slides().size(); i++) {
      SlideSpec slide = outline.slides().get(i);
      if (slide == null) {
        return "slide " + (i + 1) + " is empty";
      }
      if (slide.type() == null) {
        return "slide " + (i + 1) + " has no type";
      }
      if (slide.heading() == null || slide.heading().isBlank()) {
        return "slide " + (i + 1) + " has no heading";
      }
    }
    return null;
  }

  private PresentationOutline truncate(PresentationOutline outline) {
    int maxSlides = config.getDraft().getMaxSlidesHard();
    int maxBullets = config.getDraft().getMaxBullets();

    List<SlideSpec> source = outline.slides();
    if (source.size() > maxSlides) {
      log.debug("Truncating outline from {} to {} slides", source.size(), maxSlides);
      source = source.subList(0, maxSlides);
    }

    List<SlideSpec> slides = new ArrayList<>(source.size());
    for (SlideSpec slide : source) {
      List<String> bullets = slide.bullets();
      if (bullets != null) {
        bullets = bullets.stream().filter(b -> b != null && !b.isBlank()).toList();
        if (bullets.size() > maxBullets) {
          bullets = bullets.subList(0, maxBullets);
        }
      }
      slides.add(new SlideSpec(slide.type(), slide.heading().strip(), slide.subheading(), bullets));
    }
    return new PresentationOutline(outline.title().strip(), slides);
  }
}
