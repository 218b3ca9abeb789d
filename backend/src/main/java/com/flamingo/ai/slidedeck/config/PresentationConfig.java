package com.flamingo.ai.slidedeck.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for guided presentation building. */
@Configuration
@ConfigurationProperties(prefix = "presentation")
@Getter
@Setter
public class PresentationConfig {

  private Session session = new Session();
  private Conversation conversation = new Conversation();
  private Draft draft = new Draft();
  private Render render = new Render();
  private Quick quick = new Quick();

  /** Templates keyed by template key, e.g. {@code project_init}. */
  private Map<String, Template> templates = new LinkedHashMap<>();

  @Getter
  @Setter
  public static class Session {
    /** Sessions idle for longer than this are removed by the sweep. */
    private Duration idleTimeout = Duration.ofMinutes(30);

    private Duration sweepInterval = Duration.ofSeconds(60);

    /** Oldest turns are dropped once the history grows beyond this. */
    private int maxHistoryTurns = 50;

    /** Maximum wait for exclusive access to a session. */
    private Duration leaseTimeout = Duration.ofSeconds(150);
  }

  @Getter
  @Setter
  public static class Conversation {
    /** In-band marker the model emits once it has gathered enough information. */
    private String marker = "[READY_FOR_DRAFT]";

    /** Longest allowed gap between two model fragments. */
    private Duration streamTimeout = Duration.ofSeconds(120);

    /** Servlet async timeout for the whole SSE response; keep it above {@code streamTimeout}. */
    private Duration sseTimeout = Duration.ofMinutes(5);

    /** Whether messages are still accepted after a draft exists (refinement before generate). */
    private boolean allowMessagesAfterDraft = false;
  }

  @Getter
  @Setter
  public static class Draft {
    private int minSlides = 5;
    private int maxSlides = 7;

    /** Slides beyond this are dropped from a parsed outline. */
    private int maxSlidesHard = 20;

    /** Bullets beyond this are dropped from a parsed slide. */
    private int maxBullets = 10;
  }

  @Getter
  @Setter
  public static class Render {
    /** Directory where rendered decks are written. */
    private String outputDir = "data/output";

    /** Public path prefix for downloads. */
    private String downloadPath = "/api/v1/download/";
  }

  /** One-shot generation from a topic, without a guided conversation. */
  @Getter
  @Setter
  public static class Quick {
    /** Template whose system prompt drives one-shot generation. */
    private String template = "general";

    private String defaultLanguage = "en";
    private int defaultSlides = 3;

    /** Requested slide counts are clamped to this. */
    private int maxSlides = 10;

    private double temperature = 0.15;
  }

  @Getter
  @Setter
  public static class Template {
    private String name;
    private String description = "";

    /** Role instructions for the model when it writes a draft outline. */
    private String systemPrompt =
        "You are a professional presentation designer. Return valid JSON only.";

    private GuidedMode guidedMode = new GuidedMode();

    /** Guided conversation settings for a template. */
    @Getter
    @Setter
    public static class GuidedMode {
      private boolean enabled = false;

      private String greeting =
          "Hello! I'll help you create a presentation. Tell me about your idea.";

      /** Information the assistant should gather before signalling readiness. */
      private List<String> requiredInfo = new ArrayList<>();

      private String conversationSystemPrompt = "";
    }
  }
}
