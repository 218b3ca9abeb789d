package com.flamingo.ai.slidedeck.api.rest;

import com.flamingo.ai.slidedeck.api.dto.request.QuickGenerateRequest;
import com.flamingo.ai.slidedeck.api.dto.response.GenerateResponse;
import com.flamingo.ai.slidedeck.service.conversation.GeneratedArtifact;
import com.flamingo.ai.slidedeck.service.draft.QuickGenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** One-shot generation of a presentation from a topic. */
@RestController
@RequestMapping("/api/v1/generate")
@RequiredArgsConstructor
public class QuickGenerationController {

  private final QuickGenerationService quickGenerationService;

  @PostMapping
  public ResponseEntity<GenerateResponse> generate(
      @Valid @RequestBody QuickGenerateRequest request) {
    GeneratedArtifact artifact =
        quickGenerationService.generate(
            request.getTopic(),
            request.getLanguage(),
            request.getSlides(),
            request.getTemperature());
    return ResponseEntity.ok(GenerateResponse.from(artifact));
  }
}
