package com.flamingo.ai.slidedeck.api.rest;

import com.flamingo.ai.slidedeck.api.dto.response.TemplateResponse;
import com.flamingo.ai.slidedeck.service.template.TemplateCatalog;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller listing presentation templates. */
@RestController
@RequestMapping("/api/v1/templates")
@RequiredArgsConstructor
public class TemplateController {

  private final TemplateCatalog templateCatalog;

  /** Lists all templates in configuration order. */
  @GetMapping
  public ResponseEntity<List<TemplateResponse>> listTemplates() {
    List<TemplateResponse> templates =
        templateCatalog.list().entrySet().stream()
            .map(entry -> TemplateResponse.from(entry.getKey(), entry.getValue()))
            .toList();
    return ResponseEntity.ok(templates);
  }
}
