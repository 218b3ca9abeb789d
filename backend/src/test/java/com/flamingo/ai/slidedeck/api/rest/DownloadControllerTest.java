package com.flamingo.ai.slidedeck.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.slidedeck.config.PresentationConfig;
import com.flamingo.ai.slidedeck.exception.ApiError;
import com.flamingo.ai.slidedeck.exception.GlobalExceptionHandler;
import com.flamingo.ai.slidedeck.service.render.ArtifactStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("DownloadController Tests")
class DownloadControllerTest {

  @TempDir Path outputDir;

  private ArtifactStorage storage;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    PresentationConfig config = new PresentationConfig();
    config.getRender().setOutputDir(outputDir.toString());
    storage = new ArtifactStorage(config);
    mockMvc =
        MockMvcBuilders.standaloneSetup(new DownloadController(storage))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("should serve the file as a PPTX attachment")
  void shouldServeArtifact() throws Exception {
    String fileId = storage.newArtifactId();
    byte[] bytes = {0x50, 0x4B, 0x03, 0x04};
    Files.write(storage.allocate(fileId), bytes);

    mockMvc
        .perform(get("/api/v1/download/{fileId}", fileId))
        .andExpect(status().isOk())
        .andExpect(content().contentType(DownloadController.PPTX))
        .andExpect(
            header()
                .string("Content-Disposition", "attachment; filename=\"" + fileId + ".pptx\""))
        .andExpect(content().bytes(bytes));
  }

  @Test
  @DisplayName("should return 404 for an unknown file")
  void shouldReturnNotFoundForUnknownFile() throws Exception {
    mockMvc
        .perform(get("/api/v1/download/{fileId}", UUID.randomUUID()))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.ARTIFACT_NOT_FOUND));
  }

  @Test
  @DisplayName("should return 404 for ids that are not UUIDs")
  void shouldReturnNotFoundForMalformedId() throws Exception {
    Files.writeString(outputDir.resolve("secret.pptx"), "not for download");

    mockMvc
        .perform(get("/api/v1/download/{fileId}", "secret"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.ARTIFACT_NOT_FOUND));
  }
}
