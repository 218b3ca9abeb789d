package com.flamingo.ai.slidedeck.api.rest;

import com.flamingo.ai.slidedeck.service.render.ArtifactStorage;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for downloading rendered presentations. */
@RestController
@RequestMapping("/api/v1/download")
@RequiredArgsConstructor
@Slf4j
public class DownloadController {

  static final MediaType PPTX =
      MediaType.parseMediaType(
          "application/vnd.openxmlformats-officedocument.presentationml.presentation");

  private final ArtifactStorage artifactStorage;

  /**
   * Serves a rendered presentation.
   *
   * @param fileId artifact id returned by generation
   * @return the PPTX file, or 404 if the id is unknown or malformed
   */
  @GetMapping("/{fileId}")
  public ResponseEntity<Resource> download(@PathVariable String fileId) {
    Path path = artifactStorage.resolve(fileId);
    log.info("Download request for file {}", fileId);
    return ResponseEntity.ok()
        .contentType(PPTX)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(artifactStorage.fileName(fileId))
                .build()
                .toString())
        .body(new FileSystemResource(path));
  }
}
