package com.flamingo.ai.memorybot.api.rest;

import com.flamingo.ai.memorybot.api.dto.request.IngestMediaRequest;
import com.flamingo.ai.memorybot.api.dto.response.MediaReferenceResponse;
import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import com.flamingo.ai.memorybot.domain.entity.MediaReference;
import com.flamingo.ai.memorybot.service.media.FingerprintStore;
import com.flamingo.ai.memorybot.service.media.MediaIngestor;
import com.flamingo.ai.memorybot.service.media.MediaOwnerContext;
import com.flamingo.ai.memorybot.service.media.MediaStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for attachment ingestion and storage statistics. */
@RestController
@RequestMapping("/api/media")
@RequiredArgsConstructor
@Slf4j
public class MediaController {

  private final MediaIngestor mediaIngestor;
  private final FingerprintStore fingerprintStore;
  private final MemoryBotConfig config;

  /**
   * Downloads an attachment and stores it deduplicated.
   *
   * @param request source URL and owner context
   * @return the reference created for this upload
   */
  @PostMapping
  public ResponseEntity<MediaReferenceResponse> ingest(
      @Valid @RequestBody IngestMediaRequest request) {

    log.info("Ingesting media for user {} from {}", request.getUserId(), request.getSourceUrl());

    MediaOwnerContext owner =
        new MediaOwnerContext(
            request.getUserId(), request.getInteractionId(), request.getMemoryId());
    MediaReference reference =
        mediaIngestor.ingest(
            request.getSourceUrl(), request.getContentType(), request.getOriginalName(), owner);

    MediaReferenceResponse response =
        MediaReferenceResponse.from(
            reference,
            fingerprintStore.findByFingerprint(reference.getFingerprint()).orElse(null),
            config.getMedia().getPublicBaseUrl());
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/stats")
  public ResponseEntity<MediaStats> stats() {
    return ResponseEntity.ok(fingerprintStore.stats());
  }
}
