package com.flamingo.ai.memorybot.api.rest;

import com.flamingo.ai.memorybot.domain.entity.MediaBlob;
import com.flamingo.ai.memorybot.exception.BlobNotFoundException;
import com.flamingo.ai.memorybot.service.media.FingerprintStore;
import java.time.Duration;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves stored blobs by fingerprint. Content never changes for a fingerprint, so responses are
 * cacheable forever.
 */
@RestController
@RequestMapping("/media")
@RequiredArgsConstructor
public class MediaContentController {

  private static final Pattern FINGERPRINT = Pattern.compile("^[0-9a-f]{64}$");

  private final FingerprintStore fingerprintStore;

  @GetMapping("/{fingerprint}")
  public ResponseEntity<byte[]> getContent(@PathVariable String fingerprint) {
    if (!FINGERPRINT.matcher(fingerprint).matches()) {
      throw new BlobNotFoundException(fingerprint);
    }
    MediaBlob blob =
        fingerprintStore
            .findByFingerprint(fingerprint)
            .orElseThrow(() -> new BlobNotFoundException(fingerprint));
    byte[] bytes = fingerprintStore.readContent(fingerprint);

    return ResponseEntity.ok()
        .contentType(parseMediaType(blob.getContentType()))
        .cacheControl(CacheControl.maxAge(Duration.ofDays(365)).cachePublic())
        .eTag(fingerprint)
        .body(bytes);
  }

  private MediaType parseMediaType(String contentType) {
    try {
      return MediaType.parseMediaType(contentType);
    } catch (InvalidMediaTypeException e) {
      return MediaType.APPLICATION_OCTET_STREAM;
    }
  }
}
