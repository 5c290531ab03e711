package com.flamingo.ai.memorybot.service.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.memorybot.domain.entity.MediaReference;
import com.flamingo.ai.memorybot.exception.MediaFetchException;
import com.flamingo.ai.memorybot.exception.ValidationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link MediaIngestor}.
 *
 * <p>Some providers answer a media URL with a small JSON document naming the real binary location
 * instead of the binary itself. A payload without a known binary signature whose first
 * non-whitespace byte is <code>{</code> is treated as such a document: its location field is
 * fetched once more and the result must be the media itself. HTML and XML bodies are provider
 * error pages and are rejected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MediaIngestorImpl implements MediaIngestor {

  /** Fields an indirection document may use to name the binary location, in lookup order. */
  static final List<String> LOCATION_FIELDS =
      List.of("redirect_to", "url", "media_url", "location", "uri");

  private final MediaFetcher mediaFetcher;
  private final FingerprintStore fingerprintStore;
  private final ContentTypeSniffer sniffer;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "media.ingest", description = "Time to download and store an attachment")
  public MediaReference ingest(
      String sourceUrl, String declaredContentType, String originalName, MediaOwnerContext owner) {

    if (sourceUrl == null || sourceUrl.isBlank()) {
      throw new ValidationException("Media source URL is required");
    }

    FetchedMedia payload;
    try {
      payload = resolvePayload(sourceUrl);
    } catch (MediaFetchException e) {
      meterRegistry.counter("media.ingest.errors").increment();
      log.warn("Failed to ingest media from {}: {}", sourceUrl, e.getMessage());
      throw e;
    }

    if (payload.isEmpty()) {
      meterRegistry.counter("media.ingest.errors").increment();
      throw new ValidationException("Downloaded media from " + sourceUrl + " is empty");
    }

    String contentType =
        declaredContentType != null && !declaredContentType.isBlank()
            ? declaredContentType
            : payload.contentType();
    MediaReference reference =
        fingerprintStore.store(payload.body(), contentType, originalName, owner);
    log.info(
        "Ingested media from {} as {} for owner {}",
        sourceUrl,
        LocalBlobStorage.abbreviate(reference.getFingerprint()),
        owner.ownerId());
    return reference;
  }

  private FetchedMedia resolvePayload(String sourceUrl) {
    FetchedMedia first = mediaFetcher.fetch(sourceUrl);
    PayloadKind kind = classify(first.body());

    if (kind == PayloadKind.ERROR_DOCUMENT) {
      throw new MediaFetchException(sourceUrl, "Provider returned an error document");
    }
    if (kind != PayloadKind.METADATA) {
      return first;
    }

    String location = resolveLocation(sourceUrl, first.body());
    meterRegistry.counter("media.ingest.indirection").increment();
    log.debug("Following media indirection from {} to {}", sourceUrl, location);

    FetchedMedia second = mediaFetcher.fetch(location);
    switch (classify(second.body())) {
      case METADATA ->
          throw new MediaFetchException(
              sourceUrl, "Media indirection nested more than one level deep");
      case ERROR_DOCUMENT ->
          throw new MediaFetchException(location, "Provider returned an error document");
      default -> {
        return second;
      }
    }
  }

  private String resolveLocation(String sourceUrl, byte[] document) {
    JsonNode root;
    try {
      root = objectMapper.readTree(document);
    } catch (IOException e) {
      throw new MediaFetchException(sourceUrl, "Unreadable media metadata document", e);
    }

    for (String field : LOCATION_FIELDS) {
      JsonNode node = root.get(field);
      if (node != null && node.isTextual() && !node.asText().isBlank()) {
        try {
          return URI.create(sourceUrl).resolve(node.asText().trim()).toString();
        } catch (IllegalArgumentException e) {
          throw new MediaFetchException(sourceUrl, "Invalid media location: " + node.asText(), e);
        }
      }
    }
    throw new MediaFetchException(sourceUrl, "Media metadata document names no location");
  }

  PayloadKind classify(byte[] body) {
    if (body.length == 0) {
      return PayloadKind.MEDIA;
    }
    if (sniffer.isKnownBinary(body)) {
      return PayloadKind.MEDIA;
    }

    int start = 0;
    if (body.length >= 3
        && (body[0] & 0xFF) == 0xEF
        && (body[1] & 0xFF) == 0xBB
        && (body[2] & 0xFF) == 0xBF) {
      start = 3;
    }
    while (start < body.length && Character.isWhitespace(body[start])) {
      start++;
    }
    if (start >= body.length) {
      return PayloadKind.MEDIA;
    }

    if (body[start] == '{') {
      return PayloadKind.METADATA;
    }
    if (body[start] == '<') {
      String head =
          new String(body, start, Math.min(256, body.length - start), StandardCharsets.UTF_8)
              .toLowerCase(Locale.ROOT);
      return head.contains("<svg") ? PayloadKind.MEDIA : PayloadKind.ERROR_DOCUMENT;
    }
    return PayloadKind.MEDIA;
  }

  enum PayloadKind {
    MEDIA,
    METADATA,
    ERROR_DOCUMENT
  }
}
