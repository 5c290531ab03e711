package com.flamingo.ai.memorybot.api.dto.response;

import com.flamingo.ai.memorybot.domain.entity.MediaBlob;
import com.flamingo.ai.memorybot.domain.entity.MediaReference;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored upload and the blob behind it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaReferenceResponse {

  private UUID id;
  private UUID userId;
  private UUID interactionId;
  private UUID memoryId;
  private String originalName;
  private String fingerprint;
  private String contentType;
  private Long byteSize;
  private String url;
  private Instant createdAt;

  /** Creates a response from a reference and its blob; the blob may be null. */
  public static MediaReferenceResponse from(
      MediaReference reference, MediaBlob blob, String publicBaseUrl) {
    return MediaReferenceResponse.builder()
        .id(reference.getId())
        .userId(reference.getOwnerId())
        .interactionId(reference.getInteractionId())
        .memoryId(reference.getMemoryId())
        .originalName(reference.getOriginalName())
        .fingerprint(reference.getFingerprint())
        .contentType(blob != null ? blob.getContentType() : reference.getDeclaredContentType())
        .byteSize(blob != null ? blob.getByteSize() : null)
        .url(stripTrailingSlash(publicBaseUrl) + "/" + reference.getFingerprint())
        .createdAt(reference.getCreatedAt())
        .build();
  }

  private static String stripTrailingSlash(String base) {
    return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }
}
