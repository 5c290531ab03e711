package com.flamingo.ai.memorybot.service.media;

import java.util.Objects;
import java.util.UUID;

/**
 * Who uploaded a payload and where it came from.
 *
 * @param ownerId user that owns the upload
 * @param interactionId inbound message that carried the attachment, may be null
 * @param memoryId memory the attachment belongs to, may be null
 */
public record MediaOwnerContext(UUID ownerId, UUID interactionId, UUID memoryId) {

  public MediaOwnerContext {
    Objects.requireNonNull(ownerId, "ownerId");
  }

  public static MediaOwnerContext of(UUID ownerId) {
    return new MediaOwnerContext(ownerId, null, null);
  }
}
