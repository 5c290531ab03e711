package com.flamingo.ai.memorybot.service.media;

import com.flamingo.ai.memorybot.domain.entity.MediaReference;

/** Turns a remote attachment into a deduplicated local blob. */
public interface MediaIngestor {

  /**
   * Downloads the attachment at {@code sourceUrl}, following at most one metadata indirection,
   * and stores the final payload.
   *
   * @param sourceUrl attachment URL as received from the messaging provider
   * @param declaredContentType type claimed by the provider, may be null
   * @param originalName file name to record on the reference, may be null
   * @param owner uploader and originating context
   * @return the reference created for this upload
   * @throws com.flamingo.ai.memorybot.exception.MediaFetchException when the payload cannot be
   *     retrieved; nothing has been stored and the whole ingest may be retried
   */
  MediaReference ingest(
      String sourceUrl, String declaredContentType, String originalName, MediaOwnerContext owner);
}
