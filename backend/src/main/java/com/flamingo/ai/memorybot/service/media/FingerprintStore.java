package com.flamingo.ai.memorybot.service.media;

import com.flamingo.ai.memorybot.domain.entity.MediaBlob;
import com.flamingo.ai.memorybot.domain.entity.MediaReference;
import java.util.Optional;

/** Content-addressed store that keeps at most one physical copy of any byte sequence. */
public interface FingerprintStore {

  /** Lowercase hex SHA-256 of the full byte sequence. */
  String fingerprint(byte[] bytes);

  Optional<MediaBlob> findByFingerprint(String fingerprint);

  /**
   * Records one upload of {@code bytes}. Writes the payload only the first time its fingerprint
   * is seen; every call creates a new reference.
   *
   * @throws com.flamingo.ai.memorybot.exception.ValidationException if the payload is empty or
   *     larger than the configured limit
   * @throws com.flamingo.ai.memorybot.exception.StorageException if the bytes cannot be written
   */
  MediaReference store(
      byte[] bytes, String declaredContentType, String originalName, MediaOwnerContext owner);

  /** Reads back the bytes of a stored blob. */
  byte[] readContent(String fingerprint);

  MediaStats stats();
}
