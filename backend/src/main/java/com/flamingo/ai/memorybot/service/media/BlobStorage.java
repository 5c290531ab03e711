package com.flamingo.ai.memorybot.service.media;

import java.io.IOException;

/** Physical storage of blob bytes, addressed by fingerprint. */
public interface BlobStorage {

  /**
   * Writes the bytes for a fingerprint and returns where they live. The location depends only on
   * the fingerprint and the signature type, both functions of the bytes, so every writer of the
   * same content lands in the same place.
   *
   * @param signatureType type recognized from the payload signature, or null when none matched
   * @throws IOException if the bytes could not be made durable
   */
  String write(String fingerprint, String signatureType, byte[] bytes) throws IOException;

  /** Reads the bytes stored at a location returned by {@link #write}. */
  byte[] read(String location) throws IOException;
}
