package com.flamingo.ai.memorybot.service.media;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import com.flamingo.ai.memorybot.domain.entity.MediaBlob;
import com.flamingo.ai.memorybot.domain.entity.MediaReference;
import com.flamingo.ai.memorybot.domain.repository.MediaBlobRepository;
import com.flamingo.ai.memorybot.domain.repository.MediaReferenceRepository;
import com.flamingo.ai.memorybot.exception.BlobNotFoundException;
import com.flamingo.ai.memorybot.exception.StorageException;
import com.flamingo.ai.memorybot.exception.ValidationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** SHA-256 addressed implementation of {@link FingerprintStore} backed by JPA and disk. */
@Service
@RequiredArgsConstructor
@Slf4j
public class FingerprintStoreImpl implements FingerprintStore {

  private final MediaBlobRepository blobRepository;
  private final MediaReferenceRepository referenceRepository;
  private final BlobStorage blobStorage;
  private final ContentTypeSniffer sniffer;
  private final MemoryBotConfig config;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  public String fingerprint(byte[] bytes) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(bytes));
    } catch (NoSuchAlgorithmException e) {
      // Every JRE ships SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<MediaBlob> findByFingerprint(String fingerprint) {
    return blobRepository.findById(fingerprint);
  }

  @Override
  @Transactional
  @Timed(value = "media.store", description = "Time to fingerprint and store a payload")
  public MediaReference store(
      byte[] bytes, String declaredContentType, String originalName, MediaOwnerContext owner) {

    if (bytes == null || bytes.length == 0) {
      throw new ValidationException("Media payload is empty");
    }
    long maxBytes = config.getMedia().getMaxFileSizeBytes();
    if (bytes.length > maxBytes) {
      throw new ValidationException(
          "Media payload of " + bytes.length + " bytes exceeds the limit of " + maxBytes);
    }

    String fingerprint = fingerprint(bytes);
    meterRegistry.counter("media.store.count").increment();

    if (blobRepository.existsById(fingerprint)) {
      meterRegistry.counter("media.store.dedup").increment();
      log.info(
          "Deduplicated {} ({} bytes) for owner {}",
          LocalBlobStorage.abbreviate(fingerprint),
          bytes.length,
          owner.ownerId());
    } else {
      createBlob(fingerprint, bytes, declaredContentType);
    }

    MediaReference reference =
        MediaReference.builder()
            .ownerId(owner.ownerId())
            .interactionId(owner.interactionId())
            .memoryId(owner.memoryId())
            .originalName(originalName != null && !originalName.isBlank() ? originalName : "upload")
            .declaredContentType(declaredContentType)
            .fingerprint(fingerprint)
            .createdAt(clock.instant())
            .build();
    try {
      return referenceRepository.save(reference);
    } catch (DataAccessException e) {
      throw new StorageException(
          fingerprint, "Failed to record reference to " + fingerprint + ": " + e.getMessage(), e);
    }
  }

  private void createBlob(String fingerprint, byte[] bytes, String declaredContentType) {
    String contentType = sniffer.resolve(bytes, declaredContentType);

    // The file name must follow from the bytes alone, never from what the caller declared
    String location;
    try {
      location = blobStorage.write(fingerprint, sniffer.sniff(bytes).orElse(null), bytes);
    } catch (IOException e) {
      throw new StorageException(
          fingerprint, "Failed to write blob " + fingerprint + ": " + e.getMessage(), e);
    }

    Instant now = clock.instant();
    int inserted;
    try {
      inserted =
          blobRepository.insertIfAbsent(fingerprint, bytes.length, contentType, location, now);
    } catch (DataAccessException e) {
      throw new StorageException(
          fingerprint, "Failed to record blob " + fingerprint + ": " + e.getMessage(), e);
    }
    if (inserted == 1) {
      log.info(
          "Stored new blob {} ({} bytes, {})",
          LocalBlobStorage.abbreviate(fingerprint),
          bytes.length,
          contentType);
    } else {
      // A concurrent store won the insert; its row points at the same bytes
      meterRegistry.counter("media.store.dedup").increment();
      log.debug("Blob {} inserted concurrently", LocalBlobStorage.abbreviate(fingerprint));
    }
  }

  @Override
  @Transactional(readOnly = true)
  public byte[] readContent(String fingerprint) {
    MediaBlob blob =
        blobRepository
            .findById(fingerprint)
            .orElseThrow(() -> new BlobNotFoundException(fingerprint));
    try {
      return blobStorage.read(blob.getStorageLocation());
    } catch (IOException e) {
      throw new StorageException(
          fingerprint, "Failed to read blob " + fingerprint + ": " + e.getMessage(), e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public MediaStats stats() {
    long totalReferences = referenceRepository.count();
    long uniqueBlobs = blobRepository.count();

    Map<String, Long> byType = new LinkedHashMap<>();
    for (Object[] row : referenceRepository.countByContentType()) {
      byType.put((String) row[0], ((Number) row[1]).longValue());
    }

    return new MediaStats(
        totalReferences,
        uniqueBlobs,
        referenceRepository.sumLogicalSize(),
        blobRepository.sumByteSize(),
        byType,
        MediaStats.dedupRate(totalReferences, uniqueBlobs));
  }
}
