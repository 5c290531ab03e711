package com.flamingo.ai.memorybot.domain.repository;

import com.flamingo.ai.memorybot.domain.entity.MediaBlob;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for content-addressed media blobs. */
@Repository
public interface MediaBlobRepository extends JpaRepository<MediaBlob, String> {

  /**
   * Inserts a blob row unless one with the same fingerprint already exists. Concurrent callers
   * storing the same bytes all succeed; exactly one of them sees {@code 1}.
   *
   * @return number of rows inserted (0 or 1)
   */
  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      value =
          "INSERT INTO media_blobs "
              + "(fingerprint, byte_size, content_type, storage_location, first_seen_at) "
              + "VALUES (:fingerprint, :byteSize, :contentType, :storageLocation, :firstSeenAt) "
              + "ON CONFLICT(fingerprint) DO NOTHING",
      nativeQuery = true)
  int insertIfAbsent(
      @Param("fingerprint") String fingerprint,
      @Param("byteSize") long byteSize,
      @Param("contentType") String contentType,
      @Param("storageLocation") String storageLocation,
      @Param("firstSeenAt") Instant firstSeenAt);

  /** Sum of the physical bytes held on disk. */
  @Query("SELECT COALESCE(SUM(b.byteSize), 0) FROM MediaBlob b")
  long sumByteSize();
}
