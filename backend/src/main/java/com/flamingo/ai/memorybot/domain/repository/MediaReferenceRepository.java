package com.flamingo.ai.memorybot.domain.repository;

import com.flamingo.ai.memorybot.domain.entity.MediaReference;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for media upload events. */
@Repository
public interface MediaReferenceRepository extends JpaRepository<MediaReference, UUID> {

  long countByFingerprint(String fingerprint);

  List<MediaReference> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

  /** Bytes the references would occupy without deduplication. */
  @Query(
      "SELECT COALESCE(SUM(b.byteSize), 0) FROM MediaReference r, MediaBlob b "
          + "WHERE r.fingerprint = b.fingerprint")
  long sumLogicalSize();

  /** Reference counts per sniffed content type, as {@code [contentType, count]} rows. */
  @Query(
      "SELECT b.contentType, COUNT(r) FROM MediaReference r, MediaBlob b "
          + "WHERE r.fingerprint = b.fingerprint GROUP BY b.contentType")
  List<Object[]> countByContentType();
}
