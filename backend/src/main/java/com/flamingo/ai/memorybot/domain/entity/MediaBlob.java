package com.flamingo.ai.memorybot.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One physical content payload, identified by the SHA-256 digest of its bytes.
 *
 * <p>Exactly one row exists per distinct byte sequence. Rows are created on the first successful
 * store and never updated or deleted; the bytes live at {@link #storageLocation}, a path derived
 * from the digest alone.
 */
@Entity
@Table(name = "media_blobs")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MediaBlob {

  /** Lowercase hex SHA-256 of the content. */
  @Id
  @Column(length = 64, nullable = false, updatable = false)
  private String fingerprint;

  @Column(nullable = false, updatable = false)
  private long byteSize;

  /** Content type sniffed from the leading bytes, or the declared type when nothing matched. */
  @Column(nullable = false, updatable = false)
  private String contentType;

  @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
  private String storageLocation;

  @Column(nullable = false, updatable = false)
  private Instant firstSeenAt;

  @PrePersist
  protected void onCreate() {
    if (firstSeenAt == null) {
      firstSeenAt = Instant.now();
    }
  }
}
