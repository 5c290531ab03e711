package com.flamingo.ai.memorybot.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One upload event. Many references may share a {@link MediaBlob}; the link is the fingerprint
 * column only, so removing a reference never touches the blob.
 */
@Entity
@Table(name = "media_references")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MediaReference {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID ownerId;

  /** Interaction (inbound message) that carried the attachment, if any. */
  private UUID interactionId;

  /** Memory the attachment was filed under, if any. */
  private UUID memoryId;

  @Column(nullable = false)
  private String originalName;

  /** Content type the caller claimed; the blob keeps the sniffed one. */
  private String declaredContentType;

  @Column(length = 64, nullable = false)
  private String fingerprint;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
