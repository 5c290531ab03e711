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

/** A WhatsApp user of the bot. */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppUser {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  /** E.164 phone number without the {@code whatsapp:} prefix. */
  @Column(nullable = false, unique = true)
  private String phoneNumber;

  private String name;

  /** IANA zone id used to interpret the user's time phrases. */
  @Column(nullable = false)
  @Builder.Default
  private String timezone = "UTC";

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  /** Address used by the messaging API for this user. */
  public String whatsappAddress() {
    return "whatsapp:" + phoneNumber;
  }
}
