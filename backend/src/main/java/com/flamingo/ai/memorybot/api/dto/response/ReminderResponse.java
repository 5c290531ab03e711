package com.flamingo.ai.memorybot.api.dto.response;

import com.flamingo.ai.memorybot.domain.entity.Reminder;
import com.flamingo.ai.memorybot.domain.enums.ReminderStatus;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for reminder data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReminderResponse {

  private UUID id;
  private UUID userId;
  private UUID memoryId;
  private Instant scheduledFor;
  private String message;
  private ReminderStatus status;
  private Instant createdAt;
  private Instant updatedAt;

  /** Creates a ReminderResponse from a Reminder entity. */
  public static ReminderResponse fromEntity(Reminder reminder) {
    return ReminderResponse.builder()
        .id(reminder.getId())
        .userId(reminder.getOwnerId())
        .memoryId(reminder.getMemoryId())
        .scheduledFor(reminder.getScheduledFor())
        .message(reminder.getMessage())
        .status(reminder.getStatus())
        .createdAt(reminder.getCreatedAt())
        .updatedAt(reminder.getUpdatedAt())
        .build();
  }
}
