package com.flamingo.ai.memorybot.api.dto.request;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for scheduling a reminder. Exactly one of {@code scheduledFor} and {@code
 * naturalLanguageTime} must be given.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateReminderRequest {

  @NotNull(message = "User ID is required")
  private UUID userId;

  @NotNull(message = "Memory ID is required")
  private UUID memoryId;

  @NotBlank(message = "Message is required")
  @Size(max = 1000, message = "Message must not exceed 1000 characters")
  private String message;

  private Instant scheduledFor;

  @Size(max = 200, message = "Time phrase must not exceed 200 characters")
  private String naturalLanguageTime;

  /** IANA zone used to read {@code naturalLanguageTime}; the user's zone when absent. */
  private String timezone;

  @AssertTrue(message = "Provide either scheduledFor or naturalLanguageTime")
  public boolean isTimeSpecified() {
    boolean hasPhrase = naturalLanguageTime != null && !naturalLanguageTime.isBlank();
    return (scheduledFor != null) != hasPhrase;
  }
}
