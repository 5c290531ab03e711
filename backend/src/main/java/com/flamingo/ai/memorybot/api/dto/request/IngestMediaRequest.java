package com.flamingo.ai.memorybot.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for downloading and storing an attachment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestMediaRequest {

  @NotNull(message = "User ID is required")
  private UUID userId;

  @NotBlank(message = "Source URL is required")
  private String sourceUrl;

  private String contentType;
  private String originalName;
  private UUID interactionId;
  private UUID memoryId;
}
