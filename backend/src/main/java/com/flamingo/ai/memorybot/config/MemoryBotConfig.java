package com.flamingo.ai.memorybot.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for media storage, reminders and outbound messaging. */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class MemoryBotConfig {

  private Media media = new Media();
  private Reminders reminders = new Reminders();
  private Messaging messaging = new Messaging();

  /** Content-addressed media storage and attachment download. */
  @Getter
  @Setter
  public static class Media {
    /** Root directory of the blob store. Blobs live at {@code {basePath}/aa/bb/{digest}.{ext}}. */
    private String basePath = "./storage/media";

    /** Public prefix used to build blob URLs, e.g. {@code http://localhost:8080/media}. */
    private String publicBaseUrl = "http://localhost:8080/media";

    private long maxFileSizeBytes = 16L * 1024 * 1024;
    private int fetchTimeoutMs = 30000;

    /** Media hosted on this host is downloaded with the messaging account credentials. */
    private String authHost = "api.twilio.com";
  }

  @Getter
  @Setter
  public static class Reminders {
    private boolean schedulerEnabled = true;
    private long pollIntervalMs = 60000;

    /** Local hour used when a phrase names a day but no clock time ("tomorrow", "next week"). */
    private int defaultHour = 9;

    private int memoryPreviewLength = 100;
  }

  /** WhatsApp delivery through the Twilio REST API. Without credentials messages are logged. */
  @Getter
  @Setter
  public static class Messaging {
    private String baseUrl = "https://api.twilio.com";
    private String accountSid = "";
    private String authToken = "";
    private String whatsappNumber = "";
    private int timeoutMs = 10000;

    public boolean hasCredentials() {
      return accountSid != null
          && !accountSid.isBlank()
          && authToken != null
          && !authToken.isBlank();
    }
  }
}
