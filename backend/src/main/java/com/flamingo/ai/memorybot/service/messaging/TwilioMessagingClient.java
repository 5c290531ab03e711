package com.flamingo.ai.memorybot.service.messaging;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import com.flamingo.ai.memorybot.exception.MessageDeliveryException;
import java.time.Duration;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Sends WhatsApp messages through the Twilio Messages REST endpoint. Without account credentials
 * the client runs dry: messages are logged and reported as sent.
 */
@Component
@Slf4j
public class TwilioMessagingClient implements MessagingClient {

  private final WebClient webClient;
  private final MemoryBotConfig.Messaging messaging;

  @Autowired
  public TwilioMessagingClient(MemoryBotConfig config) {
    this(config, WebClient.builder().baseUrl(config.getMessaging().getBaseUrl()).build());
  }

  TwilioMessagingClient(MemoryBotConfig config, WebClient webClient) {
    this.messaging = config.getMessaging();
    this.webClient = webClient;
    log.info(
        "Messaging client initialized: baseUrl={}, dryRun={}",
        messaging.getBaseUrl(),
        !messaging.hasCredentials());
  }

  @Override
  public String send(String recipientAddress, String body) {
    if (!messaging.hasCredentials()) {
      String localId = "dry-run-" + UUID.randomUUID();
      log.info("Dry run, not sending to {}: {}", recipientAddress, body);
      return localId;
    }

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("From", fromAddress());
    form.add("To", recipientAddress);
    form.add("Body", body);

    try {
      MessageResponse response =
          webClient
              .post()
              .uri("/2010-04-01/Accounts/{sid}/Messages.json", messaging.getAccountSid())
              .headers(h -> h.setBasicAuth(messaging.getAccountSid(), messaging.getAuthToken()))
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(BodyInserters.fromFormData(form))
              .retrieve()
              .bodyToMono(MessageResponse.class)
              .timeout(Duration.ofMillis(messaging.getTimeoutMs()))
              .block();
      String sid = response != null ? response.sid() : null;
      log.info("Sent message {} to {}", sid, recipientAddress);
      return sid;
    } catch (WebClientResponseException e) {
      throw new MessageDeliveryException(
          recipientAddress,
          "Messaging API returned " + e.getStatusCode() + ": " + e.getResponseBodyAsString(),
          e);
    } catch (RuntimeException e) {
      throw new MessageDeliveryException(
          recipientAddress, "Messaging API call failed: " + e.getMessage(), e);
    }
  }

  private String fromAddress() {
    String number = messaging.getWhatsappNumber();
    return number.startsWith("whatsapp:") ? number : "whatsapp:" + number;
  }

  /** Subset of the Messages resource returned on creation. */
  record MessageResponse(String sid, String status) {}
}
