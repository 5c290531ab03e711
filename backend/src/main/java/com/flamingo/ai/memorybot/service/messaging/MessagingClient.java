package com.flamingo.ai.memorybot.service.messaging;

/** Outbound WhatsApp delivery. */
public interface MessagingClient {

  /**
   * Sends a text message.
   *
   * @param recipientAddress provider address, e.g. {@code whatsapp:+15551234567}
   * @param body message text
   * @return provider message id, or a local id when delivery is disabled
   * @throws com.flamingo.ai.memorybot.exception.MessageDeliveryException if the provider rejects
   *     the message or cannot be reached
   */
  String send(String recipientAddress, String body);
}
