package com.flamingo.ai.memorybot.exception;

/** Thrown by the messaging client when an outbound message is not accepted. */
public class MessageDeliveryException extends RuntimeException {

  private final String recipient;

  public MessageDeliveryException(String recipient, String message) {
    super(message);
    this.recipient = recipient;
  }

  public MessageDeliveryException(String recipient, String message, Throwable cause) {
    super(message, cause);
    this.recipient = recipient;
  }

  public String getRecipient() {
    return recipient;
  }
}
