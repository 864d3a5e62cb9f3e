package com.example.delivery.consumer;

public class DeliveryNotConfirmedException extends RuntimeException {

  private final String messageId;

  public DeliveryNotConfirmedException(String messageId, String reason) {
    super("delivery not confirmed messageId=" + messageId + " reason=" + reason);
    this.messageId = messageId;
  }

  public String messageId() {
    return messageId;
  }
}
