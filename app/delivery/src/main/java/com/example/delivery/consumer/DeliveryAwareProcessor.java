/*
 * Where: delivery-aware consumer
 * What: adapts a DeliveryHandler to the MessageProcessor contract
 * Why: an unconfirmed delivery has to surface as an exception for the retry/DLQ decision
 */
package com.example.delivery.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DeliveryAwareProcessor<T> implements MessageProcessor<T> {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryAwareProcessor.class);

  private final DeliveryHandler<T> handler;
  private final MessageIds messageIds;

  public DeliveryAwareProcessor(DeliveryHandler<T> handler, MessageIds messageIds) {
    this.handler = handler;
    this.messageIds = messageIds;
  }

  @Override
  public Class<T> payloadType() {
    return handler.payloadType();
  }

  @Override
  public String dedupKey(T payload) {
    return handler.dedupKey(payload);
  }

  @Override
  public void process(T payload) {
    process(payload, null);
  }

  @Override
  public void process(T payload, MessageOrigin origin) {
    final String messageId = messageIds.baseMessageId(origin);
    final DeliveryResult result = handler.processWithDelivery(payload, messageId);
    if (!result.confirmed()) {
      throw new DeliveryNotConfirmedException(messageId, result.error());
    }
    logger.info(
        "delivery finished messageId={} saved={} note={}",
        messageId,
        result.saved(),
        result.error());
  }
}
