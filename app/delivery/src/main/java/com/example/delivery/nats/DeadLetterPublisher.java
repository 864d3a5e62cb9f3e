/*
 * Where: delivery NATS infrastructure
 * What: republishes a failed message to its dlq.{domain}.{action} subject with diagnostic headers
 * Why: dead letters keep the original body so they can be inspected and replayed
 */
package com.example.delivery.nats;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.Message;
import io.nats.client.impl.Headers;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class DeadLetterPublisher {

  public static final String RETRY_COUNT_HEADER = "x-retry-count";
  public static final String REASON_HEADER = "x-dead-letter-reason";
  public static final String ORIGIN_SUBJECT_HEADER = "x-origin-subject";
  static final String MSG_ID_HEADER = "Nats-Msg-Id";
  private static final int MAX_REASON_LENGTH = 256;

  private static final Logger logger = LoggerFactory.getLogger(DeadLetterPublisher.class);

  private final JetStream jetStream;

  public DeadLetterPublisher(JetStream jetStream) {
    this.jetStream = jetStream;
  }

  public void publish(String deadLetterQueue, Message original, int retryCount, String reason) {
    final Headers headers = new Headers();
    final Headers originalHeaders = original.getHeaders();
    if (originalHeaders != null) {
      for (String key : originalHeaders.keySet()) {
        if (!RETRY_COUNT_HEADER.equals(key) && !MSG_ID_HEADER.equals(key)) {
          headers.put(key, originalHeaders.get(key));
        }
      }
    }
    headers.put(RETRY_COUNT_HEADER, String.valueOf(retryCount));
    headers.put(REASON_HEADER, truncate(reason));
    headers.put(ORIGIN_SUBJECT_HEADER, original.getSubject());
    final String deadLetterId = deadLetterId(original);
    if (deadLetterId != null) {
      // a redelivered failure must not produce a second dead letter
      headers.put(MSG_ID_HEADER, deadLetterId);
    }
    try {
      jetStream.publish(deadLetterQueue, headers, original.getData());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish dead letter to " + deadLetterQueue, ex);
    }
    logger.warn("message dead-lettered subject={} dlq={} retryCount={} reason={}",
        original.getSubject(), deadLetterQueue, retryCount, truncate(reason));
  }

  private String deadLetterId(Message original) {
    if (!original.isJetStream()) {
      return null;
    }
    return original.metaData().getStream() + ":" + original.metaData().streamSequence();
  }

  private String truncate(String reason) {
    if (reason == null) {
      return "unknown";
    }
    return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
  }
}
