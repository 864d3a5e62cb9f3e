/*
 * Where: delivery NATS infrastructure
 * What: publishes a JSON object to a JetStream subject with an optional Nats-Msg-Id
 * Why: the stream's duplicate window drops a republish of the same logical message
 */
package com.example.delivery.nats;

import com.example.common.TraceIds;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class JsonJetStreamPublisher {

  private final JetStream jetStream;
  private final ObjectMapper objectMapper;

  public JsonJetStreamPublisher(JetStream jetStream, ObjectMapper objectMapper) {
    this.jetStream = jetStream;
    this.objectMapper = objectMapper;
  }

  public void publish(String subject, String msgId, Map<String, Object> body) {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject is required");
    }
    final byte[] data;
    try {
      data = objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("message body is not serializable subject=" + subject, ex);
    }
    final Headers headers = new Headers();
    if (msgId != null && !msgId.isBlank()) {
      headers.add(DeadLetterPublisher.MSG_ID_HEADER, msgId);
    }
    headers.add(TraceIds.HEADER, TraceIds.currentOrNew());
    try {
      jetStream.publish(subject, headers, data);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish message subject=" + subject, ex);
    }
  }
}
