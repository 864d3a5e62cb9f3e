/*
 * Where: realtime gateway horizontal scaling
 * What: relays emits through a Redis channel so every instance delivers to its own sockets
 * Why: clients of one user or tenant spread across instances behind the load balancer
 */
package com.example.delivery.realtime;

import com.example.delivery.config.RealtimeProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

@Component
public class RedisFanoutRelay implements MessageListener {

  private static final Logger logger = LoggerFactory.getLogger(RedisFanoutRelay.class);

  private final RedisMessageListenerContainer listenerContainer;
  private final StringRedisTemplate redisTemplate;
  private final LocalSessionRegistry sessionRegistry;
  private final ObjectMapper objectMapper;
  private final RealtimeProperties.Fanout fanout;
  private final AtomicBoolean active = new AtomicBoolean(false);

  public RedisFanoutRelay(
      RedisMessageListenerContainer listenerContainer,
      StringRedisTemplate redisTemplate,
      LocalSessionRegistry sessionRegistry,
      ObjectMapper objectMapper,
      RealtimeProperties properties) {
    this.listenerContainer = listenerContainer;
    this.redisTemplate = redisTemplate;
    this.sessionRegistry = sessionRegistry;
    this.objectMapper = objectMapper;
    this.fanout = properties.fanout();
  }

  /**
   * Subscribes to the fan-out channel.
   *
   * @throws IllegalStateException when fan-out is required and the subscription fails
   */
  @PostConstruct
  public void start() {
    if (!fanout.enabled()) {
      logger.info("realtime fan-out disabled, emits stay on this instance");
      return;
    }
    try {
      // fail fast when Redis is unreachable instead of at the first emit
      redisTemplate.execute(connection -> connection.ping(), true);
      listenerContainer.addMessageListener(this, new ChannelTopic(fanout.channel()));
      active.set(true);
      logger.info("realtime fan-out subscribed channel={}", fanout.channel());
    } catch (RuntimeException ex) {
      if (fanout.required()) {
        throw new IllegalStateException(
            "realtime fan-out is required but could not subscribe to " + fanout.channel(), ex);
      }
      logger.warn(
          "realtime fan-out unavailable, degrading to local delivery channel={}",
          fanout.channel(),
          ex);
    }
  }

  public boolean isActive() {
    return active.get();
  }

  public void publish(FanoutEnvelope envelope) {
    final String body;
    try {
      body = objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("fan-out envelope is not serializable", ex);
    }
    redisTemplate.convertAndSend(fanout.channel(), body);
  }

  @Override
  public void onMessage(Message message, byte[] pattern) {
    try {
      final FanoutEnvelope envelope =
          objectMapper.readValue(message.getBody(), FanoutEnvelope.class);
      sessionRegistry.deliver(envelope.room(), envelope.frame());
    } catch (IOException ex) {
      logger.error("unreadable fan-out envelope channel={}", fanout.channel(), ex);
    }
  }
}
