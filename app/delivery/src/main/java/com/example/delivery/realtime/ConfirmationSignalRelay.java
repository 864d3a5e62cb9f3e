/*
 * Where: realtime gateway to delivery consumer
 * What: announces confirmations on the delivery:confirmations channel and wakes local waiters
 * Why: the socket that confirms and the consumer that waits usually live on different instances
 */
package com.example.delivery.realtime;

import com.example.delivery.config.RealtimeProperties;
import com.example.delivery.service.ConfirmationSignal;
import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

@Component
public class ConfirmationSignalRelay implements MessageListener {

  private static final Logger logger = LoggerFactory.getLogger(ConfirmationSignalRelay.class);

  private final ConfirmationSignal confirmationSignal;
  private final StringRedisTemplate redisTemplate;
  private final RedisMessageListenerContainer listenerContainer;
  private final String channel;

  public ConfirmationSignalRelay(
      ConfirmationSignal confirmationSignal,
      StringRedisTemplate redisTemplate,
      RedisMessageListenerContainer listenerContainer,
      RealtimeProperties properties) {
    this.confirmationSignal = confirmationSignal;
    this.redisTemplate = redisTemplate;
    this.listenerContainer = listenerContainer;
    this.channel = properties.confirmationChannel();
  }

  @PostConstruct
  public void start() {
    try {
      listenerContainer.addMessageListener(this, new ChannelTopic(channel));
    } catch (RuntimeException ex) {
      // waiters fall back to polling
      logger.warn("confirmation channel unavailable channel={}", channel, ex);
    }
  }

  public void signal(String messageId) {
    confirmationSignal.signal(messageId);
    try {
      redisTemplate.convertAndSend(channel, messageId);
    } catch (DataAccessException ex) {
      logger.warn("failed to publish confirmation signal messageId={}", messageId, ex);
    }
  }

  @Override
  public void onMessage(Message message, byte[] pattern) {
    confirmationSignal.signal(new String(message.getBody(), StandardCharsets.UTF_8));
  }
}
