/*
 * Where: delivery consumer wiring
 * What: declares one ResilientConsumer bean per queue with its processor
 * Why: the container starts every subscription after wiring and stops it on shutdown
 */
package com.example.delivery.config;

import com.example.delivery.bridge.BridgeProperties;
import com.example.delivery.bridge.ClearAllNotificationsProcessor;
import com.example.delivery.bridge.GenericEventsProcessor;
import com.example.delivery.bridge.JetStreamDomainEventPublisher;
import com.example.delivery.bridge.MembersEventsProcessor;
import com.example.delivery.bridge.RealtimeNotificationForwarder;
import com.example.delivery.consumer.ConsumerSettings;
import com.example.delivery.consumer.DeliveryAwareProcessor;
import com.example.delivery.consumer.MessageIds;
import com.example.delivery.consumer.ResilientConsumer;
import com.example.delivery.consumer.ResilientConsumerFactory;
import com.example.delivery.model.ClearAllNotificationsRequest;
import com.example.delivery.model.RealtimeNotificationMessage;
import com.example.delivery.repository.NotificationRepository;
import com.example.delivery.service.RealtimeNotificationHandler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class ConsumerConfig {

    public static final String CLEAR_ALL_CONSUMER_NAME = "clear-all-notifications";

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ResilientConsumer<RealtimeNotificationMessage> realtimeNotificationsConsumer(
            ResilientConsumerFactory factory,
            RealtimeNotificationHandler handler,
            MessageIds messageIds,
            ConfirmationProperties confirmationProperties) {
        final ConsumerSettings settings = factory.settings(RealtimeNotificationHandler.CONSUMER_NAME);
        requireAckWaitBeyondConfirmation(settings, confirmationProperties);
        return factory.create(settings, new DeliveryAwareProcessor<>(handler, messageIds));
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ResilientConsumer<RealtimeNotificationMessage> membersEventsConsumer(
            ResilientConsumerFactory factory, RealtimeNotificationForwarder forwarder) {
        return factory.create(
                factory.settings(JetStreamDomainEventPublisher.MEMBERS_CONSUMER_NAME),
                new MembersEventsProcessor(forwarder));
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ResilientConsumer<RealtimeNotificationMessage> genericEventsConsumer(
            ResilientConsumerFactory factory, RealtimeNotificationForwarder forwarder) {
        return factory.create(
                factory.settings(JetStreamDomainEventPublisher.GENERIC_CONSUMER_NAME),
                new GenericEventsProcessor(forwarder));
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ResilientConsumer<ClearAllNotificationsRequest> clearAllNotificationsConsumer(
            ResilientConsumerFactory factory,
            NotificationRepository notificationRepository,
            BridgeProperties bridgeProperties) {
        return factory.create(
                factory.settings(CLEAR_ALL_CONSUMER_NAME),
                new ClearAllNotificationsProcessor(
                        notificationRepository, bridgeProperties.clearAllBatchSize()));
    }

    /** The broker must not redeliver while a worker still waits for the client acknowledgment. */
    static void requireAckWaitBeyondConfirmation(
            ConsumerSettings settings, ConfirmationProperties confirmationProperties) {
        if (settings.ackWait().compareTo(confirmationProperties.ttl()) <= 0) {
            throw new IllegalStateException(
                    "delivery.consumers." + RealtimeNotificationHandler.CONSUMER_NAME
                            + ".ack-wait must exceed delivery.confirmation.ttl");
        }
    }
}
