/*
 * Where: domain event bridge
 * What: ensures the stream behind the publish-only invites subject at startup
 * Why: events.invites has no consumer in this service to create it
 */
package com.example.delivery.bridge;

import com.example.delivery.consumer.ConsumerSettings;
import com.example.delivery.nats.JetStreamStreamManager;
import io.nats.client.JetStreamApiException;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class PublishStreamsBootstrap {

    private final JetStreamStreamManager streamManager;
    private final BridgeProperties properties;

    public PublishStreamsBootstrap(JetStreamStreamManager streamManager, BridgeProperties properties) {
        this.streamManager = streamManager;
        this.properties = properties;
    }

    @PostConstruct
    public void ensureStreams() {
        final String subject = properties.invitesSubject();
        try {
            streamManager.ensureStream(
                    ConsumerSettings.streamNameFor(subject), subject, properties.duplicateWindow());
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to ensure stream for subject=" + subject, ex);
        }
    }
}
