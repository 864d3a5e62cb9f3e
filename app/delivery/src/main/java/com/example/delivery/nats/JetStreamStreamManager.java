/*
 * Where: delivery NATS infrastructure
 * What: creates or updates the JetStream streams backing every queue and dead-letter queue
 * Why: Nats-Msg-Id deduplication and durable consumers need the stream to exist before use
 */
package com.example.delivery.nats;

import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class JetStreamStreamManager {

    private static final Logger logger = LoggerFactory.getLogger(JetStreamStreamManager.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final Connection connection;

    public JetStreamStreamManager(Connection connection) {
        this.connection = connection;
    }

    public void ensureStream(String stream, String subject, Duration duplicateWindow)
            throws IOException, JetStreamApiException {
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(stream)
                .subjects(subject)
                .duplicateWindow(duplicateWindow)
                .build();
        JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (!isStreamNotFound(ex)) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
        logger.info("stream ensured stream={} subject={} duplicateWindow={}",
                stream,
                subject,
                duplicateWindow);
    }

    private boolean isStreamNotFound(JetStreamApiException ex) {
        return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
                || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
    }
}
