/*
 * Where: resilient consumer
 * What: one durable JetStream subscription with dedup, bounded retry and dead-letter routing
 * Why: every queue shares the same at-least-once mechanics around its MessageProcessor
 */
package com.example.delivery.consumer;

import com.example.common.TraceIds;
import com.example.delivery.nats.DeadLetterPublisher;
import com.example.delivery.nats.JetStreamStreamManager;
import com.example.delivery.service.DeliveryMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class ResilientConsumer<T> {

    private static final Logger logger = LoggerFactory.getLogger(ResilientConsumer.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
    static final String MDC_QUEUE = "queue";
    static final String MDC_MESSAGE_ID = "message_id";

    private final ConsumerSettings settings;
    private final MessageProcessor<T> processor;
    private final Connection connection;
    private final JetStreamStreamManager streamManager;
    private final DeadLetterPublisher deadLetterPublisher;
    private final DedupRepository dedupRepository;
    private final ObjectMapper objectMapper;
    private final DeliveryMetrics metrics;
    private final AtomicBoolean started;
    private ExecutorService workers;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public ResilientConsumer(ConsumerSettings settings,
            MessageProcessor<T> processor,
            Connection connection,
            JetStreamStreamManager streamManager,
            DeadLetterPublisher deadLetterPublisher,
            DedupRepository dedupRepository,
            ObjectMapper objectMapper,
            DeliveryMetrics metrics) {
        this.settings = settings;
        this.processor = processor;
        this.connection = connection;
        this.streamManager = streamManager;
        this.deadLetterPublisher = deadLetterPublisher;
        this.dedupRepository = dedupRepository;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.started = new AtomicBoolean(false);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            streamManager.ensureStream(settings.stream(), settings.queue(), settings.duplicateWindow());
            streamManager.ensureStream(settings.deadLetterStream(), settings.deadLetterQueue(),
                    settings.duplicateWindow());
            workers = Executors.newFixedThreadPool(settings.prefetch(), new ThreadFactoryBuilder()
                    .setNameFormat("consumer-" + settings.durable() + "-%d")
                    .setDaemon(true)
                    .build());
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    settings.queue(),
                    dispatcher,
                    this::dispatch,
                    false,
                    buildPushSubscribeOptions());
            logger.info("consumer started queue={} dlq={} durable={} prefetch={} maxRetries={}",
                    settings.queue(),
                    settings.deadLetterQueue(),
                    settings.durable(),
                    settings.prefetch(),
                    settings.maxRetries());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start consumer for " + settings.queue(), ex);
        }
    }

    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
        if (workers != null) {
            // interrupts confirmation waits; unacked messages are redelivered after ack-wait
            workers.shutdownNow();
            try {
                if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("consumer workers did not stop in time queue={}", settings.queue());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            workers = null;
        }
        started.set(false);
        logger.info("consumer stopped queue={}", settings.queue());
    }

    public ConsumerSettings settings() {
        return settings;
    }

    private void dispatch(Message message) {
        final ExecutorService pool = workers;
        if (pool == null) {
            return;
        }
        try {
            pool.execute(() -> handleMessage(message));
        } catch (RejectedExecutionException ex) {
            logger.warn("consumer is stopping, message left for redelivery queue={}", settings.queue());
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        MDC.put(MDC_QUEUE, settings.queue());
        MDC.put(MDC_MESSAGE_ID, resolveMessageId(message));
        MDC.put(TraceIds.MDC_KEY, resolveTraceId(message));
        try {
            final T payload = decode(message);
            if (payload == null) {
                return;
            }
            final String dedupKey = processor.dedupKey(payload);
            if (dedupKey != null && dedupRepository.exists(dedupKey)) {
                logger.info("duplicate message skipped dedupKey={}", dedupKey);
                ackSilently(message);
                metrics.recordConsumerOutcome(settings.queue(), "duplicate");
                return;
            }
            processor.process(payload, origin(message));
            // the dedup marker must be durable before the ack
            if (dedupKey != null) {
                dedupRepository.mark(dedupKey, settings.dedupTtl());
            }
            ackSilently(message);
            metrics.recordConsumerOutcome(settings.queue(), "acked");
        } catch (MalformedMessageException | PermanentProcessingException ex) {
            logger.warn("message cannot be processed, dead-lettering", ex);
            deadLetter(message, attempt(message), ex.getMessage());
        } catch (RuntimeException ex) {
            retryOrDeadLetter(message, ex);
        } finally {
            MDC.remove(MDC_QUEUE);
            MDC.remove(MDC_MESSAGE_ID);
            MDC.remove(TraceIds.MDC_KEY);
        }
    }

    private T decode(Message message) {
        final T payload;
        try {
            payload = objectMapper.readValue(message.getData(), processor.payloadType());
        } catch (IOException | RuntimeException ex) {
            logger.warn("malformed message payload, dead-lettering", ex);
            deadLetter(message, attempt(message), "malformed payload: " + ex.getMessage());
            return null;
        }
        if (payload == null) {
            deadLetter(message, attempt(message), "malformed payload: empty body");
        }
        return payload;
    }

    private void retryOrDeadLetter(Message message, RuntimeException failure) {
        final int attempt = attempt(message);
        if (attempt < settings.maxRetries()) {
            logger.warn("message processing failed, requeueing attempt={} maxRetries={}",
                    attempt, settings.maxRetries(), failure);
            nakSilently(message);
            metrics.recordConsumerOutcome(settings.queue(), "retried");
            return;
        }
        logger.error("message processing failed, retries exhausted attempt={} maxRetries={}",
                attempt, settings.maxRetries(), failure);
        deadLetter(message, attempt, failure.getMessage());
    }

    private void deadLetter(Message message, int attempt, String reason) {
        try {
            deadLetterPublisher.publish(settings.deadLetterQueue(), message, attempt, reason);
        } catch (RuntimeException ex) {
            // without a dead letter the message must stay on the primary queue
            logger.error("failed to dead-letter message, requeueing dlq={}", settings.deadLetterQueue(), ex);
            nakSilently(message);
            return;
        }
        termSilently(message);
        metrics.recordConsumerOutcome(settings.queue(), "dead_lettered");
    }

    /** Attempt number of this delivery: replay count from the header plus the broker delivery count. */
    @VisibleForTesting
    int attempt(Message message) {
        long delivered = 1;
        if (message.isJetStream()) {
            delivered = message.metaData().deliveredCount();
        }
        return (int) Math.min(Integer.MAX_VALUE, retryCountHeader(message) + delivered);
    }

    private long retryCountHeader(Message message) {
        final String value = header(message, DeadLetterPublisher.RETRY_COUNT_HEADER);
        if (value == null) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            logger.warn("ignoring unreadable retry header value={}", value);
            return 0;
        }
    }

    private String resolveMessageId(Message message) {
        final String msgId = header(message, "Nats-Msg-Id");
        if (msgId != null) {
            return msgId;
        }
        if (message.isJetStream()) {
            return settings.stream() + ":" + message.metaData().streamSequence();
        }
        return "unknown";
    }

    private MessageOrigin origin(Message message) {
        if (!message.isJetStream()) {
            return null;
        }
        final NatsJetStreamMetaData metaData = message.metaData();
        final long storedAt = metaData.timestamp() != null ? metaData.timestamp().toInstant().toEpochMilli() : 0L;
        return new MessageOrigin(settings.stream(), metaData.streamSequence(), storedAt);
    }

    private String resolveTraceId(Message message) {
        final String traceId = header(message, TraceIds.HEADER);
        return traceId != null ? traceId : TraceIds.newTraceId();
    }

    private String header(Message message, String name) {
        final Headers headers = message.getHeaders();
        if (headers == null) {
            return null;
        }
        final String value = headers.getFirst(name);
        return value == null || value.isBlank() ? null : value;
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(settings.ackWait())
                .maxAckPending(settings.prefetch())
                // one spare delivery so the final failing attempt can still reach the DLQ
                .maxDeliver(settings.maxRetries() + 1L)
                .build();
        return PushSubscribeOptions.builder()
                .stream(settings.stream())
                .durable(settings.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void ackSilently(Message message) {
        try {
            message.ack();
        } catch (IllegalStateException ex) {
            logger.warn("failed to ack nats message", ex);
        }
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack nats message", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term nats message", ex);
        }
    }
}
