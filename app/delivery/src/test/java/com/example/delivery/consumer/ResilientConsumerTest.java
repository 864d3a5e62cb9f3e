/*
 * Where: resilient consumer tests
 * What: verifies dedup, bounded retry, dead-letter routing and subscription options
 * Why: every queue relies on these mechanics for at-least-once processing
 */
package com.example.delivery.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.delivery.nats.DeadLetterPublisher;
import com.example.delivery.nats.JetStreamStreamManager;
import com.example.delivery.service.DeliveryMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ResilientConsumerTest {

    private static final int MAX_RETRIES = 5;
    private static final ConsumerSettings SETTINGS = new ConsumerSettings(
            "tests.queue",
            "dlq.tests.queue",
            "tests-durable",
            4,
            MAX_RETRIES,
            Duration.ofSeconds(60),
            Duration.ofSeconds(30),
            Duration.ofMinutes(2));

    private Connection connection;
    private JetStreamStreamManager streamManager;
    private DeadLetterPublisher deadLetterPublisher;
    private DedupRepository dedupRepository;
    private SimpleMeterRegistry registry;
    private RecordingProcessor processor;
    private ResilientConsumer<TestPayload> consumer;

    @BeforeEach
    void setUp() {
        connection = mock(Connection.class);
        streamManager = mock(JetStreamStreamManager.class);
        deadLetterPublisher = mock(DeadLetterPublisher.class);
        dedupRepository = mock(DedupRepository.class);
        registry = new SimpleMeterRegistry();
        processor = new RecordingProcessor();
        consumer = new ResilientConsumer<>(
                SETTINGS,
                processor,
                connection,
                streamManager,
                deadLetterPublisher,
                dedupRepository,
                new ObjectMapper(),
                new DeliveryMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        consumer.stop();
    }

    @Test
    void processesAcksAndMarksDedupKey() {
        final Message message = message("{\"id\":\"a-1\"}", null);

        consumer.handleMessage(message);

        assertThat(processor.processed).extracting(TestPayload::id).containsExactly("a-1");
        verify(dedupRepository).mark("test:a-1", SETTINGS.dedupTtl());
        verify(message).ack();
        assertThat(outcome("acked")).isEqualTo(1.0d);
    }

    @Test
    void redeliveryPassesTheSameBrokerOrigin() {
        final ZonedDateTime storedAt = ZonedDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

        consumer.handleMessage(jetStreamMessage(42, 1, storedAt));
        consumer.handleMessage(jetStreamMessage(42, 2, storedAt));
        consumer.handleMessage(jetStreamMessage(43, 1, storedAt.plusSeconds(1)));

        assertThat(processor.origins.get(0))
                .isEqualTo(new MessageOrigin(SETTINGS.stream(), 42, storedAt.toInstant().toEpochMilli()))
                .isEqualTo(processor.origins.get(1));
        assertThat(processor.origins.get(2).streamSequence()).isEqualTo(43);
    }

    @Test
    void duplicateIsAckedWithoutSideEffects() {
        when(dedupRepository.exists("test:a-1")).thenReturn(true);
        final Message message = message("{\"id\":\"a-1\"}", null);

        consumer.handleMessage(message);

        assertThat(processor.processed).isEmpty();
        verify(message).ack();
        verify(dedupRepository, never()).mark(anyString(), any());
        assertThat(outcome("duplicate")).isEqualTo(1.0d);
    }

    @Test
    void sameMessageTwiceProcessesOnce() {
        when(dedupRepository.exists("test:a-1")).thenReturn(false, true);

        consumer.handleMessage(message("{\"id\":\"a-1\"}", null));
        consumer.handleMessage(message("{\"id\":\"a-1\"}", null));

        assertThat(processor.processed).hasSize(1);
    }

    @Test
    void transientFailureIsRequeuedWhileRetriesRemain() {
        processor.behaviour = payload -> {
            throw new IllegalStateException("database down");
        };
        final Message message = message("{\"id\":\"a-1\"}", "3");

        consumer.handleMessage(message);

        verify(message).nak();
        verify(message, never()).ack();
        verify(deadLetterPublisher, never()).publish(anyString(), any(), anyInt(), anyString());
        verify(dedupRepository, never()).mark(anyString(), any());
        assertThat(outcome("retried")).isEqualTo(1.0d);
    }

    @Test
    void transientFailureIsDeadLetteredWhenRetriesAreExhausted() {
        processor.behaviour = payload -> {
            throw new IllegalStateException("database down");
        };
        final Message message = message("{\"id\":\"a-1\"}", String.valueOf(MAX_RETRIES - 1));

        consumer.handleMessage(message);

        verify(deadLetterPublisher).publish(
                eq("dlq.tests.queue"), eq(message), eq(MAX_RETRIES), eq("database down"));
        verify(message).term();
        verify(message, never()).nak();
        assertThat(outcome("dead_lettered")).isEqualTo(1.0d);
    }

    @Test
    void malformedBodyIsDeadLetteredImmediately() {
        final Message message = message("not-json", null);

        consumer.handleMessage(message);

        assertThat(processor.processed).isEmpty();
        verify(deadLetterPublisher).publish(eq("dlq.tests.queue"), eq(message), eq(1), anyString());
        verify(message).term();
    }

    @Test
    void permanentFailureSkipsRetries() {
        processor.behaviour = payload -> {
            throw new PermanentProcessingException("unknown tenant");
        };
        final Message message = message("{\"id\":\"a-1\"}", null);

        consumer.handleMessage(message);

        verify(deadLetterPublisher).publish("dlq.tests.queue", message, 1, "unknown tenant");
        verify(message).term();
        verify(message, never()).nak();
    }

    @Test
    void failedDeadLetterPublishLeavesMessageOnQueue() {
        processor.behaviour = payload -> {
            throw new MalformedMessageException("missing field");
        };
        doThrow(new IllegalStateException("nats down"))
                .when(deadLetterPublisher).publish(anyString(), any(), anyInt(), anyString());
        final Message message = message("{\"id\":\"a-1\"}", null);

        consumer.handleMessage(message);

        verify(message).nak();
        verify(message, never()).term();
    }

    @Test
    void unreadableRetryHeaderCountsAsFirstAttempt() {
        final Message message = message("{\"id\":\"a-1\"}", "abc");

        assertThat(consumer.attempt(message)).isEqualTo(1);
    }

    @Test
    void startEnsuresStreamsAndSubscribesWithBoundedInFlight() throws Exception {
        final JetStream jetStream = mock(JetStream.class);
        final Dispatcher dispatcher = mock(Dispatcher.class);
        when(connection.jetStream()).thenReturn(jetStream);
        when(connection.createDispatcher()).thenReturn(dispatcher);

        consumer.start();

        verify(streamManager).ensureStream("TESTS_QUEUE", "tests.queue", SETTINGS.duplicateWindow());
        verify(streamManager).ensureStream("DLQ_TESTS_QUEUE", "dlq.tests.queue", SETTINGS.duplicateWindow());
        final ArgumentCaptor<PushSubscribeOptions> options = ArgumentCaptor.forClass(PushSubscribeOptions.class);
        verify(jetStream).subscribe(
                eq("tests.queue"), eq(dispatcher), any(MessageHandler.class), eq(false), options.capture());
        assertThat(options.getValue().getDurable()).isEqualTo("tests-durable");
        assertThat(options.getValue().getConsumerConfiguration().getAckPolicy()).isEqualTo(AckPolicy.Explicit);
        assertThat(options.getValue().getConsumerConfiguration().getMaxAckPending()).isEqualTo(4L);
        assertThat(options.getValue().getConsumerConfiguration().getMaxDeliver()).isEqualTo(MAX_RETRIES + 1L);
        assertThat(options.getValue().getConsumerConfiguration().getAckWait()).isEqualTo(Duration.ofSeconds(30));
    }

    private Message message(String body, String retryCount) {
        final Message message = mock(Message.class);
        when(message.getData()).thenReturn(body.getBytes(StandardCharsets.UTF_8));
        when(message.isJetStream()).thenReturn(false);
        if (retryCount != null) {
            final Headers headers = new Headers();
            headers.add(DeadLetterPublisher.RETRY_COUNT_HEADER, retryCount);
            when(message.getHeaders()).thenReturn(headers);
        }
        return message;
    }

    private Message jetStreamMessage(long streamSequence, long deliveredCount, ZonedDateTime storedAt) {
        final Message message = mock(Message.class);
        final NatsJetStreamMetaData metaData = mock(NatsJetStreamMetaData.class);
        when(message.getData()).thenReturn("{\"id\":\"a-1\"}".getBytes(StandardCharsets.UTF_8));
        when(message.isJetStream()).thenReturn(true);
        when(message.metaData()).thenReturn(metaData);
        when(metaData.streamSequence()).thenReturn(streamSequence);
        when(metaData.deliveredCount()).thenReturn(deliveredCount);
        when(metaData.timestamp()).thenReturn(storedAt);
        return message;
    }

    private double outcome(String result) {
        return registry.get("delivery.consumer.messages.total")
                .tag("queue", "tests.queue")
                .tag("result", result)
                .counter()
                .count();
    }

    record TestPayload(String id) {}

    private static final class RecordingProcessor implements MessageProcessor<TestPayload> {

        private final List<TestPayload> processed = new ArrayList<>();
        private final List<MessageOrigin> origins = new ArrayList<>();
        private Consumer<TestPayload> behaviour = payload -> { };

        @Override
        public Class<TestPayload> payloadType() {
            return TestPayload.class;
        }

        @Override
        public String dedupKey(TestPayload payload) {
            return "test:" + payload.id();
        }

        @Override
        public void process(TestPayload payload, MessageOrigin origin) {
            origins.add(origin);
            process(payload);
        }

        @Override
        public void process(TestPayload payload) {
            behaviour.accept(payload);
            processed.add(payload);
        }
    }
}
