package com.example.delivery.config;

import com.example.delivery.consumer.ConsumerSettings;
import java.time.Duration;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsumerConfigTest {

    private static final ConfirmationProperties CONFIRMATION =
            new ConfirmationProperties(Duration.ofSeconds(60), Duration.ofMillis(500), Duration.ofSeconds(2));

    @Test
    void ackWaitLongerThanConfirmationTtlIsAccepted() {
        assertThatCode(() -> ConsumerConfig.requireAckWaitBeyondConfirmation(
                settings(Duration.ofSeconds(90)), CONFIRMATION)).doesNotThrowAnyException();
    }

    @Test
    void ackWaitNotBeyondConfirmationTtlIsRejected() {
        assertThatThrownBy(() -> ConsumerConfig.requireAckWaitBeyondConfirmation(
                settings(Duration.ofSeconds(60)), CONFIRMATION))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ack-wait");
    }

    private static ConsumerSettings settings(Duration ackWait) {
        return new ConsumerSettings(
                "notifications.realtimes",
                "dlq.notifications.realtimes",
                "delivery-realtime-notifications",
                50,
                5,
                Duration.ofSeconds(60),
                ackWait,
                Duration.ofMinutes(2));
    }
}
