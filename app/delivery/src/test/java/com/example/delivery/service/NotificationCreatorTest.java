package com.example.delivery.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.delivery.model.DeliveryMode;
import com.example.delivery.model.NotificationCategory;
import com.example.delivery.model.NotificationEventKind;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.repository.NotificationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class NotificationCreatorTest {

  private final NotificationRepository repository = mock(NotificationRepository.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final Clock clock = Clock.fixed(Instant.parse("2026-02-24T12:00:00Z"), ZoneOffset.UTC);
  private final NotificationCreator creator =
      new NotificationCreator(repository, new ObjectMapper(), new DeliveryMetrics(registry), clock);

  @Test
  void buildsRecordFromKindAndPayload() throws Exception {
    when(repository.insertIfAbsent(any())).thenReturn(true);

    final boolean inserted =
        creator.create(
            "msg_1_u1",
            "u1",
            NotificationEventKind.INVITE_CREATED,
            Map.of("sender", Map.of("id", "u2"), "companyId", "t1"),
            DeliveryMode.CONFIRMED);

    assertThat(inserted).isTrue();
    final ArgumentCaptor<NotificationRecord> captor =
        ArgumentCaptor.forClass(NotificationRecord.class);
    verify(repository).insertIfAbsent(captor.capture());
    final NotificationRecord record = captor.getValue();
    assertThat(record.messageId()).isEqualTo("msg_1_u1");
    assertThat(record.senderUserId()).isEqualTo("u2");
    assertThat(record.tenantId()).isEqualTo("t1");
    assertThat(record.eventName()).isEqualTo("invite.created");
    assertThat(record.category()).isEqualTo(NotificationCategory.COMPANY_INVITATIONS);
    assertThat(record.createdAt()).isEqualTo(Instant.parse("2026-02-24T12:00:00Z"));
    assertThat(new ObjectMapper().readTree(record.payloadJson()).get("recipientUserId").asText())
        .isEqualTo("u1");
    assertThat(
            registry.get("delivery.notifications.persisted.total").tag("mode", "CONFIRMED")
                .counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void existingRowIsNotCountedAgain() {
    when(repository.insertIfAbsent(any())).thenReturn(false);

    final boolean inserted =
        creator.create(
            "msg_1_u1", "u1", NotificationEventKind.INVITE_CREATED, Map.of(),
            DeliveryMode.TIMEOUT_FALLBACK);

    assertThat(inserted).isFalse();
    assertThat(registry.find("delivery.notifications.persisted.total").counter()).isNull();
  }
}
