/*
 * Where: delivery debug API tests
 * What: checks inbox limits, payload parse failures and manual event injection
 * Why: the debug surface is the operator's only view into persisted and pending deliveries
 */
package com.example.delivery.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.common.event.DomainEvent;
import com.example.delivery.bridge.DomainEventPublisher;
import com.example.delivery.model.DeliveryMode;
import com.example.delivery.model.NotificationCategory;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.pending.PendingDeliveryStore;
import com.example.delivery.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class DeliveryDebugControllerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final String USER_ID = "user-1";

  @Mock private NotificationRepository notificationRepository;
  @Mock private PendingDeliveryStore pendingDeliveryStore;
  @Mock private DomainEventPublisher domainEventPublisher;

  private DeliveryDebugController controller;

  @BeforeEach
  void setUp() {
    controller =
        new DeliveryDebugController(
            notificationRepository,
            pendingDeliveryStore,
            domainEventPublisher,
            new ObjectMapper(),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void inboxClampsLimitAndMapsRows() {
    when(notificationRepository.findByRecipient(USER_ID, 200))
        .thenReturn(List.of(record("{\"title\":\"hi\"}")));

    final DeliveryInboxResponse response = controller.inbox(USER_ID, 5000);

    assertThat(response.userId()).isEqualTo(USER_ID);
    assertThat(response.notifications()).hasSize(1);
    assertThat(response.notifications().get(0).payload().get("title").asText()).isEqualTo("hi");
  }

  @Test
  void inboxThrowsIllegalArgumentWhenPayloadIsInvalidJson() {
    when(notificationRepository.findByRecipient(USER_ID, 1)).thenReturn(List.of(record("{bad")));

    assertThatThrownBy(() -> controller.inbox(USER_ID, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .cause()
        .isInstanceOf(JsonProcessingException.class);
  }

  @Test
  void pendingReportsStoreContents() {
    when(pendingDeliveryStore.pendingCount()).thenReturn(1L);
    when(pendingDeliveryStore.listPending()).thenReturn(List.of("msg_a_u1"));

    final PendingDeliveriesResponse response = controller.pending();

    assertThat(response.pendingCount()).isEqualTo(1L);
    assertThat(response.messageIds()).containsExactly("msg_a_u1");
  }

  @Test
  void postedEventIsPublishedWithGivenId() throws Exception {
    final MockMvc mockMvc = MockMvcBuilders.standaloneSetup(controller).build();

    mockMvc
        .perform(
            post("/debug/delivery/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"id\":\"evt-1\",\"name\":\"companys.updated\",\"payload\":{\"id\":\"t1\"}}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.event_id").value("evt-1"));

    final ArgumentCaptor<DomainEvent> event = ArgumentCaptor.forClass(DomainEvent.class);
    verify(domainEventPublisher).publish(event.capture());
    assertThat(event.getValue().name()).isEqualTo("companys.updated");
    assertThat(event.getValue().occurredAt()).isEqualTo(FIXED_NOW);
    assertThat(event.getValue().payload()).containsEntry("id", "t1");
  }

  @Test
  void eventWithoutNameIsRejected() throws Exception {
    final MockMvc mockMvc = MockMvcBuilders.standaloneSetup(controller).build();

    mockMvc
        .perform(
            post("/debug/delivery/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"payload\":{}}"))
        .andExpect(status().isBadRequest());

    verify(domainEventPublisher, never()).publish(any());
  }

  private NotificationRecord record(String payloadJson) {
    return new NotificationRecord(
        UUID.randomUUID(),
        "msg_0123456789abcdef_" + USER_ID,
        USER_ID,
        null,
        "t1",
        "notification.created",
        NotificationCategory.COMPANY_MESSAGES,
        payloadJson,
        DeliveryMode.CONFIRMED,
        FIXED_NOW,
        null);
  }
}
