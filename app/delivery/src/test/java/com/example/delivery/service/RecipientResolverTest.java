package com.example.delivery.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.delivery.model.NotificationEventKind;
import com.example.delivery.model.RealtimeNotificationMessage;
import com.example.delivery.model.UserProfile;
import com.example.delivery.repository.UserDirectory;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RecipientResolverTest {

  private final UserDirectory userDirectory = mock(UserDirectory.class);
  private final RecipientResolver resolver = new RecipientResolver(userDirectory);

  @Test
  void notifiedUserIdsWinAndAreDeduplicated() {
    final RealtimeNotificationMessage message =
        message(Map.of("notifiedUserIds", List.of("u1", "u2", "u1"), "userId", "u9"));

    assertThat(resolver.resolve(message, NotificationEventKind.USER_REMOVED))
        .containsExactly("u1", "u2");
  }

  @Test
  void receiverIdBeatsDirectIds() {
    final RealtimeNotificationMessage message =
        message(Map.of("receiver", Map.of("id", "u3"), "userId", "u9"));

    assertThat(resolver.resolve(message, NotificationEventKind.NOTIFICATION_SENT))
        .containsExactly("u3");
  }

  @Test
  void inviteFallsBackToEmailLookup() {
    when(userDirectory.findByEmail("new@example.com"))
        .thenReturn(Optional.of(new UserProfile("u4", "new@example.com", null)));

    assertThat(
            resolver.resolve(
                message(Map.of("receiverEmail", "new@example.com")),
                NotificationEventKind.INVITE_CREATED))
        .containsExactly("u4");
  }

  @Test
  void unregisteredInviteeYieldsNoRecipient() {
    when(userDirectory.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

    assertThat(
            resolver.resolve(
                message(Map.of("invitedEmail", "ghost@example.com")),
                NotificationEventKind.INVITE_CREATED))
        .isEmpty();
  }

  @Test
  void friendEventsUseTheOtherParty() {
    assertThat(
            resolver.resolve(
                message(Map.of("addresseeId", "u5", "requesterId", "u6")),
                NotificationEventKind.FRIEND_REQUEST_SENT))
        .containsExactly("u5");
    assertThat(
            resolver.resolve(
                message(Map.of("addresseeId", "u5", "requesterId", "u6")),
                NotificationEventKind.FRIEND_REQUEST_ACCEPTED))
        .containsExactly("u6");
  }

  private RealtimeNotificationMessage message(Map<String, Object> attributes) {
    return new RealtimeNotificationMessage("ANY", attributes);
  }
}
