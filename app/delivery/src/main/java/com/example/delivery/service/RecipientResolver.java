/*
 * Where: realtime notification delivery
 * What: resolves the users a realtime notification is addressed to
 * Why: producers name recipients in several shapes; they are tried in a fixed priority order
 */
package com.example.delivery.service;

import com.example.delivery.model.NotificationEventKind;
import com.example.delivery.model.RealtimeNotificationMessage;
import com.example.delivery.model.UserProfile;
import com.example.delivery.repository.UserDirectory;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecipientResolver {

  private static final Logger logger = LoggerFactory.getLogger(RecipientResolver.class);

  private final UserDirectory userDirectory;

  public List<String> resolve(RealtimeNotificationMessage message, NotificationEventKind kind) {
    final List<String> notified = message.strings("notifiedUserIds");
    if (!notified.isEmpty()) {
      return List.copyOf(new LinkedHashSet<>(notified));
    }
    final String receiverId = message.string("receiver.id");
    if (receiverId != null) {
      return List.of(receiverId);
    }
    final String direct = message.firstString("userId", "recipientUserId", "invitedUserId");
    if (direct != null) {
      return List.of(direct);
    }
    final String fallback = fallbackRecipient(message, kind);
    if (fallback == null) {
      logger.info("no recipient in payload eventId={}", message.eventId());
      return List.of();
    }
    return List.of(fallback);
  }

  private String fallbackRecipient(RealtimeNotificationMessage message, NotificationEventKind kind) {
    switch (kind) {
      case INVITE_CREATED:
        return byEmail(message.firstString("receiverEmail", "invitedEmail"));
      case FRIEND_REQUEST_SENT:
        return message.string("addresseeId");
      case FRIEND_REQUEST_ACCEPTED:
      case FRIEND_REQUEST_REJECTED:
        return message.string("requesterId");
      case FRIEND_REMOVED:
        return oppositeParty(message);
      default:
        return null;
    }
  }

  private String byEmail(String email) {
    if (email == null) {
      return null;
    }
    final String userId = userDirectory.findByEmail(email).map(UserProfile::id).orElse(null);
    if (userId == null) {
      logger.info("invite recipient is not a registered user email={}", email);
    }
    return userId;
  }

  private String oppositeParty(RealtimeNotificationMessage message) {
    final String actor = message.string("userId");
    final String requesterId = message.string("requesterId");
    final String addresseeId = message.string("addresseeId");
    if (actor != null && requesterId != null && addresseeId != null) {
      return actor.equals(requesterId) ? addresseeId : requesterId;
    }
    return addresseeId != null ? addresseeId : requesterId;
  }
}
