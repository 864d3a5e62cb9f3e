/*
 * Where: domain event bridge
 * What: deletes a user's notifications in batches when a clear-all request is consumed
 * Why: large inboxes are cleared asynchronously without holding a request thread
 */
package com.example.delivery.bridge;

import com.example.delivery.consumer.MalformedMessageException;
import com.example.delivery.consumer.MessageProcessor;
import com.example.delivery.model.ClearAllNotificationsRequest;
import com.example.delivery.repository.NotificationRepository;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ClearAllNotificationsProcessor implements MessageProcessor<ClearAllNotificationsRequest> {

  private static final Logger logger = LoggerFactory.getLogger(ClearAllNotificationsProcessor.class);

  private final NotificationRepository notificationRepository;
  private final int batchSize;

  public ClearAllNotificationsProcessor(NotificationRepository notificationRepository, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.notificationRepository = notificationRepository;
    this.batchSize = batchSize;
  }

  @Override
  public Class<ClearAllNotificationsRequest> payloadType() {
    return ClearAllNotificationsRequest.class;
  }

  @Override
  public String dedupKey(ClearAllNotificationsRequest request) {
    return "clear-all-notifications:" + request.userId() + ":" + request.requestId();
  }

  @Override
  public void process(ClearAllNotificationsRequest request) {
    if (request.userId() == null || request.userId().isBlank()) {
      throw new MalformedMessageException("clear-all request without userId");
    }
    logger.info(
        "clearing notifications userId={} requestId={} count={}",
        request.userId(),
        request.requestId(),
        request.notificationIds().isEmpty() ? "all" : request.notificationIds().size());
    final int deleted =
        request.notificationIds().isEmpty() ? clearInbox(request) : clearListed(request);
    logger.info(
        "clear-all finished userId={} requestId={} deleted={}",
        request.userId(),
        request.requestId(),
        deleted);
  }

  private int clearInbox(ClearAllNotificationsRequest request) {
    int total = 0;
    int batch = 0;
    int deleted;
    do {
      deleted = notificationRepository.deleteBatchByRecipient(request.userId(), batchSize);
      total += deleted;
      batch++;
      logger.debug("clear-all batch={} deleted={} userId={}", batch, deleted, request.userId());
    } while (deleted == batchSize);
    return total;
  }

  private int clearListed(ClearAllNotificationsRequest request) {
    final List<UUID> ids = new ArrayList<>();
    for (String id : request.notificationIds()) {
      try {
        ids.add(UUID.fromString(id));
      } catch (IllegalArgumentException ex) {
        logger.warn("invalid notification id skipped id={} requestId={}", id, request.requestId());
      }
    }
    int total = 0;
    for (List<UUID> chunk : Lists.partition(ids, batchSize)) {
      total += notificationRepository.deleteOwnedByIds(request.userId(), chunk);
    }
    return total;
  }
}
