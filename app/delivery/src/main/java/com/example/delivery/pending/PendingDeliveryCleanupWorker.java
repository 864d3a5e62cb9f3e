/*
 * Where: pending-delivery sweep
 * What: periodically evicts pending records without expiry and publishes the pending gauge
 * Why: a record written without TTL would otherwise stay pending forever
 */
package com.example.delivery.pending;

import com.example.delivery.service.DeliveryMetrics;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "delivery.cleanup.enabled", havingValue = "true", matchIfMissing = true)
public class PendingDeliveryCleanupWorker {

  private static final Logger logger = LoggerFactory.getLogger(PendingDeliveryCleanupWorker.class);

  private final PendingDeliveryStore store;
  private final DeliveryMetrics metrics;

  @Scheduled(fixedDelayString = "${delivery.cleanup.interval:60000}")
  public void run() {
    try {
      final int removed = store.cleanupExpired();
      final long pending = store.pendingCount();
      metrics.updatePendingCurrent(pending);
      if (removed > 0) {
        logger.warn("pending delivery sweep evicted records without expiry removed={}", removed);
      }
      logger.debug("pending delivery sweep finished pending={}", pending);
    } catch (StoreUnavailableException ex) {
      // the next tick retries
      logger.warn("pending delivery sweep skipped, store unavailable", ex);
    }
  }
}
