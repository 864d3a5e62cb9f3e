/*
 * Where: resilient consumer settings
 * What: the per-queue knobs of one JetStream consumption loop
 * Why: every queue tunes prefetch, retry budget and dedup window on its own
 */
package com.example.delivery.consumer;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Locale;

public record ConsumerSettings(
    @NotBlank String queue,
    @NotBlank String deadLetterQueue,
    @NotBlank String durable,
    @NotNull @Positive Integer prefetch,
    @NotNull @Positive Integer maxRetries,
    @NotNull Duration dedupTtl,
    @NotNull Duration ackWait,
    @NotNull Duration duplicateWindow) {

  @AssertTrue(message = "dead-letter-queue must be the dlq. sibling of queue")
  public boolean isDeadLetterQueueSibling() {
    if (queue == null || deadLetterQueue == null) {
      return true;
    }
    return deadLetterQueue.equals("dlq." + queue);
  }

  @AssertTrue(message = "dedup-ttl must be positive")
  public boolean isDedupTtlPositive() {
    return isPositiveDuration(dedupTtl);
  }

  @AssertTrue(message = "ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  @AssertTrue(message = "duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  public String stream() {
    return streamNameFor(queue);
  }

  public String deadLetterStream() {
    return streamNameFor(deadLetterQueue);
  }

  /** JetStream stream names may not contain dots, so subjects map to upper snake case. */
  public static String streamNameFor(String subject) {
    return subject.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
