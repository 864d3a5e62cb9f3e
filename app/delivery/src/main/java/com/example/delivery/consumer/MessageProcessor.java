/*
 * Where: resilient consumer extension point
 * What: the business side of one queue: payload type, dedup key and the processing step
 * Why: retry, dedup and dead-letter mechanics stay in ResilientConsumer
 */
package com.example.delivery.consumer;

public interface MessageProcessor<T> {

  Class<T> payloadType();

  /** Key identifying the logical operation, or null when the payload cannot be deduplicated. */
  default String dedupKey(T payload) {
    return null;
  }

  /**
   * Runs the side effects for one message.
   *
   * @throws MalformedMessageException when the payload parsed but is structurally invalid
   * @throws PermanentProcessingException when retrying cannot succeed
   */
  void process(T payload);

  /**
   * Same as {@link #process(Object)} with the broker identity of the message, null when the
   * message did not come from a stream.
   */
  default void process(T payload, MessageOrigin origin) {
    process(payload);
  }
}
