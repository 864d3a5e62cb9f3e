package com.example.delivery.consumer;

/** Broker identity of a stored message. Redeliveries of the same message carry the same origin. */
public record MessageOrigin(String stream, long streamSequence, long storedAtMillis) {

  public String identity() {
    return stream + ":" + streamSequence + ":" + storedAtMillis;
  }
}
