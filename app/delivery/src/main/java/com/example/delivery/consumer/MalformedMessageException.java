package com.example.delivery.consumer;

/** Structural payload failure. Dead-lettered without retry. */
public class MalformedMessageException extends RuntimeException {

  public MalformedMessageException(String message) {
    super(message);
  }

  public MalformedMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
