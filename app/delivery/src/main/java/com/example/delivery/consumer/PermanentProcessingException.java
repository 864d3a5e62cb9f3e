package com.example.delivery.consumer;

/** Processing failure that a redelivery cannot fix. */
public class PermanentProcessingException extends RuntimeException {

  public PermanentProcessingException(String message) {
    super(message);
  }

  public PermanentProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
