package com.example.delivery.pending;

/** The pending-delivery store could not be reached. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
