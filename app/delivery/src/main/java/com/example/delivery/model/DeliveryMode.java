package com.example.delivery.model;

/** How a notification row came to be persisted. */
public enum DeliveryMode {
  CONFIRMED,
  TIMEOUT_FALLBACK,
  EXPIRED_FALLBACK,
  LIVE_DISABLED,
  NO_RECIPIENT
}
