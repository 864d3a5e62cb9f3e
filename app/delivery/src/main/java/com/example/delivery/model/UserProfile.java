package com.example.delivery.model;

public record UserProfile(String id, String email, NotificationPreferences preferences) {

  public UserProfile {
    preferences = preferences == null ? NotificationPreferences.DEFAULTS : preferences;
  }
}
