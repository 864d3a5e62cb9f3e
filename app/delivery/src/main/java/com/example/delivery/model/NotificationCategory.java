/*
 * Where: delivery model
 * What: user-facing notification categories and their preference keys
 * Why: realtime broadcasts are filtered by the per-user category switches
 */
package com.example.delivery.model;

public enum NotificationCategory {
  COMPANY_INVITATIONS("companyInvitations"),
  FRIEND_REQUESTS("friendRequests"),
  COMPANY_MESSAGES("companyMessages"),
  MEMBERSHIP_CHANGES("membershipChanges"),
  ROLE_CHANGES("roleChanges");

  private final String preferenceKey;

  NotificationCategory(String preferenceKey) {
    this.preferenceKey = preferenceKey;
  }

  public String preferenceKey() {
    return preferenceKey;
  }
}
