package com.example.delivery.realtime;

/** Event names exchanged over the realtime socket. */
public final class RealtimeEvents {

  public static final String NOTIFICATION_CREATED = "notification.created";
  public static final String NOTIFICATION_DELIVERED = "notification.delivered";
  public static final String NOTIFICATION_DELIVERY_FAILED = "notification.delivery.failed";
  public static final String NOTIFICATION_READ = "notification.read";
  public static final String MEMBER_JOINED = "member.joined";
  public static final String MEMBER_LEFT = "member.left";
  public static final String COMPANY_UPDATED = "company.updated";
  public static final String INVITE_REJECTED = "invite.rejected";
  public static final String FRIEND_REQUEST_SENT = "friend.request.sent";
  public static final String FRIEND_REQUEST_ACCEPTED = "friend.request.accepted";
  public static final String FRIEND_REMOVED = "friend.removed";

  private RealtimeEvents() {}
}
