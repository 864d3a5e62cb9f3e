package com.example.delivery.realtime;

/** Room naming: user:{id} and tenant:{id}; a null room addresses every connection. */
public final class Rooms {

  private static final String USER_PREFIX = "user:";
  private static final String TENANT_PREFIX = "tenant:";
  public static final String BROADCAST = "*";

  private Rooms() {}

  public static String user(String userId) {
    return USER_PREFIX + userId;
  }

  public static String tenant(String tenantId) {
    return TENANT_PREFIX + tenantId;
  }
}
