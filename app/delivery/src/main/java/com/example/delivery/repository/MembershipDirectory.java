package com.example.delivery.repository;

import java.util.List;

/** Tenants a user belongs to; each one becomes a tenant room on connect. */
public interface MembershipDirectory {

  List<String> tenantIdsOf(String userId);
}
