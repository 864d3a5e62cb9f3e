package com.example.delivery.repository;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcMembershipDirectory implements MembershipDirectory {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public List<String> tenantIdsOf(String userId) {
    final String sql =
        """
        SELECT tenant_id
        FROM memberships
        WHERE user_id = :userId
        ORDER BY tenant_id
        """;
    return jdbcTemplate.queryForList(
        sql, new MapSqlParameterSource().addValue("userId", userId), String.class);
  }
}
