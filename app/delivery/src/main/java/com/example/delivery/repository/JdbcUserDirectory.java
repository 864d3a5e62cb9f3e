/*
 * Where: delivery data access
 * What: reads users and their notification_preferences JSON
 * Why: recipient resolution and live-delivery switches depend on the user record
 */
package com.example.delivery.repository;

import com.example.delivery.model.NotificationPreferences;
import com.example.delivery.model.UserProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcUserDirectory implements UserDirectory {

  private static final Logger logger = LoggerFactory.getLogger(JdbcUserDirectory.class);
  private static final String REALTIME_ENABLED_KEY = "realtimeEnabled";
  private static final TypeReference<Map<String, Object>> PREFERENCES_TYPE =
      new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public Optional<UserProfile> findById(String userId) {
    return findOne("user_id = :value", userId);
  }

  @Override
  public Optional<UserProfile> findByEmail(String email) {
    return findOne("lower(email) = lower(:value)", email);
  }

  private Optional<UserProfile> findOne(String predicate, String value) {
    final String sql =
        "SELECT user_id, email, notification_preferences::text AS preferences_text"
            + " FROM users WHERE "
            + predicate;
    final List<UserProfile> users =
        jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("value", value), this::mapRow);
    return users.stream().findFirst();
  }

  private UserProfile mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String userId = rs.getString("user_id");
    return new UserProfile(
        userId, rs.getString("email"), parsePreferences(userId, rs.getString("preferences_text")));
  }

  private NotificationPreferences parsePreferences(String userId, String json) {
    if (json == null || json.isBlank()) {
      return NotificationPreferences.DEFAULTS;
    }
    final Map<String, Object> raw;
    try {
      raw = objectMapper.readValue(json, PREFERENCES_TYPE);
    } catch (JsonProcessingException ex) {
      logger.warn("unreadable notification preferences, using defaults userId={}", userId, ex);
      return NotificationPreferences.DEFAULTS;
    }
    final Map<String, Boolean> categories = new LinkedHashMap<>();
    raw.forEach(
        (key, flag) -> {
          if (!REALTIME_ENABLED_KEY.equals(key) && flag instanceof Boolean enabled) {
            categories.put(key, enabled);
          }
        });
    return new NotificationPreferences(
        !Boolean.FALSE.equals(raw.get(REALTIME_ENABLED_KEY)), categories);
  }
}
