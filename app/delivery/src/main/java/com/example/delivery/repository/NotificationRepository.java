/*
 * Where: delivery data access
 * What: idempotent insert, inbox listing and batched clearing of the notifications table
 * Why: every delivery path persists here and a redelivered message must not create a second row
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.DeliveryMode;
import com.example.delivery.model.NotificationCategory;
import com.example.delivery.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Returns false when a row with the same message_id already exists. */
  public boolean insertIfAbsent(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          message_id,
          recipient_user_id,
          sender_user_id,
          tenant_id,
          event_name,
          category,
          payload_json,
          delivery_mode,
          created_at,
          read_at
        ) VALUES (
          :notificationId,
          :messageId,
          :recipientUserId,
          :senderUserId,
          :tenantId,
          :eventName,
          :category,
          :payloadJson::jsonb,
          :deliveryMode,
          :createdAt,
          :readAt
        )
        ON CONFLICT (message_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("messageId", record.messageId())
            .addValue("recipientUserId", record.recipientUserId())
            .addValue("senderUserId", record.senderUserId())
            .addValue("tenantId", record.tenantId())
            .addValue("eventName", record.eventName())
            .addValue("category", record.category().name())
            .addValue("payloadJson", record.payloadJson())
            .addValue("deliveryMode", record.deliveryMode().name())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("readAt", toTimestamp(record.readAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<NotificationRecord> findByRecipient(String userId, int limit) {
    final String sql =
        """
        SELECT notification_id, message_id, recipient_user_id, sender_user_id, tenant_id,
               event_name, category, payload_json::text AS payload_json_text, delivery_mode,
               created_at, read_at
        FROM notifications
        WHERE recipient_user_id = :userId
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByMessageId(String messageId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE message_id = :messageId
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("messageId", messageId), Integer.class);
    return count == null ? 0 : count;
  }

  /** Deletes at most batchSize rows of the recipient and returns how many were removed. */
  public int deleteBatchByRecipient(String userId, int batchSize) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE notification_id IN (
          SELECT notification_id
          FROM notifications
          WHERE recipient_user_id = :userId
          ORDER BY created_at
          LIMIT :batchSize
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("batchSize", batchSize);
    return jdbcTemplate.update(sql, params);
  }

  /** Deletes the listed rows where the user is recipient or sender; other ids are left alone. */
  public int deleteOwnedByIds(String userId, List<UUID> notificationIds) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        DELETE FROM notifications
        WHERE notification_id IN (:ids)
          AND (recipient_user_id = :userId OR sender_user_id = :userId)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("ids", notificationIds);
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("message_id"),
        rs.getString("recipient_user_id"),
        rs.getString("sender_user_id"),
        rs.getString("tenant_id"),
        rs.getString("event_name"),
        NotificationCategory.valueOf(rs.getString("category")),
        rs.getString("payload_json_text"),
        DeliveryMode.valueOf(rs.getString("delivery_mode")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("read_at")));
  }
}
