/*
 * Where: Watch data access
 * What: subscriptions table and the notified flag
 * Why: notified=true is the at-most-once marker per (subscriber, resource)
 */
package com.engagewatch.watch.repository;

import static com.engagewatch.common.JdbcTimestampUtils.getInstant;
import static com.engagewatch.common.JdbcTimestampUtils.toTimestamp;

import com.engagewatch.watch.model.SubscriptionRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SubscriptionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insertIfAbsent(String subscriberId, long resourceId, Instant now) {
    final String sql =
        """
        INSERT INTO subscriptions (subscriber_id, resource_id, notified, created_at)
        VALUES (:subscriberId, :resourceId, FALSE, :now)
        ON CONFLICT (subscriber_id, resource_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        pairParams(subscriberId, resourceId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(String subscriberId, long resourceId) {
    final String sql =
        """
        DELETE FROM subscriptions
        WHERE subscriber_id = :subscriberId
          AND resource_id = :resourceId
        """;
    return jdbcTemplate.update(sql, pairParams(subscriberId, resourceId));
  }

  public Optional<SubscriptionRecord> find(String subscriberId, long resourceId) {
    final String sql =
        """
        SELECT subscriber_id, resource_id, notified, notified_at, created_at
        FROM subscriptions
        WHERE subscriber_id = :subscriberId
          AND resource_id = :resourceId
        """;
    return jdbcTemplate.query(sql, pairParams(subscriberId, resourceId), this::mapRow).stream()
        .findFirst();
  }

  public List<SubscriptionRecord> findUnnotifiedByResource(long resourceId) {
    final String sql =
        """
        SELECT subscriber_id, resource_id, notified, notified_at, created_at
        FROM subscriptions
        WHERE resource_id = :resourceId
          AND notified = FALSE
        ORDER BY created_at, subscriber_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("resourceId", resourceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Sets notified once; returns 0 when the pair was already notified or is gone. */
  public int markNotified(String subscriberId, long resourceId, Instant now) {
    final String sql =
        """
        UPDATE subscriptions
        SET notified = TRUE,
            notified_at = :now
        WHERE subscriber_id = :subscriberId
          AND resource_id = :resourceId
          AND notified = FALSE
        """;
    final MapSqlParameterSource params =
        pairParams(subscriberId, resourceId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource pairParams(String subscriberId, long resourceId) {
    return new MapSqlParameterSource()
        .addValue("subscriberId", subscriberId)
        .addValue("resourceId", resourceId);
  }

  private SubscriptionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SubscriptionRecord(
        rs.getString("subscriber_id"),
        rs.getLong("resource_id"),
        rs.getBoolean("notified"),
        getInstant(rs, "notified_at"),
        getInstant(rs, "created_at"));
  }
}
