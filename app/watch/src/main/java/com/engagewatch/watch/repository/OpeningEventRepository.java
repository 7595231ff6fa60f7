/*
 * Where: Watch data access
 * What: opening_events outbox written with the open transition and drained by fan-out
 * Why: A detected opening must reach fan-out even if the process dies right after detection
 */
package com.engagewatch.watch.repository;

import static com.engagewatch.common.JdbcTimestampUtils.getInstant;
import static com.engagewatch.common.JdbcTimestampUtils.toTimestamp;

import com.engagewatch.watch.model.OpeningEventRecord;
import com.engagewatch.watch.model.OpeningEventStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OpeningEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** One event per resource; a second insert for the same resource is a no-op. */
  public int insertIfAbsent(UUID eventId, long resourceId, Instant openedAt, Instant now) {
    final String sql =
        """
        INSERT INTO opening_events (
          event_id, resource_id, status, opened_at, attempt_count, created_at
        ) VALUES (
          :eventId, :resourceId, 'PENDING', :openedAt, 0, :now
        )
        ON CONFLICT (resource_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("resourceId", resourceId)
            .addValue("openedAt", toTimestamp(openedAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<OpeningEventRecord> findByResourceId(long resourceId) {
    final String sql =
        """
        SELECT event_id, resource_id, status, opened_at, locked_by, lease_until,
               attempt_count, created_at, completed_at
        FROM opening_events
        WHERE resource_id = :resourceId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("resourceId", resourceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<OpeningEventRecord> claimPending(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // lease-expired PROCESSING rows are reclaimed in the same statement
    final String sql =
        """
        WITH cte AS (
          SELECT event_id
          FROM opening_events
          WHERE status = 'PENDING'
             OR (status = 'PROCESSING' AND (lease_until IS NULL OR lease_until <= :now))
          ORDER BY created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE opening_events e
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            lease_until = :leaseUntil,
            attempt_count = e.attempt_count + 1
        FROM cte
        WHERE e.event_id = cte.event_id
        RETURNING e.event_id, e.resource_id, e.status, e.opened_at, e.locked_by, e.lease_until,
                  e.attempt_count, e.created_at, e.completed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markDone(UUID eventId, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE opening_events
        SET status = 'DONE',
            completed_at = :now,
            locked_by = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("now", toTimestamp(now))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int release(UUID eventId, String lockedBy) {
    final String sql =
        """
        UPDATE opening_events
        SET status = 'PENDING',
            locked_by = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("eventId", eventId).addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int resetExpiredLeases(Instant now) {
    final String sql =
        """
        UPDATE opening_events
        SET status = 'PENDING',
            locked_by = NULL,
            lease_until = NULL
        WHERE status = 'PROCESSING'
          AND (lease_until IS NULL OR lease_until <= :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public long countAll() {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM opening_events", new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  private OpeningEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OpeningEventRecord(
        UUID.fromString(rs.getString("event_id")),
        rs.getLong("resource_id"),
        OpeningEventStatus.valueOf(rs.getString("status")),
        getInstant(rs, "opened_at"),
        rs.getString("locked_by"),
        getInstant(rs, "lease_until"),
        rs.getInt("attempt_count"),
        getInstant(rs, "created_at"),
        getInstant(rs, "completed_at"));
  }
}
