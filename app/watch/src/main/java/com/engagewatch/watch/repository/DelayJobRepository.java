/*
 * Where: Watch data access
 * What: delay_jobs queue: idempotent enqueue, exclusive claim and lease-conditional completion
 * Why: At most one job per (subscriber, resource) and at most one worker per job
 */
package com.engagewatch.watch.repository;

import static com.engagewatch.common.JdbcTimestampUtils.getInstant;
import static com.engagewatch.common.JdbcTimestampUtils.toTimestamp;

import com.engagewatch.watch.model.DelayJobRecord;
import com.engagewatch.watch.model.DelayJobStatus;
import com.engagewatch.watch.model.ServiceTier;
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
public class DelayJobRepository {

  private static final String COLUMNS =
      """
      job_id, subscriber_id, resource_id, tier, opened_at, send_at, status,
      locked_by, locked_at, lease_until, attempt_count, next_retry_at, last_error,
      created_at, sent_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Returns 1 when the job was created, 0 when the pair already had a job. */
  public int insertIfAbsent(DelayJobRecord record) {
    final String sql =
        """
        INSERT INTO delay_jobs (
          job_id,
          subscriber_id,
          resource_id,
          tier,
          opened_at,
          send_at,
          status,
          attempt_count,
          created_at
        ) VALUES (
          :jobId,
          :subscriberId,
          :resourceId,
          :tier,
          :openedAt,
          :sendAt,
          :status,
          :attemptCount,
          :createdAt
        )
        ON CONFLICT (subscriber_id, resource_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("subscriberId", record.subscriberId())
            .addValue("resourceId", record.resourceId())
            .addValue("tier", record.tier().name())
            .addValue("openedAt", toTimestamp(record.openedAt()))
            .addValue("sendAt", toTimestamp(record.sendAt()))
            .addValue("status", record.status().name())
            .addValue("attemptCount", record.attemptCount())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<DelayJobRecord> findById(UUID jobId) {
    final String sql = "SELECT " + COLUMNS + " FROM delay_jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<DelayJobRecord> findByPair(String subscriberId, long resourceId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM delay_jobs WHERE subscriber_id = :subscriberId AND resource_id = :resourceId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("resourceId", resourceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<DelayJobRecord> claimDue(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM delay_jobs
          WHERE status = 'PENDING'
            AND send_at <= :now
            AND (next_retry_at IS NULL OR next_retry_at <= :now)
          ORDER BY send_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE delay_jobs j
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id, j.subscriber_id, j.resource_id, j.tier, j.opened_at, j.send_at,
                  j.status, j.locked_by, j.locked_at, j.lease_until, j.attempt_count,
                  j.next_retry_at, j.last_error, j.created_at, j.sent_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(UUID jobId, Instant sentAt, String lockedBy) {
    final String sql =
        """
        UPDATE delay_jobs
        SET status = 'SENT',
            sent_at = :sentAt,
            next_retry_at = NULL,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markCancelled(UUID jobId, String reason, String lockedBy) {
    final String sql =
        """
        UPDATE delay_jobs
        SET status = 'CANCELLED',
            last_error = :reason,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reason", reason)
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRetry(
      UUID jobId,
      int attemptCount,
      Instant nextRetryAt,
      boolean failed,
      String lastError,
      String lockedBy) {
    final String sql =
        """
        UPDATE delay_jobs
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", failed ? "FAILED" : "PENDING")
            .addValue("attemptCount", attemptCount)
            .addValue("nextRetryAt", failed ? null : toTimestamp(nextRetryAt))
            .addValue("lastError", lastError)
            .addValue("jobId", jobId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** Returns PROCESSING jobs claimed before the threshold to PENDING. */
  public int releaseStaleClaims(Instant threshold) {
    final String sql =
        """
        UPDATE delay_jobs
        SET status = 'PENDING',
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE status = 'PROCESSING'
          AND locked_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  /** Removes unclaimed or cancelled jobs of a pair; claimed jobs cancel themselves on dispatch. */
  public int deleteUnclaimed(String subscriberId, long resourceId) {
    final String sql =
        """
        DELETE FROM delay_jobs
        WHERE subscriber_id = :subscriberId
          AND resource_id = :resourceId
          AND status IN ('PENDING', 'CANCELLED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriberId", subscriberId)
            .addValue("resourceId", resourceId);
    return jdbcTemplate.update(sql, params);
  }

  public int requeueFailed(UUID jobId, Instant now) {
    final String sql =
        """
        UPDATE delay_jobs
        SET status = 'PENDING',
            attempt_count = 0,
            send_at = GREATEST(:now, opened_at),
            next_retry_at = NULL,
            last_error = NULL
        WHERE job_id = :jobId
          AND status = 'FAILED'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int countDue(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM delay_jobs
        WHERE status = 'PENDING'
          AND send_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /** SENT jobs are kept: they are the only per-pair record that an opening was delivered. */
  public int deleteCancelledOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM delay_jobs
        WHERE created_at < :threshold
          AND status = 'CANCELLED'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM delay_jobs
        WHERE send_at < :threshold
          AND status IN ('PENDING', 'PROCESSING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private DelayJobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DelayJobRecord(
        UUID.fromString(rs.getString("job_id")),
        rs.getString("subscriber_id"),
        rs.getLong("resource_id"),
        ServiceTier.valueOf(rs.getString("tier")),
        getInstant(rs, "opened_at"),
        getInstant(rs, "send_at"),
        DelayJobStatus.valueOf(rs.getString("status")),
        rs.getString("locked_by"),
        getInstant(rs, "locked_at"),
        getInstant(rs, "lease_until"),
        rs.getInt("attempt_count"),
        getInstant(rs, "next_retry_at"),
        rs.getString("last_error"),
        getInstant(rs, "created_at"),
        getInstant(rs, "sent_at"));
  }
}
