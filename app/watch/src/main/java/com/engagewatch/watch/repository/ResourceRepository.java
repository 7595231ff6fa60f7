/*
 * Where: Watch data access
 * What: resources table: tracking, poll leases, check results and the one-way open transition
 * Why: Every state change is a conditional update so concurrent pollers cannot double-open
 */
package com.engagewatch.watch.repository;

import static com.engagewatch.common.JdbcTimestampUtils.getInstant;
import static com.engagewatch.common.JdbcTimestampUtils.toTimestamp;

import com.engagewatch.watch.model.ResourceMetadata;
import com.engagewatch.watch.model.ResourceRecord;
import com.engagewatch.watch.model.ResourceStatus;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ResourceRepository {

  private static final String COLUMNS =
      """
      resource_id, display_name, location, start_date, end_date, status, is_open, opened_at,
      last_checked_at, next_check_at, consecutive_failures, poll_locked_by, poll_lease_until,
      created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Inserts an UNOPENED resource due for an immediate check; returns 0 when already tracked. */
  public int insertIfAbsent(long resourceId, Instant now) {
    final String sql =
        """
        INSERT INTO resources (
          resource_id, status, is_open, next_check_at, consecutive_failures, created_at, updated_at
        ) VALUES (
          :resourceId, 'UNOPENED', FALSE, :now, 0, :now, :now
        )
        ON CONFLICT (resource_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("resourceId", resourceId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<ResourceRecord> findById(long resourceId) {
    final String sql = "SELECT " + COLUMNS + " FROM resources WHERE resource_id = :resourceId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("resourceId", resourceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Claims due, non-terminal tracked resources. Each returned row carries its own lease
   * token in {@code poll_locked_by}.
   */
  public List<ResourceRecord> claimDueForPoll(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH cte AS (
          SELECT r.resource_id
          FROM resources r
          WHERE r.status <> 'TERMINAL'
            AND r.next_check_at <= :now
            AND (r.poll_lease_until IS NULL OR r.poll_lease_until <= :now)
          ORDER BY r.next_check_at
          LIMIT :limit
          FOR UPDATE OF r SKIP LOCKED
        )
        UPDATE resources r
        SET poll_locked_by = :lockedBy || '/' || gen_random_uuid()::text,
            poll_lease_until = :leaseUntil
        FROM cte
        WHERE r.resource_id = cte.resource_id
        RETURNING r.resource_id, r.display_name, r.location, r.start_date, r.end_date, r.status,
                  r.is_open, r.opened_at, r.last_checked_at, r.next_check_at,
                  r.consecutive_failures, r.poll_locked_by, r.poll_lease_until,
                  r.created_at, r.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Takes the poll lease of one resource unless another holder's lease is still live. */
  public Optional<ResourceRecord> tryAcquirePollLease(
      long resourceId, Instant now, Instant leaseUntil, String leaseToken) {
    final String sql =
        """
        UPDATE resources
        SET poll_locked_by = :leaseToken,
            poll_lease_until = :leaseUntil
        WHERE resource_id = :resourceId
          AND (poll_lease_until IS NULL OR poll_lease_until <= :now)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("resourceId", resourceId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("leaseToken", leaseToken);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Moves a closed resource to an open status. Returns the stored opening time, or empty when
   * the resource was already open.
   */
  public Optional<Instant> markOpened(long resourceId, ResourceStatus status, Instant now) {
    final String sql =
        """
        UPDATE resources
        SET status = :status,
            is_open = TRUE,
            opened_at = COALESCE(opened_at, :now),
            updated_at = :now
        WHERE resource_id = :resourceId
          AND is_open = FALSE
        RETURNING opened_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("resourceId", resourceId)
            .addValue("status", status.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> getInstant(rs, "opened_at"))
        .stream()
        .findFirst();
  }

  /** Stores a successful check and releases the lease; is_open and opened_at are never touched. */
  public int recordCheckSuccess(
      long resourceId,
      String leaseToken,
      ResourceStatus status,
      ResourceMetadata metadata,
      Instant now,
      Instant nextCheckAt) {
    final String sql =
        """
        UPDATE resources
        SET status = :status,
            display_name = COALESCE(:displayName, display_name),
            location = COALESCE(:location, location),
            start_date = COALESCE(:startDate, start_date),
            end_date = COALESCE(:endDate, end_date),
            last_checked_at = :now,
            next_check_at = :nextCheckAt,
            consecutive_failures = 0,
            poll_locked_by = NULL,
            poll_lease_until = NULL,
            updated_at = :now
        WHERE resource_id = :resourceId
          AND poll_locked_by = :leaseToken
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("resourceId", resourceId)
            .addValue("leaseToken", leaseToken)
            .addValue("status", status.name())
            .addValue("displayName", metadata.displayName(), Types.VARCHAR)
            .addValue("location", metadata.location(), Types.VARCHAR)
            .addValue("startDate", toDate(metadata.startDate()), Types.DATE)
            .addValue("endDate", toDate(metadata.endDate()), Types.DATE)
            .addValue("now", toTimestamp(now))
            .addValue("nextCheckAt", toTimestamp(nextCheckAt));
    return jdbcTemplate.update(sql, params);
  }

  public int recordCheckFailure(
      long resourceId, String leaseToken, Instant now, Instant nextCheckAt) {
    final String sql =
        """
        UPDATE resources
        SET last_checked_at = :now,
            next_check_at = :nextCheckAt,
            consecutive_failures = consecutive_failures + 1,
            poll_locked_by = NULL,
            poll_lease_until = NULL,
            updated_at = :now
        WHERE resource_id = :resourceId
          AND poll_locked_by = :leaseToken
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("resourceId", resourceId)
            .addValue("leaseToken", leaseToken)
            .addValue("now", toTimestamp(now))
            .addValue("nextCheckAt", toTimestamp(nextCheckAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Open resources with at least one unnotified subscriber that has no delay job. */
  public List<ResourceRecord> findOpenWithUnscheduledSubscribers() {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM resources r
            WHERE r.is_open = TRUE
              AND EXISTS (
                SELECT 1
                FROM subscriptions s
                WHERE s.resource_id = r.resource_id
                  AND s.notified = FALSE
                  AND NOT EXISTS (
                    SELECT 1
                    FROM delay_jobs j
                    WHERE j.subscriber_id = s.subscriber_id
                      AND j.resource_id = s.resource_id
                  )
              )
            ORDER BY r.opened_at
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public long countTracked() {
    return count("SELECT COUNT(*) FROM resources");
  }

  public long countOpen() {
    return count("SELECT COUNT(*) FROM resources WHERE is_open = TRUE");
  }

  private long count(String sql) {
    final Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  private ResourceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ResourceRecord(
        rs.getLong("resource_id"),
        rs.getString("display_name"),
        rs.getString("location"),
        toLocalDate(rs.getDate("start_date")),
        toLocalDate(rs.getDate("end_date")),
        ResourceStatus.valueOf(rs.getString("status")),
        rs.getBoolean("is_open"),
        getInstant(rs, "opened_at"),
        getInstant(rs, "last_checked_at"),
        getInstant(rs, "next_check_at"),
        rs.getInt("consecutive_failures"),
        rs.getString("poll_locked_by"),
        getInstant(rs, "poll_lease_until"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }

  private static Date toDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  private static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
