/*
 * Where: Watch data access
 * What: resource_checks history, one row per poll attempt
 * Why: Shows response times and failures per resource without reading logs
 */
package com.engagewatch.watch.repository;

import static com.engagewatch.common.JdbcTimestampUtils.getInstant;
import static com.engagewatch.common.JdbcTimestampUtils.toTimestamp;

import com.engagewatch.watch.model.CheckSummary;
import com.engagewatch.watch.model.ResourceCheckRecord;
import com.engagewatch.watch.model.ResourceStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ResourceCheckRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(ResourceCheckRecord record) {
    final String sql =
        """
        INSERT INTO resource_checks (
          check_id, resource_id, checked_at, status_before, status_after,
          response_time_ms, success, error_reason
        ) VALUES (
          :checkId, :resourceId, :checkedAt, :statusBefore, :statusAfter,
          :responseTimeMs, :success, :errorReason
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("checkId", record.checkId())
            .addValue("resourceId", record.resourceId())
            .addValue("checkedAt", toTimestamp(record.checkedAt()))
            .addValue("statusBefore", nameOf(record.statusBefore()))
            .addValue("statusAfter", nameOf(record.statusAfter()))
            .addValue("responseTimeMs", record.responseTimeMs())
            .addValue("success", record.success())
            .addValue("errorReason", record.errorReason());
    jdbcTemplate.update(sql, params);
  }

  public List<ResourceCheckRecord> findRecent(long resourceId, int limit) {
    final String sql =
        """
        SELECT check_id, resource_id, checked_at, status_before, status_after,
               response_time_ms, success, error_reason
        FROM resource_checks
        WHERE resource_id = :resourceId
        ORDER BY checked_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("resourceId", resourceId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public CheckSummary summarize(long resourceId) {
    return summarize(
        "WHERE resource_id = :resourceId",
        new MapSqlParameterSource().addValue("resourceId", resourceId));
  }

  public CheckSummary summarizeAll() {
    return summarize("", new MapSqlParameterSource());
  }

  public long countSince(Instant since) {
    final String sql = "SELECT COUNT(*) FROM resource_checks WHERE checked_at >= :since";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql = "DELETE FROM resource_checks WHERE checked_at < :threshold";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private CheckSummary summarize(String where, MapSqlParameterSource params) {
    final String sql =
        """
        SELECT COUNT(*) AS total_checks,
               COUNT(*) FILTER (WHERE success) AS successful_checks,
               COALESCE(AVG(response_time_ms) FILTER (WHERE success), 0) AS avg_response_time_ms
        FROM resource_checks
        """
            + where;
    final CheckSummary summary =
        jdbcTemplate.queryForObject(
            sql,
            params,
            (rs, rowNum) ->
                new CheckSummary(
                    rs.getLong("total_checks"),
                    rs.getLong("successful_checks"),
                    rs.getDouble("avg_response_time_ms")));
    return summary == null ? CheckSummary.empty() : summary;
  }

  private ResourceCheckRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ResourceCheckRecord(
        UUID.fromString(rs.getString("check_id")),
        rs.getLong("resource_id"),
        getInstant(rs, "checked_at"),
        statusOf(rs.getString("status_before")),
        statusOf(rs.getString("status_after")),
        rs.getLong("response_time_ms"),
        rs.getBoolean("success"),
        rs.getString("error_reason"));
  }

  private static String nameOf(ResourceStatus status) {
    return status == null ? null : status.name();
  }

  private static ResourceStatus statusOf(String value) {
    return value == null ? null : ResourceStatus.valueOf(value);
  }
}
