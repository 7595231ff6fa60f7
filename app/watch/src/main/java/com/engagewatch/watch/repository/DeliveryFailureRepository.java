/*
 * Where: Watch data access
 * What: notification_failures rows for jobs that exhausted their attempts
 * Why: Permanently failed deliveries stay visible and can be requeued by an operator
 */
package com.engagewatch.watch.repository;

import static com.engagewatch.common.JdbcTimestampUtils.getInstant;
import static com.engagewatch.common.JdbcTimestampUtils.toTimestamp;

import com.engagewatch.watch.model.DeliveryFailureRecord;
import com.engagewatch.watch.model.ServiceTier;
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
public class DeliveryFailureRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(DeliveryFailureRecord record) {
    final String sql =
        """
        INSERT INTO notification_failures (
          failure_id,
          job_id,
          subscriber_id,
          resource_id,
          tier,
          attempt_count,
          error_message,
          created_at
        ) VALUES (
          :failureId,
          :jobId,
          :subscriberId,
          :resourceId,
          :tier,
          :attemptCount,
          :errorMessage,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("failureId", record.failureId())
            .addValue("jobId", record.jobId())
            .addValue("subscriberId", record.subscriberId())
            .addValue("resourceId", record.resourceId())
            .addValue("tier", record.tier().name())
            .addValue("attemptCount", record.attemptCount())
            .addValue("errorMessage", record.errorMessage())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<DeliveryFailureRecord> findBySubscriber(String subscriberId) {
    final String sql =
        """
        SELECT failure_id, job_id, subscriber_id, resource_id, tier, attempt_count,
               error_message, created_at
        FROM notification_failures
        WHERE subscriber_id = :subscriberId
        ORDER BY created_at DESC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriberId", subscriberId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteByJobId(UUID jobId) {
    final String sql = "DELETE FROM notification_failures WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.update(sql, params);
  }

  private DeliveryFailureRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryFailureRecord(
        UUID.fromString(rs.getString("failure_id")),
        UUID.fromString(rs.getString("job_id")),
        rs.getString("subscriber_id"),
        rs.getLong("resource_id"),
        ServiceTier.valueOf(rs.getString("tier")),
        rs.getInt("attempt_count"),
        rs.getString("error_message"),
        getInstant(rs, "created_at"));
  }
}
