/*
 * Where: Watch data access
 * What: Append-only notification_log of successful channel deliveries
 * Why: Audit trail of who was told what, on which channel, how late
 */
package com.engagewatch.watch.repository;

import static com.engagewatch.common.JdbcTimestampUtils.getInstant;
import static com.engagewatch.common.JdbcTimestampUtils.toTimestamp;

import com.engagewatch.watch.model.ChannelType;
import com.engagewatch.watch.model.NotificationLogEntry;
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
public class NotificationLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(NotificationLogEntry entry) {
    final String sql =
        """
        INSERT INTO notification_log (
          log_id, job_id, subscriber_id, resource_id, channel, tier, delay_seconds, sent_at
        ) VALUES (
          :logId, :jobId, :subscriberId, :resourceId, :channel, :tier, :delaySeconds, :sentAt
        )
        ON CONFLICT (job_id, channel) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("logId", entry.logId())
            .addValue("jobId", entry.jobId())
            .addValue("subscriberId", entry.subscriberId())
            .addValue("resourceId", entry.resourceId())
            .addValue("channel", entry.channel().name())
            .addValue("tier", entry.tier().name())
            .addValue("delaySeconds", entry.delaySeconds())
            .addValue("sentAt", toTimestamp(entry.sentAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<NotificationLogEntry> findBySubscriber(String subscriberId) {
    final String sql =
        """
        SELECT log_id, job_id, subscriber_id, resource_id, channel, tier, delay_seconds, sent_at
        FROM notification_log
        WHERE subscriber_id = :subscriberId
        ORDER BY sent_at DESC, channel
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriberId", subscriberId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private NotificationLogEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationLogEntry(
        UUID.fromString(rs.getString("log_id")),
        UUID.fromString(rs.getString("job_id")),
        rs.getString("subscriber_id"),
        rs.getLong("resource_id"),
        ChannelType.valueOf(rs.getString("channel")),
        ServiceTier.valueOf(rs.getString("tier")),
        rs.getLong("delay_seconds"),
        getInstant(rs, "sent_at"));
  }
}
