/*
 * Where: shared utilities
 * What: converts between Instant and JDBC Timestamp in both directions
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant bind value
 */
package com.engagewatch.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are always UTC; the column type is timestamptz so no zone shift happens here
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
