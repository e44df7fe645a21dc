/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の Timestamp と Instant を相互に明示変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースと NULL 列の扱いを揃えるため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC のまま Timestamp.from で渡す。DB 側のタイムゾーン設定には依存しない。
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  // effective_to など NULL 許容の列を読むときに使う。
  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    final Timestamp timestamp = rs.getTimestamp(column);
    return timestamp == null ? null : timestamp.toInstant();
  }
}
