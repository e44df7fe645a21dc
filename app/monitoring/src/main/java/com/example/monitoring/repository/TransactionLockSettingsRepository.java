/*
 * どこで: Monitoring データアクセス
 * 何を: 現在のトランザクションに lock_timeout を設定する
 * なぜ: 行ロック待ちの上限を DB 側で持たせ、アプリ側で独自のタイムアウトを持たないため
 */
package com.example.monitoring.repository;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class TransactionLockSettingsRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void applyLockTimeout(Duration lockTimeout) {
    // SET LOCAL はバインド変数を受け付けないため set_config(..., is_local=true) を使う。
    final String sql = "SELECT set_config('lock_timeout', :value, true)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("value", lockTimeout.toMillis() + "ms");
    jdbcTemplate.query(sql, params, rs -> null);
  }
}
