/*
 * どこで: Monitoring データアクセス
 * 何を: monitoring_results から結果が記録済みのモデル ID を引く
 * なぜ: スナップショットを持たない古いサイクルのスコープを結果から推定するため
 */
package com.example.monitoring.repository;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MonitoringResultRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Long> findDistinctModelIdsByCycleId(long cycleId) {
    final String sql =
        """
        SELECT DISTINCT model_id
        FROM monitoring_results
        WHERE cycle_id = :cycleId
          AND model_id IS NOT NULL
        ORDER BY model_id ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cycleId", cycleId);
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }
}
