/*
 * どこで: Monitoring データアクセス
 * 何を: monitoring_plans の行ロックと dirty フラグ更新を行う
 * なぜ: 移管/サイクル開始のロック順序の起点をプラン行に置くため
 */
package com.example.monitoring.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class MonitoringPlanRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public List<Long> lockByIds(Collection<Long> planIds) {
    // plan_id 昇順で取得し、並行する移管/開始とのデッドロックを避ける。
    final String sql =
        """
        SELECT plan_id
        FROM monitoring_plans
        WHERE plan_id IN (:planIds)
        ORDER BY plan_id ASC
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("planIds", planIds);
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }

  public boolean existsById(long planId) {
    final String sql = "SELECT EXISTS (SELECT 1 FROM monitoring_plans WHERE plan_id = :planId)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("planId", planId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public int markDirty(Collection<Long> planIds, Instant now) {
    if (planIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE monitoring_plans
        SET is_dirty = TRUE,
            updated_at = :now
        WHERE plan_id IN (:planIds)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("planIds", planIds)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }
}
