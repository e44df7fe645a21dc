/*
 * どこで: Monitoring データアクセス
 * 何を: monitoring_plan_models(有効所属の投影)を更新/参照する
 * なぜ: 「今プラン X にいるモデル」を台帳を走査せずに引けるようにするため
 */
package com.example.monitoring.repository;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

// 書き込みは PlanMembershipService からのみ。台帳と同一トランザクションで反映する。
@Repository
@RequiredArgsConstructor
public class PlanModelProjectionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int add(long planId, long modelId) {
    final String sql =
        """
        INSERT INTO monitoring_plan_models (plan_id, model_id)
        VALUES (:planId, :modelId)
        ON CONFLICT (plan_id, model_id) DO NOTHING
        """;
    return jdbcTemplate.update(sql, params(planId, modelId));
  }

  public int remove(long planId, long modelId) {
    final String sql =
        """
        DELETE FROM monitoring_plan_models
        WHERE plan_id = :planId
          AND model_id = :modelId
        """;
    return jdbcTemplate.update(sql, params(planId, modelId));
  }

  public List<Long> findModelIdsByPlanId(long planId) {
    final String sql =
        """
        SELECT model_id
        FROM monitoring_plan_models
        WHERE plan_id = :planId
        ORDER BY model_id ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("planId", planId);
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }

  private MapSqlParameterSource params(long planId, long modelId) {
    return new MapSqlParameterSource().addValue("planId", planId).addValue("modelId", modelId);
  }
}
