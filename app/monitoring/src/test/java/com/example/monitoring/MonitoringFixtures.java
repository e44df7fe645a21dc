/*
 * どこで: Monitoring テスト基盤
 * 何を: CRUD 層が作るはずのモデル/プラン/サイクル/結果行を直接投入し、テスト間で全表を初期化する
 * なぜ: 台帳のテストを CRUD API に依存させずに前提データを組み立てるため
 */
package com.example.monitoring;

import com.example.monitoring.model.MonitoringCycleStatus;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public final class MonitoringFixtures {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public MonitoringFixtures(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  // スコープ表は行トリガで DELETE を拒否するため TRUNCATE で消す。
  public void truncateAll() {
    jdbcTemplate.getJdbcTemplate()
        .execute(
            """
            TRUNCATE monitoring_audit_log,
                     monitoring_cycle_model_scopes,
                     monitoring_results,
                     monitoring_plan_models,
                     monitoring_plan_memberships,
                     monitoring_cycles,
                     monitoring_plan_model_snapshots,
                     monitoring_plan_versions,
                     monitoring_plans,
                     models
            RESTART IDENTITY CASCADE
            """);
  }

  public long createModel(String name) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO models (model_name) VALUES (:name) RETURNING model_id",
        new MapSqlParameterSource().addValue("name", name),
        Long.class);
  }

  public long createPlan(String name) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO monitoring_plans (name) VALUES (:name) RETURNING plan_id",
        new MapSqlParameterSource().addValue("name", name),
        Long.class);
  }

  public long createCycle(long planId, MonitoringCycleStatus status) {
    return jdbcTemplate.queryForObject(
        """
        INSERT INTO monitoring_cycles (plan_id, period_start_date, period_end_date, status)
        VALUES (:planId, DATE '2026-01-01', DATE '2026-03-31', :status)
        RETURNING cycle_id
        """,
        new MapSqlParameterSource().addValue("planId", planId).addValue("status", status.name()),
        Long.class);
  }

  public void setCycleStatus(long cycleId, MonitoringCycleStatus status) {
    jdbcTemplate.update(
        "UPDATE monitoring_cycles SET status = :status WHERE cycle_id = :cycleId",
        new MapSqlParameterSource().addValue("cycleId", cycleId).addValue("status", status.name()));
  }

  public void insertResult(long cycleId, long modelId) {
    jdbcTemplate.update(
        "INSERT INTO monitoring_results (cycle_id, model_id, numeric_value) VALUES (:c, :m, 0.5)",
        new MapSqlParameterSource().addValue("c", cycleId).addValue("m", modelId));
  }

  public Map<String, Object> findVersion(long versionId) {
    return jdbcTemplate.queryForMap(
        """
        SELECT version_number, version_name, is_active
        FROM monitoring_plan_versions
        WHERE version_id = :versionId
        """,
        new MapSqlParameterSource().addValue("versionId", versionId));
  }

  /** 版と任意のモデルスナップショットを作り、サイクルに紐付ける。 */
  public long attachVersion(long cycleId, long planId, List<Long> snapshotModelIds) {
    final Long versionId =
        jdbcTemplate.queryForObject(
            """
            INSERT INTO monitoring_plan_versions (
              plan_id, version_number, version_name, effective_date, published_at, is_active
            ) VALUES (
              :planId,
              (SELECT COALESCE(MAX(version_number), 0) + 1
               FROM monitoring_plan_versions WHERE plan_id = :planId),
              'legacy', DATE '2025-12-31', now(), FALSE
            )
            RETURNING version_id
            """,
            new MapSqlParameterSource().addValue("planId", planId),
            Long.class);
    for (Long modelId : snapshotModelIds) {
      jdbcTemplate.update(
          """
          INSERT INTO monitoring_plan_model_snapshots (version_id, model_id, model_name)
          SELECT :versionId, model_id, model_name FROM models WHERE model_id = :modelId
          """,
          new MapSqlParameterSource()
              .addValue("versionId", versionId)
              .addValue("modelId", modelId));
    }
    jdbcTemplate.update(
        "UPDATE monitoring_cycles SET plan_version_id = :versionId WHERE cycle_id = :cycleId",
        new MapSqlParameterSource().addValue("versionId", versionId).addValue("cycleId", cycleId));
    return versionId;
  }

  public int count(String table) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  public int countActiveMemberships(long modelId) {
    final Integer count =
        jdbcTemplate.queryForObject(
            """
            SELECT COUNT(*) FROM monitoring_plan_memberships
            WHERE model_id = :modelId AND effective_to IS NULL
            """,
            new MapSqlParameterSource().addValue("modelId", modelId),
            Integer.class);
    return count == null ? 0 : count;
  }

  public boolean isPlanDirty(long planId) {
    return Boolean.TRUE.equals(
        jdbcTemplate.queryForObject(
            "SELECT is_dirty FROM monitoring_plans WHERE plan_id = :planId",
            new MapSqlParameterSource().addValue("planId", planId),
            Boolean.class));
  }
}
