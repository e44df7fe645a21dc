/*
 * どこで: Monitoring データアクセス
 * 何を: monitoring_plan_versions とモデルスナップショットの登録/参照を行う
 * なぜ: サイクルが固定する設定版と、版に付随する所属一覧を保存するため
 */
package com.example.monitoring.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.monitoring.model.PlanVersionRecord;
import com.example.monitoring.model.ScopeModel;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class PlanVersionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<PlanVersionRecord> lockActiveByPlanId(long planId) {
    // 版の公開とサイクル開始が同じ有効版を取り合わないよう行ロックを取る。
    final String sql =
        """
        SELECT version_id, plan_id, version_number, version_name, effective_date,
               published_by_user_id, published_at, is_active
        FROM monitoring_plan_versions
        WHERE plan_id = :planId
          AND is_active
        FOR UPDATE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("planId", planId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int nextVersionNumber(long planId) {
    final String sql =
        """
        SELECT COALESCE(MAX(version_number), 0) + 1
        FROM monitoring_plan_versions
        WHERE plan_id = :planId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("planId", planId);
    final Integer next = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return next == null ? 1 : next;
  }

  public int deactivateActive(long planId) {
    final String sql =
        """
        UPDATE monitoring_plan_versions
        SET is_active = FALSE
        WHERE plan_id = :planId
          AND is_active
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("planId", planId);
    return jdbcTemplate.update(sql, params);
  }

  public PlanVersionRecord insertActive(
      long planId,
      int versionNumber,
      String versionName,
      LocalDate effectiveDate,
      String publishedByUserId,
      Instant publishedAt) {
    final String sql =
        """
        INSERT INTO monitoring_plan_versions (
          plan_id,
          version_number,
          version_name,
          effective_date,
          published_by_user_id,
          published_at,
          is_active
        ) VALUES (
          :planId,
          :versionNumber,
          :versionName,
          :effectiveDate,
          :publishedByUserId,
          :publishedAt,
          TRUE
        )
        RETURNING version_id, plan_id, version_number, version_name, effective_date,
                  published_by_user_id, published_at, is_active
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("planId", planId)
            .addValue("versionNumber", versionNumber)
            .addValue("versionName", versionName)
            .addValue("effectiveDate", Date.valueOf(effectiveDate))
            .addValue("publishedByUserId", publishedByUserId)
            .addValue("publishedAt", toTimestamp(publishedAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public int insertModelSnapshots(long versionId, List<ScopeModel> models) {
    if (models.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO monitoring_plan_model_snapshots (version_id, model_id, model_name)
        VALUES (:versionId, :modelId, :modelName)
        """;
    final MapSqlParameterSource[] batch =
        models.stream()
            .map(
                model ->
                    new MapSqlParameterSource()
                        .addValue("versionId", versionId)
                        .addValue("modelId", model.modelId())
                        .addValue("modelName", model.modelName()))
            .toArray(MapSqlParameterSource[]::new);
    return jdbcTemplate.batchUpdate(sql, batch).length;
  }

  public List<ScopeModel> findModelSnapshots(long versionId) {
    final String sql =
        """
        SELECT model_id, model_name
        FROM monitoring_plan_model_snapshots
        WHERE version_id = :versionId
        ORDER BY model_id ASC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("versionId", versionId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> new ScopeModel(rs.getLong("model_id"), rs.getString("model_name")));
  }

  private PlanVersionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PlanVersionRecord(
        rs.getLong("version_id"),
        rs.getLong("plan_id"),
        rs.getInt("version_number"),
        rs.getString("version_name"),
        rs.getDate("effective_date").toLocalDate(),
        rs.getString("published_by_user_id"),
        getInstant(rs, "published_at"),
        rs.getBoolean("is_active"));
  }
}
