/*
 * どこで: Monitoring データアクセス
 * 何を: monitoring_cycle_model_scopes(凍結スコープ)の一括登録と参照を行う
 * なぜ: サイクル開始時点の対象モデルを後続の所属変更から切り離して保存するため
 */
package com.example.monitoring.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.monitoring.model.CycleScopeRecord;
import com.example.monitoring.model.ScopeModel;
import com.example.monitoring.model.ScopeSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

// 更新/削除メソッドは持たない。DB 側でもトリガで UPDATE/DELETE を拒否している。
@Repository
@RequiredArgsConstructor
public class CycleScopeRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean existsByCycleId(long cycleId) {
    final String sql =
        "SELECT EXISTS (SELECT 1 FROM monitoring_cycle_model_scopes WHERE cycle_id = :cycleId)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cycleId", cycleId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public int insertAll(
      long cycleId,
      List<ScopeModel> models,
      Instant lockedAt,
      ScopeSource scopeSource,
      String sourceDetailsJson) {
    if (models.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO monitoring_cycle_model_scopes (
          cycle_id,
          model_id,
          model_name,
          locked_at,
          scope_source,
          source_details
        ) VALUES (
          :cycleId,
          :modelId,
          :modelName,
          :lockedAt,
          :scopeSource,
          :sourceDetails::jsonb
        )
        """;
    final MapSqlParameterSource[] batch =
        models.stream()
            .map(
                model ->
                    new MapSqlParameterSource()
                        .addValue("cycleId", cycleId)
                        .addValue("modelId", model.modelId())
                        .addValue("modelName", model.modelName())
                        .addValue("lockedAt", toTimestamp(lockedAt))
                        .addValue("scopeSource", scopeSource.name())
                        .addValue("sourceDetails", sourceDetailsJson))
            .toArray(MapSqlParameterSource[]::new);
    return jdbcTemplate.batchUpdate(sql, batch).length;
  }

  public List<CycleScopeRecord> findByCycleId(long cycleId) {
    final String sql =
        """
        SELECT cycle_id, model_id, model_name, locked_at, scope_source
        FROM monitoring_cycle_model_scopes
        WHERE cycle_id = :cycleId
        ORDER BY model_id ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("cycleId", cycleId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private CycleScopeRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CycleScopeRecord(
        rs.getLong("cycle_id"),
        rs.getLong("model_id"),
        rs.getString("model_name"),
        getInstant(rs, "locked_at"),
        ScopeSource.valueOf(rs.getString("scope_source")));
  }
}
